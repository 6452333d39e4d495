/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.voicerelay.infrastructure.config;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves the optional API credential of each provider family.
 *
 * <p>
 * A credential comes from {@code voice.llm.providers.<name>.api-key} first,
 * then from a key file in {@code voice.llm.keys-directory}. A missing or blank
 * credential excludes the provider family from registration; it never fails
 * startup.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CredentialStore {

    private static final Map<String, String> KEY_FILES = Map.of(
            "openai", "OpenAI.key",
            "claude", "Claude.key",
            "xai", "XAI.key");

    private final RelayProperties properties;

    private final Map<String, String> apiKeys = new ConcurrentHashMap<>();

    @PostConstruct
    public void init() {
        apiKeys.clear();
        properties.getLlm().getProviders().forEach((name, provider) -> {
            if (provider != null && !isBlank(provider.getApiKey())) {
                apiKeys.put(name.toLowerCase(), provider.getApiKey().trim());
            }
        });

        String directory = properties.getLlm().getKeysDirectory();
        if (!isBlank(directory)) {
            KEY_FILES.forEach((name, fileName) -> loadKeyFile(name, Path.of(directory, fileName)));
        }

        for (String name : KEY_FILES.keySet()) {
            log.info("[Credentials] {} API key: {}", name, apiKeys.containsKey(name) ? "configured" : "absent");
        }
    }

    public Optional<String> getApiKey(String provider) {
        if (provider == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(apiKeys.get(provider.toLowerCase()));
    }

    public boolean hasApiKey(String provider) {
        return getApiKey(provider).isPresent();
    }

    private void loadKeyFile(String name, Path file) {
        if (apiKeys.containsKey(name) || !Files.isRegularFile(file)) {
            return;
        }
        try {
            String key = Files.readString(file, StandardCharsets.UTF_8).trim();
            if (!key.isEmpty()) {
                apiKeys.put(name, key);
                log.info("[Credentials] Loaded {} API key from {}", name, file);
            }
        } catch (IOException e) {
            log.error("[Credentials] Error loading {} key from {}: {}", name, file, e.getMessage());
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
