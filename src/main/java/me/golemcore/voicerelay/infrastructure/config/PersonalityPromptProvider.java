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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Supplies the system prompt sent ahead of every conversation. The
 * personality file wins over the configured prompt when it is readable and
 * non-blank.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PersonalityPromptProvider {

    static final String DEFAULT_PROMPT = "You are a helpful AI assistant.";

    private final RelayProperties properties;

    private volatile String cachedPrompt;

    public String getSystemPrompt() {
        String prompt = cachedPrompt;
        if (prompt == null) {
            prompt = loadPrompt();
            cachedPrompt = prompt;
        }
        return prompt;
    }

    private String loadPrompt() {
        RelayProperties.LlmProperties llm = properties.getLlm();
        String personalityFile = llm.getPersonalityFile();
        if (personalityFile != null && !personalityFile.isBlank()) {
            Path path = Path.of(personalityFile);
            if (Files.isRegularFile(path)) {
                try {
                    String content = Files.readString(path, StandardCharsets.UTF_8).trim();
                    if (!content.isEmpty()) {
                        log.info("Loaded personality prompt from {}", path);
                        return content;
                    }
                } catch (IOException e) {
                    log.error("Error loading personality prompt from {}: {}", path, e.getMessage());
                }
            }
        }
        String configured = llm.getSystemPrompt();
        return configured != null && !configured.isBlank() ? configured : DEFAULT_PROMPT;
    }
}
