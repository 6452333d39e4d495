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

package me.golemcore.voicerelay.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.voicerelay.adapter.inbound.web.dto.HealthResponse;
import me.golemcore.voicerelay.domain.service.SessionRegistry;
import me.golemcore.voicerelay.infrastructure.config.CredentialStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequiredArgsConstructor
public class HealthController {

    private static final List<String> CREDENTIALED_PROVIDERS = List.of("openai", "claude", "xai");

    private final SessionRegistry sessionRegistry;
    private final CredentialStore credentialStore;
    private final Clock clock;

    @GetMapping("/health")
    public Mono<ResponseEntity<HealthResponse>> health() {
        Map<String, Boolean> keys = new LinkedHashMap<>();
        for (String provider : CREDENTIALED_PROVIDERS) {
            keys.put(provider, credentialStore.hasApiKey(provider));
        }
        HealthResponse response = HealthResponse.builder()
                .status("healthy")
                .activeSessions(sessionRegistry.count())
                .apiKeysLoaded(keys)
                .timestamp(clock.instant())
                .build();
        return Mono.just(ResponseEntity.ok(response));
    }
}
