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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.voicerelay.adapter.inbound.web.dto.ModelSelectionRequest;
import me.golemcore.voicerelay.adapter.inbound.web.dto.ProviderSelectionRequest;
import me.golemcore.voicerelay.domain.service.ProviderRouter;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Provider status and process-wide provider/model selection.
 */
@RestController
@RequestMapping("/providers")
@RequiredArgsConstructor
@Slf4j
public class ProvidersController {

    private final ProviderRouter router;

    @GetMapping("/status")
    public Mono<ResponseEntity<Map<String, Object>>> getStatus() {
        return Mono.just(ResponseEntity.ok(Map.of("providers", router.status())));
    }

    @PutMapping("/current")
    public Mono<ResponseEntity<Map<String, Object>>> setCurrentProvider(
            @RequestBody ProviderSelectionRequest request) {
        if (request == null || isBlank(request.getProvider())) {
            throw new IllegalArgumentException("provider is required");
        }
        if (!router.setProvider(request.getProvider(), request.getModel())) {
            throw new ResponseStatusException(HttpStatus.CONFLICT,
                    "Provider " + request.getProvider() + " is not available");
        }
        return Mono.just(ResponseEntity.ok(selection()));
    }

    @PutMapping("/{provider}/model")
    public Mono<ResponseEntity<Map<String, Object>>> setModel(@PathVariable String provider,
            @RequestBody ModelSelectionRequest request) {
        if (request == null || isBlank(request.getModel())) {
            throw new IllegalArgumentException("model is required");
        }
        if (!router.setModel(request.getModel(), provider)) {
            throw new ResponseStatusException(HttpStatus.CONFLICT,
                    "Model " + request.getModel() + " rejected by provider " + provider);
        }
        Map<String, Object> body = selection();
        body.put("updated_provider", provider);
        body.put("updated_model", request.getModel());
        return Mono.just(ResponseEntity.ok(body));
    }

    @PostMapping("/health-check")
    public Mono<ResponseEntity<Map<String, Object>>> runHealthCheck() {
        return Mono.fromFuture(router::healthCheckAll)
                .map(results -> {
                    log.info("[API] Manual health check: {}", results);
                    return ResponseEntity.ok(Map.<String, Object>of("providers", router.status()));
                });
    }

    private Map<String, Object> selection() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("provider", router.getCurrentProvider());
        body.put("model", router.getCurrentModel());
        return body;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
