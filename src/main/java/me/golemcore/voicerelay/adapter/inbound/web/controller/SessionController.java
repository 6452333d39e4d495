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
import me.golemcore.voicerelay.adapter.inbound.web.VoiceWebSocketHandler;
import me.golemcore.voicerelay.adapter.inbound.web.dto.CreateSessionResponse;
import me.golemcore.voicerelay.domain.model.VoiceSession;
import me.golemcore.voicerelay.domain.service.SessionRegistry;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Session creation and removal. Clients create a session first, then open
 * the WebSocket at the returned URL.
 */
@RestController
@RequestMapping("/session")
@RequiredArgsConstructor
@Slf4j
public class SessionController {

    private final SessionRegistry sessionRegistry;

    @PostMapping
    public Mono<ResponseEntity<CreateSessionResponse>> createSession() {
        VoiceSession session = sessionRegistry.create();
        CreateSessionResponse response = CreateSessionResponse.builder()
                .sessionId(session.getId())
                .websocketUrl(VoiceWebSocketHandler.PATH_PREFIX + session.getId())
                .build();
        return Mono.just(ResponseEntity.ok(response));
    }

    @DeleteMapping("/{sessionId}")
    public Mono<ResponseEntity<Map<String, String>>> deleteSession(@PathVariable String sessionId) {
        if (!sessionRegistry.remove(sessionId)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Session not found");
        }
        return Mono.just(ResponseEntity.ok(Map.of("message", "Session deleted")));
    }
}
