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

package me.golemcore.voicerelay.adapter.inbound.web;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.voicerelay.adapter.inbound.web.handler.EnvelopeHandler;
import me.golemcore.voicerelay.domain.model.VoiceSession;
import me.golemcore.voicerelay.domain.service.SessionRegistry;
import me.golemcore.voicerelay.port.outbound.MonitoringPort;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Reactive WebSocket endpoint {@code /ws/{session_id}} binding one client
 * connection to one voice session.
 *
 * <p>
 * An unknown session id is rejected with close code 4004. Otherwise the
 * connection replaces any earlier one of the session, receives
 * {@code connection_established}, and its envelopes are processed strictly
 * one at a time. Unknown types and handler failures are answered with an
 * {@code error} envelope and the connection stays open; an undecodable frame
 * closes it with 1011. On exit the session's connection binding is cleared,
 * while the session itself lives on until removed or reaped.
 */
@Component
@Slf4j
public class VoiceWebSocketHandler implements WebSocketHandler {

    public static final String PATH_PREFIX = "/ws/";
    static final int CLOSE_INVALID_SESSION = 4004;
    static final int CLOSE_REPLACED = 4000;

    private static final TypeReference<Map<String, Object>> ENVELOPE_TYPE = new TypeReference<>() {
    };

    private final SessionRegistry sessionRegistry;
    private final ObjectMapper objectMapper;
    private final MonitoringPort monitoringPort;
    private final Map<String, EnvelopeHandler> handlers = new LinkedHashMap<>();

    public VoiceWebSocketHandler(SessionRegistry sessionRegistry, ObjectMapper objectMapper,
            MonitoringPort monitoringPort, List<EnvelopeHandler> envelopeHandlers) {
        this.sessionRegistry = sessionRegistry;
        this.objectMapper = objectMapper;
        this.monitoringPort = monitoringPort;
        for (EnvelopeHandler handler : envelopeHandlers) {
            handlers.put(handler.getType(), handler);
            log.debug("[WebSocket] Registered envelope handler: {}", handler.getType());
        }
    }

    @Override
    public Mono<Void> handle(WebSocketSession webSocketSession) {
        String sessionId = extractSessionId(webSocketSession.getHandshakeInfo().getUri().getPath());
        Optional<VoiceSession> found = sessionRegistry.get(sessionId);
        if (found.isEmpty()) {
            log.warn("[WebSocket] Connection rejected: invalid session {}", sessionId);
            return webSocketSession.close(new CloseStatus(CLOSE_INVALID_SESSION, "Invalid session"));
        }
        VoiceSession session = found.get();

        WebSocketConnection connection = new WebSocketConnection(UUID.randomUUID().toString(), webSocketSession,
                objectMapper);
        session.bindConnection(connection)
                .ifPresent(previous -> previous.close(CLOSE_REPLACED, "Replaced by a new connection"));
        log.info("[WebSocket] Connected: session={}, connectionId={}", sessionId, connection.getConnectionId());

        EnvelopeSender sender = new EnvelopeSender(session, connection);
        sender.send("connection_established", Map.of(
                "session_id", session.getId(),
                EnvelopeSender.TIMESTAMP, session.getCreatedAt()));

        Mono<Void> inbound = webSocketSession.receive()
                .map(WebSocketMessage::getPayloadAsText)
                .concatMap(payload -> dispatch(session, sender, payload))
                .then()
                .onErrorResume(error -> {
                    log.error("[WebSocket] Connection {} of session {} failed: {}", connection.getConnectionId(),
                            sessionId, error.getMessage());
                    monitoringPort.recordError("websocket", error.getMessage());
                    connection.close(CloseStatus.SERVER_ERROR.getCode(), "Internal error");
                    return Mono.empty();
                })
                .doFinally(signal -> {
                    session.releaseConnection(connection);
                    connection.markClosed();
                    log.info("[WebSocket] Disconnected: session={}, connectionId={}, signal={}",
                            sessionId, connection.getConnectionId(), signal);
                });

        return Mono.when(inbound, webSocketSession.send(connection.outboundMessages()));
    }

    Mono<Void> dispatch(VoiceSession session, EnvelopeSender sender, String payload) {
        Map<String, Object> envelope;
        try {
            envelope = objectMapper.readValue(payload, ENVELOPE_TYPE);
        } catch (JsonProcessingException e) {
            return Mono.error(new IllegalArgumentException("Undecodable envelope: " + e.getOriginalMessage(), e));
        }
        if (envelope == null) {
            return Mono.error(new IllegalArgumentException("Undecodable envelope: null"));
        }
        sessionRegistry.touch(session.getId());

        String type = EnvelopeHandler.stringField(envelope, EnvelopeSender.TYPE);
        EnvelopeHandler handler = type != null ? handlers.get(type) : null;
        if (handler == null) {
            log.warn("[WebSocket] Unknown message type: {}", type);
            sender.error("Unknown message type: " + type, type);
            return Mono.empty();
        }

        return Mono.defer(() -> handler.handle(session, envelope, sender))
                .onErrorResume(error -> {
                    String reason = EnvelopeHandler.describe(error);
                    log.error("[WebSocket] Error handling message type {}: {}", type, reason);
                    monitoringPort.recordError("websocket", type + ": " + reason);
                    sender.error("Error processing " + type + ": " + reason, type);
                    return Mono.empty();
                });
    }

    static String extractSessionId(String path) {
        if (path == null) {
            return null;
        }
        String trimmed = path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
        int slash = trimmed.lastIndexOf('/');
        String id = slash >= 0 ? trimmed.substring(slash + 1) : trimmed;
        return id.isBlank() ? null : id;
    }
}
