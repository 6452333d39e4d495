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
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.voicerelay.domain.model.SessionConnection;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.Map;

/**
 * {@link SessionConnection} over a reactive WebSocket session.
 *
 * <p>
 * Outbound envelopes are serialized to JSON and queued in a unicast sink that
 * the handler subscribes as the session's send stream, so sends from any
 * thread are delivered in call order without blocking the caller.
 */
@Slf4j
public class WebSocketConnection implements SessionConnection {

    private final String connectionId;
    private final WebSocketSession webSocketSession;
    private final ObjectMapper objectMapper;
    private final Sinks.Many<String> outbound = Sinks.many().unicast().onBackpressureBuffer();

    private volatile boolean open = true;

    public WebSocketConnection(String connectionId, WebSocketSession webSocketSession, ObjectMapper objectMapper) {
        this.connectionId = connectionId;
        this.webSocketSession = webSocketSession;
        this.objectMapper = objectMapper;
    }

    @Override
    public String getConnectionId() {
        return connectionId;
    }

    @Override
    public void send(Map<String, Object> envelope) {
        String json;
        try {
            json = objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize envelope: " + e.getOriginalMessage(), e);
        }
        synchronized (outbound) {
            if (!open) {
                throw new IllegalStateException("Connection " + connectionId + " is closed");
            }
            Sinks.EmitResult result = outbound.tryEmitNext(json);
            if (result.isFailure()) {
                throw new IllegalStateException("Failed to queue envelope on " + connectionId + ": " + result);
            }
        }
    }

    @Override
    public void close(int code, String reason) {
        if (!markClosed()) {
            return;
        }
        log.info("[WebSocket] Closing connection {}: {} {}", connectionId, code, reason);
        webSocketSession.close(new CloseStatus(code, reason))
                .subscribe(null, error -> log.warn("[WebSocket] Close of {} failed: {}", connectionId,
                        error.getMessage()));
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    /**
     * Stops accepting envelopes and completes the outbound stream.
     *
     * @return false if already closed
     */
    boolean markClosed() {
        synchronized (outbound) {
            if (!open) {
                return false;
            }
            open = false;
            outbound.tryEmitComplete();
            return true;
        }
    }

    Flux<WebSocketMessage> outboundMessages() {
        return outbound.asFlux().map(webSocketSession::textMessage);
    }
}
