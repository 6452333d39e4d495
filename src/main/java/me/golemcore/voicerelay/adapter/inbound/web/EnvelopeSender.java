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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.voicerelay.domain.model.SessionConnection;
import me.golemcore.voicerelay.domain.model.VoiceSession;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Emits envelopes to the connection currently processing a session's
 * messages. Every envelope carries {@code type} first and a
 * {@code timestamp}, the session's last activity unless already set.
 */
@Slf4j
public class EnvelopeSender {

    public static final String TYPE = "type";
    public static final String TIMESTAMP = "timestamp";

    private final VoiceSession session;
    private final SessionConnection connection;

    public EnvelopeSender(VoiceSession session, SessionConnection connection) {
        this.session = session;
        this.connection = connection;
    }

    /**
     * Sends an envelope of the given type.
     *
     * @throws IllegalStateException
     *             if the connection is closed
     */
    public void send(String type, Map<String, ?> fields) {
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put(TYPE, type);
        if (fields != null) {
            fields.forEach((key, value) -> {
                if (!TYPE.equals(key)) {
                    envelope.put(key, value);
                }
            });
        }
        envelope.putIfAbsent(TIMESTAMP, session.getLastActivity());
        connection.send(envelope);
    }

    /**
     * Sends an {@code error} envelope. A closed connection is logged, not
     * thrown, since there is nobody left to report to.
     */
    public void error(String message, String messageType) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("message", message);
        if (messageType != null) {
            fields.put("message_type", messageType);
        }
        try {
            send("error", fields);
        } catch (IllegalStateException e) {
            log.warn("[WebSocket] Could not report error to session {}: {}", session.getId(), e.getMessage());
        }
    }

    public VoiceSession getSession() {
        return session;
    }
}
