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

package me.golemcore.voicerelay.adapter.inbound.web.handler;

import me.golemcore.voicerelay.adapter.inbound.web.EnvelopeSender;
import me.golemcore.voicerelay.domain.model.VoiceSession;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Handles one inbound envelope type. A failing {@link Mono} is reported to the
 * client as an {@code error} envelope; the connection stays open.
 */
public interface EnvelopeHandler {

    /**
     * Inbound {@code type} value this handler accepts.
     */
    String getType();

    Mono<Void> handle(VoiceSession session, Map<String, Object> envelope, EnvelopeSender sender);

    static String stringField(Map<String, Object> envelope, String name) {
        Object value = envelope.get(name);
        return value instanceof String text ? text : null;
    }

    /**
     * Message of the innermost cause, for client-facing error text.
     */
    static String describe(Throwable error) {
        Throwable current = error;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current.getMessage() != null ? current.getMessage() : current.getClass().getSimpleName();
    }
}
