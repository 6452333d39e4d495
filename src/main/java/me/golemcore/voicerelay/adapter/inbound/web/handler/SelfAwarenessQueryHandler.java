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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.voicerelay.adapter.inbound.web.EnvelopeSender;
import me.golemcore.voicerelay.domain.model.VoiceSession;
import me.golemcore.voicerelay.port.outbound.MonitoringPort;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Relays the monitor's capability answer as {@code self_awareness_response}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SelfAwarenessQueryHandler implements EnvelopeHandler {

    static final String RESPONSE_TYPE = "self_awareness_response";

    private final MonitoringPort monitoringPort;

    @Override
    public String getType() {
        return "self_awareness_query";
    }

    @Override
    @SuppressWarnings("unchecked")
    public Mono<Void> handle(VoiceSession session, Map<String, Object> envelope, EnvelopeSender sender) {
        String question = EnvelopeHandler.stringField(envelope, "question");
        Map<String, Object> context = envelope.get("context") instanceof Map<?, ?> map
                ? (Map<String, Object>) map
                : Map.of();
        return Mono.fromFuture(() -> monitoringPort.capabilityQuery(question != null ? question : "", context))
                .onErrorResume(error -> {
                    log.error("[WebSocket] Self-awareness query failed: {}", EnvelopeHandler.describe(error));
                    return Mono.just(genericAnswer(error));
                })
                .doOnNext(answer -> sender.send(RESPONSE_TYPE, answer))
                .then();
    }

    private static Map<String, Object> genericAnswer(Throwable error) {
        Map<String, Object> assessment = new LinkedHashMap<>();
        assessment.put("question_understood", false);
        assessment.put("explanation", "System error occurred");
        assessment.put("alternatives", List.of("Try again later", "Check system status"));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("answer", "Error processing self-awareness query: " + EnvelopeHandler.describe(error));
        payload.put("capability_assessment", assessment);
        payload.put("confidence", 0);
        payload.put("source", "error");
        return payload;
    }
}
