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
import me.golemcore.voicerelay.domain.model.ChatResult;
import me.golemcore.voicerelay.domain.model.VoiceSession;
import me.golemcore.voicerelay.domain.service.ConversationService;
import me.golemcore.voicerelay.port.outbound.SynthesisPort.SynthesisResult;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Chats with the session's preferred provider, replies with a
 * {@code response} envelope and, when synthesis succeeds, a second
 * {@code audio_response}. A synthesis failure never turns a successful reply
 * into an error.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TextInputHandler implements EnvelopeHandler {

    static final String TYPE = "text_input";

    private final ConversationService conversationService;

    @Override
    public String getType() {
        return TYPE;
    }

    @Override
    public Mono<Void> handle(VoiceSession session, Map<String, Object> envelope, EnvelopeSender sender) {
        String text = EnvelopeHandler.stringField(envelope, "text");
        if (text == null || text.isBlank()) {
            return Mono.error(new IllegalArgumentException("text is required"));
        }
        return respond(session, text, null, sender)
                .onErrorResume(error -> {
                    log.error("[WebSocket] Text input of session {} failed: {}", session.getId(),
                            EnvelopeHandler.describe(error));
                    sender.error("Error processing message: " + EnvelopeHandler.describe(error), TYPE);
                    return Mono.empty();
                });
    }

    /**
     * Runs one chat turn for {@code text} and emits the reply envelopes.
     *
     * @param source
     *            value of the {@code source} field, or null to omit it
     */
    public Mono<Void> respond(VoiceSession session, String text, String source, EnvelopeSender sender) {
        return Mono.fromFuture(() -> conversationService.chat(session, text))
                .flatMap(result -> {
                    sender.send("response", responseFields(result, source));
                    return Mono.fromFuture(() -> conversationService.synthesize(result.text()))
                            .doOnNext(audio -> audio.ifPresent(
                                    synthesis -> sender.send("audio_response",
                                            audioFields(synthesis, result.text(), source))))
                            .onErrorResume(error -> {
                                log.warn("[WebSocket] Audio reply for session {} dropped: {}", session.getId(),
                                        EnvelopeHandler.describe(error));
                                return Mono.empty();
                            })
                            .then();
                });
    }

    private Map<String, Object> responseFields(ChatResult result, String source) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("text", result.text());
        fields.put("provider", result.provider());
        fields.put("model", result.model());
        fields.put("fallback_used", result.fallbackUsed());
        if (source != null) {
            fields.put("source", source);
        }
        return fields;
    }

    private Map<String, Object> audioFields(SynthesisResult synthesis, String text, String source) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("audio_data", Base64.getEncoder().encodeToString(synthesis.audio()));
        fields.put("audio_format", synthesis.format());
        fields.put("duration", synthesis.duration());
        fields.put("text", text);
        if (source != null) {
            fields.put("source", source);
        }
        return fields;
    }
}
