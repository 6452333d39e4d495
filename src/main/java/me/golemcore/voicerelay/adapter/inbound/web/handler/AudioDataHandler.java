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
import me.golemcore.voicerelay.infrastructure.config.RelayProperties;
import me.golemcore.voicerelay.port.outbound.MonitoringPort;
import me.golemcore.voicerelay.port.outbound.TranscriptionPort;
import me.golemcore.voicerelay.port.outbound.TranscriptionPort.TranscriptionResult;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Transcribes base64 audio and always reports a {@code transcription}
 * envelope. Only a non-empty, error-free transcription above the confidence
 * threshold continues as a voice-sourced chat turn.
 *
 * <p>
 * The client's audio format is kept in the session settings, so it only needs
 * to be sent once per session.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AudioDataHandler implements EnvelopeHandler {

    static final String TYPE = "audio_data";
    static final String VOICE_SOURCE = "voice_input";
    static final String FORMAT_SETTING = "audio_format";
    private static final String DEFAULT_FORMAT = "webm";

    private final TranscriptionPort transcriptionPort;
    private final TextInputHandler textInputHandler;
    private final MonitoringPort monitoringPort;
    private final RelayProperties properties;

    @Override
    public String getType() {
        return TYPE;
    }

    @Override
    public Mono<Void> handle(VoiceSession session, Map<String, Object> envelope, EnvelopeSender sender) {
        String data = EnvelopeHandler.stringField(envelope, "data");
        if (data == null || data.isBlank()) {
            sender.send("transcription", transcriptionFields(TranscriptionResult.failed("No audio data received")));
            return Mono.empty();
        }
        byte[] audio;
        try {
            audio = Base64.getDecoder().decode(data.trim());
        } catch (IllegalArgumentException e) {
            log.warn("[WebSocket] Undecodable audio from session {}: {}", session.getId(), e.getMessage());
            sender.send("transcription",
                    transcriptionFields(TranscriptionResult.failed("Audio processing error: " + e.getMessage())));
            return Mono.empty();
        }
        String sourceFormat = resolveFormat(session, EnvelopeHandler.stringField(envelope, "format"));

        return Mono.fromFuture(() -> transcriptionPort.transcribe(audio, sourceFormat))
                .onErrorResume(error -> Mono.just(
                        TranscriptionResult.failed("Audio processing error: " + EnvelopeHandler.describe(error))))
                .flatMap(result -> {
                    if (result.error() != null) {
                        monitoringPort.recordError("stt", result.error());
                    } else {
                        monitoringPort.recordTranscription(result.confidence());
                    }
                    sender.send("transcription", transcriptionFields(result));
                    if (!shouldRespond(result)) {
                        log.info("[WebSocket] Transcription not forwarded to chat (confidence={}, error={})",
                                result.confidence(), result.error());
                        return Mono.empty();
                    }
                    return textInputHandler.respond(session, result.text(), VOICE_SOURCE, sender)
                            .onErrorResume(error -> {
                                log.error("[WebSocket] Voice input of session {} failed: {}", session.getId(),
                                        EnvelopeHandler.describe(error));
                                sender.error("Error processing voice input: " + EnvelopeHandler.describe(error),
                                        TYPE);
                                return Mono.empty();
                            });
                });
    }

    /**
     * An explicit format is remembered in the session settings; frames without
     * one reuse the remembered format, else {@code webm}.
     */
    private static String resolveFormat(VoiceSession session, String format) {
        if (format != null && !format.isBlank()) {
            session.getSettings().put(FORMAT_SETTING, format);
            return format;
        }
        Object remembered = session.getSettings().get(FORMAT_SETTING);
        return remembered instanceof String ? (String) remembered : DEFAULT_FORMAT;
    }

    boolean shouldRespond(TranscriptionResult result) {
        return result.text() != null
                && !result.text().isBlank()
                && result.error() == null
                && result.confidence() > properties.getStt().getConfidenceThreshold();
    }

    private Map<String, Object> transcriptionFields(TranscriptionResult result) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("text", result.text() != null ? result.text() : "");
        fields.put("confidence", result.confidence());
        fields.put("language", result.language());
        fields.put("duration", result.duration());
        fields.put("error", result.error());
        return fields;
    }
}
