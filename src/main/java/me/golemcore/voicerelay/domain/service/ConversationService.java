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

package me.golemcore.voicerelay.domain.service;

import me.golemcore.voicerelay.domain.model.ChatResult;
import me.golemcore.voicerelay.domain.model.ConversationTurn;
import me.golemcore.voicerelay.domain.model.VoiceSession;
import me.golemcore.voicerelay.port.outbound.MonitoringPort;
import me.golemcore.voicerelay.port.outbound.SynthesisPort;
import me.golemcore.voicerelay.port.outbound.SynthesisPort.SynthesisResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * One chat turn of a session: routes the message with the session's history
 * and preferences, records the completed turn, and optionally voices the
 * reply.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConversationService {

    private final ProviderRouter router;
    private final SynthesisPort synthesisPort;
    private final MonitoringPort monitoringPort;
    private final Clock clock;

    /**
     * Routes {@code text} and appends the resulting turn to the session
     * history. Fails with the router's exception when every provider failed.
     */
    public CompletableFuture<ChatResult> chat(VoiceSession session, String text) {
        Instant started = clock.instant();
        return router.chat(text, session.getHistory(), session.getPreferredProvider(), session.getPreferredModel())
                .whenComplete((result, error) -> {
                    if (error != null) {
                        Throwable cause = error instanceof CompletionException && error.getCause() != null
                                ? error.getCause()
                                : error;
                        monitoringPort.recordError("llm", cause.getMessage());
                        return;
                    }
                    Instant finished = clock.instant();
                    monitoringPort.recordChatLatency(Duration.between(started, finished));
                    session.addTurn(new ConversationTurn(finished, text, result.text(), result.provider(),
                            result.model()));
                });
    }

    /**
     * Synthesizes speech for a reply. Never fails: an unavailable or failing
     * synthesizer yields an empty result.
     */
    public CompletableFuture<Optional<SynthesisResult>> synthesize(String text) {
        if (!synthesisPort.isAvailable()) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        CompletableFuture<SynthesisResult> call;
        try {
            call = synthesisPort.synthesize(text);
        } catch (RuntimeException e) { // NOSONAR
            call = CompletableFuture.failedFuture(e);
        }
        return call.handle((result, error) -> {
            if (error == null && result != null && result.success()) {
                monitoringPort.recordSynthesis(true);
                return Optional.of(result);
            }
            String reason = error != null ? error.getMessage() : result != null ? result.error() : "no result";
            log.warn("[Conversation] Speech synthesis failed: {}", reason);
            monitoringPort.recordSynthesis(false);
            monitoringPort.recordError("tts", reason);
            return Optional.empty();
        });
    }
}
