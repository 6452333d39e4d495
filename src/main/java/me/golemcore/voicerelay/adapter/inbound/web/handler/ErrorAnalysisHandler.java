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

@Component
@RequiredArgsConstructor
@Slf4j
public class ErrorAnalysisHandler implements EnvelopeHandler {

    static final String RESPONSE_TYPE = "error_analysis_response";

    private final MonitoringPort monitoringPort;

    @Override
    public String getType() {
        return "error_analysis_request";
    }

    @Override
    public Mono<Void> handle(VoiceSession session, Map<String, Object> envelope, EnvelopeSender sender) {
        return Mono.fromFuture(monitoringPort::errorAnalysis)
                .onErrorResume(error -> {
                    log.error("[WebSocket] Error analysis failed: {}", EnvelopeHandler.describe(error));
                    return Mono.just(genericAnalysis(error));
                })
                .doOnNext(analysis -> sender.send(RESPONSE_TYPE, analysis))
                .then();
    }

    private static Map<String, Object> genericAnalysis(Throwable error) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("analysis", "Error analysis unavailable: " + EnvelopeHandler.describe(error));
        payload.put("root_cause", "unknown");
        payload.put("severity", "unknown");
        payload.put("recommendations", List.of("Check system logs"));
        payload.put("predicted_resolution_time", "unknown");
        return payload;
    }
}
