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
 * Relays the monitor's status report as {@code system_status_response}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SystemStatusQueryHandler implements EnvelopeHandler {

    static final String RESPONSE_TYPE = "system_status_response";
    static final int DEFAULT_TIMEFRAME_MINUTES = 10;

    private final MonitoringPort monitoringPort;

    @Override
    public String getType() {
        return "system_status_query";
    }

    @Override
    public Mono<Void> handle(VoiceSession session, Map<String, Object> envelope, EnvelopeSender sender) {
        String queryType = EnvelopeHandler.stringField(envelope, "query_type");
        int timeframe = timeframeMinutes(envelope.get("timeframe_minutes"));
        return Mono.fromFuture(() -> monitoringPort.statusQuery(queryType != null ? queryType : "current", timeframe))
                .onErrorResume(error -> {
                    log.error("[WebSocket] System status query failed: {}", EnvelopeHandler.describe(error));
                    return Mono.just(genericStatus(error, session));
                })
                .doOnNext(status -> sender.send(RESPONSE_TYPE, status))
                .then();
    }

    static int timeframeMinutes(Object raw) {
        if (raw instanceof Number number && number.intValue() > 0) {
            return number.intValue();
        }
        if (raw instanceof String text) {
            try {
                int parsed = Integer.parseInt(text.trim());
                return parsed > 0 ? parsed : DEFAULT_TIMEFRAME_MINUTES;
            } catch (NumberFormatException e) {
                return DEFAULT_TIMEFRAME_MINUTES;
            }
        }
        return DEFAULT_TIMEFRAME_MINUTES;
    }

    private static Map<String, Object> genericStatus(Throwable error, VoiceSession session) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("status", "error");
        payload.put("metrics", Map.of());
        payload.put("analysis", "Error gathering system status: " + EnvelopeHandler.describe(error));
        payload.put("recommendations", List.of("Check system logs", "Restart monitoring service"));
        payload.put("alerts", List.of());
        payload.put("timestamp", session.getLastActivity());
        return payload;
    }
}
