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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.voicerelay.adapter.inbound.web.EnvelopeSender;
import me.golemcore.voicerelay.domain.model.VoiceSession;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Records the model the session asks for; {@code provider} defaults to the
 * session's current preference.
 */
@Component
@Slf4j
public class ChangeModelHandler implements EnvelopeHandler {

    @Override
    public String getType() {
        return "change_model";
    }

    @Override
    public Mono<Void> handle(VoiceSession session, Map<String, Object> envelope, EnvelopeSender sender) {
        return Mono.fromRunnable(() -> {
            String model = EnvelopeHandler.stringField(envelope, "model");
            String provider = envelope.containsKey("provider")
                    ? EnvelopeHandler.stringField(envelope, "provider")
                    : session.getPreferredProvider();
            session.setPreference(provider, model);
            log.info("[WebSocket] Session {} prefers model={} on provider={}", session.getId(), model, provider);

            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("provider", provider);
            fields.put("model", model);
            sender.send("model_changed", fields);
        });
    }
}
