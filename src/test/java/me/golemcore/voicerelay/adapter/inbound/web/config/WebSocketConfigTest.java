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

package me.golemcore.voicerelay.adapter.inbound.web.config;

import me.golemcore.voicerelay.adapter.inbound.web.VoiceWebSocketHandler;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

class WebSocketConfigTest {

    @Test
    void shouldMapSessionPathToHandlerAheadOfControllers() {
        VoiceWebSocketHandler handler = mock(VoiceWebSocketHandler.class);
        WebSocketConfig config = new WebSocketConfig(handler);

        HandlerMapping mapping = config.webSocketHandlerMapping();

        assertTrue(mapping instanceof SimpleUrlHandlerMapping);
        SimpleUrlHandlerMapping urlMapping = (SimpleUrlHandlerMapping) mapping;
        assertEquals(-1, urlMapping.getOrder());
        assertSame(handler, urlMapping.getUrlMap().get("/ws/*"));
        assertNotNull(config.webSocketHandlerAdapter());
    }
}
