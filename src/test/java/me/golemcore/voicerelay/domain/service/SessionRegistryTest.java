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

import me.golemcore.voicerelay.domain.model.VoiceSession;
import me.golemcore.voicerelay.infrastructure.config.RelayProperties;
import me.golemcore.voicerelay.testsupport.MutableClock;
import me.golemcore.voicerelay.testsupport.RecordingConnection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SessionRegistryTest {

    private static final Instant START = Instant.parse("2026-01-01T10:00:00Z");

    private MutableClock clock;
    private SessionRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        RelayProperties properties = new RelayProperties();
        properties.getSession().setTimeout(Duration.ofHours(1));
        registry = new SessionRegistry(properties, clock);
    }

    @Test
    void shouldCreateDistinctSessions() {
        VoiceSession first = registry.create();
        VoiceSession second = registry.create();

        assertNotEquals(first.getId(), second.getId());
        assertEquals(2, registry.count());
        assertTrue(first.getHistory().isEmpty());
        assertTrue(first.getConnection().isEmpty());
        assertEquals(START, first.getCreatedAt());
    }

    @Test
    void shouldTouchOnLookup() {
        VoiceSession session = registry.create();
        clock.advance(Duration.ofMinutes(5));

        assertTrue(registry.get(session.getId()).isPresent());

        assertEquals(START.plus(Duration.ofMinutes(5)), session.getLastActivity());
    }

    @Test
    void shouldReportUnknownSessions() {
        assertTrue(registry.get("missing").isEmpty());
        assertTrue(registry.get(null).isEmpty());
        assertFalse(registry.touch("missing"));
        assertFalse(registry.remove("missing"));
    }

    @Test
    void shouldReapOnlyIdleSessions() {
        VoiceSession idle = registry.create();
        VoiceSession active = registry.create();
        RecordingConnection idleConnection = new RecordingConnection("c-idle");
        idle.bindConnection(idleConnection);

        clock.advance(Duration.ofMinutes(59));
        registry.touch(active.getId());
        clock.advance(Duration.ofMinutes(2));

        assertEquals(1, registry.reap());
        assertEquals(1, registry.count());
        assertTrue(registry.get(active.getId()).isPresent());
        assertTrue(registry.get(idle.getId()).isEmpty());
        assertEquals(1000, idleConnection.closeCode());
        assertEquals("Session expired", idleConnection.closeReason());
    }

    @Test
    void shouldKeepSessionTouchedAfterReapScanStarted() {
        RelayProperties properties = new RelayProperties();
        properties.getSession().setTimeout(Duration.ofHours(1));
        SessionRegistry racingRegistry = new SessionRegistry(properties, clock) {
            @Override
            List<String> snapshotIds() {
                List<String> ids = super.snapshotIds();
                clock.advance(Duration.ofSeconds(1));
                ids.forEach(this::touch);
                return ids;
            }
        };
        VoiceSession session = racingRegistry.create();
        RecordingConnection connection = new RecordingConnection("c-late");
        session.bindConnection(connection);
        clock.advance(Duration.ofHours(2));

        assertEquals(0, racingRegistry.reap());

        assertEquals(1, racingRegistry.count());
        assertEquals(START.plus(Duration.ofHours(2)).plusSeconds(1), session.getLastActivity());
        assertNull(connection.closeCode());
    }

    @Test
    void shouldKeepSessionAtExactTimeout() {
        registry.create();
        clock.advance(Duration.ofHours(1));

        assertEquals(0, registry.reap());
        assertEquals(1, registry.count());
    }

    @Test
    void shouldCloseConnectionOnRemove() {
        VoiceSession session = registry.create();
        RecordingConnection connection = new RecordingConnection("c1");
        session.bindConnection(connection);

        assertTrue(registry.remove(session.getId()));

        assertEquals(0, registry.count());
        assertFalse(connection.isOpen());
        assertEquals(SessionRegistry.CLOSE_SESSION_REMOVED, connection.closeCode());
        assertTrue(session.getConnection().isEmpty());
    }

    @Test
    void shouldBroadcastPastFailingConnections() {
        VoiceSession broken = registry.create();
        VoiceSession healthy = registry.create();
        registry.create();
        broken.bindConnection(new RecordingConnection("broken").failingOnSend());
        RecordingConnection healthyConnection = new RecordingConnection("healthy");
        healthy.bindConnection(healthyConnection);

        int delivered = registry.broadcast(Map.of("type", "provider_status_changed"));

        assertEquals(1, delivered);
        assertEquals(1, healthyConnection.sent().size());
        Map<String, Object> envelope = healthyConnection.sent().get(0);
        assertEquals("provider_status_changed", envelope.get("type"));
        assertEquals(healthy.getLastActivity(), envelope.get("timestamp"));
    }
}
