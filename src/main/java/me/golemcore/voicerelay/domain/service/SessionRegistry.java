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

import me.golemcore.voicerelay.domain.model.SessionConnection;
import me.golemcore.voicerelay.domain.model.VoiceSession;
import me.golemcore.voicerelay.infrastructure.config.RelayProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Process-wide store of live voice sessions.
 *
 * <p>
 * Every mutation of an entry (activity touch, removal, reap decision) goes
 * through {@link ConcurrentHashMap#computeIfPresent} or
 * {@link ConcurrentHashMap#remove}, so operations on the same session are
 * mutually exclusive while different sessions never contend. The reaper and
 * {@link #broadcast(Map)} iterate a snapshot and never hold a lock across a
 * network send.
 *
 * <p>
 * A background reaper removes sessions idle longer than
 * {@code voice.session.timeout}, every {@code voice.session.reap-interval}.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class SessionRegistry {

    static final int CLOSE_SESSION_REMOVED = 1000;

    private final RelayProperties properties;
    private final Clock clock;
    private final Map<String, VoiceSession> sessions = new ConcurrentHashMap<>();

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> reapTask;

    public SessionRegistry(RelayProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        Duration interval = properties.getSession().getReapInterval();
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "session-reaper");
            t.setDaemon(true);
            return t;
        });
        reapTask = scheduler.scheduleAtFixedRate(this::reapSafely,
                interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("[Sessions] Reaper started: interval={}, timeout={}",
                interval, properties.getSession().getTimeout());
    }

    @PreDestroy
    public void shutdown() {
        if (reapTask != null) {
            reapTask.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("[Sessions] Shut down with {} live sessions", sessions.size());
    }

    /**
     * Creates a session with empty history and no bound connection.
     */
    public VoiceSession create() {
        String id = UUID.randomUUID().toString();
        VoiceSession session = new VoiceSession(id, clock.instant(), properties.getSession().getHistoryLimit());
        sessions.put(id, session);
        log.info("[Sessions] Created session {}", id);
        return session;
    }

    /**
     * Looks up a session and records activity on it. Empty when unknown.
     */
    public Optional<VoiceSession> get(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        return Optional.ofNullable(sessions.computeIfPresent(sessionId, (id, session) -> {
            session.touch(now);
            return session;
        }));
    }

    /**
     * Records activity without returning the session.
     *
     * @return false if the session no longer exists
     */
    public boolean touch(String sessionId) {
        return get(sessionId).isPresent();
    }

    /**
     * Deletes a session. A bound connection is asked to close without waiting
     * for the transport.
     *
     * @return false if no such session existed
     */
    public boolean remove(String sessionId) {
        if (sessionId == null) {
            return false;
        }
        VoiceSession removed = sessions.remove(sessionId);
        if (removed == null) {
            return false;
        }
        closeConnection(removed, "Session removed");
        log.info("[Sessions] Removed session {}", sessionId);
        return true;
    }

    /**
     * Removes every session whose last activity precedes now minus the
     * configured timeout. Idleness is re-checked under the entry lock, so a
     * session touched during the scan survives.
     *
     * @return number of sessions removed
     */
    public int reap() {
        Instant cutoff = clock.instant().minus(properties.getSession().getTimeout());
        List<VoiceSession> reaped = new ArrayList<>();
        for (String id : snapshotIds()) {
            sessions.computeIfPresent(id, (key, session) -> {
                if (session.isIdleSince(cutoff)) {
                    reaped.add(session);
                    return null;
                }
                return session;
            });
        }
        for (VoiceSession session : reaped) {
            closeConnection(session, "Session expired");
        }
        if (!reaped.isEmpty()) {
            log.info("[Sessions] Reaped {} idle sessions, {} remain", reaped.size(), sessions.size());
        }
        return reaped.size();
    }

    /** Ids present when a scan starts; entries may change before each is visited. */
    List<String> snapshotIds() {
        return new ArrayList<>(sessions.keySet());
    }

    public int count() {
        return sessions.size();
    }

    /**
     * Sends the payload to every session that currently has a connection. A
     * failed send is logged and does not stop delivery to the others.
     *
     * @return number of sessions the payload was handed to
     */
    public int broadcast(Map<String, Object> payload) {
        int delivered = 0;
        for (VoiceSession session : new ArrayList<>(sessions.values())) {
            Optional<SessionConnection> connection = session.getConnection();
            if (connection.isEmpty()) {
                continue;
            }
            Map<String, Object> envelope = new LinkedHashMap<>(payload);
            envelope.putIfAbsent("timestamp", session.getLastActivity());
            try {
                connection.get().send(envelope);
                delivered++;
            } catch (RuntimeException e) { // NOSONAR - one dead connection must not stop the broadcast
                log.error("[Sessions] Broadcast to session {} failed: {}", session.getId(), e.getMessage());
            }
        }
        return delivered;
    }

    private void reapSafely() {
        try {
            reap();
        } catch (RuntimeException e) { // NOSONAR - keep the scheduled task alive
            log.error("[Sessions] Reaper run failed", e);
        }
    }

    private void closeConnection(VoiceSession session, String reason) {
        session.getConnection().ifPresent(connection -> {
            session.releaseConnection(connection);
            try {
                connection.close(CLOSE_SESSION_REMOVED, reason);
            } catch (RuntimeException e) { // NOSONAR
                log.warn("[Sessions] Failed to close connection of session {}: {}", session.getId(),
                        e.getMessage());
            }
        });
    }
}
