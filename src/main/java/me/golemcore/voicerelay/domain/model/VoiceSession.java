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

package me.golemcore.voicerelay.domain.model;

import lombok.Getter;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Server-side conversation context of one client. Holds the bounded turn
 * history, the provider/model the client prefers, the activity timestamp used
 * by the reaper and at most one bound connection.
 *
 * <p>
 * All mutable state is guarded by the session monitor.
 */
public class VoiceSession {

    @Getter
    private final String id;
    @Getter
    private final Instant createdAt;
    @Getter
    private final int historyLimit;
    /** Client settings that outlive a single message, such as the audio format. */
    @Getter
    private final Map<String, Object> settings = new ConcurrentHashMap<>();

    private final Deque<ConversationTurn> history = new ArrayDeque<>();
    private Instant lastActivity;
    private SessionConnection connection;
    private String preferredProvider;
    private String preferredModel;

    public VoiceSession(String id, Instant createdAt, int historyLimit) {
        if (historyLimit < 1) {
            throw new IllegalArgumentException("historyLimit must be positive: " + historyLimit);
        }
        this.id = id;
        this.createdAt = createdAt;
        this.lastActivity = createdAt;
        this.historyLimit = historyLimit;
    }

    public synchronized Instant getLastActivity() {
        return lastActivity;
    }

    /**
     * Records activity. Never moves the timestamp backwards.
     */
    public synchronized void touch(Instant now) {
        if (now != null && now.isAfter(lastActivity)) {
            lastActivity = now;
        }
    }

    public synchronized boolean isIdleSince(Instant cutoff) {
        return lastActivity.isBefore(cutoff);
    }

    public synchronized Optional<SessionConnection> getConnection() {
        return Optional.ofNullable(connection);
    }

    /**
     * Binds a connection, returning the one it replaced, if any.
     */
    public synchronized Optional<SessionConnection> bindConnection(SessionConnection newConnection) {
        SessionConnection previous = connection;
        connection = newConnection;
        return previous == newConnection ? Optional.empty() : Optional.ofNullable(previous);
    }

    /**
     * Clears the binding only if it still points at {@code expected}.
     */
    public synchronized boolean releaseConnection(SessionConnection expected) {
        if (connection != null && connection == expected) {
            connection = null;
            return true;
        }
        return false;
    }

    /**
     * Appends a turn, evicting the oldest ones past the history limit.
     */
    public synchronized void addTurn(ConversationTurn turn) {
        history.addLast(turn);
        while (history.size() > historyLimit) {
            history.removeFirst();
        }
    }

    public synchronized List<ConversationTurn> getHistory() {
        return List.copyOf(history);
    }

    public synchronized String getPreferredProvider() {
        return preferredProvider;
    }

    public synchronized String getPreferredModel() {
        return preferredModel;
    }

    public synchronized void setPreference(String provider, String model) {
        this.preferredProvider = provider;
        this.preferredModel = model;
    }
}
