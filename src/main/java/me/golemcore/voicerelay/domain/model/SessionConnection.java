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

import java.util.Map;

/**
 * Transport handle bound to a {@link VoiceSession} while a client is
 * connected.
 */
public interface SessionConnection {

    String getConnectionId();

    /**
     * Queues an envelope for delivery without waiting for the transport.
     *
     * @throws IllegalStateException
     *             if the connection is already closed
     */
    void send(Map<String, Object> envelope);

    /**
     * Requests closure with the given close code. Returns immediately.
     */
    void close(int code, String reason);

    boolean isOpen();
}
