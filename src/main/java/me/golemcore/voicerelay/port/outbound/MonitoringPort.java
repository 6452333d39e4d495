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

package me.golemcore.voicerelay.port.outbound;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Port for the self-awareness monitor: answers status, capability and
 * error-analysis queries, and receives the runtime signals it reports on.
 */
public interface MonitoringPort {

    CompletableFuture<Map<String, Object>> statusQuery(String queryType, int timeframeMinutes);

    CompletableFuture<Map<String, Object>> capabilityQuery(String question, Map<String, Object> context);

    CompletableFuture<Map<String, Object>> errorAnalysis();

    void recordError(String source, String message);

    void recordChatLatency(Duration latency);

    void recordTranscription(double confidence);

    void recordSynthesis(boolean success);
}
