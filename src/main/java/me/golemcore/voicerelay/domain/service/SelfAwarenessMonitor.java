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

import me.golemcore.voicerelay.infrastructure.config.RelayProperties;
import me.golemcore.voicerelay.port.outbound.LlmProviderPort;
import me.golemcore.voicerelay.port.outbound.MonitoringPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * In-process monitor answering questions about the relay's own health and
 * capabilities.
 *
 * <p>
 * Keeps lightweight runtime metrics (last chat latency, last transcription
 * confidence, synthesis success rate) and a bounded ring of recent errors.
 * When the local provider is registered and available, it phrases
 * capability answers and analyses; otherwise answers come from a built-in
 * knowledge base. Every query completes normally: failures yield a generic
 * payload with the same fields.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class SelfAwarenessMonitor implements MonitoringPort {

    static final String LOCAL_PROVIDER = "ollama";

    private static final String STATUS_HEALTHY = "healthy";
    private static final String STATUS_DEGRADED = "degraded";
    private static final String STATUS_ERROR = "error";

    private static final List<String> CAPABILITIES = List.of(
            "speech-to-text through a Whisper-compatible server",
            "text-to-speech through ElevenLabs",
            "multi-provider LLM chat with automatic fallback",
            "per-session conversation context",
            "runtime metrics and error analysis");

    private static final List<String> LIMITATIONS = List.of(
            "no image generation capabilities",
            "no internet browsing or real-time web access",
            "no file system access",
            "no code execution capabilities",
            "no learning from conversations");

    private static final Map<String, String> KNOWLEDGE_BASE_ANSWERS = Map.of(
            "internet_browsing", "I cannot browse the internet or access real-time web information.",
            "image_generation", "I cannot generate, create, edit, or produce images.",
            "audio_processing", "I can transcribe your voice and answer with synthesized speech.",
            "general_assistant", "I'm a voice-activated AI assistant with text conversation capabilities.");

    private final RelayProperties properties;
    private final ProviderRouter router;
    private final Clock clock;

    private final Deque<ErrorRecord> errors = new ArrayDeque<>();
    private final AtomicLong synthesisSuccesses = new AtomicLong();
    private final AtomicLong synthesisFailures = new AtomicLong();
    private volatile Double lastChatLatencySeconds;
    private volatile Double lastSttConfidence;

    public SelfAwarenessMonitor(RelayProperties properties, ProviderRouter router, Clock clock) {
        this.properties = properties;
        this.router = router;
        this.clock = clock;
    }

    /**
     * One entry of the recent-error ring.
     */
    public record ErrorRecord(Instant timestamp, String source, String message) {
    }

    // ==================== RECORDING ====================

    @Override
    public void recordError(String source, String message) {
        ErrorRecord error = new ErrorRecord(clock.instant(), source != null ? source : "unknown",
                message != null ? message : "");
        synchronized (errors) {
            errors.addLast(error);
            while (errors.size() > properties.getMonitoring().getErrorHistorySize()) {
                errors.removeFirst();
            }
        }
    }

    @Override
    public void recordChatLatency(Duration latency) {
        lastChatLatencySeconds = latency.toMillis() / 1000.0;
    }

    @Override
    public void recordTranscription(double confidence) {
        lastSttConfidence = confidence;
    }

    @Override
    public void recordSynthesis(boolean success) {
        if (success) {
            synthesisSuccesses.incrementAndGet();
        } else {
            synthesisFailures.incrementAndGet();
        }
    }

    public List<ErrorRecord> getRecentErrors() {
        synchronized (errors) {
            return List.copyOf(errors);
        }
    }

    // ==================== STATUS ====================

    @Override
    public CompletableFuture<Map<String, Object>> statusQuery(String queryType, int timeframeMinutes) {
        try {
            int minutes = timeframeMinutes > 0 ? timeframeMinutes : 10;
            Map<String, Object> metrics = currentMetrics(minutes);
            String status = determineStatus(metrics);
            List<String> recommendations = recommendations(metrics);
            List<Map<String, Object>> alerts = alerts(metrics);

            if (!"recent_performance".equals(queryType)) {
                return CompletableFuture.completedFuture(
                        statusPayload(status, metrics, "System status check completed", recommendations, alerts));
            }
            String summary = String.format(Locale.ROOT,
                    "Status %s over the last %d minutes: %s errors, last response time %s s.",
                    status, minutes, metrics.get("error_count"), metrics.get("llm_response_time"));
            String prompt = "Analyze the performance of a voice AI assistant relay.\n\nMetrics: " + metrics
                    + "\nRecent errors: " + recentErrorLines(5)
                    + "\n\nProvide a brief analysis of responsiveness, reliability and issues. Keep it under 100 words.";
            return askLocalModel(prompt, summary)
                    .thenApply(analysis -> statusPayload(status, metrics, analysis, recommendations, alerts))
                    .exceptionally(error -> genericStatus(error));
        } catch (RuntimeException e) { // NOSONAR
            return CompletableFuture.completedFuture(genericStatus(e));
        }
    }

    Map<String, Object> currentMetrics(int timeframeMinutes) {
        Instant cutoff = clock.instant().minus(Duration.ofMinutes(timeframeMinutes));
        long errorCount = getRecentErrors().stream()
                .filter(error -> !error.timestamp().isBefore(cutoff))
                .count();
        long successes = synthesisSuccesses.get();
        long total = successes + synthesisFailures.get();

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("stt_confidence", lastSttConfidence);
        metrics.put("llm_response_time", lastChatLatencySeconds);
        metrics.put("tts_success_rate", total > 0 ? successes * 100.0 / total : null);
        metrics.put("error_count", errorCount);
        metrics.put("provider_health", !router.findAvailable().isEmpty());
        metrics.put("current_provider", router.getCurrentProvider());
        metrics.put("current_model", router.getCurrentModel());
        return metrics;
    }

    String determineStatus(Map<String, Object> metrics) {
        RelayProperties.MonitoringProperties thresholds = properties.getMonitoring();
        long errorCount = ((Number) metrics.get("error_count")).longValue();
        if (errorCount > thresholds.getErrorCountThreshold()) {
            return STATUS_ERROR;
        }
        Double latency = (Double) metrics.get("llm_response_time");
        Double confidence = (Double) metrics.get("stt_confidence");
        if ((latency != null && latency > thresholds.getResponseTimeThresholdSeconds())
                || (confidence != null && confidence < thresholds.getSttConfidenceThreshold())) {
            return STATUS_DEGRADED;
        }
        return STATUS_HEALTHY;
    }

    private List<String> recommendations(Map<String, Object> metrics) {
        List<String> recommendations = new ArrayList<>();
        Double confidence = (Double) metrics.get("stt_confidence");
        if (confidence != null && confidence < 80) {
            recommendations.add("Check microphone position and reduce background noise");
        }
        Double latency = (Double) metrics.get("llm_response_time");
        if (latency != null && latency > 3) {
            recommendations.add("Consider switching to a faster LLM model");
        }
        if (((Number) metrics.get("error_count")).longValue() > 2) {
            recommendations.add("Review recent error logs for issues");
        }
        if (!Boolean.TRUE.equals(metrics.get("provider_health"))) {
            recommendations.add("Configure an API key or start the local model server");
        }
        if (recommendations.isEmpty()) {
            recommendations.add("System operating optimally");
        }
        return recommendations;
    }

    private List<Map<String, Object>> alerts(Map<String, Object> metrics) {
        List<Map<String, Object>> alerts = new ArrayList<>();
        if (!Boolean.TRUE.equals(metrics.get("provider_health"))) {
            alerts.add(alert("high", "No LLM provider is available"));
        }
        long errorCount = ((Number) metrics.get("error_count")).longValue();
        if (errorCount > properties.getMonitoring().getErrorCountThreshold()) {
            alerts.add(alert("medium", errorCount + " errors in the selected timeframe"));
        }
        return alerts;
    }

    private Map<String, Object> statusPayload(String status, Map<String, Object> metrics, String analysis,
            List<String> recommendations, List<Map<String, Object>> alerts) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("status", status);
        payload.put("metrics", metrics);
        payload.put("analysis", analysis);
        payload.put("recommendations", recommendations);
        payload.put("alerts", alerts);
        payload.put("timestamp", clock.instant());
        return payload;
    }

    private Map<String, Object> genericStatus(Throwable error) {
        log.error("[Monitor] Status query failed: {}", error.getMessage());
        return statusPayload(STATUS_ERROR, Map.of(), "Error gathering system status: " + error.getMessage(),
                List.of("Check system logs", "Restart monitoring service"), List.of());
    }

    // ==================== CAPABILITIES ====================

    @Override
    public CompletableFuture<Map<String, Object>> capabilityQuery(String question, Map<String, Object> context) {
        String safeQuestion = question != null ? question : "";
        Map<String, Object> assessment = assessCapability(safeQuestion);
        Optional<LlmProviderPort> local = localModel();
        if (local.isEmpty()) {
            return CompletableFuture.completedFuture(knowledgeBaseAnswer(assessment));
        }
        String prompt = "You are a self-aware AI assistant answering questions about your own capabilities.\n\n"
                + "Capabilities: " + String.join(", ", CAPABILITIES) + "\n"
                + "Limitations: " + String.join(", ", LIMITATIONS) + "\n"
                + "Current system status: " + determineStatus(currentMetrics(10)) + "\n"
                + (context != null && !context.isEmpty() ? "Context: " + context + "\n" : "")
                + "\nUser Question: \"" + safeQuestion + "\"\n\n"
                + "Provide a direct, honest answer in 1-2 sentences. Be specific about what you can and cannot do.";
        return chatLocally(local.get(), prompt)
                .thenApply(answer -> {
                    Map<String, Object> payload = new LinkedHashMap<>();
                    payload.put("answer", answer);
                    payload.put("capability_assessment", assessment);
                    payload.put("confidence", 90);
                    payload.put("source", "self_awareness_llm");
                    return payload;
                })
                .exceptionally(error -> {
                    log.warn("[Monitor] Local model failed to answer, using knowledge base: {}", error.getMessage());
                    return knowledgeBaseAnswer(assessment);
                });
    }

    Map<String, Object> assessCapability(String question) {
        String lower = question.toLowerCase(Locale.ROOT);
        Map<String, Object> assessment = new LinkedHashMap<>();
        if (containsAny(lower, "browse", "web", "internet", "search")) {
            assessment.put("capability", "internet_browsing");
            assessment.put("available", false);
            assessment.put("explanation", "No internet browsing or real-time web access available");
        } else if (containsAny(lower, "image", "picture", "generate", "create")) {
            assessment.put("capability", "image_generation");
            assessment.put("available", false);
            assessment.put("explanation", "No image generation capabilities");
        } else if (containsAny(lower, "hear", "audio", "voice", "speak")) {
            assessment.put("capability", "audio_processing");
            assessment.put("available", true);
            assessment.put("explanation", "Voice input and spoken replies are available");
        } else {
            assessment.put("capability", "general_assistant");
            assessment.put("available", true);
            assessment.put("explanation", "Text-based AI assistance with multi-LLM support");
        }
        return assessment;
    }

    private Map<String, Object> knowledgeBaseAnswer(Map<String, Object> assessment) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("answer", KNOWLEDGE_BASE_ANSWERS.getOrDefault((String) assessment.get("capability"),
                "I'm a voice-activated AI assistant. Please ask specific questions about my capabilities."));
        payload.put("capability_assessment", assessment);
        payload.put("confidence", 95);
        payload.put("source", "knowledge_base");
        return payload;
    }

    // ==================== ERROR ANALYSIS ====================

    @Override
    public CompletableFuture<Map<String, Object>> errorAnalysis() {
        try {
            List<ErrorRecord> recent = getRecentErrors();
            int threshold = properties.getMonitoring().getErrorCountThreshold();
            String severity = recent.isEmpty() ? "low" : recent.size() > threshold ? "high" : "medium";
            String rootCause = recent.stream()
                    .collect(Collectors.groupingBy(ErrorRecord::source, Collectors.counting()))
                    .entrySet().stream()
                    .max(Map.Entry.comparingByValue())
                    .map(entry -> entry.getKey() + " (" + entry.getValue() + " errors)")
                    .orElse("none");
            List<String> recommendations = errorRecommendations(recent);
            String predicted = switch (severity) {
            case "high" -> "30+ minutes";
            case "medium" -> "5-15 minutes";
            default -> "immediate";
            };
            String summary = recent.isEmpty()
                    ? "No recent errors recorded."
                    : recent.size() + " recent errors, most frequent source: " + rootCause + ".";

            if (recent.isEmpty()) {
                return CompletableFuture.completedFuture(
                        analysisPayload(summary, rootCause, severity, recommendations, predicted));
            }
            String prompt = "Analyze these recent errors of a voice AI assistant relay:\n\n" + recentErrorLines(20)
                    + "\n\nDescribe the most likely root cause and impact in 2-3 sentences.";
            return askLocalModel(prompt, summary)
                    .thenApply(analysis -> analysisPayload(analysis, rootCause, severity, recommendations, predicted))
                    .exceptionally(this::genericAnalysis);
        } catch (RuntimeException e) { // NOSONAR
            return CompletableFuture.completedFuture(genericAnalysis(e));
        }
    }

    private List<String> errorRecommendations(List<ErrorRecord> recent) {
        Map<String, Long> bySource = recent.stream()
                .collect(Collectors.groupingBy(ErrorRecord::source, Collectors.counting()));
        List<String> recommendations = new ArrayList<>();
        if (bySource.containsKey("llm")) {
            recommendations.add("Check provider API keys and run a provider health check");
        }
        if (bySource.containsKey("stt")) {
            recommendations.add("Verify the speech-to-text server is reachable");
        }
        if (bySource.containsKey("tts")) {
            recommendations.add("Verify the text-to-speech API key and quota");
        }
        if (bySource.containsKey("websocket")) {
            recommendations.add("Inspect client messages for malformed envelopes");
        }
        if (recommendations.isEmpty()) {
            recommendations.add("No action required");
        }
        return recommendations;
    }

    private Map<String, Object> analysisPayload(String analysis, String rootCause, String severity,
            List<String> recommendations, String predicted) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("analysis", analysis);
        payload.put("root_cause", rootCause);
        payload.put("severity", severity);
        payload.put("recommendations", recommendations);
        payload.put("predicted_resolution_time", predicted);
        return payload;
    }

    private Map<String, Object> genericAnalysis(Throwable error) {
        log.error("[Monitor] Error analysis failed: {}", error.getMessage());
        return analysisPayload("Error analysis unavailable: " + error.getMessage(), "unknown", "unknown",
                List.of("Check system logs"), "unknown");
    }

    // ==================== LOCAL MODEL ====================

    private Optional<LlmProviderPort> localModel() {
        return router.getProvider(LOCAL_PROVIDER).filter(LlmProviderPort::isAvailable);
    }

    /**
     * Asks the local model, falling back to {@code fallback} when it is
     * unavailable or fails.
     */
    private CompletableFuture<String> askLocalModel(String prompt, String fallback) {
        Optional<LlmProviderPort> local = localModel();
        if (local.isEmpty()) {
            return CompletableFuture.completedFuture(fallback);
        }
        return chatLocally(local.get(), prompt)
                .exceptionally(error -> {
                    log.warn("[Monitor] Local model analysis failed: {}", error.getMessage());
                    return fallback;
                });
    }

    private CompletableFuture<String> chatLocally(LlmProviderPort local, String prompt) {
        try {
            return local.chat(prompt, List.of(), local.getCurrentModel())
                    .thenApply(text -> {
                        if (text == null || text.isBlank()) {
                            throw new IllegalStateException("Empty answer from local model");
                        }
                        return text.trim();
                    });
        } catch (RuntimeException e) { // NOSONAR
            return CompletableFuture.failedFuture(e);
        }
    }

    private String recentErrorLines(int limit) {
        List<ErrorRecord> recent = getRecentErrors();
        List<ErrorRecord> tail = recent.subList(Math.max(0, recent.size() - limit), recent.size());
        if (tail.isEmpty()) {
            return "none";
        }
        return tail.stream()
                .map(error -> error.timestamp() + " [" + error.source() + "] " + error.message())
                .collect(Collectors.joining("\n"));
    }

    private static Map<String, Object> alert(String severity, String message) {
        Map<String, Object> alert = new LinkedHashMap<>();
        alert.put("severity", severity);
        alert.put("message", message);
        return alert;
    }

    private static boolean containsAny(String text, String... terms) {
        for (String term : terms) {
            if (text.contains(term)) {
                return true;
            }
        }
        return false;
    }
}
