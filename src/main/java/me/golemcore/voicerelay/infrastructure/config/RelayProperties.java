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

package me.golemcore.voicerelay.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties for the relay, bound from
 * application.properties.
 *
 * <p>
 * All relay configuration is organized under the {@code voice.*} prefix:
 * <ul>
 * <li>{@link SessionProperties} - session lifetime and history cap</li>
 * <li>{@link LlmProperties} - provider credentials and fallback chain</li>
 * <li>{@link SttProperties} / {@link TtsProperties} - voice collaborators</li>
 * <li>{@link HttpProperties} - shared OkHttp client</li>
 * <li>{@link MonitoringProperties} - self-awareness thresholds</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "voice")
@Data
public class RelayProperties {

    private SessionProperties session = new SessionProperties();
    private LlmProperties llm = new LlmProperties();
    private SttProperties stt = new SttProperties();
    private TtsProperties tts = new TtsProperties();
    private HttpProperties http = new HttpProperties();
    private MonitoringProperties monitoring = new MonitoringProperties();

    // ==================== SESSIONS ====================

    @Data
    public static class SessionProperties {
        /** Idle time after which the reaper removes a session. */
        private Duration timeout = Duration.ofHours(1);

        private Duration reapInterval = Duration.ofMinutes(5);

        /** Max conversation turns kept per session. */
        private int historyLimit = 10;
    }

    // ==================== LLM ====================

    @Data
    public static class LlmProperties {
        /** Priority order in which providers are tried. */
        private List<String> fallbackChain = new ArrayList<>(List.of("openai", "claude", "xai", "ollama"));

        /** Provider families reported by status even when not registered. */
        private List<String> knownProviders = new ArrayList<>(
                List.of("openai", "claude", "xai", "lm_studio", "ollama"));

        private Duration healthCheckInterval = Duration.ofMinutes(5);
        private Duration timeout = Duration.ofSeconds(60);
        private int maxTokens = 1000;
        private double temperature = 0.7;
        private String systemPrompt = "You are a helpful AI assistant.";
        private String personalityFile = "Personality.txt";

        /** Optional directory with OpenAI.key, Claude.key, XAI.key files. */
        private String keysDirectory = "config/keys";

        private Map<String, ProviderProperties> providers = new HashMap<>();
    }

    @Data
    public static class ProviderProperties {
        private String apiKey;
        private String baseUrl;
        private String defaultModel;
    }

    // ==================== VOICE ====================

    @Data
    public static class SttProperties {
        private String url = "";
        private String apiKey = "";
        private String model = "whisper-1";

        /** Transcriptions at or below this confidence (0-100) are not sent to chat. */
        private double confidenceThreshold = 30.0;
    }

    @Data
    public static class TtsProperties {
        private String apiKey = "";
        private String voiceId = "21m00Tcm4TlvDq8ikWAM";
        private String modelId = "eleven_multilingual_v2";
        private float speed = 1.0f;
        private String url = "https://api.elevenlabs.io/v1/text-to-speech/%s";
    }

    // ==================== HTTP ====================

    /**
     * Shared HTTP client used by the speech adapters and the local model
     * server.
     */
    @Data
    public static class HttpProperties {
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(60);
        private Duration writeTimeout = Duration.ofSeconds(60);
        private int maxIdleConnections = 5;
        private Duration keepAlive = Duration.ofMinutes(5);
        private String userAgent = "voice-relay/1.0";
    }

    // ==================== MONITORING ====================

    @Data
    public static class MonitoringProperties {
        private int errorHistorySize = 50;
        private int errorCountThreshold = 5;
        private double responseTimeThresholdSeconds = 5.0;
        private double sttConfidenceThreshold = 70.0;
    }
}
