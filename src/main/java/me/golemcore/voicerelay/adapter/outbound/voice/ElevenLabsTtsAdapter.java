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

package me.golemcore.voicerelay.adapter.outbound.voice;

import me.golemcore.voicerelay.infrastructure.config.RelayProperties;
import me.golemcore.voicerelay.port.outbound.SynthesisPort;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Text-to-speech through the ElevenLabs API, returning MP3 audio.
 *
 * <p>
 * Unavailable without an API key. Failures are reported inside the result.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ElevenLabsTtsAdapter implements SynthesisPort {

    static final String AUDIO_FORMAT = "mp3";
    private static final int MP3_BITRATE = 128_000;
    private static final int MAX_RETRIES = 3;

    private static final ExecutorService VOICE_EXECUTOR = Executors.newFixedThreadPool(2,
            r -> {
                Thread t = new Thread(r, "elevenlabs-tts");
                t.setDaemon(true);
                return t;
            });

    private final OkHttpClient okHttpClient;
    private final RelayProperties properties;
    private final ObjectMapper objectMapper;

    @PostConstruct
    void init() {
        RelayProperties.TtsProperties tts = properties.getTts();
        log.info("[ElevenLabs] Adapter initialized: apiKeyConfigured={}, voiceId={}, model={}",
                isAvailable(), tts.getVoiceId(), tts.getModelId());
    }

    @Override
    public boolean isAvailable() {
        String apiKey = properties.getTts().getApiKey();
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public CompletableFuture<SynthesisResult> synthesize(String text) {
        return CompletableFuture.supplyAsync(() -> doSynthesize(text), VOICE_EXECUTOR);
    }

    @SuppressWarnings("PMD.CloseResource") // ResponseBody is closed when Response is closed in try-with-resources
    SynthesisResult doSynthesize(String text) {
        if (!isAvailable()) {
            return SynthesisResult.failed("ElevenLabs API key not configured");
        }
        if (text == null || text.isBlank()) {
            return SynthesisResult.failed("Nothing to synthesize");
        }
        try {
            RelayProperties.TtsProperties tts = properties.getTts();
            log.info("[ElevenLabs] TTS request: {} chars, voice={}, model={}, speed={}",
                    text.length(), tts.getVoiceId(), tts.getModelId(), tts.getSpeed());

            String jsonBody = objectMapper.writeValueAsString(new TtsRequest(text, tts.getModelId(), tts.getSpeed()));
            Request request = new Request.Builder()
                    .url(getTtsUrl(tts.getVoiceId()) + "?output_format=mp3_44100_128")
                    .header("xi-api-key", tts.getApiKey())
                    .header("Accept", "audio/mpeg")
                    .post(RequestBody.create(jsonBody, MediaType.parse("application/json")))
                    .build();

            long startTime = System.currentTimeMillis();
            int attempt = 0;
            while (attempt < MAX_RETRIES) {
                try (Response response = okHttpClient.newCall(request).execute()) {
                    long elapsed = System.currentTimeMillis() - startTime;
                    ResponseBody body = response.body();

                    if (!response.isSuccessful()) {
                        if (isRetryableError(response.code()) && attempt < MAX_RETRIES - 1) {
                            attempt++;
                            long backoffMs = (long) Math.pow(2, attempt) * 1000;
                            log.info("[ElevenLabs] TTS retrying after {} (attempt {}/{}), backoff={}ms",
                                    response.code(), attempt, MAX_RETRIES, backoffMs);
                            sleepBeforeRetry(backoffMs);
                            continue;
                        }
                        return SynthesisResult.failed(describeError(response.code(), body, elapsed));
                    }

                    if (body == null) {
                        return SynthesisResult.failed("ElevenLabs TTS returned empty body");
                    }
                    byte[] audio = body.bytes();
                    log.info("[ElevenLabs] TTS success: {} chars -> {} bytes MP3, {}ms",
                            text.length(), audio.length, elapsed);
                    return new SynthesisResult(true, audio, AUDIO_FORMAT, estimateDuration(audio.length), null);
                }
            }
            return SynthesisResult.failed("ElevenLabs TTS failed after " + MAX_RETRIES + " attempts");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return SynthesisResult.failed("ElevenLabs TTS interrupted");
        } catch (IOException e) {
            log.error("[ElevenLabs] TTS network error: {}", e.getMessage());
            return SynthesisResult.failed("Synthesis failed: " + e.getMessage());
        }
    }

    protected String getTtsUrl(String voiceId) {
        return String.format(properties.getTts().getUrl(), voiceId);
    }

    protected void sleepBeforeRetry(long backoffMs) throws InterruptedException {
        Thread.sleep(backoffMs);
    }

    static double estimateDuration(int bytes) {
        return bytes * 8.0 / MP3_BITRATE;
    }

    private String describeError(int code, ResponseBody body, long elapsed) throws IOException {
        String errorBody = body != null ? body.string() : "";
        ErrorResponse errorResponse = parseErrorResponse(errorBody);
        String message = extractErrorMessage(errorResponse);
        String context = getErrorContext(code);
        log.warn("[ElevenLabs] TTS failed: HTTP {} in {}ms, {} ({})", code, elapsed, message, context);
        return String.format("ElevenLabs TTS error (HTTP %d): %s. %s", code, message, context);
    }

    private ErrorResponse parseErrorResponse(String errorBody) {
        try {
            return objectMapper.readValue(errorBody, ErrorResponse.class);
        } catch (IOException e) {
            log.debug("[ElevenLabs] Could not parse error response: {}", errorBody);
            ErrorResponse fallback = new ErrorResponse();
            fallback.setMessage(errorBody);
            return fallback;
        }
    }

    private String extractErrorMessage(ErrorResponse errorResponse) {
        if (errorResponse.getDetail() != null && errorResponse.getDetail().getMessage() != null) {
            return errorResponse.getDetail().getMessage();
        }
        if (errorResponse.getMessage() != null && !errorResponse.getMessage().isBlank()) {
            return errorResponse.getMessage();
        }
        return "Unknown error";
    }

    private String getErrorContext(int code) {
        return switch (code) {
        case 400 -> "Bad request. Check text length limits";
        case 401 -> "Authentication failed. Check your ElevenLabs API key";
        case 402 -> "Quota exceeded. Enable usage-based billing or upgrade the plan";
        case 422 -> "Invalid request format. Check parameters";
        case 429 -> "Rate limit exceeded";
        case 500, 503 -> "ElevenLabs service temporarily unavailable";
        case 504 -> "Request timeout";
        default -> "Service error";
        };
    }

    private boolean isRetryableError(int code) {
        return code == 429 || code == 500 || code == 503 || code == 504;
    }

    record TtsRequest(
            String text,
            @JsonProperty("model_id") String modelId,
            float speed) {
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ErrorResponse {
        private ErrorDetail detail;
        private String message;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ErrorDetail {
        private String status;
        private String message;
    }
}
