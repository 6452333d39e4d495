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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.voicerelay.infrastructure.config.RelayProperties;
import me.golemcore.voicerelay.port.outbound.TranscriptionPort;
import okhttp3.MediaType;
import okhttp3.MultipartBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Transcription through any Whisper-compatible STT server (faster-whisper,
 * Whisper.cpp, OpenAI). All use the same API:
 * {@code POST /v1/audio/transcriptions} with a {@code verbose_json} response.
 *
 * <p>
 * Confidence is derived from the per-segment no-speech probability: the mean
 * of {@code (1 - no_speech_prob) * 100} over all segments, 0 without
 * segments. Failures are reported inside the result.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WhisperCompatibleSttAdapter implements TranscriptionPort {

    private static final String TRANSCRIPTION_PATH = "/v1/audio/transcriptions";
    private static final int MAX_RETRIES = 3;
    private static final String DEFAULT_FORMAT = "webm";

    private static final Map<String, String> MIME_TYPES = Map.of(
            "webm", "audio/webm",
            "wav", "audio/wav",
            "ogg", "audio/ogg",
            "mp3", "audio/mpeg",
            "m4a", "audio/mp4",
            "flac", "audio/flac");

    private final OkHttpClient okHttpClient;
    private final RelayProperties properties;
    private final ObjectMapper objectMapper;

    @Override
    public boolean isAvailable() {
        String url = properties.getStt().getUrl();
        return url != null && !url.isBlank();
    }

    @Override
    public CompletableFuture<TranscriptionResult> transcribe(byte[] audioData, String sourceFormat) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return transcribeBlocking(audioData, sourceFormat);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return TranscriptionResult.failed("Transcription interrupted");
            } catch (IOException | RuntimeException e) { // NOSONAR - reported in the result
                log.error("[WhisperSTT] Transcription failed: {}", e.getMessage());
                return TranscriptionResult.failed("Transcription failed: " + e.getMessage());
            }
        });
    }

    TranscriptionResult transcribeBlocking(byte[] audioData, String sourceFormat)
            throws IOException, InterruptedException {
        if (!isAvailable()) {
            return TranscriptionResult.failed("Speech-to-text is not configured");
        }
        if (audioData == null || audioData.length == 0) {
            return TranscriptionResult.failed("No audio data received");
        }

        String extension = sourceFormat != null && !sourceFormat.isBlank()
                ? sourceFormat.toLowerCase(Locale.ROOT)
                : DEFAULT_FORMAT;
        String mimeType = MIME_TYPES.getOrDefault(extension, "application/octet-stream");
        String baseUrl = properties.getStt().getUrl();

        log.info("[WhisperSTT] STT request: {} bytes, format={}, url={}", audioData.length, mimeType, baseUrl);

        MultipartBody requestBody = new MultipartBody.Builder()
                .setType(MultipartBody.FORM)
                .addFormDataPart("file", "audio." + extension, RequestBody.create(audioData, MediaType.parse(mimeType)))
                .addFormDataPart("model", properties.getStt().getModel())
                .addFormDataPart("response_format", "verbose_json")
                .build();

        Request.Builder requestBuilder = new Request.Builder()
                .url(getTranscriptionUrl(baseUrl))
                .post(requestBody);
        String apiKey = properties.getStt().getApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            requestBuilder.header("Authorization", "Bearer " + apiKey);
        }

        long startTime = System.currentTimeMillis();
        return executeWithRetry(requestBuilder.build(), startTime);
    }

    protected String getTranscriptionUrl(String baseUrl) {
        return normalizeBaseUrl(baseUrl) + TRANSCRIPTION_PATH;
    }

    protected void sleepBeforeRetry(long backoffMs) throws InterruptedException {
        Thread.sleep(backoffMs);
    }

    @SuppressWarnings("PMD.CloseResource") // ResponseBody is closed when Response is closed in try-with-resources
    private TranscriptionResult executeWithRetry(Request request, long startTime)
            throws IOException, InterruptedException {
        int attempt = 0;

        while (attempt < MAX_RETRIES) {
            try (Response response = okHttpClient.newCall(request).execute()) {
                ResponseBody body = response.body();

                if (!response.isSuccessful()) {
                    if (isRetryableError(response.code()) && attempt < MAX_RETRIES - 1) {
                        attempt++;
                        long backoffMs = (long) Math.pow(2, attempt) * 1000;
                        log.info("[WhisperSTT] Retrying after {} (attempt {}/{}), backoff={}ms",
                                response.code(), attempt, MAX_RETRIES, backoffMs);
                        sleepBeforeRetry(backoffMs);
                        continue;
                    }
                    String errorBody = body != null ? body.string() : "";
                    return TranscriptionResult.failed(
                            String.format("Whisper STT error (HTTP %d): %s", response.code(), errorBody));
                }

                if (body == null) {
                    return TranscriptionResult.failed("Whisper STT returned empty body");
                }
                return parseResponse(body.string(), System.currentTimeMillis() - startTime);
            }
        }
        return TranscriptionResult.failed("Whisper STT failed after " + MAX_RETRIES + " attempts");
    }

    private TranscriptionResult parseResponse(String responseBody, long elapsed) throws IOException {
        WhisperResponse whisperResponse = objectMapper.readValue(responseBody, WhisperResponse.class);

        String text = whisperResponse.getText() != null ? whisperResponse.getText().trim() : "";
        String language = whisperResponse.getLanguage() != null ? whisperResponse.getLanguage() : "unknown";
        double confidence = confidence(whisperResponse.getSegments());
        double duration = whisperResponse.getDuration() != null ? whisperResponse.getDuration() : 0.0;

        String preview = text.length() > 200 ? text.substring(0, 200) + "..." : text;
        log.info("[WhisperSTT] STT success: \"{}\" ({} chars, language={}, confidence={}, {}ms)",
                preview, text.length(), language, String.format(Locale.ROOT, "%.1f", confidence), elapsed);

        return new TranscriptionResult(text, confidence, language, duration, null);
    }

    static double confidence(List<Segment> segments) {
        if (segments == null || segments.isEmpty()) {
            return 0.0;
        }
        double total = 0.0;
        for (Segment segment : segments) {
            total += (1.0 - segment.getNoSpeechProb()) * 100.0;
        }
        return total / segments.size();
    }

    private boolean isRetryableError(int code) {
        return code == 429 || code == 500 || code == 503 || code == 504;
    }

    private String normalizeBaseUrl(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class WhisperResponse {
        private String text;
        private String language;
        private Double duration;
        private List<Segment> segments;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Segment {
        @JsonProperty("no_speech_prob")
        private double noSpeechProb;
    }
}
