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

import java.util.concurrent.CompletableFuture;

/**
 * Port for speech-to-text. Implementations report failures inside the result
 * instead of completing exceptionally.
 */
public interface TranscriptionPort {

    CompletableFuture<TranscriptionResult> transcribe(byte[] audioData, String sourceFormat);

    boolean isAvailable();

    /**
     * Transcription outcome.
     *
     * @param text
     *            recognized text, empty on failure
     * @param confidence
     *            0-100
     * @param language
     *            detected language code
     * @param duration
     *            audio duration in seconds
     * @param error
     *            failure description, null on success
     */
    record TranscriptionResult(String text, double confidence, String language, double duration, String error) {

        public static TranscriptionResult failed(String error) {
            return new TranscriptionResult("", 0.0, "unknown", 0.0, error);
        }
    }
}
