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
 * Port for text-to-speech. Implementations report failures inside the result
 * instead of completing exceptionally.
 */
public interface SynthesisPort {

    CompletableFuture<SynthesisResult> synthesize(String text);

    boolean isAvailable();

    /**
     * Synthesis outcome. {@code audio} is empty unless {@code success}.
     */
    record SynthesisResult(boolean success, byte[] audio, String format, double duration, String error) {

        public static SynthesisResult failed(String error) {
            return new SynthesisResult(false, new byte[0], null, 0.0, error);
        }
    }
}
