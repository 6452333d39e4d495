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

package me.golemcore.voicerelay.domain.exception;

import java.util.List;

/**
 * Raised when every provider in the fallback chain was tried for a chat call
 * and none produced a reply.
 */
public class AllProvidersFailedException extends RuntimeException {

    private final List<String> attemptedProviders;

    public AllProvidersFailedException(List<String> attemptedProviders) {
        this("All LLM providers failed (attempted: " + attemptedProviders + ")", attemptedProviders);
    }

    protected AllProvidersFailedException(String message, List<String> attemptedProviders) {
        super(message);
        this.attemptedProviders = List.copyOf(attemptedProviders);
    }

    public List<String> getAttemptedProviders() {
        return attemptedProviders;
    }
}
