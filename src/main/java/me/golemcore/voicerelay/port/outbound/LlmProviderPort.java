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

import me.golemcore.voicerelay.domain.model.ConversationTurn;
import me.golemcore.voicerelay.domain.model.ModelInfo;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Port for one chat backend (OpenAI, Claude, Ollama, etc.). Adapters hold no
 * state shared with each other.
 */
public interface LlmProviderPort {

    /**
     * Returns the provider identifier used in the fallback chain (e.g.,
     * "openai", "ollama").
     */
    String getProviderId();

    /**
     * Whether the provider needs an API credential at all. Local servers do
     * not.
     */
    boolean requiresApiKey();

    boolean hasApiKey();

    /**
     * Loads the model catalog, selects the default model and runs the startup
     * health check, recording its outcome in the health flag.
     */
    void initialize();

    /**
     * Sends one user message with prior history. Completes exceptionally on
     * any transport or API failure, including timeouts.
     */
    CompletableFuture<String> chat(String message, List<ConversationTurn> history, String model);

    /**
     * Probes the backend. Does not update the health flag; callers do that.
     */
    boolean healthCheck();

    List<ModelInfo> getAvailableModels();

    /**
     * Selects the current model. Returns false, leaving the selection
     * unchanged, when the provider rejects the id.
     */
    boolean setModel(String model);

    String getCurrentModel();

    boolean isHealthy();

    void setHealthy(boolean healthy);

    /**
     * Credential present (or not required) and last health check passed.
     */
    default boolean isAvailable() {
        return (!requiresApiKey() || hasApiKey()) && isHealthy();
    }
}
