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

package me.golemcore.voicerelay.adapter.outbound.llm;

import me.golemcore.voicerelay.domain.model.ConversationTurn;
import me.golemcore.voicerelay.domain.model.ModelInfo;
import me.golemcore.voicerelay.infrastructure.config.PersonalityPromptProvider;
import me.golemcore.voicerelay.infrastructure.config.RelayProperties;
import me.golemcore.voicerelay.infrastructure.http.FeignClientFactory;
import me.golemcore.voicerelay.port.outbound.LlmProviderPort;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import feign.Headers;
import feign.RequestLine;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Local Ollama server, no credential required.
 *
 * <p>
 * The model catalog is whatever {@code GET /api/tags} reports; any model id is
 * accepted by {@link #setModel(String)} and validated by the server on use.
 * Conversation history is flattened into a single
 * {@code System:/User:/Assistant:} transcript prompt.
 */
@Component
@Slf4j
public class OllamaChatAdapter implements LlmProviderPort {

    static final String PROVIDER_ID = "ollama";
    static final String DEFAULT_BASE_URL = "http://localhost:11434";
    static final List<String> PREFERRED_MODELS = List.of("llama3.1:8b", "llama3.1:latest", "llama3.1", "llama3");

    private final RelayProperties properties;
    private final PersonalityPromptProvider promptProvider;
    private final OllamaApi api;

    private volatile List<ModelInfo> models = List.of();
    private volatile String currentModel;
    private volatile boolean healthy;

    public OllamaChatAdapter(RelayProperties properties, PersonalityPromptProvider promptProvider,
            FeignClientFactory feignClientFactory) {
        this.properties = properties;
        this.promptProvider = promptProvider;
        this.api = feignClientFactory.create(OllamaApi.class, baseUrl(properties),
                properties.getLlm().getTimeout());
    }

    @Override
    public String getProviderId() {
        return PROVIDER_ID;
    }

    @Override
    public boolean requiresApiKey() {
        return false;
    }

    @Override
    public boolean hasApiKey() {
        return false;
    }

    @Override
    public void initialize() {
        try {
            models = fetchModels();
            currentModel = pickDefaultModel(models);
        } catch (Exception e) { // NOSONAR - server not running is an expected state
            log.warn("[Ollama] Could not list models at {}: {}", baseUrl(properties), e.getMessage());
            models = List.of();
        }
        healthy = healthCheck();
        if (healthy) {
            log.info("[Ollama] Initialized with {} models, current: {}", models.size(), currentModel);
        } else {
            log.warn("[Ollama] Health check failed");
        }
    }

    @Override
    public CompletableFuture<String> chat(String message, List<ConversationTurn> history, String model) {
        return CompletableFuture.supplyAsync(() -> {
            String modelToUse = model != null ? model : currentModel;
            if (modelToUse == null) {
                throw new IllegalStateException("No Ollama model selected");
            }
            GenerateRequest request = new GenerateRequest(modelToUse, buildPrompt(message, history), false,
                    Map.of("temperature", properties.getLlm().getTemperature(), "top_p", 0.9));
            GenerateResponse response;
            try {
                response = api.generate(request);
            } catch (Exception e) {
                log.error("[Ollama] Chat failed: {}", e.getMessage());
                throw new IllegalStateException("Ollama error: " + e.getMessage(), e);
            }
            String text = response != null ? response.getResponse() : null;
            if (text == null || text.isBlank()) {
                throw new IllegalStateException("Ollama returned an empty response");
            }
            return text.trim();
        });
    }

    /**
     * Healthy when the server lists its models and, if a model is selected,
     * answers a minimal generate request.
     */
    @Override
    public boolean healthCheck() {
        try {
            api.tags();
            String model = currentModel;
            if (model != null) {
                api.generate(new GenerateRequest(model, "Hello", false, Map.of("num_predict", 5)));
            }
            return true;
        } catch (Exception e) { // NOSONAR - best-effort health check
            log.warn("[Ollama] Health check failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public List<ModelInfo> getAvailableModels() {
        return models;
    }

    @Override
    public boolean setModel(String model) {
        if (model == null || model.isBlank()) {
            return false;
        }
        currentModel = model;
        log.info("[Ollama] Model set to {}", model);
        return true;
    }

    @Override
    public String getCurrentModel() {
        return currentModel;
    }

    @Override
    public boolean isHealthy() {
        return healthy;
    }

    @Override
    public void setHealthy(boolean healthy) {
        this.healthy = healthy;
    }

    String buildPrompt(String message, List<ConversationTurn> history) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("System: ").append(promptProvider.getSystemPrompt()).append("\n\n");
        if (history != null) {
            for (ConversationTurn turn : history) {
                prompt.append("User: ").append(turn.user()).append('\n');
                prompt.append("Assistant: ").append(turn.assistant()).append('\n');
            }
        }
        prompt.append("User: ").append(message).append("\nAssistant:");
        return prompt.toString();
    }

    private List<ModelInfo> fetchModels() {
        TagsResponse tags = api.tags();
        List<ModelInfo> result = new ArrayList<>();
        if (tags != null && tags.getModels() != null) {
            for (TagsResponse.Tag tag : tags.getModels()) {
                result.add(new ModelInfo(tag.getName(), tag.getName(), true, "free"));
            }
        }
        return List.copyOf(result);
    }

    static String pickDefaultModel(List<ModelInfo> models) {
        for (String preferred : PREFERRED_MODELS) {
            for (ModelInfo model : models) {
                if (model.id().contains(preferred)) {
                    return model.id();
                }
            }
        }
        return models.isEmpty() ? null : models.get(0).id();
    }

    private static String baseUrl(RelayProperties properties) {
        RelayProperties.ProviderProperties provider = properties.getLlm().getProviders().get(PROVIDER_ID);
        if (provider != null && provider.getBaseUrl() != null && !provider.getBaseUrl().isBlank()) {
            return provider.getBaseUrl();
        }
        return DEFAULT_BASE_URL;
    }

    // Feign API interface
    public interface OllamaApi {
        @RequestLine("GET /api/tags")
        TagsResponse tags();

        @RequestLine("POST /api/generate")
        @Headers("Content-Type: application/json")
        GenerateResponse generate(GenerateRequest request);
    }

    // API DTOs
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class GenerateRequest {
        private String model;
        private String prompt;
        private boolean stream;
        private Map<String, Object> options;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class GenerateResponse {
        private String model;
        private String response;
        private boolean done;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TagsResponse {
        private List<Tag> models;

        @Data
        @JsonIgnoreProperties(ignoreUnknown = true)
        public static class Tag {
            private String name;
            private long size;
        }
    }
}
