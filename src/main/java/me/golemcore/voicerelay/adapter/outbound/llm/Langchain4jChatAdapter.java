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
import me.golemcore.voicerelay.infrastructure.config.CredentialStore;
import me.golemcore.voicerelay.infrastructure.config.PersonalityPromptProvider;
import me.golemcore.voicerelay.port.outbound.LlmProviderPort;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Credentialed cloud provider backed by a langchain4j {@link ChatModel}.
 *
 * <p>
 * One instance per provider family (OpenAI, Claude, xAI); the family-specific
 * part is the {@link ChatModelFactory} and the static model catalog. Chat
 * models are built lazily, one per model id.
 *
 * @see LlmAdapterConfiguration
 */
@Slf4j
public class Langchain4jChatAdapter implements LlmProviderPort {

    static final String HEALTH_CHECK_PROMPT = "Hello";

    /**
     * Builds a chat model for one API key and model id.
     */
    @FunctionalInterface
    public interface ChatModelFactory {
        ChatModel create(String apiKey, String modelName);
    }

    private final String providerId;
    private final List<ModelInfo> catalog;
    private final String preferredModel;
    private final CredentialStore credentialStore;
    private final PersonalityPromptProvider promptProvider;
    private final ChatModelFactory modelFactory;
    private final Map<String, ChatModel> models = new ConcurrentHashMap<>();

    private volatile String currentModel;
    private volatile boolean healthy;

    public Langchain4jChatAdapter(String providerId, List<ModelInfo> catalog, String preferredModel,
            CredentialStore credentialStore, PersonalityPromptProvider promptProvider,
            ChatModelFactory modelFactory) {
        this.providerId = providerId;
        this.catalog = List.copyOf(catalog);
        this.preferredModel = preferredModel;
        this.credentialStore = credentialStore;
        this.promptProvider = promptProvider;
        this.modelFactory = modelFactory;
    }

    @Override
    public String getProviderId() {
        return providerId;
    }

    @Override
    public boolean requiresApiKey() {
        return true;
    }

    @Override
    public boolean hasApiKey() {
        return credentialStore.hasApiKey(providerId);
    }

    @Override
    public void initialize() {
        currentModel = isSelectable(preferredModel) ? preferredModel
                : catalog.stream().filter(ModelInfo::available).map(ModelInfo::id).findFirst().orElse(null);
        healthy = healthCheck();
        if (healthy) {
            log.info("[{}] Provider initialized with model {}", providerId, currentModel);
        } else {
            log.warn("[{}] Provider health check failed", providerId);
        }
    }

    @Override
    public CompletableFuture<String> chat(String message, List<ConversationTurn> history, String model) {
        return CompletableFuture.supplyAsync(() -> {
            String modelName = model != null ? model : currentModel;
            List<ChatMessage> messages = buildMessages(message, history);
            try {
                ChatResponse response = chatModel(modelName).chat(messages);
                String text = response.aiMessage() != null ? response.aiMessage().text() : null;
                if (text == null || text.isBlank()) {
                    throw new IllegalStateException(providerId + " returned an empty response");
                }
                return text.trim();
            } catch (IllegalStateException e) {
                throw e;
            } catch (Exception e) {
                log.error("[{}] Chat failed: {}", providerId, e.getMessage());
                throw new IllegalStateException(providerId + " chat failed: " + e.getMessage(), e);
            }
        });
    }

    @Override
    public boolean healthCheck() {
        if (currentModel == null || !hasApiKey()) {
            return false;
        }
        try {
            ChatResponse response = chatModel(currentModel).chat(List.of(UserMessage.from(HEALTH_CHECK_PROMPT)));
            return response.aiMessage() != null
                    && response.aiMessage().text() != null
                    && !response.aiMessage().text().isBlank();
        } catch (Exception e) { // NOSONAR - best-effort health check
            log.warn("[{}] Health check failed: {}", providerId, e.getMessage());
            return false;
        }
    }

    @Override
    public List<ModelInfo> getAvailableModels() {
        return catalog;
    }

    @Override
    public boolean setModel(String model) {
        if (!isSelectable(model)) {
            log.warn("[{}] Model {} is not available", providerId, model);
            return false;
        }
        currentModel = model;
        log.info("[{}] Model set to {}", providerId, model);
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

    List<ChatMessage> buildMessages(String message, List<ConversationTurn> history) {
        List<ChatMessage> messages = new ArrayList<>();
        String systemPrompt = promptProvider.getSystemPrompt();
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            messages.add(SystemMessage.from(systemPrompt));
        }
        if (history != null) {
            for (ConversationTurn turn : history) {
                messages.add(UserMessage.from(turn.user()));
                messages.add(AiMessage.from(turn.assistant()));
            }
        }
        messages.add(UserMessage.from(message));
        return messages;
    }

    private boolean isSelectable(String model) {
        return model != null && catalog.stream().anyMatch(info -> info.id().equals(model) && info.available());
    }

    private ChatModel chatModel(String modelName) {
        String apiKey = credentialStore.getApiKey(providerId)
                .orElseThrow(() -> new IllegalStateException(providerId + " API key not configured"));
        return models.computeIfAbsent(modelName, name -> modelFactory.create(apiKey, name));
    }
}
