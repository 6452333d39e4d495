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

import me.golemcore.voicerelay.infrastructure.config.CredentialStore;
import me.golemcore.voicerelay.infrastructure.config.PersonalityPromptProvider;
import me.golemcore.voicerelay.infrastructure.config.RelayProperties;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Optional;

/**
 * Declares one {@link Langchain4jChatAdapter} per cloud provider family. xAI
 * speaks the OpenAI protocol on its own endpoint.
 */
@Configuration
public class LlmAdapterConfiguration {

    static final String OPENAI = "openai";
    static final String CLAUDE = "claude";
    static final String XAI = "xai";
    static final String XAI_BASE_URL = "https://api.x.ai/v1";

    @Bean
    public Langchain4jChatAdapter openAiChatAdapter(RelayProperties properties, CredentialStore credentialStore,
            PersonalityPromptProvider promptProvider) {
        return new Langchain4jChatAdapter(OPENAI, ModelCatalog.OPENAI, defaultModel(properties, OPENAI),
                credentialStore, promptProvider,
                (apiKey, model) -> openAiCompatible(properties, apiKey, model, baseUrl(properties, OPENAI, null)));
    }

    @Bean
    public Langchain4jChatAdapter claudeChatAdapter(RelayProperties properties, CredentialStore credentialStore,
            PersonalityPromptProvider promptProvider) {
        return new Langchain4jChatAdapter(CLAUDE, ModelCatalog.CLAUDE, defaultModel(properties, CLAUDE),
                credentialStore, promptProvider, (apiKey, model) -> {
                    RelayProperties.LlmProperties llm = properties.getLlm();
                    var builder = AnthropicChatModel.builder()
                            .apiKey(apiKey)
                            .modelName(model)
                            .maxRetries(0) // one attempt per provider, fallback handles the rest
                            .maxTokens(llm.getMaxTokens())
                            .temperature(llm.getTemperature())
                            .timeout(llm.getTimeout());
                    String baseUrl = baseUrl(properties, CLAUDE, null);
                    if (baseUrl != null) {
                        builder.baseUrl(baseUrl);
                    }
                    return builder.build();
                });
    }

    @Bean
    public Langchain4jChatAdapter xaiChatAdapter(RelayProperties properties, CredentialStore credentialStore,
            PersonalityPromptProvider promptProvider) {
        return new Langchain4jChatAdapter(XAI, ModelCatalog.XAI, defaultModel(properties, XAI),
                credentialStore, promptProvider,
                (apiKey, model) -> openAiCompatible(properties, apiKey, model,
                        baseUrl(properties, XAI, XAI_BASE_URL)));
    }

    private static OpenAiChatModel openAiCompatible(RelayProperties properties, String apiKey, String model,
            String baseUrl) {
        RelayProperties.LlmProperties llm = properties.getLlm();
        var builder = OpenAiChatModel.builder()
                .apiKey(apiKey)
                .modelName(model)
                .maxRetries(0) // one attempt per provider, fallback handles the rest
                .maxTokens(llm.getMaxTokens())
                .temperature(llm.getTemperature())
                .timeout(llm.getTimeout());
        if (baseUrl != null) {
            builder.baseUrl(baseUrl);
        }
        return builder.build();
    }

    private static Optional<RelayProperties.ProviderProperties> provider(RelayProperties properties, String id) {
        return Optional.ofNullable(properties.getLlm().getProviders().get(id));
    }

    private static String defaultModel(RelayProperties properties, String id) {
        return provider(properties, id).map(RelayProperties.ProviderProperties::getDefaultModel).orElse(null);
    }

    private static String baseUrl(RelayProperties properties, String id, String fallback) {
        return provider(properties, id)
                .map(RelayProperties.ProviderProperties::getBaseUrl)
                .filter(url -> !url.isBlank())
                .orElse(fallback);
    }
}
