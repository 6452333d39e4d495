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
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

class LlmAdapterConfigurationTest {

    private final LlmAdapterConfiguration configuration = new LlmAdapterConfiguration();
    private final RelayProperties properties = new RelayProperties();
    private final CredentialStore credentialStore = mock(CredentialStore.class);
    private final PersonalityPromptProvider promptProvider = mock(PersonalityPromptProvider.class);

    @Test
    void shouldDeclareOneAdapterPerCloudFamily() {
        assertEquals("openai",
                configuration.openAiChatAdapter(properties, credentialStore, promptProvider).getProviderId());
        assertEquals("claude",
                configuration.claudeChatAdapter(properties, credentialStore, promptProvider).getProviderId());
        Langchain4jChatAdapter xai = configuration.xaiChatAdapter(properties, credentialStore, promptProvider);
        assertEquals("xai", xai.getProviderId());
        assertEquals(ModelCatalog.XAI, xai.getAvailableModels());
        assertTrue(xai.requiresApiKey());
    }

    @Test
    void shouldApplyConfiguredDefaultModel() {
        RelayProperties.ProviderProperties claude = new RelayProperties.ProviderProperties();
        claude.setDefaultModel("claude-3-haiku-20240307");
        properties.getLlm().getProviders().put("claude", claude);

        Langchain4jChatAdapter adapter = configuration.claudeChatAdapter(properties, credentialStore,
                promptProvider);
        assertTrue(adapter.setModel("claude-3-haiku-20240307"));
    }
}
