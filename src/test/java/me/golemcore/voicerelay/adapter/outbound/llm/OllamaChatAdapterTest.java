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

import me.golemcore.voicerelay.adapter.outbound.llm.OllamaChatAdapter.GenerateRequest;
import me.golemcore.voicerelay.adapter.outbound.llm.OllamaChatAdapter.GenerateResponse;
import me.golemcore.voicerelay.adapter.outbound.llm.OllamaChatAdapter.OllamaApi;
import me.golemcore.voicerelay.adapter.outbound.llm.OllamaChatAdapter.TagsResponse;
import me.golemcore.voicerelay.domain.model.ConversationTurn;
import me.golemcore.voicerelay.domain.model.ModelInfo;
import me.golemcore.voicerelay.infrastructure.config.PersonalityPromptProvider;
import me.golemcore.voicerelay.infrastructure.config.RelayProperties;
import me.golemcore.voicerelay.infrastructure.http.FeignClientFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class OllamaChatAdapterTest {

    private OllamaApi api;
    private FeignClientFactory feignClientFactory;
    private RelayProperties properties;
    private OllamaChatAdapter adapter;

    @BeforeEach
    void setUp() {
        api = mock(OllamaApi.class);
        feignClientFactory = mock(FeignClientFactory.class);
        when(feignClientFactory.create(eq(OllamaApi.class), anyString(), any())).thenReturn(api);
        properties = new RelayProperties();
        PersonalityPromptProvider promptProvider = mock(PersonalityPromptProvider.class);
        when(promptProvider.getSystemPrompt()).thenReturn("You are helpful.");
        adapter = new OllamaChatAdapter(properties, promptProvider, feignClientFactory);
    }

    private static TagsResponse tags(String... names) {
        TagsResponse response = new TagsResponse();
        response.setModels(java.util.Arrays.stream(names).map(name -> {
            TagsResponse.Tag tag = new TagsResponse.Tag();
            tag.setName(name);
            return tag;
        }).toList());
        return response;
    }

    private static GenerateResponse generated(String text) {
        GenerateResponse response = new GenerateResponse();
        response.setResponse(text);
        response.setDone(true);
        return response;
    }

    @Test
    void shouldUseDefaultBaseUrl() {
        verify(feignClientFactory).create(OllamaApi.class, OllamaChatAdapter.DEFAULT_BASE_URL,
                properties.getLlm().getTimeout());
    }

    @Test
    void shouldInitializeWithPreferredLocalModel() {
        when(api.tags()).thenReturn(tags("mistral:7b", "llama3.1:8b"));
        when(api.generate(any())).thenReturn(generated("Hi"));

        adapter.initialize();

        assertTrue(adapter.isHealthy());
        assertTrue(adapter.isAvailable());
        assertEquals("llama3.1:8b", adapter.getCurrentModel());
        assertEquals(2, adapter.getAvailableModels().size());
        assertEquals("free", adapter.getAvailableModels().get(0).costTier());
    }

    @Test
    void shouldBeUnhealthyWhenServerIsDown() {
        when(api.tags()).thenThrow(new RuntimeException("Connection refused"));

        adapter.initialize();

        assertFalse(adapter.isHealthy());
        assertTrue(adapter.getAvailableModels().isEmpty());
        assertNull(adapter.getCurrentModel());
    }

    @Test
    void shouldPickFirstModelWithoutPreferredMatch() {
        List<ModelInfo> models = List.of(
                new ModelInfo("mistral", "mistral", true, "free"),
                new ModelInfo("phi3", "phi3", true, "free"));

        assertEquals("mistral", OllamaChatAdapter.pickDefaultModel(models));
        assertNull(OllamaChatAdapter.pickDefaultModel(List.of()));
    }

    @Test
    void shouldSendTranscriptPrompt() {
        when(api.tags()).thenReturn(tags("llama3"));
        when(api.generate(any())).thenReturn(generated(" Sure. "));
        adapter.initialize();

        Instant now = Instant.parse("2026-01-01T10:00:00Z");
        String reply = adapter.chat("And now?", List.of(new ConversationTurn(now, "Hi", "Hello", "ollama",
                "llama3")), null).join();

        assertEquals("Sure.", reply);
        ArgumentCaptor<GenerateRequest> captor = ArgumentCaptor.forClass(GenerateRequest.class);
        verify(api, org.mockito.Mockito.times(2)).generate(captor.capture());
        GenerateRequest request = captor.getAllValues().get(1);
        assertEquals("llama3", request.getModel());
        assertFalse(request.isStream());
        assertEquals("System: You are helpful.\n\nUser: Hi\nAssistant: Hello\nUser: And now?\nAssistant:",
                request.getPrompt());
        assertEquals(0.9, request.getOptions().get("top_p"));
    }

    @Test
    void shouldFailOnEmptyReply() {
        when(api.generate(any())).thenReturn(generated(""));
        adapter.setModel("llama3");

        assertThrows(CompletionException.class, () -> adapter.chat("Hi", List.of(), null).join());
    }

    @Test
    void shouldFailWithoutSelectedModel() {
        assertThrows(CompletionException.class, () -> adapter.chat("Hi", List.of(), null).join());
    }

    @Test
    void shouldAcceptAnyNonBlankModel() {
        assertTrue(adapter.setModel("custom:latest"));
        assertFalse(adapter.setModel(" "));
        assertEquals("custom:latest", adapter.getCurrentModel());
    }

    @Test
    void shouldNotRequireCredential() {
        assertFalse(adapter.requiresApiKey());
        assertEquals("ollama", adapter.getProviderId());
    }
}
