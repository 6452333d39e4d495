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

package me.golemcore.voicerelay.domain.service;

import me.golemcore.voicerelay.domain.exception.AllProvidersFailedException;
import me.golemcore.voicerelay.domain.exception.NoProviderAvailableException;
import me.golemcore.voicerelay.domain.model.ChatResult;
import me.golemcore.voicerelay.domain.model.ProviderStatus;
import me.golemcore.voicerelay.infrastructure.config.RelayProperties;
import me.golemcore.voicerelay.testsupport.StubLlmProvider;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProviderRouterTest {

    private RelayProperties properties;
    private StubLlmProvider openai;
    private StubLlmProvider claude;
    private StubLlmProvider xai;
    private StubLlmProvider ollama;
    private ProviderRouter router;

    @BeforeEach
    void setUp() {
        properties = new RelayProperties();
        properties.getLlm().setFallbackChain(List.of("openai", "claude", "xai", "ollama"));
        properties.getLlm().setTimeout(Duration.ofSeconds(5));
        openai = new StubLlmProvider("openai", true, "gpt-4o", "gpt-3.5-turbo");
        claude = new StubLlmProvider("claude", true, "claude-3-5-sonnet-20241022");
        xai = new StubLlmProvider("xai", true, "grok-2-latest");
        ollama = new StubLlmProvider("ollama", false, "llama3");
    }

    @AfterEach
    void tearDown() {
        if (router != null) {
            router.shutdown();
        }
    }

    private ProviderRouter start(StubLlmProvider... providers) {
        router = new ProviderRouter(properties, List.of(providers));
        router.initialize();
        return router;
    }

    @Test
    void shouldFallBackInChainOrderUntilOneSucceeds() {
        openai.failing("rate limited");
        claude.throwing("boom");
        start(openai, claude, xai);

        ChatResult result = router.chat("Hi", List.of(), null, null).join();

        assertEquals("reply from xai", result.text());
        assertEquals("xai", result.provider());
        assertEquals("grok-2-latest", result.model());
        assertTrue(result.fallbackUsed());
        assertEquals(1, openai.chatCalls());
        assertEquals(1, claude.chatCalls());
        assertEquals(1, xai.chatCalls());
    }

    @Test
    void shouldNotFlagFallbackWhenPrimaryAnswers() {
        start(openai, claude);

        ChatResult result = router.chat("Hi", List.of(), null, null).join();

        assertEquals("openai", result.provider());
        assertEquals("gpt-4o", result.model());
        assertFalse(result.fallbackUsed());
        assertEquals(0, claude.chatCalls());
    }

    @Test
    void shouldReportEveryAttemptedProviderWhenAllFail() {
        openai.failing("a");
        claude.replying("  ");
        start(openai, claude);

        CompletableFuture<ChatResult> future = router.chat("Hi", List.of(), null, null);

        CompletionException error = assertThrows(CompletionException.class, future::join);
        AllProvidersFailedException cause = assertInstanceOf(AllProvidersFailedException.class, error.getCause());
        assertEquals(List.of("openai", "claude"), cause.getAttemptedProviders());
    }

    @Test
    void shouldFailWithoutCallsWhenNothingIsRegistered() {
        openai.withApiKey(false);
        ollama.withHealthCheck(false);
        start(openai, ollama);

        CompletableFuture<ChatResult> future = router.chat("Hi", List.of(), null, null);

        CompletionException error = assertThrows(CompletionException.class, future::join);
        assertInstanceOf(NoProviderAvailableException.class, error.getCause());
        assertEquals(0, openai.chatCalls());
        assertEquals(0, ollama.chatCalls());
        assertNull(router.getCurrentProvider());
    }

    @Test
    void shouldSkipRequestedProviderThatIsUnavailable() {
        start(openai, claude);
        claude.setHealthy(false);

        ChatResult result = router.chat("Hi", List.of(), "claude", null).join();

        assertEquals("openai", result.provider());
        assertTrue(result.fallbackUsed());
        assertEquals(0, claude.chatCalls());
    }

    @Test
    void shouldUseRequestedModelForPrimaryAndOwnModelForFallback() {
        openai.failing("down");
        start(openai, claude);

        ChatResult result = router.chat("Hi", List.of(), "openai", "gpt-3.5-turbo").join();

        assertEquals(List.of("gpt-3.5-turbo"), openai.requestedModels());
        assertEquals(List.of("claude-3-5-sonnet-20241022"), claude.requestedModels());
        assertEquals("claude-3-5-sonnet-20241022", result.model());
    }

    @Test
    void shouldTreatHangingProviderAsFailed() {
        properties.getLlm().setTimeout(Duration.ofMillis(100));
        StubLlmProvider hanging = new StubLlmProvider("openai", true, "gpt-4o") {
            @Override
            public CompletableFuture<String> chat(String message,
                    List<me.golemcore.voicerelay.domain.model.ConversationTurn> history, String model) {
                super.chat(message, history, model);
                return new CompletableFuture<>();
            }
        };
        start(hanging, claude);

        ChatResult result = router.chat("Hi", List.of(), null, null).join();

        assertEquals("claude", result.provider());
        assertEquals(1, hanging.chatCalls());
    }

    @Test
    void shouldRetryFailedProviderOnNextChatWithoutTouchingItsHealth() {
        openai.failing("rate limited");
        start(openai, claude);

        ChatResult first = router.chat("Hi", List.of(), null, null).join();
        ChatResult second = router.chat("Again", List.of(), null, null).join();

        assertEquals("claude", first.provider());
        assertEquals("claude", second.provider());
        assertTrue(openai.isHealthy());
        assertEquals(2, openai.chatCalls());
        assertEquals("openai", router.getCurrentProvider());
        assertEquals(List.of("openai", "claude"), router.findAvailable());
    }

    @Test
    void shouldKeepPreviousSelectionWhileProviderSwitchIsInProgress() {
        start(openai, claude);
        List<ChatResult> duringSwitch = new ArrayList<>();
        claude.onSetModel(() -> duringSwitch.add(router.chat("Hi", List.of(), null, null).join()));

        assertTrue(router.setProvider("claude", "claude-3-5-sonnet-20241022"));
        ChatResult after = router.chat("Hi", List.of(), null, null).join();

        assertEquals(1, duringSwitch.size());
        assertEquals("openai", duringSwitch.get(0).provider());
        assertEquals("gpt-4o", duringSwitch.get(0).model());
        assertEquals(List.of("gpt-4o"), openai.requestedModels());
        assertEquals("claude", after.provider());
        assertEquals("claude-3-5-sonnet-20241022", after.model());
        assertEquals(List.of("claude-3-5-sonnet-20241022"), claude.requestedModels());
    }

    @Test
    void shouldRegisterCredentialedProviderEvenWhenUnhealthy() {
        openai.withHealthCheck(false);
        claude.withApiKey(false);
        ollama.withHealthCheck(false);
        start(openai, claude, xai, ollama);

        assertEquals(java.util.Set.of("openai", "xai"), router.getRegisteredProviders());
        assertEquals("xai", router.getCurrentProvider());
        assertEquals("grok-2-latest", router.getCurrentModel());
        assertEquals(List.of("xai"), router.findAvailable());
    }

    @Test
    void shouldRegisterHealthyLocalProvider() {
        start(ollama);

        assertEquals("ollama", router.getCurrentProvider());
        assertEquals("llama3", router.getCurrentModel());
        assertTrue(router.getProvider("ollama").isPresent());
    }

    @Test
    void shouldSwitchProviderAndKeepOwnModelWhenRequestedModelIsUnknown() {
        start(openai, claude);

        assertTrue(router.setProvider("claude", "not-a-model"));

        assertEquals("claude", router.getCurrentProvider());
        assertEquals("claude-3-5-sonnet-20241022", router.getCurrentModel());
    }

    @Test
    void shouldRejectUnregisteredOrUnavailableProvider() {
        start(openai, claude);
        claude.setHealthy(false);

        assertFalse(router.setProvider("lm_studio", null));
        assertFalse(router.setProvider("claude", null));
        assertEquals("openai", router.getCurrentProvider());
    }

    @Test
    void shouldSwitchModelOfCurrentProvider() {
        start(openai);

        assertTrue(router.setModel("gpt-3.5-turbo", null));
        assertEquals("gpt-3.5-turbo", router.getCurrentModel());

        assertFalse(router.setModel("unknown", "openai"));
        assertEquals("gpt-3.5-turbo", router.getCurrentModel());
        assertFalse(router.setModel("gpt-4o", "claude"));
    }

    @Test
    void shouldListKnownProvidersAsPlaceholders() {
        start(openai);

        Map<String, ProviderStatus> status = router.status();

        assertTrue(status.get("openai").available());
        assertEquals("gpt-4o", status.get("openai").currentModel());
        assertEquals(2, status.get("openai").models().size());
        assertEquals(ProviderStatus.notConfigured(), status.get("lm_studio"));
        assertFalse(status.get("claude").available());
    }

    @Test
    void shouldIsolateHealthCheckFailures() {
        start(openai, claude, xai);
        claude.withHealthCheckFailure(new IllegalStateException("unreachable"));
        xai.withHealthCheck(false);

        Map<String, Boolean> results = router.healthCheckAll().join();

        assertEquals(Map.of("openai", true, "claude", false, "xai", false), results);
        assertTrue(openai.isHealthy());
        assertFalse(claude.isHealthy());
        assertFalse(xai.isHealthy());
    }

    @Test
    void shouldPromoteRecoveredProviderOnHealthCheck() {
        openai.withHealthCheck(false);
        start(openai);
        assertFalse(openai.isAvailable());

        openai.withHealthCheck(true);
        router.healthCheckAll().join();

        assertEquals(List.of("openai"), router.findAvailable());
    }

    @Test
    void shouldDeduplicateFallbackChain() {
        properties.getLlm().setFallbackChain(List.of("openai", "claude", "openai"));
        start(openai, claude);

        assertEquals(List.of("openai", "claude"), router.getFallbackChain());
    }
}
