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
import me.golemcore.voicerelay.domain.model.ConversationTurn;
import me.golemcore.voicerelay.domain.model.ProviderStatus;
import me.golemcore.voicerelay.infrastructure.config.RelayProperties;
import me.golemcore.voicerelay.port.outbound.LlmProviderPort;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Routes chat requests across the registered LLM providers.
 *
 * <p>
 * Owns the fixed-priority fallback chain, the provider registry built at
 * startup and the current provider/model selection. A chat call tries the
 * requested (or current) provider first, then every other available provider
 * of the chain in priority order with that provider's own current model. Each
 * provider gets exactly one attempt per call; any exception, timeout or blank
 * reply moves on to the next one.
 *
 * <p>
 * Health flags change only through {@link #healthCheckAll()}; a failed chat
 * call never marks a provider unhealthy.
 *
 * @since 1.0
 * @see LlmProviderPort
 */
@Service
@Slf4j
public class ProviderRouter {

    private final RelayProperties properties;
    private final Map<String, LlmProviderPort> adaptersById = new LinkedHashMap<>();
    private final Map<String, LlmProviderPort> registry = Collections.synchronizedMap(new LinkedHashMap<>());
    private final List<String> fallbackChain;
    private final ExecutorService healthCheckExecutor;

    private volatile Selection selection = Selection.NONE;

    public ProviderRouter(RelayProperties properties, List<LlmProviderPort> adapters) {
        this.properties = properties;
        for (LlmProviderPort adapter : adapters) {
            adaptersById.put(adapter.getProviderId(), adapter);
        }
        this.fallbackChain = List.copyOf(new LinkedHashSet<>(properties.getLlm().getFallbackChain()));
        AtomicInteger threadCounter = new AtomicInteger();
        this.healthCheckExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "provider-health-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Initializes and registers the providers of the fallback chain, then
     * selects the default provider.
     *
     * <p>
     * A provider that needs a credential is registered once its credential is
     * present, even when its startup health check fails, so a later sweep can
     * promote it. A local provider is registered only when healthy.
     */
    @PostConstruct
    public void initialize() {
        registry.clear();
        for (String name : fallbackChain) {
            LlmProviderPort adapter = adaptersById.get(name);
            if (adapter == null) {
                log.debug("[Router] No adapter for provider '{}'", name);
                continue;
            }
            if (adapter.requiresApiKey() && !adapter.hasApiKey()) {
                log.info("[Router] Skipping {}: no API key configured", name);
                continue;
            }
            try {
                adapter.initialize();
            } catch (RuntimeException e) { // NOSONAR
                log.error("[Router] Failed to initialize {}: {}", name, e.getMessage());
                continue;
            }
            if (!adapter.requiresApiKey() && !adapter.isHealthy()) {
                log.warn("[Router] Local provider {} is not healthy, not registering", name);
                continue;
            }
            registry.put(name, adapter);
            log.info("[Router] Registered provider {} (healthy: {}, model: {})",
                    name, adapter.isHealthy(), adapter.getCurrentModel());
        }
        selectDefaultProvider();
    }

    @PreDestroy
    public void shutdown() {
        healthCheckExecutor.shutdownNow();
    }

    private synchronized void selectDefaultProvider() {
        selection = Selection.NONE;
        for (String name : fallbackChain) {
            LlmProviderPort adapter = registry.get(name);
            if (adapter == null) {
                continue;
            }
            boolean eligible = adapter.requiresApiKey()
                    ? adapter.isAvailable()
                    : adapter.isHealthy() && adapter.getCurrentModel() != null;
            if (eligible) {
                selection = new Selection(name, adapter.getCurrentModel());
                log.info("[Router] Default provider: {} with model {}", selection.provider(), selection.model());
                return;
            }
        }
        log.warn("[Router] No provider available, chat requests will fail until one recovers");
    }

    /**
     * Sends a message through the requested provider, falling back along the
     * chain.
     *
     * @param provider
     *            requested provider, or null for the current one
     * @param model
     *            requested model, or null for that provider's current model
     * @return future completing with the first successful reply, or
     *         exceptionally with {@link AllProvidersFailedException}
     *         ({@link NoProviderAvailableException} when nothing could be
     *         tried)
     */
    public CompletableFuture<ChatResult> chat(String message, List<ConversationTurn> history, String provider,
            String model) {
        Selection current = selection;
        String requested = provider != null ? provider : current.provider();
        String requestedModel = resolveModel(current, requested, model);

        List<String> candidates = new ArrayList<>();
        if (requested != null) {
            candidates.add(requested);
        }
        for (String name : fallbackChain) {
            if (!name.equals(requested)) {
                candidates.add(name);
            }
        }
        List<ConversationTurn> turns = history != null ? history : List.of();
        return attempt(candidates, 0, requested, requestedModel, message, turns, new ArrayList<>());
    }

    private CompletableFuture<ChatResult> attempt(List<String> candidates, int index, String requested,
            String requestedModel, String message, List<ConversationTurn> history, List<String> attempted) {
        int next = index;
        LlmProviderPort adapter = null;
        while (next < candidates.size()) {
            adapter = registry.get(candidates.get(next));
            if (adapter != null && adapter.isAvailable()) {
                break;
            }
            adapter = null;
            next++;
        }
        if (adapter == null) {
            if (attempted.isEmpty()) {
                log.error("[Router] No provider available for chat");
                return CompletableFuture.failedFuture(new NoProviderAvailableException());
            }
            log.error("[Router] All providers failed: {}", attempted);
            return CompletableFuture.failedFuture(new AllProvidersFailedException(attempted));
        }

        String name = candidates.get(next);
        boolean primary = name.equals(requested);
        String model = primary ? requestedModel : adapter.getCurrentModel();
        attempted.add(name);
        int following = next + 1;

        return invoke(adapter, message, history, model)
                .handle((text, error) -> {
                    if (error == null && text != null && !text.isBlank()) {
                        if (!primary) {
                            log.info("[Router] Fallback successful with {}", name);
                        }
                        return CompletableFuture.completedFuture(new ChatResult(text, name, model, !primary));
                    }
                    log.warn("[Router] Provider {} failed: {}", name,
                            error != null ? rootMessage(error) : "empty response");
                    return attempt(candidates, following, requested, requestedModel, message, history, attempted);
                })
                .thenCompose(future -> future);
    }

    private CompletableFuture<String> invoke(LlmProviderPort adapter, String message,
            List<ConversationTurn> history, String model) {
        CompletableFuture<String> call;
        try {
            call = adapter.chat(message, history, model);
        } catch (RuntimeException e) { // NOSONAR - treated like an asynchronous failure
            return CompletableFuture.failedFuture(e);
        }
        if (call == null) {
            return CompletableFuture.completedFuture(null);
        }
        Duration timeout = properties.getLlm().getTimeout();
        return call.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private String resolveModel(Selection current, String provider, String model) {
        if (model != null) {
            return model;
        }
        if (provider == null) {
            return null;
        }
        if (provider.equals(current.provider())) {
            return current.model();
        }
        LlmProviderPort adapter = registry.get(provider);
        return adapter != null ? adapter.getCurrentModel() : null;
    }

    /**
     * Makes {@code name} the current provider, optionally switching its model.
     * An invalid model keeps the provider's own current model.
     *
     * @return false if the provider is not registered or not available
     */
    public synchronized boolean setProvider(String name, String model) {
        LlmProviderPort adapter = name != null ? registry.get(name) : null;
        if (adapter == null) {
            log.warn("[Router] Provider {} is not registered", name);
            return false;
        }
        if (!adapter.isAvailable()) {
            log.warn("[Router] Provider {} is not available", name);
            return false;
        }
        String selectedModel = model != null && adapter.setModel(model) ? model : adapter.getCurrentModel();
        selection = new Selection(name, selectedModel);
        log.info("[Router] Provider set to {} with model {}", name, selectedModel);
        return true;
    }

    /**
     * Switches the model of {@code provider}, or of the current provider when
     * null.
     *
     * @return false if the provider is not registered, not available, or
     *         rejects the model id
     */
    public synchronized boolean setModel(String model, String provider) {
        String target = provider != null ? provider : selection.provider();
        LlmProviderPort adapter = target != null ? registry.get(target) : null;
        if (adapter == null) {
            log.warn("[Router] Provider {} is not registered", target);
            return false;
        }
        if (!adapter.isAvailable()) {
            log.warn("[Router] Provider {} is not available", target);
            return false;
        }
        if (model == null || !adapter.setModel(model)) {
            log.warn("[Router] Provider {} rejected model {}", target, model);
            return false;
        }
        if (target.equals(selection.provider())) {
            selection = new Selection(target, model);
        }
        log.info("[Router] Model set to {} for provider {}", model, target);
        return true;
    }

    /**
     * Status of every registered provider, plus placeholder entries for known
     * provider families that were never registered.
     */
    public Map<String, ProviderStatus> status() {
        Map<String, ProviderStatus> status = new LinkedHashMap<>();
        synchronized (registry) {
            registry.forEach((name, adapter) -> status.put(name, new ProviderStatus(
                    adapter.isAvailable(),
                    adapter.getCurrentModel(),
                    adapter.isHealthy(),
                    List.copyOf(adapter.getAvailableModels()))));
        }
        for (String known : properties.getLlm().getKnownProviders()) {
            status.putIfAbsent(known, ProviderStatus.notConfigured());
        }
        return status;
    }

    /**
     * Runs the health check of every registered provider concurrently. Each
     * flag is updated independently; a check that throws marks only its own
     * provider unhealthy. Completes when all checks are done.
     *
     * @return provider id to resulting health flag
     */
    public CompletableFuture<Map<String, Boolean>> healthCheckAll() {
        List<LlmProviderPort> adapters;
        synchronized (registry) {
            adapters = new ArrayList<>(registry.values());
        }
        Map<String, Boolean> results = Collections.synchronizedMap(new LinkedHashMap<>());
        CompletableFuture<?>[] checks = adapters.stream()
                .map(adapter -> CompletableFuture
                        .supplyAsync(adapter::healthCheck, healthCheckExecutor)
                        .handle((healthy, error) -> {
                            boolean result = error == null && Boolean.TRUE.equals(healthy);
                            adapter.setHealthy(result);
                            results.put(adapter.getProviderId(), result);
                            if (error != null) {
                                log.error("[Router] Health check of {} failed: {}", adapter.getProviderId(),
                                        rootMessage(error));
                            } else {
                                log.info("[Router] Provider {} health check: {}", adapter.getProviderId(),
                                        result ? "OK" : "FAILED");
                            }
                            return result;
                        }))
                .toArray(CompletableFuture[]::new);
        return CompletableFuture.allOf(checks).thenApply(ignored -> Map.copyOf(results));
    }

    /**
     * Ids of registered providers that are currently available, in chain
     * order.
     */
    public List<String> findAvailable() {
        List<String> available = new ArrayList<>();
        for (String name : fallbackChain) {
            LlmProviderPort adapter = registry.get(name);
            if (adapter != null && adapter.isAvailable()) {
                available.add(name);
            }
        }
        return available;
    }

    public Optional<LlmProviderPort> getProvider(String name) {
        return Optional.ofNullable(name != null ? registry.get(name) : null);
    }

    public Set<String> getRegisteredProviders() {
        synchronized (registry) {
            return Set.copyOf(registry.keySet());
        }
    }

    public List<String> getFallbackChain() {
        return fallbackChain;
    }

    public String getCurrentProvider() {
        return selection.provider();
    }

    public String getCurrentModel() {
        return selection.model();
    }

    /**
     * Current provider and its model. Always replaced as a whole.
     */
    private record Selection(String provider, String model) {
        static final Selection NONE = new Selection(null, null);
    }

    private static String rootMessage(Throwable error) {
        Throwable current = error;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current.getMessage() != null ? current.getMessage() : current.getClass().getSimpleName();
    }
}
