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

import me.golemcore.voicerelay.domain.model.ProviderStatus;
import me.golemcore.voicerelay.infrastructure.config.RelayProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodically re-checks provider health. When a sweep changes the
 * availability of any provider, every connected client receives a
 * {@code provider_status_changed} envelope.
 *
 * <p>
 * Sweeps never overlap: a tick that fires while the previous sweep is still
 * running is skipped.
 */
@Component
@Slf4j
public class ProviderHealthScheduler {

    static final String PROVIDER_STATUS_CHANGED = "provider_status_changed";

    private final ProviderRouter router;
    private final SessionRegistry sessionRegistry;
    private final RelayProperties properties;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> sweepTask;

    public ProviderHealthScheduler(ProviderRouter router, SessionRegistry sessionRegistry,
            RelayProperties properties) {
        this.router = router;
        this.sessionRegistry = sessionRegistry;
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        Duration interval = properties.getLlm().getHealthCheckInterval();
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "provider-health-sweep");
            t.setDaemon(true);
            return t;
        });
        sweepTask = scheduler.scheduleAtFixedRate(this::sweep,
                interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("[HealthSweep] Started with interval {}", interval);
    }

    @PreDestroy
    public void shutdown() {
        if (sweepTask != null) {
            sweepTask.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
    }

    /**
     * Runs one health sweep.
     *
     * @return true if any provider's availability changed
     */
    public boolean sweep() {
        if (!running.compareAndSet(false, true)) {
            log.debug("[HealthSweep] Previous sweep still running, skipping");
            return false;
        }
        try {
            Map<String, Boolean> before = availability(router.status());
            router.healthCheckAll().get(sweepTimeout().toMillis(), TimeUnit.MILLISECONDS);
            Map<String, ProviderStatus> after = router.status();
            if (before.equals(availability(after))) {
                return false;
            }
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("type", PROVIDER_STATUS_CHANGED);
            payload.put("providers", after);
            int delivered = sessionRegistry.broadcast(payload);
            log.info("[HealthSweep] Provider availability changed, notified {} sessions", delivered);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[HealthSweep] Interrupted");
            return false;
        } catch (ExecutionException | TimeoutException | RuntimeException e) { // NOSONAR - keep the schedule alive
            log.error("[HealthSweep] Sweep failed: {}", e.getMessage());
            return false;
        } finally {
            running.set(false);
        }
    }

    private Duration sweepTimeout() {
        return properties.getLlm().getTimeout().multipliedBy(2);
    }

    private static Map<String, Boolean> availability(Map<String, ProviderStatus> status) {
        Map<String, Boolean> result = new LinkedHashMap<>();
        status.forEach((name, providerStatus) -> result.put(name, providerStatus.available()));
        return result;
    }
}
