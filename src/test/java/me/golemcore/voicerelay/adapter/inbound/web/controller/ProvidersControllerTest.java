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

package me.golemcore.voicerelay.adapter.inbound.web.controller;

import me.golemcore.voicerelay.adapter.inbound.web.dto.ModelSelectionRequest;
import me.golemcore.voicerelay.adapter.inbound.web.dto.ProviderSelectionRequest;
import me.golemcore.voicerelay.domain.model.ProviderStatus;
import me.golemcore.voicerelay.domain.service.ProviderRouter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ProvidersControllerTest {

    private ProviderRouter router;
    private ProvidersController controller;

    @BeforeEach
    void setUp() {
        router = mock(ProviderRouter.class);
        controller = new ProvidersController(router);
    }

    @Test
    void shouldReturnProviderStatus() {
        Map<String, ProviderStatus> status = Map.of("openai", new ProviderStatus(true, "gpt-4o", true, List.of()));
        when(router.status()).thenReturn(status);

        StepVerifier.create(controller.getStatus())
                .assertNext(response -> assertEquals(status, response.getBody().get("providers")))
                .verifyComplete();
    }

    @Test
    void shouldSwitchCurrentProvider() {
        when(router.setProvider("claude", null)).thenReturn(true);
        when(router.getCurrentProvider()).thenReturn("claude");
        when(router.getCurrentModel()).thenReturn("claude-3-5-sonnet-20241022");

        StepVerifier.create(controller.setCurrentProvider(new ProviderSelectionRequest("claude", null)))
                .assertNext(response -> {
                    assertEquals("claude", response.getBody().get("provider"));
                    assertEquals("claude-3-5-sonnet-20241022", response.getBody().get("model"));
                })
                .verifyComplete();
    }

    @Test
    void shouldConflictWhenProviderUnavailable() {
        when(router.setProvider("xai", null)).thenReturn(false);

        ResponseStatusException error = assertThrows(ResponseStatusException.class,
                () -> controller.setCurrentProvider(new ProviderSelectionRequest("xai", null)));
        assertEquals(HttpStatus.CONFLICT, error.getStatusCode());
    }

    @Test
    void shouldRejectMissingProvider() {
        assertThrows(IllegalArgumentException.class,
                () -> controller.setCurrentProvider(new ProviderSelectionRequest(" ", null)));
        verify(router, never()).setProvider(any(), any());
    }

    @Test
    void shouldSwitchModel() {
        when(router.setModel("gpt-3.5-turbo", "openai")).thenReturn(true);

        StepVerifier.create(controller.setModel("openai", new ModelSelectionRequest("gpt-3.5-turbo")))
                .assertNext(response -> assertEquals("gpt-3.5-turbo", response.getBody().get("updated_model")))
                .verifyComplete();
    }

    @Test
    void shouldConflictWhenModelRejected() {
        when(router.setModel("bogus", "openai")).thenReturn(false);

        ResponseStatusException error = assertThrows(ResponseStatusException.class,
                () -> controller.setModel("openai", new ModelSelectionRequest("bogus")));
        assertEquals(HttpStatus.CONFLICT, error.getStatusCode());
    }

    @Test
    void shouldRunHealthCheckThenReportStatus() {
        when(router.healthCheckAll()).thenReturn(CompletableFuture.completedFuture(Map.of("openai", false)));
        when(router.status()).thenReturn(Map.of("openai", ProviderStatus.notConfigured()));

        StepVerifier.create(controller.runHealthCheck())
                .assertNext(response -> assertEquals(Map.of("openai", ProviderStatus.notConfigured()),
                        response.getBody().get("providers")))
                .verifyComplete();
        verify(router).healthCheckAll();
    }
}
