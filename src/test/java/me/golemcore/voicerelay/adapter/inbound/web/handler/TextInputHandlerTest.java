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

package me.golemcore.voicerelay.adapter.inbound.web.handler;

import me.golemcore.voicerelay.adapter.inbound.web.EnvelopeSender;
import me.golemcore.voicerelay.domain.exception.AllProvidersFailedException;
import me.golemcore.voicerelay.domain.model.ChatResult;
import me.golemcore.voicerelay.domain.model.VoiceSession;
import me.golemcore.voicerelay.domain.service.ConversationService;
import me.golemcore.voicerelay.port.outbound.SynthesisPort.SynthesisResult;
import me.golemcore.voicerelay.testsupport.RecordingConnection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TextInputHandlerTest {

    private ConversationService conversationService;
    private TextInputHandler handler;
    private VoiceSession session;
    private RecordingConnection connection;
    private EnvelopeSender sender;

    @BeforeEach
    void setUp() {
        conversationService = mock(ConversationService.class);
        handler = new TextInputHandler(conversationService);
        session = new VoiceSession("s1", Instant.parse("2026-01-01T10:00:00Z"), 10);
        connection = new RecordingConnection("c1");
        sender = new EnvelopeSender(session, connection);
    }

    @Test
    void shouldSendResponseThenAudio() {
        when(conversationService.chat(session, "Hello")).thenReturn(CompletableFuture.completedFuture(
                new ChatResult("Hi there", "claude", "claude-3-5-sonnet-20241022", true)));
        when(conversationService.synthesize("Hi there")).thenReturn(CompletableFuture.completedFuture(
                Optional.of(new SynthesisResult(true, new byte[] { 1, 2 }, "mp3", 0.5, null))));

        StepVerifier.create(handler.handle(session, Map.of("type", "text_input", "text", "Hello"), sender))
                .verifyComplete();

        assertEquals(List.of("response", "audio_response"), connection.sentTypes());
        Map<String, Object> response = connection.sent().get(0);
        assertEquals("Hi there", response.get("text"));
        assertEquals("claude", response.get("provider"));
        assertEquals(true, response.get("fallback_used"));
        assertFalse(response.containsKey("source"));
        Map<String, Object> audio = connection.sent().get(1);
        assertEquals(Base64.getEncoder().encodeToString(new byte[] { 1, 2 }), audio.get("audio_data"));
        assertEquals("mp3", audio.get("audio_format"));
        assertEquals("Hi there", audio.get("text"));
    }

    @Test
    void shouldSendOnlyResponseWithoutAudio() {
        when(conversationService.chat(session, "Hello")).thenReturn(CompletableFuture.completedFuture(
                new ChatResult("Hi", "openai", "gpt-4o", false)));
        when(conversationService.synthesize("Hi")).thenReturn(CompletableFuture.completedFuture(Optional.empty()));

        StepVerifier.create(handler.handle(session, Map.of("text", "Hello"), sender)).verifyComplete();

        assertEquals(List.of("response"), connection.sentTypes());
    }

    @Test
    void shouldReportChatFailureAsError() {
        when(conversationService.chat(session, "Hello")).thenReturn(
                CompletableFuture.failedFuture(new AllProvidersFailedException(List.of("openai", "claude"))));

        StepVerifier.create(handler.handle(session, Map.of("text", "Hello"), sender)).verifyComplete();

        assertEquals(List.of("error"), connection.sentTypes());
        Map<String, Object> error = connection.sent().get(0);
        assertEquals("text_input", error.get("message_type"));
        assertEquals(true, ((String) error.get("message")).startsWith("Error processing message: "));
        verify(conversationService, never()).synthesize(anyString());
    }

    @Test
    void shouldRejectBlankText() {
        StepVerifier.create(handler.handle(session, Map.of("text", "  "), sender))
                .expectError(IllegalArgumentException.class)
                .verify();

        verify(conversationService, never()).chat(any(), anyString());
    }

    @Test
    void shouldTagVoiceReplies() {
        when(conversationService.chat(session, "Hello")).thenReturn(CompletableFuture.completedFuture(
                new ChatResult("Hi", "openai", "gpt-4o", false)));
        when(conversationService.synthesize("Hi")).thenReturn(CompletableFuture.completedFuture(
                Optional.of(new SynthesisResult(true, new byte[] { 9 }, "mp3", 0.1, null))));

        StepVerifier.create(handler.respond(session, "Hello", "voice_input", sender)).verifyComplete();

        assertEquals("voice_input", connection.sent().get(0).get("source"));
        assertEquals("voice_input", connection.sent().get(1).get("source"));
    }
}
