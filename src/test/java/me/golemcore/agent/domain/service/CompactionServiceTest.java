package me.golemcore.agent.domain.service;

import me.golemcore.agent.domain.model.LlmRequest;
import me.golemcore.agent.domain.model.LlmResponse;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.port.outbound.LlmPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CompactionServiceTest {

    private static final Instant NOW = Instant.parse("2026-02-14T10:00:00Z");

    @Mock
    private LlmPort llmPort;

    private CompactionService service;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        AgentProperties properties = new AgentProperties();
        properties.getMemory().setSummaryTimeout(Duration.ofMillis(200));
        service = new CompactionService(llmPort, properties, Clock.fixed(NOW, ZoneId.of("UTC")));
        when(llmPort.isAvailable()).thenReturn(true);
    }

    private static List<Message> turns() {
        return List.of(Message.user("My name is Ann", NOW), Message.assistant("Nice to meet you, Ann", NOW));
    }

    @Test
    void shouldSummarizeTurnsWithPreviousSummary() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(
                LlmResponse.builder().content("  User is Ann.  ").build()));

        String summary = service.summarize("Earlier: greeting", turns());

        assertEquals("User is Ann.", summary);
        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort).chat(captor.capture());
        String prompt = captor.getValue().getMessages().get(0).getContent();
        assertTrue(prompt.startsWith("Previous summary:\nEarlier: greeting"));
        assertTrue(prompt.contains("user: My name is Ann"));
        assertTrue(prompt.contains("assistant: Nice to meet you, Ann"));
    }

    @Test
    void shouldReturnPreviousSummaryWhenNoTurns() {
        assertEquals("kept", service.summarize("kept", List.of()));
        verify(llmPort, never()).chat(any());
    }

    @Test
    void shouldReturnNullWhenLlmUnavailable() {
        when(llmPort.isAvailable()).thenReturn(false);

        assertNull(service.summarize(null, turns()));
        verify(llmPort, never()).chat(any());
    }

    @Test
    void shouldReturnNullOnFailure() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("down")));

        assertNull(service.summarize(null, turns()));
    }

    @Test
    void shouldReturnNullOnTimeout() {
        when(llmPort.chat(any())).thenReturn(new CompletableFuture<>());

        assertNull(service.summarize(null, turns()));
    }

    @Test
    void shouldReturnNullOnEmptySummary() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(
                LlmResponse.builder().content(" ").build()));

        assertNull(service.summarize(null, turns()));
    }
}
