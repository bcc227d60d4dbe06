package me.golemcore.agent.domain.service;

import me.golemcore.agent.domain.exception.ExchangeCancelledException;
import me.golemcore.agent.domain.exception.IterationBudgetExceededException;
import me.golemcore.agent.domain.exception.ReasoningEngineUnavailableException;
import me.golemcore.agent.domain.exception.UnknownToolException;
import me.golemcore.agent.domain.memory.MemoryFactory;
import me.golemcore.agent.domain.model.AgentSession;
import me.golemcore.agent.domain.model.ExchangeRequest;
import me.golemcore.agent.domain.model.ExchangeResult;
import me.golemcore.agent.domain.model.LlmRequest;
import me.golemcore.agent.domain.model.LlmResponse;
import me.golemcore.agent.domain.model.LlmUsage;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.SessionSnapshot;
import me.golemcore.agent.domain.model.ToolFailureKind;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.domain.system.toolloop.DefaultHistoryWriter;
import me.golemcore.agent.domain.system.toolloop.DefaultToolExecutor;
import me.golemcore.agent.domain.system.toolloop.DefaultToolLoopSystem;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.port.outbound.LlmPort;
import me.golemcore.agent.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ExchangeServiceTest {

    private static final Instant START = Instant.parse("2026-02-14T10:00:00Z");

    private MutableClock clock;
    private AgentProperties properties;
    private LlmPort llmPort;
    private ToolRegistry toolRegistry;
    private SessionService sessionService;
    private ExchangeService exchangeService;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        properties = new AgentProperties();
        properties.getLoop().setMaxIterations(3);
        properties.getTools().setEnabled(new ArrayList<>(List.of("echo")));

        llmPort = mock(LlmPort.class);
        toolRegistry = new ToolRegistry(Duration.ofSeconds(1));
        toolRegistry.register("echo", "Echoes text", Map.of(), args -> ToolResult.success("echo: " + args));
        toolRegistry.register("upper", "Upper-cases text", Map.of(), args -> ToolResult.success("UPPER"));

        MemoryFactory memoryFactory = new MemoryFactory(properties, (previous, turns) -> "summary");
        sessionService = new SessionService(properties, toolRegistry, memoryFactory, clock);
        DefaultToolLoopSystem toolLoop = new DefaultToolLoopSystem(llmPort,
                new DefaultToolExecutor(toolRegistry, properties.getTools()), new DefaultHistoryWriter(clock),
                properties.getLoop(), properties.getLlm(), clock);
        exchangeService = new ExchangeService(sessionService, toolRegistry, toolLoop, properties, clock);
    }

    private static CompletableFuture<LlmResponse> reply(String content) {
        return CompletableFuture.completedFuture(LlmResponse.builder()
                .content(content)
                .usage(LlmUsage.of(10, 5, 15))
                .build());
    }

    private static CompletableFuture<LlmResponse> toolCall(String name) {
        return CompletableFuture.completedFuture(LlmResponse.builder()
                .toolCalls(List.of(Message.ToolCall.builder().id("tc-" + name).name(name).arguments(Map.of())
                        .build()))
                .usage(LlmUsage.of(3, 2, 5))
                .build());
    }

    private static ExchangeRequest message(String text, String sessionId) {
        return ExchangeRequest.builder().message(text).sessionId(sessionId).build();
    }

    // ==================== Basic exchange ====================

    @Test
    void shouldCreateSessionAndRememberFirstTurn() {
        when(llmPort.chat(any())).thenReturn(reply("4"), reply("You asked 2+2"));

        ExchangeResult first = exchangeService.exchange(message("2+2?", null));
        ExchangeResult second = exchangeService.exchange(message("what did I ask?", first.getSessionId()));

        assertNotNull(first.getSessionId());
        assertEquals("4", first.getReply());
        assertEquals(first.getSessionId(), second.getSessionId());

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort, times(2)).chat(captor.capture());
        List<Message> context = captor.getAllValues().get(1).getMessages();
        assertEquals(3, context.size());
        assertEquals("2+2?", context.get(0).getContent());
        assertEquals("4", context.get(1).getContent());
        assertEquals("what did I ask?", context.get(2).getContent());
    }

    @Test
    void shouldReportUsageAndIterations() {
        when(llmPort.chat(any())).thenReturn(toolCall("echo"), reply("done"));

        ExchangeResult result = exchangeService.exchange(message("echo please", "s1"));

        assertEquals(2, result.getIterations());
        assertEquals(20, result.getUsage().getTotalTokens());
        assertEquals(1, result.getToolTrace().size());
        assertTrue(result.getToolTrace().get(0).isSuccess());
        assertFalse(result.isDegraded());
    }

    @Test
    void shouldCommitUserAndAssistantTurnsWithTrace() {
        when(llmPort.chat(any())).thenReturn(toolCall("echo"), reply("done"));
        clock.advance(Duration.ofMinutes(1));

        exchangeService.exchange(message("echo please", "s1"));

        SessionSnapshot snapshot = sessionService.getSnapshot("s1");
        List<Message> history = snapshot.getHistory();
        assertEquals(2, history.size());
        assertTrue(history.get(0).isUserMessage());
        assertEquals("done", history.get(1).getContent());
        assertEquals(1, history.get(1).getToolTrace().size());
        assertEquals(START.plusSeconds(60), snapshot.getLastInteraction());
    }

    @Test
    void shouldRecordUnknownToolAndStillReply() {
        when(llmPort.chat(any())).thenReturn(toolCall("shout"), reply("I cannot shout"));

        ExchangeResult result = exchangeService.exchange(message("shout it", "s1"));

        assertEquals("I cannot shout", result.getReply());
        assertEquals(ToolFailureKind.UNKNOWN_TOOL, result.getToolTrace().get(0).getFailureKind());
    }

    // ==================== Validation ====================

    @Test
    void shouldRejectBlankMessage() {
        assertThrows(IllegalArgumentException.class, () -> exchangeService.exchange(message("  ", null)));
        assertEquals(0, sessionService.size());
    }

    @Test
    void shouldRejectUnknownToolOverride() {
        ExchangeRequest request = ExchangeRequest.builder().message("hi").tools(List.of("nope")).build();

        assertThrows(UnknownToolException.class, () -> exchangeService.exchange(request));
        assertEquals(0, sessionService.size());
        verify(llmPort, never()).chat(any());
    }

    @Test
    void shouldRejectTemperatureOutOfRange() {
        ExchangeRequest request = ExchangeRequest.builder().message("hi").temperature(-0.1).build();

        assertThrows(IllegalArgumentException.class, () -> exchangeService.exchange(request));
    }

    // ==================== Overrides ====================

    @Test
    void shouldApplyOverridesForThisExchangeOnly() {
        when(llmPort.chat(any())).thenReturn(reply("a"), reply("b"));

        exchangeService.exchange(ExchangeRequest.builder().message("hi").sessionId("s1")
                .temperature(0.1).tools(List.of("upper")).build());
        exchangeService.exchange(message("again", "s1"));

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort, times(2)).chat(captor.capture());
        LlmRequest overridden = captor.getAllValues().get(0);
        assertEquals(Double.valueOf(0.1), overridden.getTemperature());
        assertEquals("upper", overridden.getTools().get(0).getName());
        LlmRequest plain = captor.getAllValues().get(1);
        assertEquals(Double.valueOf(properties.getLlm().getTemperature()), plain.getTemperature());
        assertEquals(List.of("echo"), sessionService.getSnapshot("s1").getConfig().getTools());
    }

    @Test
    void shouldPersistOverridesWhenRequested() {
        when(llmPort.chat(any())).thenReturn(reply("a"));

        exchangeService.exchange(ExchangeRequest.builder().message("hi").sessionId("s1")
                .temperature(0.1).persist(true).build());

        assertEquals(0.1, sessionService.getSnapshot("s1").getConfig().getTemperature());
        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort).chat(captor.capture());
        assertEquals(Double.valueOf(0.1), captor.getValue().getTemperature());
    }

    @Test
    void shouldNotPersistOverridesWhenExchangeFails() {
        when(llmPort.chat(any())).thenReturn(reply("a"), CompletableFuture.failedFuture(
                new ReasoningEngineUnavailableException("down", 3, "llm.rate_limit", Duration.ofSeconds(4), null)));
        exchangeService.exchange(message("hi", "s1"));

        assertThrows(ReasoningEngineUnavailableException.class, () -> exchangeService.exchange(
                ExchangeRequest.builder().message("again").sessionId("s1")
                        .temperature(0.1).tools(List.of("upper")).persist(true).build()));

        SessionSnapshot snapshot = sessionService.getSnapshot("s1");
        assertEquals(properties.getLlm().getTemperature(), snapshot.getConfig().getTemperature());
        assertEquals(List.of("echo"), snapshot.getConfig().getTools());
        assertFalse(sessionService.resolveOrCreate("s1").getLock().isLocked());
    }

    // ==================== Failures ====================

    @Test
    void shouldNotCommitWhenReasoningEngineFails() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.failedFuture(
                new ReasoningEngineUnavailableException("down", 3, "llm.rate_limit", Duration.ofSeconds(4), null)));

        assertThrows(ReasoningEngineUnavailableException.class, () -> exchangeService.exchange(message("hi", "s1")));

        AgentSession session = sessionService.resolveOrCreate("s1");
        assertEquals(0, session.getMemory().size());
        assertFalse(session.getLock().isLocked());
    }

    @Test
    void shouldNotCommitWhenBudgetExhausted() {
        when(llmPort.chat(any())).thenAnswer(inv -> toolCall("echo"));

        IterationBudgetExceededException error = assertThrows(IterationBudgetExceededException.class,
                () -> exchangeService.exchange(message("loop forever", "s1")));

        assertEquals(3, error.getIterations());
        verify(llmPort, times(3)).chat(any());
        assertEquals(0, sessionService.getSnapshot("s1").getHistory().size());
    }

    // ==================== Concurrency ====================

    @Test
    void shouldReleaseLockAndCommitNothingWhenCancelledDuringReasoning() throws Exception {
        when(llmPort.chat(any())).thenReturn(reply("hello"));
        exchangeService.exchange(message("first", "s1"));
        List<Message> before = sessionService.getSnapshot("s1").getHistory();

        CountDownLatch reasoning = new CountDownLatch(1);
        when(llmPort.chat(any())).thenAnswer(inv -> {
            reasoning.countDown();
            return new CompletableFuture<LlmResponse>();
        });
        AtomicReference<Throwable> failure = new AtomicReference<>();
        Thread worker = new Thread(() -> {
            try {
                exchangeService.exchange(message("never answered", "s1"));
            } catch (RuntimeException e) {
                failure.set(e);
            }
        });
        worker.start();
        assertTrue(reasoning.await(5, TimeUnit.SECONDS));

        worker.interrupt();
        worker.join(5000);

        assertInstanceOf(ExchangeCancelledException.class, failure.get());
        AgentSession session = sessionService.resolveOrCreate("s1");
        assertFalse(session.getLock().isLocked());
        assertEquals(before, sessionService.getSnapshot("s1").getHistory());

        when(llmPort.chat(any())).thenReturn(reply("back again"));
        ExchangeResult next = exchangeService.exchange(message("second", "s1"));
        assertEquals("back again", next.getReply());
        assertEquals(before.size() + 2, sessionService.getSnapshot("s1").getHistory().size());
    }

    @Test
    void shouldSerializeConcurrentExchangesOnSameSession() throws Exception {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch firstEntered = new CountDownLatch(1);
        CountDownLatch releaseFirst = new CountDownLatch(1);
        when(llmPort.chat(any())).thenAnswer(inv -> {
            int current = inFlight.incrementAndGet();
            maxInFlight.accumulateAndGet(current, Math::max);
            try {
                int call = calls.incrementAndGet();
                if (call == 1) {
                    firstEntered.countDown();
                    assertTrue(releaseFirst.await(5, TimeUnit.SECONDS));
                }
                return reply("reply " + call);
            } finally {
                inFlight.decrementAndGet();
            }
        });
        sessionService.resolveOrCreate("s1");

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<ExchangeResult> first = pool.submit(() -> exchangeService.exchange(message("first", "s1")));
            assertTrue(firstEntered.await(5, TimeUnit.SECONDS));
            Future<ExchangeResult> second = pool.submit(() -> exchangeService.exchange(message("second", "s1")));
            Thread.sleep(100);
            assertEquals(1, calls.get());
            releaseFirst.countDown();

            first.get(5, TimeUnit.SECONDS);
            second.get(5, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, maxInFlight.get());
        List<String> contents = sessionService.getSnapshot("s1").getHistory().stream()
                .map(Message::getContent)
                .toList();
        assertEquals(List.of("first", "reply 1", "second", "reply 2"), contents);
    }

    @Test
    void shouldRunDifferentSessionsInParallel() throws Exception {
        CountDownLatch bothEntered = new CountDownLatch(2);
        when(llmPort.chat(any())).thenAnswer(inv -> {
            bothEntered.countDown();
            assertTrue(bothEntered.await(5, TimeUnit.SECONDS));
            return reply("ok");
        });

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<ExchangeResult> a = pool.submit(() -> exchangeService.exchange(message("a", "s1")));
            Future<ExchangeResult> b = pool.submit(() -> exchangeService.exchange(message("b", "s2")));

            assertEquals("ok", a.get(5, TimeUnit.SECONDS).getReply());
            assertEquals("ok", b.get(5, TimeUnit.SECONDS).getReply());
        } finally {
            pool.shutdownNow();
        }
    }
}
