package me.golemcore.agent.domain.system.toolloop;

import me.golemcore.agent.domain.exception.ExchangeCancelledException;
import me.golemcore.agent.domain.exception.IterationBudgetExceededException;
import me.golemcore.agent.domain.exception.ReasoningEngineUnavailableException;
import me.golemcore.agent.domain.model.AgentContext;
import me.golemcore.agent.domain.model.AgentSession;
import me.golemcore.agent.domain.model.LlmRequest;
import me.golemcore.agent.domain.model.LlmResponse;
import me.golemcore.agent.domain.model.LlmUsage;
import me.golemcore.agent.domain.model.LoopState;
import me.golemcore.agent.domain.model.MemoryKind;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.SessionConfig;
import me.golemcore.agent.domain.model.ToolFailureKind;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.domain.model.ToolTraceEntry;
import me.golemcore.agent.domain.service.ToolRegistry;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.port.outbound.LlmPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DefaultToolLoopSystemTest {

    private static final String MODEL = "gpt-4o-mini";
    private static final String TOOL_NAME = "echo";

    @Mock
    private LlmPort llmPort;

    @Mock
    private ToolExecutorPort toolExecutor;

    private AgentProperties properties;
    private Clock clock;
    private DefaultToolLoopSystem system;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        clock = Clock.fixed(Instant.parse("2026-02-14T00:00:00Z"), ZoneId.of("UTC"));
        properties = new AgentProperties();
        properties.getLoop().setMaxIterations(3);
        system = newSystem(toolExecutor);
    }

    private DefaultToolLoopSystem newSystem(ToolExecutorPort executor) {
        return new DefaultToolLoopSystem(llmPort, executor, new DefaultHistoryWriter(clock),
                properties.getLoop(), properties.getLlm(), clock);
    }

    private AgentContext buildContext(List<String> tools) {
        SessionConfig config = SessionConfig.builder()
                .model(MODEL)
                .temperature(0.5)
                .tools(tools)
                .memoryKind(MemoryKind.BUFFER)
                .build();
        AgentSession session = AgentSession.builder()
                .id("sess-1")
                .createdAt(clock.instant())
                .config(config)
                .build();
        List<Message> messages = new ArrayList<>();
        messages.add(Message.user("hello", clock.instant()));
        return AgentContext.builder()
                .session(session)
                .effectiveConfig(config)
                .systemPrompt("You are helpful.")
                .messages(messages)
                .build();
    }

    private static LlmResponse finalResponse(String content, int tokens) {
        return LlmResponse.builder()
                .content(content)
                .usage(LlmUsage.of(tokens, tokens, null))
                .build();
    }

    private static LlmResponse toolCallResponse(String id, String name) {
        return LlmResponse.builder()
                .toolCalls(List.of(Message.ToolCall.builder()
                        .id(id)
                        .name(name)
                        .arguments(Map.of())
                        .build()))
                .usage(LlmUsage.of(1, 1, null))
                .build();
    }

    private static ToolExecutionOutcome successOutcome(String id) {
        return new ToolExecutionOutcome(id, TOOL_NAME, ToolResult.success("echoed"), "echoed", false);
    }

    // ==================== Final answer ====================

    @Test
    void shouldReturnFinalAnswerWithoutTools() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(finalResponse("4", 5)));
        AgentContext context = buildContext(List.of(TOOL_NAME));

        ToolLoopTurnResult result = system.processTurn(context);

        assertEquals("4", result.reply());
        assertEquals(1, result.llmCalls());
        assertEquals(0, result.toolExecutions());
        assertFalse(result.degraded());
        assertEquals(LoopState.DONE, context.getState());
        assertEquals(10, context.getUsage().getTotalTokens());
        verify(toolExecutor, never()).execute(any(), any());
    }

    @Test
    void shouldSendEffectiveConfigToReasoningEngine() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(finalResponse("ok", 1)));
        AgentContext context = buildContext(List.of(TOOL_NAME));

        system.processTurn(context);

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort).chat(captor.capture());
        LlmRequest request = captor.getValue();
        assertEquals(MODEL, request.getModel());
        assertEquals(Double.valueOf(0.5), request.getTemperature());
        assertEquals("You are helpful.", request.getSystemPrompt());
        assertEquals("sess-1", request.getSessionId());
        assertEquals(1, request.getMessages().size());
    }

    // ==================== Tool dispatch ====================

    @Test
    void shouldDispatchToolAndFeedResultBack() {
        when(llmPort.chat(any()))
                .thenReturn(CompletableFuture.completedFuture(toolCallResponse("tc-1", TOOL_NAME)))
                .thenReturn(CompletableFuture.completedFuture(finalResponse("done", 2)));
        when(toolExecutor.execute(any(), any())).thenReturn(successOutcome("tc-1"));
        AgentContext context = buildContext(List.of(TOOL_NAME));

        ToolLoopTurnResult result = system.processTurn(context);

        assertEquals("done", result.reply());
        assertEquals(2, result.llmCalls());
        assertEquals(1, result.toolExecutions());
        List<Message> messages = context.getMessages();
        assertEquals(3, messages.size());
        assertTrue(messages.get(1).hasToolCalls());
        assertTrue(messages.get(2).isToolMessage());
        assertEquals("tc-1", messages.get(2).getToolCallId());

        ToolTraceEntry entry = context.getToolTrace().get(0);
        assertTrue(entry.isSuccess());
        assertEquals(1, entry.getIteration());
        assertEquals("echoed", entry.getOutput());
    }

    @Test
    void shouldRecordUnknownToolAsObservationAndContinue() {
        ToolRegistry registry = new ToolRegistry(List.of(), new AgentProperties());
        registry.register(TOOL_NAME, "Echoes", Map.of(), args -> ToolResult.success("echo"));
        system = newSystem(new DefaultToolExecutor(registry, properties.getTools()));
        when(llmPort.chat(any()))
                .thenReturn(CompletableFuture.completedFuture(toolCallResponse("tc-1", "upper")))
                .thenReturn(CompletableFuture.completedFuture(finalResponse("sorry, no upper tool", 1)));
        AgentContext context = buildContext(List.of(TOOL_NAME));

        ToolLoopTurnResult result = system.processTurn(context);

        assertEquals("sorry, no upper tool", result.reply());
        assertEquals(2, result.llmCalls());
        ToolTraceEntry entry = context.getToolTrace().get(0);
        assertFalse(entry.isSuccess());
        assertEquals("upper", entry.getToolName());
        assertEquals(ToolFailureKind.UNKNOWN_TOOL, entry.getFailureKind());

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort, times(2)).chat(captor.capture());
        List<Message> secondCall = captor.getAllValues().get(1).getMessages();
        Message observation = secondCall.get(secondCall.size() - 1);
        assertTrue(observation.isToolMessage());
        assertTrue(observation.getContent().contains("Unknown tool: upper"));
    }

    @Test
    void shouldAbsorbExecutorFailure() {
        when(llmPort.chat(any()))
                .thenReturn(CompletableFuture.completedFuture(toolCallResponse("tc-1", TOOL_NAME)))
                .thenReturn(CompletableFuture.completedFuture(finalResponse("recovered", 1)));
        when(toolExecutor.execute(any(), any())).thenThrow(new IllegalStateException("executor broke"));
        AgentContext context = buildContext(List.of(TOOL_NAME));

        ToolLoopTurnResult result = system.processTurn(context);

        assertEquals("recovered", result.reply());
        assertEquals(ToolFailureKind.EXECUTION_FAILED, context.getToolTrace().get(0).getFailureKind());
    }

    @Test
    void shouldPropagateCancellationFromExecutor() {
        when(llmPort.chat(any()))
                .thenReturn(CompletableFuture.completedFuture(toolCallResponse("tc-1", TOOL_NAME)));
        when(toolExecutor.execute(any(), any()))
                .thenThrow(new ExchangeCancelledException("cancelled", null));

        assertThrows(ExchangeCancelledException.class, () -> system.processTurn(buildContext(List.of(TOOL_NAME))));
    }

    // ==================== Budget ====================

    @Test
    void shouldStopAfterExactlyMaxReasoningCalls() {
        when(llmPort.chat(any())).thenAnswer(inv -> CompletableFuture.completedFuture(
                toolCallResponse("tc-" + System.nanoTime(), TOOL_NAME)));
        when(toolExecutor.execute(any(), any())).thenAnswer(inv -> successOutcome("tc"));
        AgentContext context = buildContext(List.of(TOOL_NAME));

        IterationBudgetExceededException error = assertThrows(IterationBudgetExceededException.class,
                () -> system.processTurn(context));

        verify(llmPort, times(3)).chat(any());
        verify(toolExecutor, times(2)).execute(any(), any());
        assertEquals(3, error.getIterations());
        assertEquals(3, error.getTrace().size());
        assertEquals(ToolFailureKind.SKIPPED, error.getTrace().get(2).getFailureKind());
        assertEquals(LoopState.FAILED, context.getState());
    }

    @Test
    void shouldReturnDegradedReplyWhenConfigured() {
        properties.getLoop().setOnBudgetExhausted(AgentProperties.BudgetExhaustedMode.DEGRADED_REPLY);
        when(llmPort.chat(any())).thenAnswer(inv -> CompletableFuture.completedFuture(
                toolCallResponse("tc", TOOL_NAME)));
        when(toolExecutor.execute(any(), any())).thenAnswer(inv -> successOutcome("tc"));
        AgentContext context = buildContext(List.of(TOOL_NAME));

        ToolLoopTurnResult result = system.processTurn(context);

        assertTrue(result.degraded());
        assertEquals(3, result.llmCalls());
        assertTrue(result.reply().startsWith("I could not finish this request"));
        assertTrue(result.stopReason().contains("max reasoning calls"));
        verify(llmPort, times(3)).chat(any());
    }

    // ==================== Reasoning failures ====================

    @Test
    void shouldAttachProgressToReasoningFailure() {
        when(llmPort.chat(any()))
                .thenReturn(CompletableFuture.completedFuture(toolCallResponse("tc-1", TOOL_NAME)))
                .thenReturn(CompletableFuture.failedFuture(new ReasoningEngineUnavailableException(
                        "rate limited", 3, "llm.rate_limit", null, null)));
        when(toolExecutor.execute(any(), any())).thenReturn(successOutcome("tc-1"));

        ReasoningEngineUnavailableException error = assertThrows(ReasoningEngineUnavailableException.class,
                () -> system.processTurn(buildContext(List.of(TOOL_NAME))));

        assertEquals(1, error.getIterations());
        assertEquals(1, error.getTrace().size());
        assertEquals(3, error.getAttempts());
    }

    @Test
    void shouldWrapUnexpectedReasoningFailure() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("boom")));

        ReasoningEngineUnavailableException error = assertThrows(ReasoningEngineUnavailableException.class,
                () -> system.processTurn(buildContext(List.of(TOOL_NAME))));

        assertEquals(0, error.getIterations());
        assertTrue(error.getMessage().contains("boom"));
    }
}
