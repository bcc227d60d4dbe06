package me.golemcore.agent.domain.system.toolloop;

import me.golemcore.agent.domain.exception.AgentException;
import me.golemcore.agent.domain.exception.ExchangeCancelledException;
import me.golemcore.agent.domain.exception.IterationBudgetExceededException;
import me.golemcore.agent.domain.exception.ReasoningEngineUnavailableException;
import me.golemcore.agent.domain.model.AgentContext;
import me.golemcore.agent.domain.model.LlmRequest;
import me.golemcore.agent.domain.model.LlmResponse;
import me.golemcore.agent.domain.model.LoopState;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.ToolFailureKind;
import me.golemcore.agent.domain.model.ToolTraceEntry;
import me.golemcore.agent.domain.system.LlmErrorClassifier;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.port.outbound.LlmPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutionException;

/**
 * Reasoning and tool dispatch for one exchange.
 *
 * <p>
 * Each pass makes one reasoning call. A response without tool calls ends the
 * loop in {@link LoopState#DONE}. Otherwise the calls run sequentially in the
 * order returned and their outcomes (results or error observations) are fed
 * into the next pass. At most {@code maxIterations} reasoning calls are made;
 * tool calls returned by the last allowed call are recorded as skipped, never
 * run.
 */
public class DefaultToolLoopSystem implements ToolLoopSystem {

    private static final Logger log = LoggerFactory.getLogger(DefaultToolLoopSystem.class);

    private final LlmPort llmPort;
    private final ToolExecutorPort toolExecutor;
    private final HistoryWriter historyWriter;
    private final AgentProperties.LoopProperties settings;
    private final AgentProperties.LlmProperties llmSettings;
    private final Clock clock;

    public DefaultToolLoopSystem(LlmPort llmPort, ToolExecutorPort toolExecutor, HistoryWriter historyWriter,
            AgentProperties.LoopProperties settings, AgentProperties.LlmProperties llmSettings, Clock clock) {
        this.llmPort = llmPort;
        this.toolExecutor = toolExecutor;
        this.historyWriter = historyWriter;
        this.settings = settings;
        this.llmSettings = llmSettings;
        this.clock = clock;
    }

    @Override
    public ToolLoopTurnResult processTurn(AgentContext context) {
        int maxIterations = Math.max(1, settings.getMaxIterations());
        Instant deadline = clock.instant().plus(settings.getDeadline());

        int llmCalls = 0;
        int toolExecutions = 0;
        LlmResponse last = null;

        while (true) {
            if (llmCalls >= maxIterations) {
                return budgetExhausted(context, last, llmCalls, toolExecutions,
                        "reached max reasoning calls (" + maxIterations + ")");
            }
            if (!clock.instant().isBefore(deadline)) {
                return budgetExhausted(context, last, llmCalls, toolExecutions, "deadline exceeded");
            }

            // 1) Reasoning call
            context.setState(LoopState.REASONING);
            LlmResponse response = callReasoning(context, llmCalls);
            llmCalls++;
            context.setCurrentIteration(llmCalls);
            context.addUsage(response.getUsage());
            last = response;

            // 2) Final answer
            if (!response.hasToolCalls()) {
                context.setState(LoopState.DONE);
                String reply = response.getContent() != null ? response.getContent() : "";
                log.debug("[ToolLoop] Final answer after {} reasoning calls, {} tool executions",
                        llmCalls, toolExecutions);
                return new ToolLoopTurnResult(context, reply, llmCalls, toolExecutions, false, null);
            }

            historyWriter.appendAssistantToolCalls(context, response, response.getToolCalls());

            // 3) No reasoning call left to read the results: record the calls as skipped
            if (llmCalls >= maxIterations) {
                skipPending(context, response.getToolCalls(), llmCalls);
                continue;
            }

            // 4) Dispatch tools in order
            context.setState(LoopState.TOOL_DISPATCH);
            for (Message.ToolCall toolCall : response.getToolCalls()) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new ExchangeCancelledException("Exchange cancelled during tool dispatch", null);
                }
                long start = clock.millis();
                ToolExecutionOutcome outcome;
                try {
                    outcome = toolExecutor.execute(context, toolCall);
                } catch (ExchangeCancelledException e) {
                    throw e;
                } catch (RuntimeException e) {
                    log.warn("[ToolLoop] Tool executor failed for {}: {}", toolCall.getName(), e.getMessage());
                    outcome = ToolExecutionOutcome.synthetic(toolCall, ToolFailureKind.EXECUTION_FAILED,
                            "Tool execution failed: " + e.getMessage());
                }
                toolExecutions++;
                historyWriter.appendToolResult(context, outcome);
                context.getToolTrace().add(traceEntry(toolCall, outcome, llmCalls, clock.millis() - start));
            }
        }
    }

    private LlmResponse callReasoning(AgentContext context, int completedCalls) {
        try {
            LlmResponse response = llmPort.chat(buildRequest(context)).get();
            if (response == null) {
                throw new ReasoningEngineUnavailableException("Reasoning engine returned no response", 1,
                        LlmErrorClassifier.MALFORMED_RESPONSE, null, null)
                        .withProgress(completedCalls, context.getToolTrace());
            }
            return response;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExchangeCancelledException("Interrupted while waiting for the reasoning engine", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof ReasoningEngineUnavailableException unavailable) {
                throw unavailable.withProgress(completedCalls, context.getToolTrace());
            }
            if (cause instanceof AgentException agentException) {
                throw agentException;
            }
            throw new ReasoningEngineUnavailableException("Reasoning engine call failed: " + cause.getMessage(), 1,
                    LlmErrorClassifier.classifyFromThrowable(cause), null, cause)
                    .withProgress(completedCalls, context.getToolTrace());
        }
    }

    private void skipPending(AgentContext context, List<Message.ToolCall> toolCalls, int iteration) {
        for (Message.ToolCall toolCall : toolCalls) {
            ToolExecutionOutcome skipped = ToolExecutionOutcome.synthetic(toolCall, ToolFailureKind.SKIPPED,
                    "Not executed: iteration budget exhausted");
            historyWriter.appendToolResult(context, skipped);
            context.getToolTrace().add(traceEntry(toolCall, skipped, iteration, 0));
        }
    }

    private ToolLoopTurnResult budgetExhausted(AgentContext context, LlmResponse last, int llmCalls,
            int toolExecutions, String reason) {
        log.warn("[ToolLoop] Session {} stopped: {}", context.getSessionId(), reason);
        if (settings.getOnBudgetExhausted() == AgentProperties.BudgetExhaustedMode.DEGRADED_REPLY) {
            context.setState(LoopState.DONE);
            String partial = last != null ? last.getContent() : null;
            String reply = partial != null && !partial.isBlank()
                    ? partial
                    : "I could not finish this request within the allowed number of steps (" + reason + ").";
            return new ToolLoopTurnResult(context, reply, llmCalls, toolExecutions, true, reason);
        }
        context.setState(LoopState.FAILED);
        throw new IterationBudgetExceededException(context.getSessionId(), llmCalls, context.getToolTrace(), reason);
    }

    private ToolTraceEntry traceEntry(Message.ToolCall toolCall, ToolExecutionOutcome outcome, int iteration,
            long durationMs) {
        return ToolTraceEntry.builder()
                .iteration(iteration)
                .toolCallId(toolCall.getId())
                .toolName(toolCall.getName())
                .arguments(toolCall.getArguments())
                .success(outcome.isSuccess())
                .output(outcome.isSuccess() ? outcome.messageContent() : null)
                .error(outcome.isSuccess() ? null : outcome.messageContent())
                .failureKind(outcome.failureKind())
                .durationMs(durationMs)
                .build();
    }

    private LlmRequest buildRequest(AgentContext context) {
        return LlmRequest.builder()
                .model(context.getEffectiveConfig().getModel())
                .temperature(context.getEffectiveConfig().getTemperature())
                .maxTokens(llmSettings.getMaxTokens())
                .systemPrompt(context.getSystemPrompt())
                .messages(List.copyOf(context.getMessages()))
                .tools(context.getAvailableTools())
                .sessionId(context.getSessionId())
                .build();
    }
}
