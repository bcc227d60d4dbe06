package me.golemcore.agent.domain.system.toolloop;

import me.golemcore.agent.domain.model.AgentContext;
import me.golemcore.agent.domain.model.LlmResponse;
import me.golemcore.agent.domain.model.Message;

import java.util.List;

/**
 * Appends the tool conversation of the current exchange to the context's
 * scratch messages.
 */
public interface HistoryWriter {

    void appendAssistantToolCalls(AgentContext context, LlmResponse llmResponse, List<Message.ToolCall> toolCalls);

    void appendToolResult(AgentContext context, ToolExecutionOutcome outcome);
}
