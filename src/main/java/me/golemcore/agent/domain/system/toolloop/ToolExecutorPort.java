package me.golemcore.agent.domain.system.toolloop;

import me.golemcore.agent.domain.model.AgentContext;
import me.golemcore.agent.domain.model.Message;

public interface ToolExecutorPort {

    /**
     * Runs one tool call. Tool-level failures come back as failed outcomes;
     * only cancellation is thrown.
     */
    ToolExecutionOutcome execute(AgentContext context, Message.ToolCall toolCall);
}
