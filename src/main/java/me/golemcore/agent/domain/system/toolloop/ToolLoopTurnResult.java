package me.golemcore.agent.domain.system.toolloop;

import me.golemcore.agent.domain.model.AgentContext;

public record ToolLoopTurnResult(AgentContext context, String reply, int llmCalls, int toolExecutions,
        boolean degraded, String stopReason) {
}
