package me.golemcore.agent.domain.system.toolloop;

import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.ToolFailureKind;
import me.golemcore.agent.domain.model.ToolResult;

/**
 * Result of one tool call as fed back to the reasoning engine. Synthetic
 * outcomes describe calls that never reached a tool.
 */
public record ToolExecutionOutcome(String toolCallId, String toolName, ToolResult toolResult,
        String messageContent, boolean synthetic) {

    public static ToolExecutionOutcome synthetic(Message.ToolCall toolCall, ToolFailureKind kind, String reason) {
        return new ToolExecutionOutcome(toolCall.getId(), toolCall.getName(), ToolResult.failure(kind, reason),
                "Error: " + reason, true);
    }

    public boolean isSuccess() {
        return toolResult != null && toolResult.isSuccess();
    }

    public ToolFailureKind failureKind() {
        if (toolResult == null || toolResult.isSuccess()) {
            return null;
        }
        return toolResult.getFailureKind() != null ? toolResult.getFailureKind() : ToolFailureKind.EXECUTION_FAILED;
    }
}
