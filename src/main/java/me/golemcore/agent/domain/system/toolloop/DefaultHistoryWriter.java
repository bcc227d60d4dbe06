package me.golemcore.agent.domain.system.toolloop;

import me.golemcore.agent.domain.model.AgentContext;
import me.golemcore.agent.domain.model.LlmResponse;
import me.golemcore.agent.domain.model.Message;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

public class DefaultHistoryWriter implements HistoryWriter {

    private final Clock clock;

    public DefaultHistoryWriter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void appendAssistantToolCalls(AgentContext context, LlmResponse llmResponse,
            List<Message.ToolCall> toolCalls) {
        context.getMessages().add(Message.builder()
                .id(UUID.randomUUID().toString())
                .role(Message.ROLE_ASSISTANT)
                .content(llmResponse != null ? llmResponse.getContent() : null)
                .toolCalls(toolCalls)
                .timestamp(clock.instant())
                .build());
    }

    @Override
    public void appendToolResult(AgentContext context, ToolExecutionOutcome outcome) {
        context.getMessages().add(Message.builder()
                .id(UUID.randomUUID().toString())
                .role(Message.ROLE_TOOL)
                .toolCallId(outcome.toolCallId())
                .toolName(outcome.toolName())
                .content(outcome.messageContent())
                .timestamp(clock.instant())
                .build());
    }
}
