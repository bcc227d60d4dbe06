package me.golemcore.agent.domain.system.toolloop;

import me.golemcore.agent.domain.exception.InvalidToolArgumentsException;
import me.golemcore.agent.domain.exception.ToolExecutionException;
import me.golemcore.agent.domain.exception.UnknownToolException;
import me.golemcore.agent.domain.model.AgentContext;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.ToolFailureKind;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.domain.service.ToolRegistry;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dispatches tool calls through the {@link ToolRegistry}, turning every
 * tool-level failure into an error observation for the reasoning engine.
 */
public class DefaultToolExecutor implements ToolExecutorPort {

    private static final Logger log = LoggerFactory.getLogger(DefaultToolExecutor.class);

    private final ToolRegistry toolRegistry;
    private final AgentProperties.ToolsProperties settings;

    public DefaultToolExecutor(ToolRegistry toolRegistry, AgentProperties.ToolsProperties settings) {
        this.toolRegistry = toolRegistry;
        this.settings = settings;
    }

    @Override
    public ToolExecutionOutcome execute(AgentContext context, Message.ToolCall toolCall) {
        String toolName = sanitizeToolName(toolCall.getName());

        if (!toolRegistry.contains(toolName)) {
            log.warn("[Tools] Unknown tool requested: {}", toolCall.getName());
            return ToolExecutionOutcome.synthetic(toolCall, ToolFailureKind.UNKNOWN_TOOL,
                    "Unknown tool: " + toolCall.getName() + ". Available tools: "
                            + String.join(", ", context.getEffectiveConfig().getTools()));
        }
        if (!context.isToolEnabled(toolName)) {
            log.warn("[Tools] Tool not enabled for session {}: {}", context.getSessionId(), toolName);
            return ToolExecutionOutcome.synthetic(toolCall, ToolFailureKind.NOT_ENABLED,
                    "Tool is not enabled for this conversation: " + toolName);
        }

        ToolResult result;
        try {
            result = toolRegistry.invoke(toolName, toolCall.getArguments(), settings.retryPolicyFor(toolName));
        } catch (InvalidToolArgumentsException e) {
            log.debug("[Tools] Invalid arguments for {}: {}", toolName, e.getViolations());
            return ToolExecutionOutcome.synthetic(toolCall, ToolFailureKind.INVALID_ARGUMENTS, e.getMessage());
        } catch (UnknownToolException e) {
            return ToolExecutionOutcome.synthetic(toolCall, ToolFailureKind.UNKNOWN_TOOL, e.getMessage());
        } catch (ToolExecutionException e) {
            log.warn("[Tools] Tool {} failed: {}", toolName, e.getMessage());
            return ToolExecutionOutcome.synthetic(toolCall, ToolFailureKind.EXECUTION_FAILED, e.getMessage());
        }

        if (!result.isSuccess() && result.getFailureKind() == null) {
            result.setFailureKind(ToolFailureKind.EXECUTION_FAILED);
        }
        String content = truncateToolResult(buildToolMessageContent(result), toolName);
        return new ToolExecutionOutcome(toolCall.getId(), toolCall.getName(), result, content, false);
    }

    /**
     * Strip special tokens some models leak into tool call names, such as
     * {@code <|channel|>}.
     */
    private String sanitizeToolName(String name) {
        if (name == null) {
            return null;
        }
        String sanitized = name.replaceAll("[^a-zA-Z0-9_-].*", "");
        if (!sanitized.equals(name)) {
            log.warn("[Tools] Sanitized tool name: '{}' -> '{}'", name, sanitized);
        }
        return sanitized;
    }

    private String buildToolMessageContent(ToolResult result) {
        if (result.isSuccess()) {
            return result.getOutput() != null ? result.getOutput() : "";
        }
        if (result.getOutput() != null && !result.getOutput().isBlank()) {
            return result.getOutput();
        }
        return "Error: " + result.getError();
    }

    String truncateToolResult(String content, String toolName) {
        int maxChars = settings.getMaxResultChars();
        if (content == null || maxChars <= 0 || content.length() <= maxChars) {
            return content;
        }
        String suffix = "\n\n[OUTPUT TRUNCATED: " + content.length() + " chars total, showing first "
                + maxChars + " chars.]";
        int cutPoint = Math.max(0, maxChars - suffix.length());
        log.debug("[Tools] Truncated {} result from {} to {} chars", toolName, content.length(), maxChars);
        return content.substring(0, cutPoint) + suffix;
    }
}
