package me.golemcore.agent.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of one exchange as returned to the caller. Never persisted.
 */
@Value
@Builder
public class ExchangeResult {

    String sessionId;
    String reply;
    LlmUsage usage;
    List<ToolTraceEntry> toolTrace;
    int iterations;
    boolean degraded;
    String stopReason;
}
