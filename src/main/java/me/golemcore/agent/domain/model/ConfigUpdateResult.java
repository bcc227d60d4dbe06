package me.golemcore.agent.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Outcome of a configuration update: the effective configuration and any
 * data loss the update caused.
 */
@Value
@Builder
public class ConfigUpdateResult {

    String sessionId;
    SessionConfig config;

    /** True when switching from summary to buffer memory dropped a non-empty summary. */
    boolean discardedSummary;

    @Singular
    List<String> warnings;
}
