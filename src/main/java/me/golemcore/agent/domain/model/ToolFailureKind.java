package me.golemcore.agent.domain.model;

/**
 * Why a tool call produced an error observation instead of a result.
 */
public enum ToolFailureKind {
    UNKNOWN_TOOL, NOT_ENABLED, INVALID_ARGUMENTS, EXECUTION_FAILED, SKIPPED
}
