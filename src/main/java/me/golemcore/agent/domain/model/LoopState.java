package me.golemcore.agent.domain.model;

/**
 * States of one exchange.
 *
 * <pre>
 * START -> CONTEXT_LOADED -> REASONING -> (TOOL_DISPATCH -> REASONING)* -> DONE | FAILED
 * </pre>
 */
public enum LoopState {
    START, CONTEXT_LOADED, REASONING, TOOL_DISPATCH, DONE, FAILED
}
