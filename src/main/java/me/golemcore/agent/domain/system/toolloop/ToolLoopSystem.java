package me.golemcore.agent.domain.system.toolloop;

import me.golemcore.agent.domain.model.AgentContext;

public interface ToolLoopSystem {

    /**
     * Runs reasoning and tool dispatch until a final answer or the budget
     * runs out.
     *
     * @throws me.golemcore.agent.domain.exception.IterationBudgetExceededException
     *             when the budget runs out and degraded replies are off
     * @throws me.golemcore.agent.domain.exception.ReasoningEngineUnavailableException
     *             when the reasoning engine cannot be reached
     * @throws me.golemcore.agent.domain.exception.ExchangeCancelledException
     *             when the calling thread is interrupted
     */
    ToolLoopTurnResult processTurn(AgentContext context);
}
