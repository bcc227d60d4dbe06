package me.golemcore.agent.domain.exception;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.agent.domain.model.ToolTraceEntry;

import java.util.List;

/**
 * The loop used up its reasoning calls or its deadline without reaching a
 * final answer.
 */
public class IterationBudgetExceededException extends AgentException {

    private static final long serialVersionUID = 1L;

    private final String sessionId;
    private final int iterations;
    private final transient List<ToolTraceEntry> trace;
    private final String reason;

    public IterationBudgetExceededException(String sessionId, int iterations, List<ToolTraceEntry> trace,
            String reason) {
        super("Iteration budget exceeded after " + iterations + " reasoning calls: " + reason);
        this.sessionId = sessionId;
        this.iterations = iterations;
        this.trace = List.copyOf(trace);
        this.reason = reason;
    }

    public String getSessionId() {
        return sessionId;
    }

    public int getIterations() {
        return iterations;
    }

    public List<ToolTraceEntry> getTrace() {
        return trace;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String getCode() {
        return "loop.budget_exceeded";
    }
}
