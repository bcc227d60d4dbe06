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

import java.time.Duration;
import java.util.List;

/**
 * The reasoning engine could not be reached within the retry envelope, or
 * rejected the request outright. Callers may retry after {@link #getRetryAfter()}.
 */
public class ReasoningEngineUnavailableException extends AgentException {

    private static final long serialVersionUID = 1L;

    private final int attempts;
    private final int iterations;
    private final transient List<ToolTraceEntry> trace;
    private final String reasonCode;
    private final transient Duration retryAfter;

    public ReasoningEngineUnavailableException(String message, int attempts, String reasonCode,
            Duration retryAfter, Throwable cause) {
        this(message, attempts, 0, List.of(), reasonCode, retryAfter, cause);
    }

    private ReasoningEngineUnavailableException(String message, int attempts, int iterations,
            List<ToolTraceEntry> trace, String reasonCode, Duration retryAfter, Throwable cause) {
        super(message, cause);
        this.attempts = attempts;
        this.iterations = iterations;
        this.trace = List.copyOf(trace);
        this.reasonCode = reasonCode;
        this.retryAfter = retryAfter;
    }

    /**
     * Copy carrying how far the exchange got before the engine failed.
     */
    public ReasoningEngineUnavailableException withProgress(int iterationCount, List<ToolTraceEntry> partialTrace) {
        ReasoningEngineUnavailableException copy = new ReasoningEngineUnavailableException(getMessage(), attempts,
                iterationCount, partialTrace, reasonCode, retryAfter, getCause());
        copy.setStackTrace(getStackTrace());
        return copy;
    }

    public int getAttempts() {
        return attempts;
    }

    public int getIterations() {
        return iterations;
    }

    public List<ToolTraceEntry> getTrace() {
        return trace;
    }

    public String getReasonCode() {
        return reasonCode;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }

    @Override
    public String getCode() {
        return "llm.unavailable";
    }
}
