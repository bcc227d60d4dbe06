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

/**
 * A tool failed while running. Transient failures (timeouts) may be retried
 * by a tool retry policy.
 */
public class ToolExecutionException extends AgentException {

    private static final long serialVersionUID = 1L;

    private final String toolName;
    private final boolean transientFailure;

    public ToolExecutionException(String toolName, String message, Throwable cause, boolean transientFailure) {
        super(message, cause);
        this.toolName = toolName;
        this.transientFailure = transientFailure;
    }

    public String getToolName() {
        return toolName;
    }

    public boolean isTransientFailure() {
        return transientFailure;
    }

    @Override
    public String getCode() {
        return "tool.execution_failed";
    }
}
