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

import java.util.List;

/**
 * Tool arguments did not match the tool's input schema. Raised before the
 * tool runs.
 */
public class InvalidToolArgumentsException extends AgentException {

    private static final long serialVersionUID = 1L;

    private final String toolName;
    private final List<String> violations;

    public InvalidToolArgumentsException(String toolName, List<String> violations) {
        super("Invalid arguments for tool " + toolName + ": " + String.join("; ", violations));
        this.toolName = toolName;
        this.violations = List.copyOf(violations);
    }

    public String getToolName() {
        return toolName;
    }

    public List<String> getViolations() {
        return violations;
    }

    @Override
    public String getCode() {
        return "tool.invalid_arguments";
    }
}
