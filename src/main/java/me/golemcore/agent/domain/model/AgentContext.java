package me.golemcore.agent.domain.model;

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

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Working state of one exchange while the session lock is held. The scratch
 * messages and trace are discarded unless the exchange commits.
 */
@Data
@Builder
public class AgentContext {

    private AgentSession session;

    /** Configuration after request overrides. */
    private SessionConfig effectiveConfig;

    private String systemPrompt;

    /** Memory context followed by the user turn and the scratch tool conversation. */
    @Builder.Default
    private List<Message> messages = new ArrayList<>();

    @Builder.Default
    private List<ToolDefinition> availableTools = new ArrayList<>();

    @Builder.Default
    private List<ToolTraceEntry> toolTrace = new ArrayList<>();

    @Builder.Default
    private LlmUsage usage = LlmUsage.empty();

    @Builder.Default
    private LoopState state = LoopState.START;

    private int currentIteration;

    public String getSessionId() {
        return session != null ? session.getId() : null;
    }

    public void addUsage(LlmUsage callUsage) {
        this.usage = this.usage.plus(callUsage);
    }

    public boolean isToolEnabled(String toolName) {
        return effectiveConfig != null && effectiveConfig.getTools().contains(toolName);
    }
}
