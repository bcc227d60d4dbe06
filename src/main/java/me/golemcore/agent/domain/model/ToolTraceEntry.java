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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * One tool call made during an exchange, successful or not.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolTraceEntry {

    private int iteration;
    private String toolCallId;
    private String toolName;
    private Map<String, Object> arguments;
    private boolean success;
    private String output;
    private String error;
    private ToolFailureKind failureKind;
    private long durationMs;
}
