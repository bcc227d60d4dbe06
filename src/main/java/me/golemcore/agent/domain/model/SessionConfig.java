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
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Effective configuration of a session. Immutable: updates produce a new
 * instance that replaces the previous one on the session.
 */
@Value
@Builder(toBuilder = true)
public class SessionConfig {

    /** Model identifier passed to the reasoning engine; {@code null} uses the provider default. */
    String model;

    /** Sampling temperature in {@code [0, 1]}. */
    double temperature;

    /** Enabled tool names, ordered and without duplicates. */
    @Singular
    List<String> tools;

    MemoryKind memoryKind;
}
