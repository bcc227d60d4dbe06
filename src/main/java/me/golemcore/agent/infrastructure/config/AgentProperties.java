package me.golemcore.agent.infrastructure.config;

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

import lombok.Data;
import me.golemcore.agent.domain.model.MemoryKind;
import me.golemcore.agent.domain.model.ToolRetryPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties for the agent, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code agent.*} prefix:
 * <ul>
 * <li>{@link LlmProperties} - reasoning engine provider settings</li>
 * <li>{@link ReasoningProperties} - retry envelope around reasoning calls</li>
 * <li>{@link MemoryProperties} - default memory strategy</li>
 * <li>{@link SessionProperties} - session TTL and eviction sweep</li>
 * <li>{@link LoopProperties} - iteration budget of an exchange</li>
 * <li>{@link ToolsProperties} - default tools, timeouts and retry policies</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "agent")
@Data
public class AgentProperties {

    private LlmProperties llm = new LlmProperties();
    private ReasoningProperties reasoning = new ReasoningProperties();
    private MemoryProperties memory = new MemoryProperties();
    private SessionProperties session = new SessionProperties();
    private LoopProperties loop = new LoopProperties();
    private ToolsProperties tools = new ToolsProperties();

    @Data
    public static class LlmProperties {
        /** Adapter id: {@code langchain4j} or {@code none}. */
        private String provider = "langchain4j";

        /** Backend for the langchain4j adapter: {@code openai} or {@code anthropic}. */
        private String modelProvider = "openai";

        private String apiKey;
        private String baseUrl;
        private String model = "gpt-4o-mini";
        private double temperature = 0.7;
        private int maxTokens = 4096;
        private Duration timeout = Duration.ofSeconds(60);
        private String systemPrompt = "You are a helpful assistant. Use the available tools when they help answer the user.";
    }

    @Data
    public static class ReasoningProperties {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofSeconds(1);
        private double backoffMultiplier = 2.0;
        private Duration maxBackoff = Duration.ofSeconds(30);

        /** Upper bound for a single reasoning call, retries excluded. */
        private Duration callTimeout = Duration.ofSeconds(90);
    }

    @Data
    public static class MemoryProperties {
        private MemoryKind kind = MemoryKind.BUFFER;

        /** Maximum turns kept by buffer memory; 0 keeps everything. */
        private int maxTurns = 0;

        /** Raw turns kept after the rolling summary. */
        private int summaryTailTurns = 6;

        private Duration summaryTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class SessionProperties {
        private Duration ttl = Duration.ofMinutes(30);
        private Duration sweepInterval = Duration.ofMinutes(1);
    }

    public enum BudgetExhaustedMode {
        FAIL, DEGRADED_REPLY
    }

    @Data
    public static class LoopProperties {
        /** Reasoning calls allowed per exchange. */
        private int maxIterations = 8;
        private Duration deadline = Duration.ofMinutes(5);
        private BudgetExhaustedMode onBudgetExhausted = BudgetExhaustedMode.FAIL;
        private int exchangeThreads = 16;
    }

    @Data
    public static class ToolsProperties {
        /** Tools enabled for new sessions. */
        private List<String> enabled = new ArrayList<>(List.of("calculate_date", "datetime"));
        private Duration timeout = Duration.ofSeconds(30);
        private int maxResultChars = 20_000;
        private Map<String, RetryProperties> retry = new HashMap<>();

        public ToolRetryPolicy retryPolicyFor(String toolName) {
            RetryProperties props = retry.get(toolName);
            if (props == null) {
                return ToolRetryPolicy.none();
            }
            return new ToolRetryPolicy(props.getMaxAttempts(), props.getInitialDelay(), props.getMultiplier());
        }
    }

    @Data
    public static class RetryProperties {
        private int maxAttempts = 1;
        private Duration initialDelay = Duration.ofMillis(500);
        private double multiplier = 2.0;
    }
}
