package me.golemcore.agent.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.component.ToolComponent;
import me.golemcore.agent.domain.exception.DuplicateToolNameException;
import me.golemcore.agent.domain.exception.ExchangeCancelledException;
import me.golemcore.agent.domain.exception.InvalidToolArgumentsException;
import me.golemcore.agent.domain.exception.ToolExecutionException;
import me.golemcore.agent.domain.exception.UnknownToolException;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.domain.model.ToolRetryPolicy;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Name to tool map shared by all sessions.
 *
 * <p>
 * Registration happens at startup; lookups afterwards are lock-free. Every
 * invocation validates arguments against the tool's input schema before the
 * tool runs and bounds the wait with {@code agent.tools.timeout}. Tool faults
 * surface as {@link ToolExecutionException}, so one failing tool never takes
 * the caller down with it.
 */
@Service
@Slf4j
public class ToolRegistry {

    private final Map<String, ToolComponent> tools = new ConcurrentHashMap<>();
    private final Duration timeout;

    @Autowired
    public ToolRegistry(List<ToolComponent> toolComponents, AgentProperties properties) {
        this(properties.getTools().getTimeout());
        for (ToolComponent tool : toolComponents) {
            if (!tool.isEnabled()) {
                log.info("[Tools] Skipping disabled tool: {}", tool.getToolName());
                continue;
            }
            register(tool);
        }
        log.info("[Tools] Registered {} tools: {}", tools.size(), tools.keySet());
    }

    // Visible for testing
    ToolRegistry(Duration timeout) {
        this.timeout = timeout;
    }

    /**
     * @throws DuplicateToolNameException
     *             if a tool with the same name is already registered
     */
    public void register(ToolComponent tool) {
        String name = tool.getToolName();
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Tool name must not be blank");
        }
        if (tools.putIfAbsent(name, tool) != null) {
            throw new DuplicateToolNameException(name);
        }
        log.debug("[Tools] Registered tool: {}", name);
    }

    /**
     * Registers a synchronous capability under a new name.
     */
    public void register(String name, String description, Map<String, Object> inputSchema,
            Function<Map<String, Object>, ToolResult> capability) {
        ToolDefinition definition = ToolDefinition.builder()
                .name(name)
                .description(description)
                .inputSchema(inputSchema)
                .build();
        register(new FunctionToolComponent(definition, capability));
    }

    public boolean contains(String name) {
        return name != null && tools.containsKey(name);
    }

    /**
     * Descriptors for the given names, in the order given.
     *
     * @throws UnknownToolException
     *             for the first name that is not registered
     */
    public List<ToolDefinition> resolve(Collection<String> names) {
        List<ToolDefinition> definitions = new ArrayList<>(names.size());
        for (String name : names) {
            ToolComponent tool = name != null ? tools.get(name) : null;
            if (tool == null) {
                throw new UnknownToolException(name);
            }
            definitions.add(tool.getDefinition());
        }
        return definitions;
    }

    public List<ToolDefinition> list() {
        return tools.values().stream()
                .map(ToolComponent::getDefinition)
                .sorted(Comparator.comparing(ToolDefinition::getName))
                .toList();
    }

    public int size() {
        return tools.size();
    }

    public ToolResult invoke(String name, Map<String, Object> arguments) {
        ToolComponent tool = name != null ? tools.get(name) : null;
        if (tool == null) {
            throw new UnknownToolException(name);
        }

        List<String> violations = ToolArgumentValidator.validate(tool.getDefinition().getInputSchema(), arguments);
        if (!violations.isEmpty()) {
            throw new InvalidToolArgumentsException(name, violations);
        }

        CompletableFuture<ToolResult> future;
        try {
            future = tool.execute(arguments != null ? arguments : Map.of());
        } catch (RuntimeException e) {
            throw new ToolExecutionException(name, "Tool execution failed: " + safeCauseMessage(e), e, false);
        }

        try {
            ToolResult result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (result == null) {
                throw new ToolExecutionException(name, "Tool returned no result", null, false);
            }
            return result;
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ToolExecutionException(name,
                    "Tool timed out after " + timeout.toMillis() + " ms", e, true);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new ToolExecutionException(name, "Tool execution failed: " + safeCauseMessage(cause), cause,
                    cause instanceof TimeoutException);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ExchangeCancelledException("Interrupted while waiting for tool " + name, e);
        }
    }

    /**
     * Invokes the tool and retries transient failures according to the
     * policy. Validation and unknown-tool errors are never retried.
     */
    public ToolResult invoke(String name, Map<String, Object> arguments, ToolRetryPolicy policy) {
        ToolRetryPolicy effective = policy != null ? policy : ToolRetryPolicy.none();
        for (int attempt = 1;; attempt++) {
            try {
                return invoke(name, arguments);
            } catch (ToolExecutionException e) {
                if (!e.isTransientFailure() || attempt >= effective.maxAttempts()) {
                    throw e;
                }
                Duration delay = effective.delayBefore(attempt + 1);
                log.warn("[Tools] Tool '{}' failed transiently (attempt {}/{}), retrying in {}ms: {}",
                        name, attempt, effective.maxAttempts(), delay.toMillis(), e.getMessage());
                sleepForRetry(delay);
            }
        }
    }

    // Visible for testing
    void sleepForRetry(Duration delay) {
        if (delay.isZero()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExchangeCancelledException("Interrupted during tool retry backoff", e);
        }
    }

    static String safeCauseMessage(Throwable error) {
        if (error == null) {
            return "unknown";
        }
        Throwable cursor = error;
        Throwable cause = cursor.getCause();
        while (cause != null && cause != cursor) {
            cursor = cause;
            cause = cursor.getCause();
        }
        String message = cursor.getMessage();
        if (message == null || message.isBlank()) {
            message = cursor.getClass().getSimpleName();
        }
        return message;
    }

    private record FunctionToolComponent(ToolDefinition definition,
            Function<Map<String, Object>, ToolResult> capability) implements ToolComponent {

        @Override
        public ToolDefinition getDefinition() {
            return definition;
        }

        @Override
        public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
            try {
                return CompletableFuture.completedFuture(capability.apply(parameters));
            } catch (RuntimeException e) {
                return CompletableFuture.failedFuture(e);
            }
        }
    }
}
