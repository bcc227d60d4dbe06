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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.exception.ExchangeCancelledException;
import me.golemcore.agent.domain.model.AgentContext;
import me.golemcore.agent.domain.model.AgentSession;
import me.golemcore.agent.domain.model.ExchangeRequest;
import me.golemcore.agent.domain.model.ExchangeResult;
import me.golemcore.agent.domain.model.LoopState;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.SessionConfig;
import me.golemcore.agent.domain.model.SessionConfigUpdate;
import me.golemcore.agent.domain.system.toolloop.ToolLoopSystem;
import me.golemcore.agent.domain.system.toolloop.ToolLoopTurnResult;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.port.outbound.SessionPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Runs one exchange: resolves the session, applies request overrides, holds
 * the session lock while the tool loop runs, then commits the user turn and
 * the assistant reply to memory and refreshes the session's expiry.
 *
 * <p>
 * Exchanges on the same session run one at a time in arrival order. Nothing
 * is written to memory unless the loop produced a reply; a failed or
 * cancelled exchange leaves the session exactly as it was.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExchangeService {

    private final SessionPort sessionPort;
    private final ToolRegistry toolRegistry;
    private final ToolLoopSystem toolLoopSystem;
    private final AgentProperties properties;
    private final Clock clock;

    public ExchangeResult exchange(ExchangeRequest request) {
        validate(request);

        // START
        AgentSession session = lock(sessionPort.resolveOrCreate(request.getSessionId()));

        try {
            AgentContext context = loadContext(session, request);
            log.debug("[Exchange] Session {}: {} context messages, {} tools", session.getId(),
                    context.getMessages().size(), context.getAvailableTools().size());
            Message userTurn = Message.user(request.getMessage(), clock.instant());
            context.getMessages().add(userTurn);

            ToolLoopTurnResult result = toolLoopSystem.processTurn(context);

            if (Thread.currentThread().isInterrupted()) {
                throw new ExchangeCancelledException("Exchange cancelled before commit", null);
            }
            commit(session, request, userTurn, result);

            return ExchangeResult.builder()
                    .sessionId(session.getId())
                    .reply(result.reply())
                    .usage(context.getUsage())
                    .toolTrace(List.copyOf(context.getToolTrace()))
                    .iterations(result.llmCalls())
                    .degraded(result.degraded())
                    .stopReason(result.stopReason())
                    .build();
        } finally {
            session.getLock().unlock();
        }
    }

    /**
     * Acquires the session lock, re-resolving if the session was evicted
     * while this request waited for it.
     */
    private AgentSession lock(AgentSession resolved) {
        AgentSession session = resolved;
        while (true) {
            try {
                session.getLock().lockInterruptibly();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ExchangeCancelledException("Interrupted while waiting for session " + session.getId(), e);
            }
            if (!session.isEvicted()) {
                return session;
            }
            session.getLock().unlock();
            log.debug("[Exchange] Session {} evicted while waiting, resolving again", session.getId());
            session = sessionPort.resolveOrCreate(session.getId());
        }
    }

    private AgentContext loadContext(AgentSession session, ExchangeRequest request) {
        SessionConfig effective = effectiveConfig(session.getConfig(), request);
        AgentContext context = AgentContext.builder()
                .session(session)
                .effectiveConfig(effective)
                .systemPrompt(properties.getLlm().getSystemPrompt())
                .messages(new ArrayList<>(session.getMemory().getContextView()))
                .availableTools(new ArrayList<>(toolRegistry.resolve(effective.getTools())))
                .build();
        context.setState(LoopState.CONTEXT_LOADED);
        return context;
    }

    private SessionConfig effectiveConfig(SessionConfig base, ExchangeRequest request) {
        if (!request.hasOverrides()) {
            return base;
        }
        SessionConfig.SessionConfigBuilder builder = base.toBuilder();
        if (request.getModel() != null) {
            builder.model(request.getModel());
        }
        if (request.getTemperature() != null) {
            builder.temperature(request.getTemperature());
        }
        if (request.getTools() != null) {
            builder.clearTools().tools(new LinkedHashSet<>(request.getTools()));
        }
        return builder.build();
    }

    private void commit(AgentSession session, ExchangeRequest request, Message userTurn, ToolLoopTurnResult result) {
        if (request.isPersist() && request.hasOverrides()) {
            // reentrant: this thread already holds the session lock
            sessionPort.applyConfigUpdate(session.getId(), SessionConfigUpdate.builder()
                    .model(request.getModel())
                    .temperature(request.getTemperature())
                    .tools(request.getTools())
                    .build());
        }
        Instant now = clock.instant();
        Message assistantTurn = Message.builder()
                .role(Message.ROLE_ASSISTANT)
                .content(result.reply())
                .toolTrace(List.copyOf(result.context().getToolTrace()))
                .timestamp(now)
                .build();
        session.getMemory().append(List.of(userTurn, assistantTurn));
        sessionPort.touch(session.getId());
        log.info("[Exchange] Session {}: exchange committed ({} reasoning calls, {} tool calls{})",
                session.getId(), result.llmCalls(), result.toolExecutions(), result.degraded() ? ", degraded" : "");
    }

    private void validate(ExchangeRequest request) {
        if (request == null || request.getMessage() == null || request.getMessage().isBlank()) {
            throw new IllegalArgumentException("message must not be blank");
        }
        if (request.getTemperature() != null) {
            double temperature = request.getTemperature();
            if (Double.isNaN(temperature) || temperature < 0.0 || temperature > 1.0) {
                throw new IllegalArgumentException("temperature must be within [0, 1]");
            }
        }
        if (request.getModel() != null && request.getModel().isBlank()) {
            throw new IllegalArgumentException("model must not be blank");
        }
        if (request.getTools() != null) {
            toolRegistry.resolve(request.getTools());
        }
    }
}
