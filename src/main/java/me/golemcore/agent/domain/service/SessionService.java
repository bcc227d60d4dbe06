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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.exception.ExchangeCancelledException;
import me.golemcore.agent.domain.exception.SessionNotFoundException;
import me.golemcore.agent.domain.memory.ConversationMemory;
import me.golemcore.agent.domain.memory.MemoryFactory;
import me.golemcore.agent.domain.model.AgentSession;
import me.golemcore.agent.domain.model.ConfigUpdateResult;
import me.golemcore.agent.domain.model.MemoryKind;
import me.golemcore.agent.domain.model.SessionConfig;
import me.golemcore.agent.domain.model.SessionConfigUpdate;
import me.golemcore.agent.domain.model.SessionSnapshot;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.port.outbound.SessionPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * In-memory session store with idle expiry.
 *
 * <p>
 * Sessions are keyed by id in a {@link ConcurrentHashMap}; creation and
 * expiry replacement for one id are atomic, while different ids never block
 * each other. A session is expired once it has been idle longer than
 * {@code agent.session.ttl}, unless an exchange currently holds its lock.
 * Expired sessions are dropped lazily when accessed and by a background sweep.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionService implements SessionPort {

    private final AgentProperties properties;
    private final ToolRegistry toolRegistry;
    private final MemoryFactory memoryFactory;
    private final Clock clock;

    private final Map<String, AgentSession> sessions = new ConcurrentHashMap<>();
    private ScheduledExecutorService sweepExecutor;

    @PostConstruct
    public void startSweep() {
        long intervalMs = properties.getSession().getSweepInterval().toMillis();
        if (intervalMs <= 0) {
            log.info("[Session] Expiry sweep disabled");
            return;
        }
        sweepExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "session-expiry-sweep");
            t.setDaemon(true);
            return t;
        });
        sweepExecutor.scheduleAtFixedRate(this::sweep, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("[Session] Expiry sweep every {}ms, ttl {}", intervalMs, ttl());
    }

    @PreDestroy
    public void stopSweep() {
        if (sweepExecutor != null) {
            sweepExecutor.shutdownNow();
        }
    }

    private void sweep() {
        try {
            int evicted = evictExpired();
            if (evicted > 0) {
                log.info("[Session] Evicted {} expired sessions, {} live", evicted, sessions.size());
            }
        } catch (RuntimeException e) {
            // keep the schedule alive
            log.error("[Session] Expiry sweep failed", e);
        }
    }

    @Override
    public AgentSession resolveOrCreate(String sessionId) {
        String id = sessionId == null || sessionId.isBlank() ? UUID.randomUUID().toString() : sessionId;
        Instant now = clock.instant();
        return sessions.compute(id, (key, existing) -> {
            if (existing == null) {
                return newSession(key, now);
            }
            if (!existing.isExpired(now, ttl())) {
                return existing;
            }
            // an exchange holding the lock keeps the session alive
            if (!existing.getLock().tryLock()) {
                return existing;
            }
            try {
                existing.markEvicted();
            } finally {
                existing.getLock().unlock();
            }
            log.info("[Session] Session {} expired, starting a fresh one", key);
            return newSession(key, now);
        });
    }

    @Override
    public ConfigUpdateResult applyConfigUpdate(String sessionId, SessionConfigUpdate update) {
        AgentSession session = requireLive(sessionId);
        if (update == null || update.isEmpty()) {
            return ConfigUpdateResult.builder()
                    .sessionId(sessionId)
                    .config(session.getConfig())
                    .build();
        }
        validate(update);

        try {
            session.getLock().lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExchangeCancelledException("Interrupted while waiting for session " + sessionId, e);
        }
        try {
            if (session.isEvicted()) {
                throw new SessionNotFoundException(sessionId);
            }
            SessionConfig current = session.getConfig();
            SessionConfig.SessionConfigBuilder next = current.toBuilder();
            if (update.getModel() != null) {
                next.model(update.getModel());
            }
            if (update.getTemperature() != null) {
                next.temperature(update.getTemperature());
            }
            if (update.getTools() != null) {
                next.clearTools().tools(new LinkedHashSet<>(update.getTools()));
            }

            ConfigUpdateResult.ConfigUpdateResultBuilder result = ConfigUpdateResult.builder().sessionId(sessionId);
            MemoryKind targetKind = update.getMemoryKind();
            if (targetKind != null && targetKind != current.getMemoryKind()) {
                MemoryFactory.Conversion conversion = memoryFactory.convert(session.getMemory(), targetKind);
                session.setMemory(conversion.memory());
                next.memoryKind(targetKind);
                if (conversion.discardedSummary()) {
                    result.discardedSummary(true)
                            .warning("Switching to buffer memory discarded the conversation summary; "
                                    + "only the " + conversion.memory().size() + " most recent turns were kept");
                }
                log.info("[Session] Session {} memory {} -> {}", sessionId, current.getMemoryKind(), targetKind);
            }

            SessionConfig effective = next.build();
            session.setConfig(effective);
            session.touch(clock.instant());
            log.debug("[Session] Session {} config updated: {}", sessionId, effective);
            return result.config(effective).build();
        } finally {
            session.getLock().unlock();
        }
    }

    @Override
    public void touch(String sessionId) {
        AgentSession session = sessions.get(sessionId);
        if (session != null) {
            session.touch(clock.instant());
        }
    }

    @Override
    public int evictExpired() {
        Instant now = clock.instant();
        int evicted = 0;
        for (AgentSession session : sessions.values()) {
            if (evictIfIdle(session, now)) {
                evicted++;
            }
        }
        return evicted;
    }

    @Override
    public SessionSnapshot getSnapshot(String sessionId) {
        AgentSession session = requireLive(sessionId);
        ConversationMemory memory = session.getMemory();
        return SessionSnapshot.builder()
                .sessionId(session.getId())
                .createdAt(session.getCreatedAt())
                .lastInteraction(session.getLastInteraction())
                .config(session.getConfig())
                .history(memory.getTurns())
                .summary(memory.getSummary())
                .build();
    }

    @Override
    public boolean delete(String sessionId) {
        AgentSession removed = sessions.remove(sessionId);
        if (removed == null) {
            return false;
        }
        removed.markEvicted();
        log.info("[Session] Deleted session: {}", sessionId);
        return true;
    }

    @Override
    public List<SessionSnapshot> listAll() {
        Instant now = clock.instant();
        List<SessionSnapshot> result = new ArrayList<>();
        for (AgentSession session : sessions.values()) {
            if (isExpired(session, now)) {
                continue;
            }
            result.add(SessionSnapshot.builder()
                    .sessionId(session.getId())
                    .createdAt(session.getCreatedAt())
                    .lastInteraction(session.getLastInteraction())
                    .config(session.getConfig())
                    .history(session.getMemory().getTurns())
                    .summary(session.getMemory().getSummary())
                    .build());
        }
        result.sort(Comparator.comparing(SessionSnapshot::getLastInteraction).reversed());
        return result;
    }

    @Override
    public int size() {
        return sessions.size();
    }

    /**
     * Configuration given to sessions created from now on.
     */
    public SessionConfig defaultConfig() {
        List<String> tools = new ArrayList<>();
        for (String name : properties.getTools().getEnabled()) {
            if (toolRegistry.contains(name)) {
                tools.add(name);
            } else {
                log.warn("[Session] Default tool '{}' is not registered, skipping", name);
            }
        }
        return SessionConfig.builder()
                .model(properties.getLlm().getModel())
                .temperature(properties.getLlm().getTemperature())
                .tools(new LinkedHashSet<>(tools))
                .memoryKind(properties.getMemory().getKind())
                .build();
    }

    private AgentSession newSession(String id, Instant now) {
        SessionConfig config = defaultConfig();
        AgentSession session = AgentSession.builder()
                .id(id)
                .createdAt(now)
                .lastInteraction(now)
                .config(config)
                .memory(memoryFactory.create(config.getMemoryKind()))
                .build();
        log.info("[Session] Created new session: {}", id);
        return session;
    }

    private AgentSession requireLive(String sessionId) {
        AgentSession session = sessionId != null ? sessions.get(sessionId) : null;
        if (session == null) {
            throw new SessionNotFoundException(sessionId);
        }
        Instant now = clock.instant();
        if (isExpired(session, now)) {
            evictIfIdle(session, now);
            throw new SessionNotFoundException(sessionId);
        }
        return session;
    }

    private boolean evictIfIdle(AgentSession session, Instant now) {
        if (!session.isExpired(now, ttl())) {
            return false;
        }
        if (!session.getLock().tryLock()) {
            return false;
        }
        try {
            if (session.isExpired(now, ttl()) && sessions.remove(session.getId(), session)) {
                session.markEvicted();
                log.debug("[Session] Evicted idle session: {}", session.getId());
                return true;
            }
            return false;
        } finally {
            session.getLock().unlock();
        }
    }

    private boolean isExpired(AgentSession session, Instant now) {
        return !session.isBusy() && session.isExpired(now, ttl());
    }

    private Duration ttl() {
        return properties.getSession().getTtl();
    }

    private void validate(SessionConfigUpdate update) {
        if (update.getTemperature() != null) {
            double temperature = update.getTemperature();
            if (Double.isNaN(temperature) || temperature < 0.0 || temperature > 1.0) {
                throw new IllegalArgumentException("temperature must be within [0, 1]");
            }
        }
        if (update.getModel() != null && update.getModel().isBlank()) {
            throw new IllegalArgumentException("model must not be blank");
        }
        if (update.getTools() != null) {
            toolRegistry.resolve(update.getTools());
        }
    }
}
