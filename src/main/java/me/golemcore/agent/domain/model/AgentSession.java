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
import lombok.Getter;
import lombok.Setter;
import me.golemcore.agent.domain.memory.ConversationMemory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A live conversation: identity, configuration, owned memory and the lock
 * that serializes its exchanges. The memory's kind always matches
 * {@code config.memoryKind}; both are swapped together under the lock.
 */
@Getter
@Builder
public class AgentSession {

    private final String id;
    private final Instant createdAt;

    private volatile Instant lastInteraction;

    @Setter
    private volatile SessionConfig config;

    @Setter
    private volatile ConversationMemory memory;

    @Builder.Default
    private final ReentrantLock lock = new ReentrantLock(true);

    private volatile boolean evicted;

    /**
     * Advances the last interaction time. Never moves it backwards.
     */
    public synchronized void touch(Instant now) {
        if (lastInteraction == null || now.isAfter(lastInteraction)) {
            lastInteraction = now;
        }
    }

    public boolean isExpired(Instant now, Duration ttl) {
        Instant last = lastInteraction != null ? lastInteraction : createdAt;
        return Duration.between(last, now).compareTo(ttl) > 0;
    }

    /**
     * Marks the session as removed from the store. A request that resolved it
     * before the removal must resolve again.
     */
    public void markEvicted() {
        this.evicted = true;
    }

    public boolean isBusy() {
        return lock.isLocked();
    }
}
