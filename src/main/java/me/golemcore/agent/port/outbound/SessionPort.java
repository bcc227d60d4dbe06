package me.golemcore.agent.port.outbound;

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

import me.golemcore.agent.domain.model.AgentSession;
import me.golemcore.agent.domain.model.ConfigUpdateResult;
import me.golemcore.agent.domain.model.SessionConfigUpdate;
import me.golemcore.agent.domain.model.SessionSnapshot;

import java.util.List;

/**
 * Port for the in-memory session store. Sessions expire after a period of
 * inactivity and are evicted lazily on access and by a periodic sweep.
 */
public interface SessionPort {

    /**
     * Returns the live session with this id, or creates one. A {@code null}
     * id gets a freshly generated identity; an expired or unknown id gets a
     * new empty session under the same identity.
     */
    AgentSession resolveOrCreate(String sessionId);

    /**
     * Merges the supplied fields into the session's configuration.
     *
     * @throws me.golemcore.agent.domain.exception.SessionNotFoundException
     *             if the session is unknown or expired
     * @throws me.golemcore.agent.domain.exception.UnknownToolException
     *             if a tool name is not registered
     */
    ConfigUpdateResult applyConfigUpdate(String sessionId, SessionConfigUpdate update);

    void touch(String sessionId);

    /**
     * Removes idle sessions that are not in the middle of an exchange.
     *
     * @return number of sessions removed
     */
    int evictExpired();

    SessionSnapshot getSnapshot(String sessionId);

    boolean delete(String sessionId);

    List<SessionSnapshot> listAll();

    int size();
}
