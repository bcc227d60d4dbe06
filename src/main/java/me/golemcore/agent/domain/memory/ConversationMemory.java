package me.golemcore.agent.domain.memory;

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

import me.golemcore.agent.domain.model.MemoryKind;
import me.golemcore.agent.domain.model.Message;

import java.util.List;

/**
 * Conversation state owned by a session. Writers are serialized by the
 * session lock; reads may happen concurrently and see a consistent copy.
 */
public interface ConversationMemory {

    MemoryKind getKind();

    /**
     * Appends the turns of one exchange as a unit. Truncation only ever
     * removes the oldest material and never the most recent user turn.
     */
    void append(List<Message> turns);

    /**
     * Messages to prepend to the next reasoning call.
     */
    List<Message> getContextView();

    /**
     * Raw turns currently retained, oldest first.
     */
    List<Message> getTurns();

    /**
     * Rolling summary, or {@code null} when this memory keeps none.
     */
    default String getSummary() {
        return null;
    }

    default int size() {
        return getTurns().size();
    }
}
