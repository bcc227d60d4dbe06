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

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps the raw turn sequence, optionally capped at {@code maxTurns} (oldest
 * dropped first). A cap of 0 keeps everything.
 */
public class BufferMemory implements ConversationMemory {

    private final int maxTurns;
    private final List<Message> turns = new ArrayList<>();

    public BufferMemory(int maxTurns) {
        if (maxTurns < 0) {
            throw new IllegalArgumentException("maxTurns must be >= 0");
        }
        this.maxTurns = maxTurns;
    }

    @Override
    public MemoryKind getKind() {
        return MemoryKind.BUFFER;
    }

    @Override
    public synchronized void append(List<Message> newTurns) {
        turns.addAll(newTurns);
        if (maxTurns > 0) {
            int removable = MemoryTurns.removableCount(turns, maxTurns);
            if (removable > 0) {
                turns.subList(0, removable).clear();
            }
        }
    }

    @Override
    public synchronized List<Message> getContextView() {
        return turns.stream().map(Message::withoutTrace).toList();
    }

    @Override
    public synchronized List<Message> getTurns() {
        return List.copyOf(turns);
    }

    public int getMaxTurns() {
        return maxTurns;
    }
}
