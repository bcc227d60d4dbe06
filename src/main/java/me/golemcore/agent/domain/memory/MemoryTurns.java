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

import me.golemcore.agent.domain.model.Message;

import java.util.List;

final class MemoryTurns {

    private MemoryTurns() {
    }

    static int lastUserIndex(List<Message> turns) {
        for (int i = turns.size() - 1; i >= 0; i--) {
            if (turns.get(i).isUserMessage()) {
                return i;
            }
        }
        return -1;
    }

    /**
     * How many of the oldest turns may go so that at most {@code keep} remain,
     * without touching the most recent user turn.
     */
    static int removableCount(List<Message> turns, int keep) {
        int excess = turns.size() - keep;
        if (excess <= 0) {
            return 0;
        }
        int lastUser = lastUserIndex(turns);
        return lastUser >= 0 ? Math.min(excess, lastUser) : excess;
    }
}
