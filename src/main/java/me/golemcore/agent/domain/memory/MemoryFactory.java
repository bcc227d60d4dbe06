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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.model.MemoryKind;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Creates memory instances and converts a session's memory between kinds.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MemoryFactory {

    private final AgentProperties properties;
    private final ConversationSummarizer summarizer;

    public ConversationMemory create(MemoryKind kind) {
        return switch (kind) {
        case BUFFER -> new BufferMemory(properties.getMemory().getMaxTurns());
        case SUMMARY -> new SummaryMemory(properties.getMemory().getSummaryTailTurns(), summarizer);
        };
    }

    /**
     * Builds a memory of {@code target} kind from {@code current}. Buffer to
     * summary replays all turns so the overflow is summarized immediately.
     * Summary to buffer keeps only the retained tail: the summary is lost.
     */
    public Conversion convert(ConversationMemory current, MemoryKind target) {
        if (current.getKind() == target) {
            return new Conversion(current, false);
        }
        ConversationMemory next = create(target);
        List<Message> turns = current.getTurns();
        if (!turns.isEmpty()) {
            next.append(turns);
        }
        String summary = current.getSummary();
        boolean discarded = target == MemoryKind.BUFFER && summary != null && !summary.isBlank();
        log.debug("[Memory] Converted {} -> {} ({} turns, summary discarded: {})",
                current.getKind(), target, turns.size(), discarded);
        return new Conversion(next, discarded);
    }

    public record Conversion(ConversationMemory memory, boolean discardedSummary) {
    }
}
