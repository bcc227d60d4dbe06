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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.model.MemoryKind;
import me.golemcore.agent.domain.model.Message;

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps a rolling summary plus the last {@code tailTurns} raw turns. Turns
 * pushed out of the tail are folded into the summary by the summarizer. When
 * that fails they stay in the tail and folding is retried on the next append.
 */
@Slf4j
public class SummaryMemory implements ConversationMemory {

    static final String SUMMARY_PREFIX = "[Conversation summary]\n";

    private final int tailTurns;
    private final ConversationSummarizer summarizer;
    private final List<Message> tail = new ArrayList<>();
    private String summary;

    public SummaryMemory(int tailTurns, ConversationSummarizer summarizer) {
        if (tailTurns < 0) {
            throw new IllegalArgumentException("tailTurns must be >= 0");
        }
        this.tailTurns = tailTurns;
        this.summarizer = summarizer;
    }

    @Override
    public MemoryKind getKind() {
        return MemoryKind.SUMMARY;
    }

    @Override
    public void append(List<Message> newTurns) {
        List<Message> overflow;
        String previous;
        synchronized (this) {
            tail.addAll(newTurns);
            int removable = MemoryTurns.removableCount(tail, tailTurns);
            if (removable == 0) {
                return;
            }
            overflow = List.copyOf(tail.subList(0, removable));
            previous = summary;
        }

        // Summarizer calls the reasoning engine; do not block readers meanwhile.
        String condensed;
        try {
            condensed = summarizer.summarize(previous, overflow);
        } catch (RuntimeException e) {
            log.warn("[Memory] Summarization failed, keeping {} raw turns: {}", overflow.size(), e.getMessage());
            return;
        }
        if (condensed == null || condensed.isBlank()) {
            log.warn("[Memory] Summarization returned nothing, keeping {} raw turns", overflow.size());
            return;
        }

        synchronized (this) {
            summary = condensed;
            tail.subList(0, overflow.size()).clear();
        }
        log.debug("[Memory] Folded {} turns into summary ({} chars)", overflow.size(), condensed.length());
    }

    @Override
    public synchronized List<Message> getContextView() {
        List<Message> view = new ArrayList<>(tail.size() + 1);
        if (summary != null && !summary.isBlank()) {
            view.add(Message.system(SUMMARY_PREFIX + summary));
        }
        tail.forEach(turn -> view.add(turn.withoutTrace()));
        return view;
    }

    @Override
    public synchronized List<Message> getTurns() {
        return List.copyOf(tail);
    }

    @Override
    public synchronized String getSummary() {
        return summary;
    }

    public int getTailTurns() {
        return tailTurns;
    }
}
