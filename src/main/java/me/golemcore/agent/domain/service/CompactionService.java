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
import me.golemcore.agent.domain.memory.ConversationSummarizer;
import me.golemcore.agent.domain.model.LlmRequest;
import me.golemcore.agent.domain.model.LlmResponse;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.port.outbound.LlmPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * LLM-powered summarization backing summary memory. Folds the oldest turns
 * into the previous summary. Returns {@code null} on any failure so the memory
 * keeps the raw turns and tries again later.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CompactionService implements ConversationSummarizer {

    private static final int MAX_SUMMARY_TOKENS = 500;
    private static final int MAX_TURN_CHARS = 300;

    private static final String SYSTEM_PROMPT = """
            You maintain a running summary of a conversation between a user and an assistant.
            Merge the previous summary (if any) with the new turns into one updated summary.

            Include, when applicable:
            - facts the user shared about themselves, their preferences and constraints
            - questions asked and the answers given
            - decisions made and open questions

            Keep it factual. Write in the same language the conversation uses.
            Do NOT include greetings, apologies, or meta-commentary. Output only the summary.""";

    private final LlmPort llmPort;
    private final AgentProperties properties;
    private final Clock clock;

    @Override
    public String summarize(String previousSummary, List<Message> turns) {
        if (turns == null || turns.isEmpty()) {
            return previousSummary;
        }

        if (llmPort == null || !llmPort.isAvailable()) {
            log.warn("[Compaction] LLM not available, cannot summarize");
            return null;
        }

        StringBuilder prompt = new StringBuilder();
        if (previousSummary != null && !previousSummary.isBlank()) {
            prompt.append("Previous summary:\n").append(previousSummary).append("\n\n");
        }
        prompt.append("New turns:\n").append(formatConversation(turns));

        LlmRequest request = LlmRequest.builder()
                .model(properties.getLlm().getModel())
                .systemPrompt(SYSTEM_PROMPT)
                .messages(List.of(Message.builder()
                        .role(Message.ROLE_USER)
                        .content(prompt.toString())
                        .build()))
                .maxTokens(MAX_SUMMARY_TOKENS)
                .temperature(0.3)
                .build();

        long timeoutMs = properties.getMemory().getSummaryTimeout().toMillis();
        try {
            long start = clock.millis();
            LlmResponse response = llmPort.chat(request).get(timeoutMs, TimeUnit.MILLISECONDS);
            long elapsed = clock.millis() - start;

            String summary = response != null ? response.getContent() : null;
            if (summary == null || summary.isBlank()) {
                log.warn("[Compaction] LLM returned empty summary");
                return null;
            }
            log.info("[Compaction] Summarized {} turns in {}ms ({} chars)", turns.size(), elapsed, summary.length());
            return summary.trim();

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Compaction] LLM summarization interrupted: {}", e.getMessage());
            return null;
        } catch (ExecutionException | TimeoutException e) {
            log.warn("[Compaction] LLM summarization failed: {}", e.getMessage());
            return null;
        }
    }

    private String formatConversation(List<Message> messages) {
        return messages.stream()
                .filter(m -> m.getContent() != null && !m.getContent().isBlank())
                .map(m -> m.getRole() + ": " + truncate(m.getContent(), MAX_TURN_CHARS))
                .collect(Collectors.joining("\n"));
    }

    private String truncate(String text, int maxLen) {
        if (text.length() <= maxLen) {
            return text;
        }
        return text.substring(0, maxLen) + "...";
    }
}
