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

/**
 * Condenses turns into a rolling summary.
 */
public interface ConversationSummarizer {

    /**
     * @param previousSummary
     *            summary so far, may be {@code null}
     * @param turns
     *            oldest turns to fold into the summary
     * @return the new summary, or {@code null} if condensation failed
     */
    String summarize(String previousSummary, List<Message> turns);
}
