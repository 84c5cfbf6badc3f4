package me.golemcore.orchestrator.port.outbound;

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

import me.golemcore.orchestrator.domain.model.ConversationInteraction;

import java.time.Instant;
import java.util.List;

/**
 * Port for conversation memory. The orchestrator core only reads history to
 * seed planning; storing is up to plugins.
 */
public interface MemoryPort {

    void storeUserInteraction(String userId, String platform, String content, Instant timestamp, String messageId);

    /**
     * Returns the most recent interactions, oldest first.
     *
     * @param limit
     *            maximum number of interactions, or null for the provider default
     */
    List<ConversationInteraction> getRecentConversationHistory(String userId, String platform, Integer limit);
}
