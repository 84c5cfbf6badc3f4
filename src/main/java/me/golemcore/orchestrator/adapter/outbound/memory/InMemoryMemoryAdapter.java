package me.golemcore.orchestrator.adapter.outbound.memory;

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
import me.golemcore.orchestrator.domain.model.ConversationInteraction;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.MemoryPort;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local conversation memory. Keeps a bounded window of the most recent
 * interactions per user and platform; oldest entries are dropped first.
 */
@Component
@Slf4j
public class InMemoryMemoryAdapter implements MemoryPort {

    private static final String DEFAULT_PLATFORM = "default";

    private final OrchestratorProperties properties;
    private final Map<String, Deque<ConversationInteraction>> conversations = new ConcurrentHashMap<>();

    public InMemoryMemoryAdapter(OrchestratorProperties properties) {
        this.properties = properties;
    }

    @Override
    public void storeUserInteraction(String userId, String platform, String content, Instant timestamp,
            String messageId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be blank");
        }
        ConversationInteraction interaction = ConversationInteraction.builder()
                .userId(userId)
                .platform(normalizePlatform(platform))
                .content(content)
                .timestamp(timestamp != null ? timestamp : Instant.now())
                .messageId(messageId)
                .build();

        int maxEntries = Math.max(1, properties.getMemory().getMaxEntriesPerConversation());
        Deque<ConversationInteraction> history = conversations.computeIfAbsent(key(userId, platform),
                k -> new ArrayDeque<>());
        synchronized (history) {
            history.addLast(interaction);
            while (history.size() > maxEntries) {
                history.removeFirst();
            }
        }
        log.trace("[Memory] Stored interaction for {}:{}", interaction.platform(), userId);
    }

    @Override
    public List<ConversationInteraction> getRecentConversationHistory(String userId, String platform,
            Integer limit) {
        Deque<ConversationInteraction> history = conversations.get(key(userId, platform));
        if (history == null) {
            return List.of();
        }
        List<ConversationInteraction> snapshot;
        synchronized (history) {
            snapshot = new ArrayList<>(history);
        }
        if (limit != null && limit >= 0 && snapshot.size() > limit) {
            snapshot = snapshot.subList(snapshot.size() - limit, snapshot.size());
        }
        return List.copyOf(snapshot);
    }

    private static String key(String userId, String platform) {
        return normalizePlatform(platform) + ":" + userId;
    }

    private static String normalizePlatform(String platform) {
        return platform != null && !platform.isBlank() ? platform : DEFAULT_PLATFORM;
    }
}
