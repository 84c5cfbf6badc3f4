package me.golemcore.orchestrator.domain.model;

import lombok.Builder;

import java.time.Instant;

/**
 * One stored exchange in a user's conversation history.
 */
@Builder
public record ConversationInteraction(String userId, String platform, String content, Instant timestamp,
        String messageId) {
}
