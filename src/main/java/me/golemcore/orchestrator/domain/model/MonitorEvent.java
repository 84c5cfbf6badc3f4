package me.golemcore.orchestrator.domain.model;

import lombok.Builder;

import java.time.Instant;
import java.util.Map;

/**
 * Structured observability event emitted during queueing and execution.
 */
@Builder
public record MonitorEvent(MonitorEventType type, Instant timestamp, String eventId, String conversationKey,
        Map<String, Object> payload) {
}
