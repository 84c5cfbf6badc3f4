package me.golemcore.orchestrator.adapter.outbound.monitor;

import me.golemcore.orchestrator.domain.model.MonitorEvent;
import me.golemcore.orchestrator.domain.model.MonitorEventType;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;

class LoggingMonitorAdapterTest {

    @Test
    void shouldAcceptEventsWithAndWithoutPayload() {
        LoggingMonitorAdapter adapter = new LoggingMonitorAdapter();

        assertDoesNotThrow(() -> adapter.publishEvent(MonitorEvent.builder()
                .type(MonitorEventType.STEP_COMPLETED)
                .timestamp(Instant.EPOCH)
                .eventId("e1")
                .conversationKey("web:alice")
                .payload(Map.of("plugin", "conversation", "action", "respond"))
                .build()));
        assertDoesNotThrow(() -> adapter.publishEvent(MonitorEvent.builder()
                .type(MonitorEventType.RUN_STARTED)
                .timestamp(Instant.EPOCH)
                .build()));
    }
}
