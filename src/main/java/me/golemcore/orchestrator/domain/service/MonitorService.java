package me.golemcore.orchestrator.domain.service;

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

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.model.Event;
import me.golemcore.orchestrator.domain.model.MonitorEvent;
import me.golemcore.orchestrator.domain.model.MonitorEventType;
import me.golemcore.orchestrator.port.outbound.MonitorPort;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Builds monitor events and fans them out to every {@link MonitorPort}.
 *
 * <p>
 * Publishing is fire-and-forget on a dedicated thread: callers never wait on a
 * sink, and sink failures are logged and dropped.
 */
@Service
@Slf4j
public class MonitorService {

    private final Clock clock;
    private final List<MonitorPort> sinks;
    private final ExecutorService publisher;

    @Autowired
    public MonitorService(Clock clock, List<MonitorPort> sinks) {
        this(clock, sinks, Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "monitor-publisher");
            t.setDaemon(true);
            return t;
        }));
    }

    MonitorService(Clock clock, List<MonitorPort> sinks, ExecutorService publisher) {
        this.clock = clock;
        this.sinks = sinks != null ? List.copyOf(sinks) : List.of();
        this.publisher = publisher;
    }

    public MonitorEvent emit(Event event, MonitorEventType type, Map<String, Object> payload) {
        MonitorEvent monitorEvent = MonitorEvent.builder()
                .type(type)
                .timestamp(Instant.now(clock))
                .eventId(event != null ? event.getId() : null)
                .conversationKey(event != null ? event.getConversationKey() : null)
                .payload(payload != null ? new LinkedHashMap<>(payload) : Map.of())
                .build();
        publish(monitorEvent);
        return monitorEvent;
    }

    public MonitorEvent emit(Event event, MonitorEventType type) {
        return emit(event, type, Map.of());
    }

    private void publish(MonitorEvent monitorEvent) {
        if (sinks.isEmpty()) {
            return;
        }
        try {
            publisher.execute(() -> deliver(monitorEvent));
        } catch (RejectedExecutionException e) {
            log.debug("[Monitor] Publisher stopped, dropping {} event", monitorEvent.type());
        }
    }

    private void deliver(MonitorEvent monitorEvent) {
        for (MonitorPort sink : sinks) {
            try {
                sink.publishEvent(monitorEvent);
            } catch (Exception e) { // NOSONAR - monitor sinks must never affect execution
                log.warn("[Monitor] Sink {} failed on {}: {}", sink.getClass().getSimpleName(),
                        monitorEvent.type(), e.getMessage());
            }
        }
    }

    @PreDestroy
    public void shutdown() {
        publisher.shutdown();
        try {
            if (!publisher.awaitTermination(2, TimeUnit.SECONDS)) {
                publisher.shutdownNow();
            }
        } catch (InterruptedException e) {
            publisher.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
