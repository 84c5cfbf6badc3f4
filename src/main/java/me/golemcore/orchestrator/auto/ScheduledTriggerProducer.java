package me.golemcore.orchestrator.auto;

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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.model.Event;
import me.golemcore.orchestrator.domain.service.EventQueueService;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties.TriggerProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Timer producer: submits a synthetic event for each configured trigger every
 * {@code interval-seconds}. Events go through the regular queue.
 */
@Component
@Slf4j
public class ScheduledTriggerProducer {

    static final String METADATA_TRIGGER_ID = "trigger.id";

    private final EventQueueService eventQueueService;
    private final OrchestratorProperties properties;
    private final Clock clock;

    private ScheduledExecutorService scheduler;
    private final List<ScheduledFuture<?>> tasks = new ArrayList<>();

    public ScheduledTriggerProducer(EventQueueService eventQueueService, OrchestratorProperties properties,
            Clock clock) {
        this.eventQueueService = eventQueueService;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        List<TriggerProperties> triggers = properties.getTriggers().stream()
                .filter(TriggerProperties::isEnabled)
                .toList();
        if (triggers.isEmpty()) {
            log.info("[Triggers] No scheduled triggers configured");
            return;
        }

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "trigger-scheduler");
            t.setDaemon(true);
            return t;
        });

        for (TriggerProperties trigger : triggers) {
            if (trigger.getId() == null || trigger.getId().isBlank() || trigger.getIntervalSeconds() <= 0) {
                log.warn("[Triggers] Skipping trigger with missing id or non-positive interval: {}", trigger);
                continue;
            }
            long interval = trigger.getIntervalSeconds();
            tasks.add(scheduler.scheduleAtFixedRate(() -> fire(trigger), interval, interval, TimeUnit.SECONDS));
            log.info("[Triggers] Scheduled {} -> {}/{} every {}s", trigger.getId(), trigger.getPluginId(),
                    trigger.getAction(), interval);
        }
    }

    /**
     * Submits one event for the trigger. Never throws so the schedule keeps
     * running.
     */
    Event fire(TriggerProperties trigger) {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put(METADATA_TRIGGER_ID, trigger.getId());
        Event event = Event.builder()
                .id(trigger.getId() + ":" + UUID.randomUUID())
                .pluginId(trigger.getPluginId())
                .action(trigger.getAction())
                .type(trigger.getType())
                .content(trigger.getContent() != null ? trigger.getContent() : "")
                .timestamp(clock.instant())
                .user(trigger.getUser())
                .platform(trigger.getPlatform())
                .metadata(metadata)
                .build();
        try {
            eventQueueService.submit(event);
            log.debug("[Triggers] {} fired event {}", trigger.getId(), event.getId());
        } catch (RuntimeException e) { // NOSONAR - a failing trigger must not cancel its schedule
            log.warn("[Triggers] {} failed to submit: {}", trigger.getId(), e.getMessage());
        }
        return event;
    }

    @PreDestroy
    public void shutdown() {
        for (ScheduledFuture<?> task : tasks) {
            task.cancel(false);
        }
        tasks.clear();
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }
}
