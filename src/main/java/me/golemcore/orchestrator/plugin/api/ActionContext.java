package me.golemcore.orchestrator.plugin.api;

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

import me.golemcore.orchestrator.domain.model.ContextItem;
import me.golemcore.orchestrator.domain.model.ContextPayload;
import me.golemcore.orchestrator.domain.model.Event;
import me.golemcore.orchestrator.domain.model.PipelineStep;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * What an action handler sees: the originating event, the step being run and a
 * read-only view of the chain. New items are built here and returned through
 * {@link ActionResult}; only the executor appends.
 */
public final class ActionContext {

    private final Event event;
    private final PipelineStep step;
    private final List<ContextItem> items;
    private final Clock clock;

    public ActionContext(Event event, PipelineStep step, List<ContextItem> items, Clock clock) {
        this.event = event;
        this.step = step;
        this.items = items;
        this.clock = clock;
    }

    public Event getEvent() {
        return event;
    }

    public PipelineStep getStep() {
        return step;
    }

    public List<ContextItem> getItems() {
        return items;
    }

    public ContextItem seed() {
        return items.get(0);
    }

    public Optional<ContextItem> latest(String type) {
        for (int i = items.size() - 1; i >= 0; i--) {
            if (items.get(i).type().equals(type)) {
                return Optional.of(items.get(i));
            }
        }
        return Optional.empty();
    }

    /**
     * Builds an item attributed to the current step.
     */
    public ContextItem newItem(String type, String content, ContextPayload payload) {
        return ContextItem.builder()
                .id(ContextItem.newId())
                .pluginId(step.pluginId())
                .action(step.action())
                .type(type)
                .content(content)
                .createdAt(clock.instant())
                .payload(payload)
                .build();
    }
}
