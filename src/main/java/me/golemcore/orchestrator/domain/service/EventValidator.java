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

import me.golemcore.orchestrator.domain.exception.InvalidEventException;
import me.golemcore.orchestrator.domain.model.Event;

import java.util.ArrayList;
import java.util.List;

/**
 * Required-field validation applied before an event is queued.
 */
public final class EventValidator {

    private EventValidator() {
    }

    public static void validate(Event event) {
        if (event == null) {
            throw new InvalidEventException("Event must not be null");
        }
        List<String> missing = new ArrayList<>();
        requireText(event.getId(), "id", missing);
        requireText(event.getPluginId(), "pluginId", missing);
        requireText(event.getAction(), "action", missing);
        requireText(event.getType(), "type", missing);
        if (event.getContent() == null) {
            missing.add("content");
        }
        if (event.getTimestamp() == null) {
            missing.add("timestamp");
        }
        if (!missing.isEmpty()) {
            throw new InvalidEventException("Event is missing required field(s): " + String.join(", ", missing));
        }
    }

    private static void requireText(String value, String field, List<String> missing) {
        if (value == null || value.isBlank()) {
            missing.add(field);
        }
    }
}
