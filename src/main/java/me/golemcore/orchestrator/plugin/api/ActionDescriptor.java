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

import lombok.Builder;
import lombok.Singular;

import java.util.Set;

/**
 * Declared effects of a plugin action, rendered to the planning capability.
 *
 * @param name
 *            action name, unique within its plugin
 * @param description
 *            what the action does
 * @param reads
 *            context item types the action reads
 * @param appends
 *            context item types the action may append
 * @param exclusiveEffects
 *            effect tags that must not be combined with the same tag of an
 *            earlier step
 */
@Builder
public record ActionDescriptor(
        String name,
        String description,
        @Singular Set<String> reads,
        @Singular Set<String> appends,
        @Singular Set<String> exclusiveEffects
) {
}
