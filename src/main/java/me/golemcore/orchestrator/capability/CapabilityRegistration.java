package me.golemcore.orchestrator.capability;

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

import java.util.Objects;
import java.util.Set;

/**
 * Capability declaration: identifier, alias identifiers and the handler they
 * all resolve to.
 *
 * @param id
 *            canonical capability identifier
 * @param aliases
 *            alternative identifiers resolving to the same handler
 * @param handler
 *            provider implementation
 */
public record CapabilityRegistration(String id, Set<String> aliases, CapabilityHandler handler) {

    public CapabilityRegistration {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(handler, "handler");
        aliases = aliases != null ? Set.copyOf(aliases) : Set.of();
    }

    public static CapabilityRegistration of(String id, CapabilityHandler handler, String... aliases) {
        return new CapabilityRegistration(id, Set.of(aliases), handler);
    }
}
