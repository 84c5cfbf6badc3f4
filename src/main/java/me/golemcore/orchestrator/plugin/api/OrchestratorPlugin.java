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

import me.golemcore.orchestrator.capability.CapabilityRegistration;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Unit of pluggable behavior: a set of named actions plus optional capability
 * declarations.
 *
 * <p>
 * Lifecycle: all plugins are registered first, then {@link #init} runs for each
 * in registration order, so an init hook sees every plugin and every declared
 * capability.
 */
public interface OrchestratorPlugin {

    PluginDescriptor descriptor();

    /**
     * Actions keyed by name, in declaration order.
     */
    Map<String, PluginAction> actions();

    /**
     * Capabilities this plugin provides to the router.
     */
    default List<CapabilityRegistration> capabilities() {
        return List.of();
    }

    /**
     * Capability ids or aliases this plugin calls.
     */
    default Set<String> requiredCapabilities() {
        return Set.of();
    }

    /**
     * Invoked once after every plugin has been registered.
     */
    default void init(PluginContext context) {
    }
}
