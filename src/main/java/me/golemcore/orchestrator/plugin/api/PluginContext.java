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

import java.util.Map;

/**
 * Host-provided context handed to plugin init hooks.
 */
public interface PluginContext {

    /**
     * Resolve required host service/bean by type.
     */
    <T> T requireService(Class<T> type);

    /**
     * Read-only plugin configuration section ({@code orchestrator.plugins.<id>}).
     */
    Map<String, Object> pluginConfig(String pluginId);

    /**
     * Register an additional capability with the router. Only valid during
     * initialization.
     */
    void registerCapability(CapabilityRegistration registration);
}
