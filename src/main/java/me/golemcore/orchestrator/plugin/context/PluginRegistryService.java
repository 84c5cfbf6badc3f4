package me.golemcore.orchestrator.plugin.context;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.capability.CapabilityRegistration;
import me.golemcore.orchestrator.domain.exception.DuplicateRegistrationException;
import me.golemcore.orchestrator.domain.exception.UnknownStepException;
import me.golemcore.orchestrator.domain.model.PipelineStep;
import me.golemcore.orchestrator.plugin.api.OrchestratorPlugin;
import me.golemcore.orchestrator.plugin.api.PluginAction;
import me.golemcore.orchestrator.plugin.api.PluginContext;
import me.golemcore.orchestrator.plugin.api.PluginDescriptor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runtime plugin registry with strict step lookup.
 *
 * <p>
 * Mutable only until {@link #freeze()}; afterwards the tables are immutable and
 * read concurrently by every executor run without locking.
 */
@Component
@Slf4j
public class PluginRegistryService {

    private final Map<String, OrchestratorPlugin> registering = new LinkedHashMap<>();

    private volatile boolean frozen;
    private volatile Map<String, OrchestratorPlugin> pluginsById = Map.of();

    public synchronized void register(OrchestratorPlugin plugin) {
        if (frozen) {
            throw new IllegalStateException("Plugin registry is frozen; cannot register "
                    + plugin.descriptor().id());
        }
        String pluginId = plugin.descriptor().id();
        if (pluginId == null || pluginId.isBlank()) {
            throw new IllegalArgumentException("Plugin id must not be blank");
        }
        if (registering.containsKey(pluginId)) {
            throw new DuplicateRegistrationException("Duplicate plugin id: " + pluginId);
        }
        registering.put(pluginId, plugin);
        pluginsById = Collections.unmodifiableMap(new LinkedHashMap<>(registering));

        log.debug("[Plugins] Registered {} with actions {}", pluginId, plugin.actions().keySet());
    }

    /**
     * Second initialization phase: runs every init hook in registration order.
     */
    public void initializePlugins(PluginContext context) {
        for (OrchestratorPlugin plugin : pluginsById.values()) {
            log.debug("[Plugins] Initializing {}", plugin.descriptor().id());
            plugin.init(context);
        }
    }

    public synchronized void freeze() {
        frozen = true;
        log.info("[Plugins] Loaded {} plugins, {} actions", pluginsById.size(), availableSteps().size());
        log.info("[Plugins] Active plugins: {}", pluginsById.keySet());
    }

    public boolean isFrozen() {
        return frozen;
    }

    public PluginAction lookup(String pluginId, String action) {
        OrchestratorPlugin plugin = pluginsById.get(pluginId);
        PluginAction pluginAction = plugin != null ? plugin.actions().get(action) : null;
        if (pluginAction == null) {
            throw new UnknownStepException(PipelineStep.of(pluginId, action));
        }
        return pluginAction;
    }

    public PluginAction lookup(PipelineStep step) {
        return lookup(step.pluginId(), step.action());
    }

    public boolean contains(PipelineStep step) {
        OrchestratorPlugin plugin = pluginsById.get(step.pluginId());
        return plugin != null && plugin.actions().containsKey(step.action());
    }

    /**
     * Capability declarations of all registered plugins, in registration order.
     */
    public List<CapabilityRegistration> listCapabilityProviders() {
        List<CapabilityRegistration> result = new ArrayList<>();
        for (OrchestratorPlugin plugin : pluginsById.values()) {
            result.addAll(plugin.capabilities());
        }
        return List.copyOf(result);
    }

    public List<AvailableStep> availableSteps() {
        List<AvailableStep> result = new ArrayList<>();
        for (OrchestratorPlugin plugin : pluginsById.values()) {
            for (PluginAction action : plugin.actions().values()) {
                result.add(new AvailableStep(PipelineStep.of(plugin.descriptor().id(), action.name()),
                        action.descriptor()));
            }
        }
        return List.copyOf(result);
    }

    public List<OrchestratorPlugin> listPlugins() {
        return List.copyOf(pluginsById.values());
    }

    public List<PluginDescriptor> getPluginDescriptors() {
        return pluginsById.values().stream()
                .map(OrchestratorPlugin::descriptor)
                .toList();
    }
}
