package me.golemcore.orchestrator.plugin.builtin;

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
import me.golemcore.orchestrator.plugin.api.ActionDescriptor;
import me.golemcore.orchestrator.plugin.api.ActionHandler;
import me.golemcore.orchestrator.plugin.api.OrchestratorPlugin;
import me.golemcore.orchestrator.plugin.api.PluginAction;
import me.golemcore.orchestrator.plugin.api.PluginDescriptor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public abstract class AbstractPlugin implements OrchestratorPlugin {

    private static final String DEFAULT_PLUGIN_VERSION = "1.0.0";

    private final PluginDescriptor pluginDescriptor;
    private final Map<String, PluginAction> pluginActions = new LinkedHashMap<>();
    private final List<CapabilityRegistration> providedCapabilities = new ArrayList<>();
    private final Set<String> capabilityRequirements;

    protected AbstractPlugin(String id, String name, String description, String... requiredCapabilities) {
        this.pluginDescriptor = new PluginDescriptor(id, name, DEFAULT_PLUGIN_VERSION, description);
        this.capabilityRequirements = new LinkedHashSet<>(Arrays.asList(requiredCapabilities));
    }

    @Override
    public PluginDescriptor descriptor() {
        return pluginDescriptor;
    }

    @Override
    public Map<String, PluginAction> actions() {
        return Collections.unmodifiableMap(pluginActions);
    }

    @Override
    public List<CapabilityRegistration> capabilities() {
        return List.copyOf(providedCapabilities);
    }

    @Override
    public Set<String> requiredCapabilities() {
        return Collections.unmodifiableSet(capabilityRequirements);
    }

    protected void addAction(ActionDescriptor descriptor, ActionHandler handler) {
        if (pluginActions.containsKey(descriptor.name())) {
            throw new IllegalStateException("Duplicate action '" + descriptor.name() + "' in plugin "
                    + pluginDescriptor.id());
        }
        pluginActions.put(descriptor.name(), new PluginAction(descriptor, handler));
    }

    protected void addCapability(CapabilityRegistration registration) {
        providedCapabilities.add(registration);
    }
}
