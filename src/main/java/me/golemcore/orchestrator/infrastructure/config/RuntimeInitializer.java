package me.golemcore.orchestrator.infrastructure.config;

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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.capability.CapabilityRegistration;
import me.golemcore.orchestrator.capability.CapabilityRouter;
import me.golemcore.orchestrator.domain.service.EventQueueService;
import me.golemcore.orchestrator.plugin.api.OrchestratorPlugin;
import me.golemcore.orchestrator.plugin.api.PluginContext;
import me.golemcore.orchestrator.plugin.builtin.BuiltinPluginCatalog;
import me.golemcore.orchestrator.plugin.context.PluginRegistryService;
import me.golemcore.orchestrator.port.outbound.ModelProviderPort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Brings the runtime up in two phases before any event is dispatched.
 *
 * <ol>
 * <li>Register model provider capabilities, then every plugin (built-in catalog
 * first, then plugin beans), then each plugin's declared capabilities.</li>
 * <li>Run plugin init hooks in registration order, freeze both registries and
 * open the event queue.</li>
 * </ol>
 *
 * Any registration conflict propagates and aborts application startup.
 */
@Component
@Slf4j
public class RuntimeInitializer {

    private final List<ModelProviderPort> modelProviders;
    private final List<OrchestratorPlugin> pluginBeans;
    private final BuiltinPluginCatalog builtinPluginCatalog;
    private final PluginRegistryService pluginRegistry;
    private final CapabilityRouter capabilityRouter;
    private final PluginContext pluginContext;
    private final EventQueueService eventQueueService;

    @Autowired
    public RuntimeInitializer(ObjectProvider<ModelProviderPort> modelProviders,
            ObjectProvider<OrchestratorPlugin> pluginBeans, PluginRegistryService pluginRegistry,
            CapabilityRouter capabilityRouter, PluginContext pluginContext, EventQueueService eventQueueService) {
        this(modelProviders.orderedStream().toList(), pluginBeans.orderedStream().toList(),
                new BuiltinPluginCatalog(), pluginRegistry, capabilityRouter, pluginContext, eventQueueService);
    }

    RuntimeInitializer(List<ModelProviderPort> modelProviders, List<OrchestratorPlugin> pluginBeans,
            BuiltinPluginCatalog builtinPluginCatalog, PluginRegistryService pluginRegistry,
            CapabilityRouter capabilityRouter, PluginContext pluginContext, EventQueueService eventQueueService) {
        this.modelProviders = modelProviders;
        this.pluginBeans = pluginBeans;
        this.builtinPluginCatalog = builtinPluginCatalog;
        this.pluginRegistry = pluginRegistry;
        this.capabilityRouter = capabilityRouter;
        this.pluginContext = pluginContext;
        this.eventQueueService = eventQueueService;
    }

    @PostConstruct
    public void initialize() {
        registerModelProviders();
        List<OrchestratorPlugin> plugins = registerPlugins();
        registerPluginCapabilities(plugins);

        pluginRegistry.initializePlugins(pluginContext);
        reportMissingCapabilities(plugins);

        pluginRegistry.freeze();
        capabilityRouter.freeze();
        log.info("[Capabilities] Registered: {}", capabilityRouter.listCapabilityIds());

        eventQueueService.start();
    }

    private void registerModelProviders() {
        for (ModelProviderPort provider : modelProviders) {
            if (!provider.isAvailable()) {
                log.info("[Capabilities] Model provider {} not configured, skipping", provider.getProviderId());
                continue;
            }
            for (CapabilityRegistration registration : provider.capabilities()) {
                capabilityRouter.registerCapability(registration);
            }
            log.info("[Capabilities] Model provider {} registered {} capabilities", provider.getProviderId(),
                    provider.capabilities().size());
        }
    }

    private List<OrchestratorPlugin> registerPlugins() {
        List<OrchestratorPlugin> plugins = new ArrayList<>(builtinPluginCatalog.createPlugins());
        plugins.addAll(pluginBeans);
        for (OrchestratorPlugin plugin : plugins) {
            pluginRegistry.register(plugin);
        }
        return plugins;
    }

    private void registerPluginCapabilities(List<OrchestratorPlugin> plugins) {
        for (OrchestratorPlugin plugin : plugins) {
            for (CapabilityRegistration registration : plugin.capabilities()) {
                capabilityRouter.registerCapability(registration);
            }
        }
    }

    private void reportMissingCapabilities(List<OrchestratorPlugin> plugins) {
        for (OrchestratorPlugin plugin : plugins) {
            for (String capability : plugin.requiredCapabilities()) {
                if (!capabilityRouter.isRegistered(capability)) {
                    log.warn("[Capabilities] Plugin {} requires '{}', which is not registered; its actions will fail",
                            plugin.descriptor().id(), capability);
                }
            }
        }
    }
}
