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

import me.golemcore.orchestrator.capability.CapabilityRegistration;
import me.golemcore.orchestrator.capability.CapabilityRouter;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.plugin.api.PluginContext;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Default host-side plugin context backed by Spring's application context.
 */
@Component
public class SpringPluginContext implements PluginContext {

    private final ApplicationContext applicationContext;
    private final CapabilityRouter capabilityRouter;
    private final OrchestratorProperties properties;

    public SpringPluginContext(ApplicationContext applicationContext, CapabilityRouter capabilityRouter,
            OrchestratorProperties properties) {
        this.applicationContext = applicationContext;
        this.capabilityRouter = capabilityRouter;
        this.properties = properties;
    }

    @Override
    public <T> T requireService(Class<T> type) {
        return applicationContext.getBean(type);
    }

    @Override
    public Map<String, Object> pluginConfig(String pluginId) {
        Map<String, Object> config = properties.getPlugins().get(pluginId);
        return config != null ? Map.copyOf(config) : Map.of();
    }

    @Override
    public void registerCapability(CapabilityRegistration registration) {
        capabilityRouter.registerCapability(registration);
    }
}
