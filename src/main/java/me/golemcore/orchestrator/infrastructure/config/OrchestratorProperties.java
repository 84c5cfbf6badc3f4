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

import lombok.Data;
import me.golemcore.orchestrator.domain.model.StepFailurePolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the orchestrator.
 *
 * <p>
 * All configuration is organized under the {@code orchestrator.*} prefix:
 * <ul>
 * <li>{@link QueueProperties} - event queue worker bound</li>
 * <li>{@link ExecutorProperties} - step limits and failure policy</li>
 * <li>{@link PlannerProperties} - planning capability and replanning</li>
 * <li>{@link CapabilitiesProperties} - capability invocation defaults</li>
 * <li>{@link ExtractionProperties} - structured extraction retry bound</li>
 * <li>{@link LlmProperties} - langchain4j model provider</li>
 * <li>{@link MemoryProperties} - in-memory conversation history</li>
 * <li>{@link TriggerProperties} - scheduled event triggers</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "orchestrator")
@Data
public class OrchestratorProperties {

    private QueueProperties queue = new QueueProperties();
    private ExecutorProperties executor = new ExecutorProperties();
    private PlannerProperties planner = new PlannerProperties();
    private CapabilitiesProperties capabilities = new CapabilitiesProperties();
    private ExtractionProperties extraction = new ExtractionProperties();
    private LlmProperties llm = new LlmProperties();
    private MemoryProperties memory = new MemoryProperties();
    private List<TriggerProperties> triggers = new ArrayList<>();
    private Map<String, Map<String, Object>> plugins = new HashMap<>();

    @Data
    public static class QueueProperties {
        private int workers = 4;
    }

    @Data
    public static class ExecutorProperties {
        private int maxSteps = 50;
        private StepFailurePolicy stepFailurePolicy = StepFailurePolicy.HALT;
    }

    @Data
    public static class PlannerProperties {
        private String capability = "planning";
        private long timeoutMs = 60000;
        private boolean replanEnabled = true;
        private int historyLimit = 10;
    }

    @Data
    public static class CapabilitiesProperties {
        private long defaultTimeoutMs = 60000;
    }

    @Data
    public static class ExtractionProperties {
        private int maxAttempts = 3;
        private long timeoutMs = 60000;
    }

    @Data
    public static class LlmProperties {
        private String provider = "openai";
        private String apiKey;
        private String baseUrl;
        private String model = "gpt-4o-mini";
        private double temperature = 0.2;
        private int maxTokens = 4096;
        private long timeoutMs = 60000;
        private List<String> chatAliases = new ArrayList<>(List.of("text-generation", "llm"));
        private List<String> planningAliases = new ArrayList<>(List.of("planner"));
    }

    @Data
    public static class MemoryProperties {
        private int maxEntriesPerConversation = 200;
    }

    @Data
    public static class TriggerProperties {
        private String id;
        private boolean enabled = true;
        private long intervalSeconds = 3600;
        private String pluginId = "scheduler";
        private String action = "tick";
        private String type = "trigger";
        private String content = "";
        private String user;
        private String platform;
    }
}
