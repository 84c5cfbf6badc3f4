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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.capability.CapabilityRouter;
import me.golemcore.orchestrator.capability.JsonResponseReader;
import me.golemcore.orchestrator.domain.exception.Failures;
import me.golemcore.orchestrator.domain.exception.PlanningException;
import me.golemcore.orchestrator.domain.model.ContextChain;
import me.golemcore.orchestrator.domain.model.ContextItem;
import me.golemcore.orchestrator.domain.model.ConversationInteraction;
import me.golemcore.orchestrator.domain.model.Pipeline;
import me.golemcore.orchestrator.domain.model.PipelineStep;
import me.golemcore.orchestrator.domain.model.ReplanDecision;
import me.golemcore.orchestrator.domain.model.UserInputPayload;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.plugin.api.ActionDescriptor;
import me.golemcore.orchestrator.plugin.context.AvailableStep;
import me.golemcore.orchestrator.plugin.context.PluginRegistryService;
import me.golemcore.orchestrator.port.outbound.MemoryPort;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Planner backed by a single "planning" capability invocation per decision.
 *
 * <p>
 * The capability receives a textual description of the available steps, recent
 * conversation history and the chain, and answers with JSON:
 * <ul>
 * <li>plan: {@code {"steps": [{"plugin": "...", "action": "..."}], "reason":
 * "..."}}</li>
 * <li>replan: {@code {"decision": "continue"}} or
 * {@code {"decision": "replace", "steps": [...], "reason": "..."}}</li>
 * </ul>
 * Every returned step must be registered; duplicates are kept in order.
 *
 * @see PipelinePlanner
 */
@Service
@Slf4j
public class CapabilityPipelinePlanner implements PipelinePlanner {

    static final String MODE_PLAN = "plan";
    static final String MODE_REPLAN = "replan";

    private static final int MAX_ITEM_CONTENT = 500;

    private static final String PLAN_SYSTEM_PROMPT = """
            You are the planner of an agent runtime. Given the available plugin actions and the context produced so far,
            choose the ordered list of actions that turns the context into a final response.

            ## Rules:
            1. Use ONLY actions from the "Available Actions" list, referenced by plugin and action name
            2. The same action may appear more than once if it must run more than once
            3. Return an empty list if nothing needs to be done
            4. Respond ONLY with valid JSON (no markdown, no explanation):

            {"steps": [{"plugin": "plugin-id", "action": "action-name"}], "reason": "Brief explanation"}
            """;

    private static final String REPLAN_SYSTEM_PROMPT = """
            You are the planner of an agent runtime. A step has just completed. Decide whether the remaining steps
            still make sense given the latest context.

            ## Rules:
            1. Answer {"decision": "continue"} to keep the remaining steps unchanged
            2. Otherwise answer {"decision": "replace", "steps": [{"plugin": "plugin-id", "action": "action-name"}],
               "reason": "Brief explanation"} to discard ALL remaining steps and run the given ones instead
            3. Use ONLY actions from the "Available Actions" list
            4. Respond ONLY with valid JSON (no markdown, no explanation)
            """;

    private final CapabilityRouter capabilityRouter;
    private final PluginRegistryService pluginRegistry;
    private final MemoryPort memoryPort;
    private final JsonResponseReader responseReader;
    private final OrchestratorProperties properties;

    public CapabilityPipelinePlanner(CapabilityRouter capabilityRouter, PluginRegistryService pluginRegistry,
            MemoryPort memoryPort, JsonResponseReader responseReader, OrchestratorProperties properties) {
        this.capabilityRouter = capabilityRouter;
        this.pluginRegistry = pluginRegistry;
        this.memoryPort = memoryPort;
        this.responseReader = responseReader;
        this.properties = properties;
    }

    @Override
    public CompletableFuture<Pipeline> plan(ContextChain chain, List<AvailableStep> availableSteps) {
        String prompt;
        try {
            prompt = buildPlanPrompt(chain, availableSteps);
        } catch (RuntimeException e) { // NOSONAR - any prompt failure is a planning failure
            return CompletableFuture.failedFuture(new PlanningException("Failed to build plan prompt", e));
        }

        log.debug("[Planner] Plan prompt for {}:\n{}", chain.getEventId(), prompt);
        return invokePlanning(MODE_PLAN, PLAN_SYSTEM_PROMPT, prompt)
                .thenApply(output -> {
                    JsonNode root = readJson(output);
                    JsonNode stepsNode = root.isArray() ? root : root.get("steps");
                    List<PipelineStep> steps = parseSteps(stepsNode, availableSteps);
                    log.info("[Planner] Plan for {}: {} step(s) {}{}", chain.getEventId(), steps.size(), steps,
                            root.has("reason") ? " - " + root.get("reason").asText() : "");
                    return Pipeline.of(steps);
                });
    }

    @Override
    public CompletableFuture<ReplanDecision> shouldReplan(ContextChain chain, List<PipelineStep> remainingSteps) {
        if (!properties.getPlanner().isReplanEnabled()) {
            return CompletableFuture.completedFuture(ReplanDecision.continueWithCurrent());
        }

        List<AvailableStep> availableSteps = pluginRegistry.availableSteps();
        String prompt;
        try {
            prompt = buildReplanPrompt(chain, remainingSteps, availableSteps);
        } catch (RuntimeException e) { // NOSONAR - any prompt failure is a planning failure
            return CompletableFuture.failedFuture(new PlanningException("Failed to build replan prompt", e));
        }

        return invokePlanning(MODE_REPLAN, REPLAN_SYSTEM_PROMPT, prompt)
                .thenApply(output -> {
                    JsonNode root = readJson(output);
                    String decision = root.path("decision").asText("continue");
                    if (!"replace".equalsIgnoreCase(decision)) {
                        return ReplanDecision.continueWithCurrent();
                    }
                    List<PipelineStep> steps = parseSteps(root.get("steps"), availableSteps);
                    String reason = root.path("reason").asText("");
                    return ReplanDecision.replace(steps, reason);
                });
    }

    private CompletableFuture<Object> invokePlanning(String mode, String systemPrompt, String prompt) {
        String capability = properties.getPlanner().getCapability();
        Map<String, Object> config = Map.of(
                "mode", mode,
                "system_prompt", systemPrompt);
        Duration timeout = Duration.ofMillis(properties.getPlanner().getTimeoutMs());

        return capabilityRouter.invoke(capability, prompt, config, timeout)
                .handle((output, error) -> {
                    if (error != null) {
                        throw new PlanningException("Planning capability '" + capability + "' failed: "
                                + Failures.describe(error), Failures.unwrap(error));
                    }
                    return output;
                });
    }

    private JsonNode readJson(Object output) {
        try {
            JsonNode root = responseReader.read(output);
            if (root == null || !(root.isObject() || root.isArray())) {
                throw new PlanningException("Planner returned neither an object nor an array");
            }
            return root;
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new PlanningException("Planner returned invalid JSON: " + e.getMessage(), e);
        }
    }

    List<PipelineStep> parseSteps(JsonNode stepsNode, List<AvailableStep> availableSteps) {
        if (stepsNode == null || stepsNode.isNull()) {
            return List.of();
        }
        if (!stepsNode.isArray()) {
            throw new PlanningException("Planner 'steps' must be an array");
        }

        Set<PipelineStep> known = availableSteps.stream()
                .map(AvailableStep::step)
                .collect(Collectors.toSet());

        List<PipelineStep> steps = new ArrayList<>();
        for (JsonNode node : stepsNode) {
            String pluginId = firstText(node, "plugin", "pluginId");
            String action = firstText(node, "action");
            if (pluginId == null || action == null) {
                throw new PlanningException("Planner step is missing plugin or action: " + node);
            }
            PipelineStep step = PipelineStep.of(pluginId, action);
            if (!known.contains(step)) {
                throw new PlanningException("Planner referenced unknown step: " + step);
            }
            steps.add(step);
        }
        return steps;
    }

    private String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && value.isTextual() && !value.asText().isBlank()) {
                return value.asText().trim();
            }
        }
        return null;
    }

    private String buildPlanPrompt(ContextChain chain, List<AvailableStep> availableSteps) {
        StringBuilder sb = new StringBuilder();
        appendAvailableSteps(sb, availableSteps);
        appendHistory(sb, chain);
        appendChain(sb, chain);
        sb.append("Produce the plan and respond with JSON only.");
        return sb.toString();
    }

    private String buildReplanPrompt(ContextChain chain, List<PipelineStep> remainingSteps,
            List<AvailableStep> availableSteps) {
        StringBuilder sb = new StringBuilder();
        appendAvailableSteps(sb, availableSteps);
        appendChain(sb, chain);
        sb.append("## Remaining Steps:\n");
        if (remainingSteps.isEmpty()) {
            sb.append("(none)\n");
        } else {
            for (int i = 0; i < remainingSteps.size(); i++) {
                sb.append(String.format("%d. %s%n", i + 1, remainingSteps.get(i)));
            }
        }
        sb.append("\nDecide whether to continue or replace and respond with JSON only.");
        return sb.toString();
    }

    private void appendAvailableSteps(StringBuilder sb, List<AvailableStep> availableSteps) {
        sb.append("## Available Actions:\n\n");
        for (AvailableStep available : availableSteps) {
            ActionDescriptor descriptor = available.descriptor();
            sb.append("- plugin: ").append(available.step().pluginId())
                    .append(", action: ").append(available.step().action()).append('\n');
            if (descriptor.description() != null) {
                sb.append("  ").append(descriptor.description()).append('\n');
            }
            if (!descriptor.reads().isEmpty()) {
                sb.append("  reads: ").append(String.join(", ", descriptor.reads())).append('\n');
            }
            if (!descriptor.appends().isEmpty()) {
                sb.append("  appends: ").append(String.join(", ", descriptor.appends())).append('\n');
            }
            if (!descriptor.exclusiveEffects().isEmpty()) {
                sb.append("  exclusive effects: ").append(String.join(", ", descriptor.exclusiveEffects()))
                        .append('\n');
            }
        }
        sb.append('\n');
    }

    private void appendHistory(StringBuilder sb, ContextChain chain) {
        List<ConversationInteraction> history = loadHistory(chain);
        if (history.isEmpty()) {
            return;
        }
        sb.append("## Conversation History:\n");
        for (ConversationInteraction interaction : history) {
            sb.append("- ").append(truncate(interaction.content(), 200)).append('\n');
        }
        sb.append('\n');
    }

    private List<ConversationInteraction> loadHistory(ContextChain chain) {
        if (chain.isEmpty()) {
            return List.of();
        }
        Optional<UserInputPayload> user = chain.seed().payloadAs(UserInputPayload.class);
        if (user.isEmpty() || user.get().user() == null) {
            return List.of();
        }
        try {
            return memoryPort.getRecentConversationHistory(user.get().user(), user.get().platform(),
                    properties.getPlanner().getHistoryLimit());
        } catch (RuntimeException e) { // NOSONAR - history only enriches the prompt
            log.warn("[Planner] Failed to load conversation history for {}: {}", user.get().user(),
                    e.getMessage());
            return List.of();
        }
    }

    private void appendChain(StringBuilder sb, ContextChain chain) {
        sb.append("## Context So Far:\n");
        for (ContextItem item : chain.items()) {
            sb.append(String.format("- [%s] from %s/%s: %s%n",
                    item.type(), item.pluginId(), item.action(), truncate(item.content(), MAX_ITEM_CONTENT)));
        }
        sb.append('\n');
    }

    private String truncate(String text, int maxLen) {
        if (text == null)
            return "";
        if (text.length() <= maxLen)
            return text;
        return text.substring(0, maxLen) + "...";
    }
}
