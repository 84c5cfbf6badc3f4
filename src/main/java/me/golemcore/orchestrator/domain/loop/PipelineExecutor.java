package me.golemcore.orchestrator.domain.loop;

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
import me.golemcore.orchestrator.domain.exception.Failures;
import me.golemcore.orchestrator.domain.exception.OrchestratorException;
import me.golemcore.orchestrator.domain.exception.PlanningException;
import me.golemcore.orchestrator.domain.exception.UnknownStepException;
import me.golemcore.orchestrator.domain.model.ContextChain;
import me.golemcore.orchestrator.domain.model.ContextItem;
import me.golemcore.orchestrator.domain.model.ContextItemTypes;
import me.golemcore.orchestrator.domain.model.ErrorPayload;
import me.golemcore.orchestrator.domain.model.Event;
import me.golemcore.orchestrator.domain.model.FailureKind;
import me.golemcore.orchestrator.domain.model.MonitorEventType;
import me.golemcore.orchestrator.domain.model.Pipeline;
import me.golemcore.orchestrator.domain.model.PipelineStep;
import me.golemcore.orchestrator.domain.model.ReplanDecision;
import me.golemcore.orchestrator.domain.model.ResponseHandler;
import me.golemcore.orchestrator.domain.model.RunResult;
import me.golemcore.orchestrator.domain.model.RunState;
import me.golemcore.orchestrator.domain.model.RunStatus;
import me.golemcore.orchestrator.domain.model.StepFailurePolicy;
import me.golemcore.orchestrator.domain.model.UserInputPayload;
import me.golemcore.orchestrator.domain.service.MonitorService;
import me.golemcore.orchestrator.domain.service.PipelinePlanner;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.plugin.api.ActionContext;
import me.golemcore.orchestrator.plugin.api.ActionResult;
import me.golemcore.orchestrator.plugin.api.PluginAction;
import me.golemcore.orchestrator.plugin.context.PluginRegistryService;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Drives one event end-to-end through the state machine
 * {@code PLANNING -> RUNNING -> REPLANNING <-> RUNNING -> SUCCEEDED | FAILED}.
 *
 * <p>
 * Each call to {@link #execute(Event)} owns a fresh {@link ContextChain} and
 * {@link Pipeline}; nothing is shared between runs. Failures are recorded as
 * error items and never thrown. The event's response handler is invoked exactly
 * once at termination.
 */
@Component
@Slf4j
public class PipelineExecutor {

    private final PipelinePlanner planner;
    private final PluginRegistryService pluginRegistry;
    private final MonitorService monitorService;
    private final OrchestratorProperties properties;
    private final Clock clock;

    public PipelineExecutor(PipelinePlanner planner, PluginRegistryService pluginRegistry,
            MonitorService monitorService, OrchestratorProperties properties, Clock clock) {
        this.planner = planner;
        this.pluginRegistry = pluginRegistry;
        this.monitorService = monitorService;
        this.properties = properties;
        this.clock = clock;
    }

    public RunResult execute(Event event) {
        log.info("[Executor] Run started: event={}, key={}, origin={}/{}", event.getId(),
                event.getConversationKey(), event.getPluginId(), event.getAction());
        return new Run(event).execute();
    }

    static ContextItem seedItem(Event event) {
        return ContextItem.builder()
                .id(event.getId())
                .pluginId(event.getPluginId())
                .action(event.getAction())
                .type(event.getType())
                .content(event.getContent())
                .createdAt(event.getTimestamp())
                .payload(ContextItemTypes.USER_INPUT.equals(event.getType())
                        ? new UserInputPayload(event.getUser(), event.getPlatform())
                        : null)
                .build();
    }

    private final class Run {

        private final Event event;
        private final ContextChain chain;
        private final int maxSteps;
        private final StepFailurePolicy failurePolicy;

        private Pipeline pipeline = Pipeline.empty();
        private RunState state = RunState.PLANNING;
        private int executedSteps;
        private ErrorPayload failure;

        private Run(Event event) {
            this.event = event;
            this.chain = new ContextChain(event.getId());
            this.maxSteps = properties.getExecutor().getMaxSteps();
            this.failurePolicy = properties.getExecutor().getStepFailurePolicy();
        }

        RunResult execute() {
            long startMs = clock.millis();
            monitorService.emit(event, MonitorEventType.RUN_STARTED);
            try {
                chain.append(seedItem(event));
                while (!state.isTerminal()) {
                    log.debug("[Executor] {} state={}", event.getId(), state);
                    state = switch (state) {
                    case PLANNING -> plan();
                    case RUNNING -> runNextStep();
                    case REPLANNING -> replan();
                    default -> state;
                    };
                }
            } catch (RuntimeException e) { // NOSONAR - a run must always terminate and notify
                log.error("[Executor] Run {} failed unexpectedly in state {}: {}", event.getId(), state,
                        e.getMessage(), e);
                FailureKind kind = e instanceof OrchestratorException orchestratorException
                        ? orchestratorException.getKind()
                        : FailureKind.STEP_FAILURE;
                state = fail(ErrorPayload.forRun(kind, Failures.describe(e)));
            }
            return terminate(clock.millis() - startMs);
        }

        private RunState plan() {
            try {
                CompletableFuture<Pipeline> planned = planner.plan(chain, pluginRegistry.availableSteps());
                pipeline = await(planned, "plan");
            } catch (RuntimeException e) { // NOSONAR - any planner failure is a planning error
                log.error("[Executor] Planning failed for {}: {}", event.getId(), Failures.describe(e));
                return fail(ErrorPayload.forRun(FailureKind.PLANNING_ERROR, Failures.describe(e)));
            }

            if (pipeline == null || pipeline.isEmpty()) {
                log.info("[Executor] Empty plan for {}, nothing to run", event.getId());
                pipeline = Pipeline.empty();
                return RunState.SUCCEEDED;
            }

            monitorService.emit(event, MonitorEventType.PLAN_ACCEPTED,
                    Map.of("steps", describe(pipeline.remaining())));
            return RunState.RUNNING;
        }

        private RunState runNextStep() {
            Optional<PipelineStep> next = pipeline.next();
            if (next.isEmpty()) {
                return RunState.SUCCEEDED;
            }
            PipelineStep step = next.get();

            if (executedSteps >= maxSteps) {
                log.warn("[Executor] Run {} reached step limit ({})", event.getId(), maxSteps);
                return fail(ErrorPayload.forStep(FailureKind.STEP_LIMIT, step,
                        "Step limit of " + maxSteps + " reached before " + step));
            }

            PluginAction action;
            try {
                action = pluginRegistry.lookup(step);
            } catch (UnknownStepException e) {
                log.error("[Executor] Run {} references unknown step {}", event.getId(), step);
                monitorService.emit(event, MonitorEventType.STEP_FAILED, stepPayload(step, e.getMessage()));
                return fail(ErrorPayload.forStep(FailureKind.UNKNOWN_STEP, step, e.getMessage()));
            }

            executedSteps++;
            monitorService.emit(event, MonitorEventType.STEP_STARTED, stepPayload(step, null));
            long startMs = clock.millis();
            ActionResult result = invoke(action, step);

            if (result.isSuccess()) {
                String duplicate = findDuplicateId(result.getItems());
                if (duplicate != null) {
                    result = ActionResult.failure("Action returned duplicate context item id: " + duplicate);
                }
            }

            if (!result.isSuccess()) {
                log.error("[Executor] Step {} FAILED after {}ms: {}", step, clock.millis() - startMs,
                        result.getError());
                ErrorPayload error = ErrorPayload.forStep(FailureKind.STEP_FAILURE, step, result.getError());
                monitorService.emit(event, MonitorEventType.STEP_FAILED, stepPayload(step, result.getError()));
                if (failurePolicy == StepFailurePolicy.SKIP) {
                    appendError(error);
                    return RunState.REPLANNING;
                }
                return fail(error);
            }

            chain.appendAll(result.getItems());
            log.debug("[Executor] Step {} completed in {}ms, appended {} item(s)", step, clock.millis() - startMs,
                    result.getItems().size());
            Map<String, Object> payload = stepPayload(step, null);
            payload.put("appended", result.getItems().size());
            monitorService.emit(event, MonitorEventType.STEP_COMPLETED, payload);
            return RunState.REPLANNING;
        }

        private ActionResult invoke(PluginAction action, PipelineStep step) {
            try {
                ActionResult result = action.handler()
                        .handle(new ActionContext(event, step, chain.items(), clock));
                return result != null ? result : ActionResult.failure("Action returned no result");
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return ActionResult.failure("Interrupted");
            } catch (Exception e) { // NOSONAR - handler failures become error items
                log.debug("[Executor] Step {} threw", step, e);
                return ActionResult.failure(Failures.describe(e));
            }
        }

        private RunState replan() {
            List<PipelineStep> remaining = pipeline.remaining();
            ReplanDecision decision;
            try {
                decision = await(planner.shouldReplan(chain, remaining), "replan");
            } catch (RuntimeException e) { // NOSONAR - fall back to the current pipeline
                log.warn("[Executor] Replan check failed for {}, continuing with {} remaining step(s): {}",
                        event.getId(), remaining.size(), Failures.describe(e));
                monitorService.emit(event, MonitorEventType.REPLAN_FAILED,
                        Map.of("error", Failures.describe(e)));
                return RunState.RUNNING;
            }

            if (decision == null || !decision.isReplace()) {
                return RunState.RUNNING;
            }

            for (PipelineStep step : decision.steps()) {
                if (!pluginRegistry.contains(step)) {
                    log.warn("[Executor] Replan for {} referenced unknown step {}, keeping current pipeline",
                            event.getId(), step);
                    monitorService.emit(event, MonitorEventType.REPLAN_FAILED,
                            Map.of("error", "Unknown step: " + step));
                    return RunState.RUNNING;
                }
            }

            pipeline.replaceRemaining(decision.steps());
            log.info("[Executor] Pipeline replaced for {}: {} -> {} ({})", event.getId(), remaining,
                    decision.steps(), decision.reason());
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("discarded", describe(remaining));
            payload.put("steps", describe(decision.steps()));
            payload.put("reason", decision.reason() != null ? decision.reason() : "");
            monitorService.emit(event, MonitorEventType.PIPELINE_REPLACED, payload);
            return RunState.RUNNING;
        }

        private <T> T await(CompletableFuture<T> future, String operation) {
            if (future == null) {
                throw new PlanningException("Planner returned no result for " + operation);
            }
            try {
                return future.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new PlanningException("Interrupted while waiting for " + operation, e);
            } catch (ExecutionException e) {
                Throwable cause = Failures.unwrap(e);
                if (cause instanceof RuntimeException runtimeException) {
                    throw runtimeException;
                }
                throw new PlanningException(operation + " failed: " + Failures.describe(cause), cause);
            }
        }

        private RunState fail(ErrorPayload error) {
            appendError(error);
            failure = error;
            return RunState.FAILED;
        }

        private void appendError(ErrorPayload error) {
            chain.append(ContextItem.builder()
                    .id(ContextItem.newId())
                    .pluginId(error.stepPluginId() != null ? error.stepPluginId() : "orchestrator")
                    .action(error.stepAction() != null ? error.stepAction() : "plan")
                    .type(ContextItemTypes.ERROR)
                    .content(error.detail())
                    .createdAt(clock.instant())
                    .payload(error)
                    .build());
        }

        private String findDuplicateId(List<ContextItem> items) {
            Set<String> seen = new HashSet<>();
            for (ContextItem item : items) {
                if (item == null) {
                    return "<null item>";
                }
                if (chain.containsId(item.id()) || !seen.add(item.id())) {
                    return item.id();
                }
            }
            return null;
        }

        private RunResult terminate(long durationMs) {
            RunStatus status = state == RunState.SUCCEEDED ? RunStatus.SUCCESS : RunStatus.FAILURE;
            RunResult result = RunResult.builder()
                    .eventId(event.getId())
                    .conversationKey(event.getConversationKey())
                    .status(status)
                    .chain(chain.snapshot())
                    .executedSteps(executedSteps)
                    .failure(failure)
                    .build();

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("steps", executedSteps);
            payload.put("items", chain.size());
            payload.put("durationMs", durationMs);
            if (failure != null) {
                payload.put("failure", failure.kind().name());
            }
            monitorService.emit(event,
                    status == RunStatus.SUCCESS ? MonitorEventType.RUN_SUCCEEDED : MonitorEventType.RUN_FAILED,
                    payload);
            log.info("[Executor] Run {} terminated {} after {} step(s), {} item(s), {}ms", event.getId(), status,
                    executedSteps, chain.size(), durationMs);

            notifyResponseHandler(result);
            return result;
        }

        private void notifyResponseHandler(RunResult result) {
            ResponseHandler handler = event.getResponseHandler();
            if (handler == null) {
                return;
            }
            try {
                handler.onRunComplete(result);
            } catch (Exception e) { // NOSONAR - the response channel belongs to the producer
                log.error("[Executor] Response handler for {} failed: {}", event.getId(), e.getMessage(), e);
            }
        }

        private Map<String, Object> stepPayload(PipelineStep step, String error) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("plugin", step.pluginId());
            payload.put("action", step.action());
            if (error != null) {
                payload.put("error", error);
            }
            return payload;
        }

        private List<String> describe(List<PipelineStep> steps) {
            return steps.stream().map(PipelineStep::toString).toList();
        }
    }
}
