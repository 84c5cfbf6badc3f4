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

import me.golemcore.orchestrator.domain.model.ContextChain;
import me.golemcore.orchestrator.domain.model.Pipeline;
import me.golemcore.orchestrator.domain.model.PipelineStep;
import me.golemcore.orchestrator.domain.model.ReplanDecision;
import me.golemcore.orchestrator.plugin.context.AvailableStep;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Produces and revises the pipeline of one run.
 *
 * <p>
 * Both operations may be long-latency and complete asynchronously. Failures
 * complete the future with
 * {@link me.golemcore.orchestrator.domain.exception.PlanningException}.
 */
public interface PipelinePlanner {

    /**
     * Initial plan for the chain. An empty pipeline is valid and ends the run
     * successfully.
     */
    CompletableFuture<Pipeline> plan(ContextChain chain, List<AvailableStep> availableSteps);

    /**
     * Called after every completed step with the steps not yet executed.
     */
    CompletableFuture<ReplanDecision> shouldReplan(ContextChain chain, List<PipelineStep> remainingSteps);
}
