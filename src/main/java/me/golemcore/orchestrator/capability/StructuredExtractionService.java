package me.golemcore.orchestrator.capability;

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
import me.golemcore.orchestrator.capability.schema.SchemaDescription;
import me.golemcore.orchestrator.capability.schema.SchemaValidator;
import me.golemcore.orchestrator.capability.schema.ValidationResult;
import me.golemcore.orchestrator.domain.exception.ExtractionFailedException;
import me.golemcore.orchestrator.domain.exception.Failures;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Schema-validated extraction on top of a text capability, with bounded retry.
 *
 * <p>
 * Each attempt invokes the capability once. An invocation failure, unparseable
 * output or a schema violation consumes the attempt; the next attempt appends
 * the rejection reason to the instruction via {@link RetryInstructionPolicy}.
 * After the last attempt the future fails with
 * {@link ExtractionFailedException}.
 */
@Service
@Slf4j
public class StructuredExtractionService {

    private final CapabilityRouter capabilityRouter;
    private final SchemaValidator schemaValidator;
    private final JsonResponseReader responseReader;
    private final OrchestratorProperties properties;

    public StructuredExtractionService(CapabilityRouter capabilityRouter, SchemaValidator schemaValidator,
            JsonResponseReader responseReader, OrchestratorProperties properties) {
        this.capabilityRouter = capabilityRouter;
        this.schemaValidator = schemaValidator;
        this.responseReader = responseReader;
        this.properties = properties;
    }

    public CompletableFuture<ExtractionResult> extract(ExtractionRequest request) {
        int maxAttempts = request.maxAttempts() != null
                ? request.maxAttempts()
                : properties.getExtraction().getMaxAttempts();
        if (maxAttempts < 1) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("maxAttempts must be at least 1"));
        }
        Duration timeout = request.timeout() != null
                ? request.timeout()
                : Duration.ofMillis(properties.getExtraction().getTimeoutMs());
        return attempt(request, 1, maxAttempts, timeout, null, null);
    }

    private CompletableFuture<ExtractionResult> attempt(ExtractionRequest request, int attempt, int maxAttempts,
            Duration timeout, String lastError, Throwable lastCause) {
        String instruction = RetryInstructionPolicy.nextInstruction(request.instruction(), attempt, lastError);
        String prompt = buildPrompt(request.schema(), instruction);

        return capabilityRouter.invoke(request.capability(), prompt, buildConfig(request), timeout)
                .handle((output, error) -> evaluate(request.schema(), output, error))
                .thenCompose(outcome -> {
                    if (outcome.value() != null) {
                        log.debug("[Extraction] {} succeeded on attempt {}/{}", request.schema().name(), attempt,
                                maxAttempts);
                        return CompletableFuture.completedFuture(new ExtractionResult(outcome.value(), attempt));
                    }
                    if (attempt >= maxAttempts) {
                        log.warn("[Extraction] {} failed after {} attempt(s): {}", request.schema().name(),
                                attempt, outcome.error());
                        return CompletableFuture.failedFuture(new ExtractionFailedException(
                                "Extraction of '" + request.schema().name() + "' failed after " + attempt
                                        + " attempt(s): " + outcome.error(),
                                attempt, outcome.cause() != null ? outcome.cause() : lastCause));
                    }
                    log.warn("[Extraction] {} attempt {}/{} rejected: {}", request.schema().name(), attempt,
                            maxAttempts, outcome.error());
                    return attempt(request, attempt + 1, maxAttempts, timeout, outcome.error(), outcome.cause());
                });
    }

    private Outcome evaluate(SchemaDescription schema, Object output, Throwable error) {
        if (error != null) {
            return Outcome.rejected("capability call failed: " + Failures.describe(error), Failures.unwrap(error));
        }
        JsonNode value;
        try {
            value = responseReader.read(output);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            return Outcome.rejected("response is not valid JSON (" + e.getMessage() + ")", e);
        }
        ValidationResult validation = schemaValidator.validate(schema, value);
        if (!validation.valid()) {
            return Outcome.rejected(validation.summary(), null);
        }
        return new Outcome(value, null, null);
    }

    private String buildPrompt(SchemaDescription schema, String instruction) {
        return instruction
                + "\n\n## Output schema\n"
                + schema.render()
                + "\nRespond ONLY with a JSON object (no markdown, no explanation).";
    }

    private Map<String, Object> buildConfig(ExtractionRequest request) {
        Map<String, Object> config = new LinkedHashMap<>();
        if (request.config() != null) {
            config.putAll(request.config());
        }
        config.put("response_format", "json");
        config.put("schema", request.schema().name());
        return config;
    }

    private record Outcome(JsonNode value, String error, Throwable cause) {

        static Outcome rejected(String error, Throwable cause) {
            return new Outcome(null, error, cause);
        }
    }
}
