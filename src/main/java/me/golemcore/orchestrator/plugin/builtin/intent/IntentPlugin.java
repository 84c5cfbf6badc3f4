package me.golemcore.orchestrator.plugin.builtin.intent;

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

import com.fasterxml.jackson.databind.JsonNode;
import me.golemcore.orchestrator.capability.ExtractionRequest;
import me.golemcore.orchestrator.capability.ExtractionResult;
import me.golemcore.orchestrator.capability.StructuredExtractionService;
import me.golemcore.orchestrator.capability.schema.FieldType;
import me.golemcore.orchestrator.capability.schema.SchemaDescription;
import me.golemcore.orchestrator.capability.schema.SchemaField;
import me.golemcore.orchestrator.domain.exception.StepExecutionException;
import me.golemcore.orchestrator.domain.model.ContextItem;
import me.golemcore.orchestrator.domain.model.ContextItemTypes;
import me.golemcore.orchestrator.domain.model.ExtractionPayload;
import me.golemcore.orchestrator.plugin.api.ActionContext;
import me.golemcore.orchestrator.plugin.api.ActionDescriptor;
import me.golemcore.orchestrator.plugin.api.ActionResult;
import me.golemcore.orchestrator.plugin.api.PluginContext;
import me.golemcore.orchestrator.plugin.builtin.AbstractPlugin;

import java.util.Map;

/**
 * Built-in plugin classifying the user's intent with schema-validated
 * extraction.
 */
public final class IntentPlugin extends AbstractPlugin {

    public static final String PLUGIN_ID = "intent";
    public static final String ACTION_CLASSIFY = "classify";

    static final String EXTRACTION_CAPABILITY = "chat";

    static final SchemaDescription INTENT_SCHEMA = SchemaDescription.of("intent",
            SchemaField.required("intent", FieldType.STRING,
                    "short snake_case label, e.g. question, request, greeting, complaint"),
            SchemaField.required("confidence", FieldType.NUMBER, "confidence between 0 and 1"),
            SchemaField.required("summary", FieldType.STRING, "one-sentence summary of what the user wants"));

    private StructuredExtractionService extractionService;

    public IntentPlugin() {
        super(PLUGIN_ID, "Intent", "Classifies user input into a structured intent.", EXTRACTION_CAPABILITY);
        addAction(ActionDescriptor.builder()
                .name(ACTION_CLASSIFY)
                .description("Classify the latest user message into {intent, confidence, summary}")
                .read(ContextItemTypes.USER_INPUT)
                .append(ContextItemTypes.EXTRACTION)
                .build(), this::classify);
    }

    @Override
    public void init(PluginContext context) {
        extractionService = context.requireService(StructuredExtractionService.class);
    }

    ActionResult classify(ActionContext context) throws Exception {
        if (extractionService == null) {
            throw new StepExecutionException("Plugin " + PLUGIN_ID + " is not initialized");
        }
        ContextItem input = context.latest(ContextItemTypes.USER_INPUT).orElse(null);
        if (input == null) {
            return ActionResult.failure("No user input to classify");
        }

        ExtractionResult result = extractionService.extract(ExtractionRequest.builder()
                .capability(EXTRACTION_CAPABILITY)
                .schema(INTENT_SCHEMA)
                .instruction("Classify the intent of the following user message.\n\nMessage:\n" + input.content())
                .config(Map.of("temperature", 0.0))
                .build()).get();

        JsonNode value = result.value();
        return ActionResult.success(context.newItem(ContextItemTypes.EXTRACTION, value.toString(),
                new ExtractionPayload(INTENT_SCHEMA.name(), result.attempts())));
    }
}
