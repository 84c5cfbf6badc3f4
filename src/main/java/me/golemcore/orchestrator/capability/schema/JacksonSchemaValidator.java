package me.golemcore.orchestrator.capability.schema;

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
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Default {@link SchemaValidator} over Jackson trees. Checks object shape,
 * required fields and field types; unknown fields are allowed.
 */
@Component
public class JacksonSchemaValidator implements SchemaValidator {

    @Override
    public ValidationResult validate(SchemaDescription schema, JsonNode value) {
        if (value == null || !value.isObject()) {
            return ValidationResult.invalid("Expected a JSON object for \"" + schema.name() + "\"");
        }

        List<String> errors = new ArrayList<>();
        for (SchemaField field : schema.fields()) {
            JsonNode node = value.get(field.name());
            if (node == null || node.isNull()) {
                if (field.required()) {
                    errors.add("Missing required field '" + field.name() + "'");
                }
                continue;
            }
            if (!matches(field.type(), node)) {
                errors.add("Field '" + field.name() + "' must be " + field.type().getJsonName()
                        + " but was " + node.getNodeType().name().toLowerCase());
            }
        }
        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.invalid(errors);
    }

    private boolean matches(FieldType type, JsonNode node) {
        return switch (type) {
        case STRING -> node.isTextual();
        case NUMBER -> node.isNumber();
        case INTEGER -> node.isIntegralNumber();
        case BOOLEAN -> node.isBoolean();
        case ARRAY -> node.isArray();
        case OBJECT -> node.isObject();
        };
    }
}
