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

import java.util.List;
import java.util.Objects;

/**
 * Structural description of an expected JSON object, independent of any
 * particular schema library.
 */
public record SchemaDescription(String name, List<SchemaField> fields) {

    public SchemaDescription {
        Objects.requireNonNull(name, "name");
        fields = fields != null ? List.copyOf(fields) : List.of();
    }

    public static SchemaDescription of(String name, SchemaField... fields) {
        return new SchemaDescription(name, List.of(fields));
    }

    /**
     * Human and model readable rendering used in extraction prompts.
     */
    public String render() {
        StringBuilder sb = new StringBuilder();
        sb.append("Object \"").append(name).append("\" with fields:\n");
        for (SchemaField field : fields) {
            sb.append("- ").append(field.name()).append(" (").append(field.type().getJsonName())
                    .append(field.required() ? ", required" : ", optional").append(')');
            if (field.description() != null && !field.description().isBlank()) {
                sb.append(": ").append(field.description());
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
