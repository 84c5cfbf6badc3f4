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

import java.util.Objects;

/**
 * Named, typed field of a {@link SchemaDescription}.
 */
public record SchemaField(String name, FieldType type, String description, boolean required) {

    public SchemaField {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
    }

    public static SchemaField required(String name, FieldType type, String description) {
        return new SchemaField(name, type, description, true);
    }

    public static SchemaField optional(String name, FieldType type, String description) {
        return new SchemaField(name, type, description, false);
    }
}
