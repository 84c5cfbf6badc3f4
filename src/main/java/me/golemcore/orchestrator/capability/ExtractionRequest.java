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

import lombok.Builder;
import me.golemcore.orchestrator.capability.schema.SchemaDescription;

import java.time.Duration;
import java.util.Map;

/**
 * Input of a structured extraction. {@code maxAttempts} and {@code timeout}
 * fall back to configured defaults when null.
 */
@Builder
public record ExtractionRequest(String capability, SchemaDescription schema, String instruction,
        Map<String, Object> config, Integer maxAttempts, Duration timeout) {
}
