package me.golemcore.orchestrator.domain.exception;

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

import me.golemcore.orchestrator.domain.model.FailureKind;

/**
 * Structured extraction did not produce a schema-conforming value within its
 * attempt bound.
 */
public class ExtractionFailedException extends OrchestratorException {

    private final int attempts;

    public ExtractionFailedException(String message, int attempts, Throwable cause) {
        super(FailureKind.EXTRACTION_FAILED, message, cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
