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

/**
 * Builds the instruction for each extraction attempt. A pure function of the
 * base instruction, the attempt number and the previous validation error.
 */
public final class RetryInstructionPolicy {

    private RetryInstructionPolicy() {
    }

    /**
     * @param attempt
     *            1-based attempt number
     * @param lastError
     *            validation or invocation error of attempt {@code attempt - 1};
     *            ignored for the first attempt
     */
    public static String nextInstruction(String baseInstruction, int attempt, String lastError) {
        if (attempt <= 1 || lastError == null || lastError.isBlank()) {
            return baseInstruction;
        }
        return baseInstruction
                + "\n\n## Previous attempt rejected\n"
                + "Attempt " + (attempt - 1) + " did not conform to the schema: " + lastError + "\n"
                + "Respond again with a single JSON object that satisfies every required field and type.";
    }
}
