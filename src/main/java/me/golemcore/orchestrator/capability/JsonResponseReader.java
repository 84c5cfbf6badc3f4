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
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads capability output into a JSON tree. Text output may wrap the JSON in a
 * markdown code block or surround it with prose.
 */
@Component
public class JsonResponseReader {

    private static final Pattern CODE_BLOCK_PATTERN = Pattern.compile("```(?:json)?\\s*([\\[{].*?[]}])\\s*```",
            Pattern.DOTALL);

    private final ObjectMapper objectMapper;

    public JsonResponseReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws JsonProcessingException
     *             if text output holds no parseable JSON
     */
    public JsonNode read(Object output) throws JsonProcessingException {
        if (output == null) {
            throw new IllegalArgumentException("Capability returned no output");
        }
        if (output instanceof JsonNode node) {
            return node;
        }
        if (output instanceof CharSequence text) {
            return objectMapper.readTree(extractJson(text.toString()));
        }
        return objectMapper.valueToTree(output);
    }

    String extractJson(String response) {
        Matcher blockMatcher = CODE_BLOCK_PATTERN.matcher(response);
        if (blockMatcher.find()) {
            return blockMatcher.group(1);
        }

        String trimmed = response.trim();
        if (trimmed.startsWith("{") || trimmed.startsWith("[")) {
            return trimmed;
        }

        // Prose around a single object
        int start = trimmed.indexOf('{');
        int end = trimmed.lastIndexOf('}');
        if (start >= 0 && end > start) {
            return trimmed.substring(start, end + 1);
        }
        return trimmed;
    }
}
