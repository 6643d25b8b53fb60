package me.golemcore.pilot.domain.system;

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
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the JSON object out of a structured-generation response. Providers
 * without a native JSON mode sometimes wrap the object in a markdown fence or
 * surround it with prose.
 */
public final class StructuredOutputReader {

    private static final Pattern FENCED_JSON = Pattern.compile("```(?:json)?\\s*(\\{.*})\\s*```", Pattern.DOTALL);

    private final ObjectMapper objectMapper;

    public StructuredOutputReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parses {@code raw} into a JSON object.
     *
     * @throws JsonProcessingException
     *             if no JSON object can be found or parsed
     */
    public ObjectNode readObject(String raw) throws JsonProcessingException {
        String json = extractJson(raw);
        if (json == null) {
            throw new StructuredOutputException("No JSON object in model response");
        }
        JsonNode node = objectMapper.readTree(json);
        if (!(node instanceof ObjectNode objectNode)) {
            throw new StructuredOutputException("Model response is not a JSON object");
        }
        return objectNode;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    static String extractJson(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String trimmed = raw.trim();
        if (trimmed.startsWith("{") && trimmed.endsWith("}")) {
            return trimmed;
        }
        Matcher fenced = FENCED_JSON.matcher(trimmed);
        if (fenced.find()) {
            return fenced.group(1);
        }
        int start = trimmed.indexOf('{');
        int end = trimmed.lastIndexOf('}');
        if (start >= 0 && end > start) {
            return trimmed.substring(start, end + 1);
        }
        return null;
    }

    /**
     * Raised when the response holds no usable JSON object.
     */
    public static class StructuredOutputException extends JsonProcessingException {

        private static final long serialVersionUID = 1L;

        public StructuredOutputException(String message) {
            super(message);
        }
    }
}
