package me.golemcore.chains.domain.agent;

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
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.chains.domain.model.ToolDefinition;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Conversions between the action input text a model produced and what tools
 * and providers expect.
 */
@Slf4j
final class ToolInputs {

    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    ToolInputs(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * {@code {"input": "x"}} becomes {@code x}; any other JSON object is passed
     * as compact JSON; plain text is passed verbatim.
     */
    String normalize(String actionInput) {
        if (actionInput == null) {
            return "";
        }
        String trimmed = actionInput.trim();
        if (!trimmed.startsWith("{")) {
            return actionInput;
        }
        try {
            JsonNode node = objectMapper.readTree(trimmed);
            if (node.isObject() && node.size() == 1 && node.has(ToolDefinition.INPUT_PARAMETER)
                    && node.get(ToolDefinition.INPUT_PARAMETER).isTextual()) {
                return node.get(ToolDefinition.INPUT_PARAMETER).asText();
            }
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            log.trace("[Agent] Action input is not JSON, passing it verbatim: {}", e.getOriginalMessage());
            return actionInput;
        }
    }

    /**
     * Argument map for a native tool call. Non-object input is wrapped as
     * {@code {"input": text}}.
     */
    Map<String, Object> toArguments(String actionInput) {
        String trimmed = actionInput == null ? "" : actionInput.trim();
        if (trimmed.startsWith("{")) {
            try {
                return objectMapper.readValue(trimmed, MAP_TYPE_REF);
            } catch (JsonProcessingException e) {
                log.trace("[Agent] Action input is not a JSON object, wrapping as text: {}", e.getOriginalMessage());
            }
        }
        Map<String, Object> arguments = new LinkedHashMap<>();
        arguments.put(ToolDefinition.INPUT_PARAMETER, actionInput == null ? "" : actionInput);
        return arguments;
    }

    /**
     * Compact JSON of a native tool call's arguments.
     */
    String toActionInput(Map<String, Object> arguments) {
        if (arguments == null || arguments.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(arguments);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Tool arguments are not serializable", e);
        }
    }
}
