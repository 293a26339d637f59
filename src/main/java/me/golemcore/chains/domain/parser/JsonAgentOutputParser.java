package me.golemcore.chains.domain.parser;

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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.chains.domain.exception.UnparsableOutputException;
import me.golemcore.chains.domain.model.AgentAction;
import me.golemcore.chains.domain.model.AgentActions;
import me.golemcore.chains.domain.model.AgentDecision;
import me.golemcore.chains.domain.model.AgentFinish;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the JSON reply format used by the conversational agent:
 *
 * <pre>
 * {"action": "calculator", "action_input": {"input": "2+2"}}
 * {"final_answer": "4"}
 * </pre>
 *
 * <p>
 * {@code {"action": "Final Answer", "action_input": ...}} is also a finish.
 * Replies are read from a fenced block or bare text; broken JSON is repaired
 * with {@link JsonRepair} and, as a last resort, the keys are matched with
 * regular expressions.
 */
@Slf4j
public class JsonAgentOutputParser implements AgentOutputParser {

    static final String FINAL_ANSWER_KEY = "final_answer";
    static final String ACTION_KEY = "action";
    static final String ACTION_INPUT_KEY = "action_input";
    static final String FINAL_ANSWER_ACTION = "Final Answer";

    private static final Pattern FINAL_ANSWER_FALLBACK = Pattern.compile(
            "\"final_answer\"\\s*:\\s*\"((?:[^\"\\\\]|\\\\.)*)\"?", Pattern.DOTALL);
    private static final Pattern ACTION_FALLBACK = Pattern.compile("\"action\"\\s*:\\s*\"([^\"]*)\"");
    private static final Pattern ACTION_INPUT_FALLBACK = Pattern.compile(
            "\"action_input\"\\s*:\\s*(\"(?:[^\"\\\\]|\\\\.)*\"|\\{.*}|[^,}\\n]+)", Pattern.DOTALL);

    private final ObjectMapper objectMapper;

    public JsonAgentOutputParser() {
        this(new ObjectMapper());
    }

    public JsonAgentOutputParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public AgentDecision parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new UnparsableOutputException(raw, "empty output");
        }

        String candidate = JsonRepair.extractJson(raw);
        if (candidate != null) {
            JsonNode node = readLeniently(candidate);
            if (node != null && node.isObject()) {
                AgentDecision decision = fromNode(node, raw);
                if (decision != null) {
                    return decision;
                }
            }
        }

        AgentDecision fallback = fromRegex(raw);
        if (fallback != null) {
            log.debug("[Agent] Parsed output with regex fallback");
            return fallback;
        }
        throw new UnparsableOutputException(raw, "expected a JSON object with 'action' or 'final_answer'");
    }

    private JsonNode readLeniently(String candidate) {
        try {
            return objectMapper.readTree(candidate);
        } catch (JsonProcessingException e) {
            log.trace("[Agent] Output is not valid JSON, repairing: {}", e.getOriginalMessage());
        }
        try {
            return objectMapper.readTree(JsonRepair.repair(candidate));
        } catch (JsonProcessingException e) {
            log.trace("[Agent] Repaired output is still not valid JSON: {}", e.getOriginalMessage());
            return null;
        }
    }

    private AgentDecision fromNode(JsonNode node, String raw) {
        if (node.has(FINAL_ANSWER_KEY)) {
            return new AgentFinish(nodeText(node.get(FINAL_ANSWER_KEY)), raw);
        }
        if (node.has(ACTION_KEY)) {
            String action = node.get(ACTION_KEY).asText().trim();
            String input = nodeText(node.get(ACTION_INPUT_KEY));
            if (FINAL_ANSWER_ACTION.equalsIgnoreCase(action)) {
                return new AgentFinish(input, raw);
            }
            return AgentActions.of(AgentAction.of(action, input, raw));
        }
        return null;
    }

    private AgentDecision fromRegex(String raw) {
        Matcher finalAnswer = FINAL_ANSWER_FALLBACK.matcher(raw);
        if (finalAnswer.find()) {
            return new AgentFinish(unescape(finalAnswer.group(1)), raw);
        }
        Matcher action = ACTION_FALLBACK.matcher(raw);
        if (!action.find()) {
            return null;
        }
        String tool = action.group(1).trim();
        String input = "";
        Matcher actionInput = ACTION_INPUT_FALLBACK.matcher(raw);
        if (actionInput.find()) {
            input = actionInput.group(1).trim();
            if (input.length() >= 2 && input.startsWith("\"") && input.endsWith("\"")) {
                input = unescape(input.substring(1, input.length() - 1));
            }
        }
        if (FINAL_ANSWER_ACTION.equalsIgnoreCase(tool)) {
            return new AgentFinish(input, raw);
        }
        return AgentActions.of(AgentAction.of(tool, input, raw));
    }

    private String nodeText(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return "";
        }
        if (value.isValueNode()) {
            return value.asText();
        }
        return value.toString();
    }

    private String unescape(String text) {
        try {
            return objectMapper.readValue("\"" + text + "\"", String.class);
        } catch (JsonProcessingException e) {
            log.trace("[Agent] Keeping raw escape sequences: {}", e.getOriginalMessage());
            return text;
        }
    }
}
