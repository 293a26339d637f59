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

import me.golemcore.chains.domain.exception.UnparsableOutputException;
import me.golemcore.chains.domain.model.AgentAction;
import me.golemcore.chains.domain.model.AgentActions;
import me.golemcore.chains.domain.model.AgentDecision;
import me.golemcore.chains.domain.model.AgentFinish;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the plain-text ReAct format:
 *
 * <pre>
 * Thought: I need to add numbers
 * Action: calculator
 * Action Input: 2 + 2
 * </pre>
 *
 * or {@code Final Answer: 4}. Marker case, spacing and the separator
 * ({@code :} or {@code -}) are not significant; quotes and backticks around
 * the tool name and input are stripped.
 */
public class ReActOutputParser implements AgentOutputParser {

    private static final Pattern FINAL_ANSWER = Pattern.compile("final\\s*answer\\s*[:\\-]\\s*(.*)",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern ACTION = Pattern.compile("^[\\s*]*action\\s*\\d*\\s*[:\\-]\\s*(.+?)\\s*$",
            Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);
    private static final Pattern ACTION_INPUT = Pattern.compile(
            "action\\s*\\d*\\s*input\\s*\\d*\\s*[:\\-]\\s*(.*?)(?:\\n\\s*observation\\s*[:\\-].*)?$",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    @Override
    public AgentDecision parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new UnparsableOutputException(raw, "empty output");
        }
        Matcher action = ACTION.matcher(raw);
        boolean hasAction = action.find();
        Matcher finalAnswer = FINAL_ANSWER.matcher(raw);
        boolean hasFinal = finalAnswer.find();

        if (hasFinal && (!hasAction || finalAnswer.start() < action.start())) {
            return new AgentFinish(finalAnswer.group(1).trim(), raw);
        }
        if (!hasAction) {
            throw new UnparsableOutputException(raw, "expected 'Action:' or 'Final Answer:'");
        }

        String tool = unquote(action.group(1));
        Matcher input = ACTION_INPUT.matcher(raw);
        if (!input.find(action.end())) {
            throw new UnparsableOutputException(raw, "missing 'Action Input:' after 'Action: " + tool + "'");
        }
        if (tool.isEmpty()) {
            throw new UnparsableOutputException(raw, "empty tool name");
        }
        return AgentActions.of(AgentAction.of(tool, unquote(input.group(1)), raw));
    }

    private static String unquote(String value) {
        String result = value.trim();
        while (result.length() >= 2 && isQuote(result.charAt(0)) && result.charAt(result.length() - 1) == result.charAt(0)) {
            result = result.substring(1, result.length() - 1).trim();
        }
        return result;
    }

    private static boolean isQuote(char c) {
        return c == '"' || c == '\'' || c == '`';
    }
}
