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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Locates and repairs the JSON object models put in their replies: fenced or
 * bare, with trailing commas or cut off before the closing braces.
 */
public final class JsonRepair {

    private static final Pattern FENCED_BLOCK = Pattern.compile("```(?:json)?[ \\t]*\\r?\\n?(.*?)(?:```|$)",
            Pattern.DOTALL | Pattern.CASE_INSENSITIVE);

    private JsonRepair() {
    }

    /**
     * Returns the JSON candidate inside {@code text}: the first fenced block
     * holding an object, otherwise everything from the first {@code '{'}.
     * Returns {@code null} when the text has no object at all.
     */
    public static String extractJson(String text) {
        if (text == null) {
            return null;
        }
        Matcher matcher = FENCED_BLOCK.matcher(text);
        while (matcher.find()) {
            String body = matcher.group(1).trim();
            int start = body.indexOf('{');
            if (start >= 0) {
                return body.substring(start);
            }
        }
        int start = text.indexOf('{');
        if (start < 0) {
            return null;
        }
        int end = text.lastIndexOf('}');
        return end > start ? text.substring(start, end + 1) : text.substring(start);
    }

    /**
     * Drops trailing commas, closes an unterminated string and appends the
     * missing closing brackets in the right order.
     */
    public static String repair(String json) {
        if (json == null) {
            return null;
        }
        StringBuilder out = new StringBuilder(json.length() + 8);
        Deque<Character> open = new ArrayDeque<>();
        boolean inString = false;
        boolean escaped = false;

        for (int i = 0; i < json.length(); i++) {
            char c = json.charAt(i);
            if (inString) {
                out.append(c);
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            switch (c) {
            case '"' -> {
                inString = true;
                out.append(c);
            }
            case '{' -> {
                open.push('}');
                out.append(c);
            }
            case '[' -> {
                open.push(']');
                out.append(c);
            }
            case '}', ']' -> {
                stripTrailingComma(out);
                if (!open.isEmpty() && open.peek() == c) {
                    open.pop();
                    out.append(c);
                } else if (open.isEmpty()) {
                    // stray closer after the top-level value
                    return finish(out, open, false);
                } else {
                    out.append(open.pop());
                }
            }
            default -> out.append(c);
            }
            if (open.isEmpty() && out.length() > 0 && (c == '}' || c == ']')) {
                return out.toString();
            }
        }
        return finish(out, open, inString);
    }

    private static String finish(StringBuilder out, Deque<Character> open, boolean inString) {
        if (inString) {
            out.append('"');
        }
        stripTrailingComma(out);
        while (!open.isEmpty()) {
            stripTrailingComma(out);
            out.append(open.pop());
        }
        return out.toString();
    }

    private static void stripTrailingComma(StringBuilder out) {
        int i = out.length() - 1;
        while (i >= 0 && Character.isWhitespace(out.charAt(i))) {
            i--;
        }
        if (i >= 0 && out.charAt(i) == ',') {
            out.setLength(i);
        }
    }
}
