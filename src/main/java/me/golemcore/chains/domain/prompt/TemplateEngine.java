package me.golemcore.chains.domain.prompt;

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
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.chains.domain.exception.MalformedTemplateException;
import me.golemcore.chains.domain.exception.MissingVariableException;
import me.golemcore.chains.domain.model.Document;
import me.golemcore.chains.domain.model.Message;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Compiles templates into literal and variable segments and renders them.
 *
 * <p>
 * Compilation rejects unbalanced braces, empty or nested placeholders and
 * unsupported directives. Rendering checks every referenced variable before
 * producing any output, so a template never renders partially.
 */
public final class TemplateEngine {

    private static final Pattern VARIABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private TemplateEngine() {
    }

    /**
     * A compiled piece of a template: literal text when {@code variable} is
     * {@code null}, otherwise a placeholder.
     */
    public record Segment(String literal, String variable) {

        static Segment text(String literal) {
            return new Segment(literal, null);
        }

        static Segment placeholder(String variable) {
            return new Segment(null, variable);
        }

        public boolean isVariable() {
            return variable != null;
        }
    }

    /**
     * Compiles a template into segments.
     *
     * @throws MalformedTemplateException
     *             if the brace syntax is invalid
     */
    public static List<Segment> compile(String template, TemplateFormat format) {
        if (template == null) {
            throw new MalformedTemplateException(null, 0, "template must not be null");
        }
        return format == TemplateFormat.JINJA2 ? compileJinja2(template) : compileFString(template);
    }

    /**
     * Returns the variable names a template references, in order of first use.
     */
    public static Set<String> extractVariables(String template, TemplateFormat format) {
        return variablesOf(compile(template, format));
    }

    static Set<String> variablesOf(List<Segment> segments) {
        Set<String> names = new LinkedHashSet<>();
        for (Segment segment : segments) {
            if (segment.isVariable()) {
                names.add(segment.variable());
            }
        }
        return Collections.unmodifiableSet(names);
    }

    /**
     * Compiles and renders a template in one step.
     */
    public static String format(String template, TemplateFormat format, Map<String, ?> variables) {
        return render(compile(template, format), variables);
    }

    /**
     * Renders compiled segments against a variable mapping.
     *
     * @throws MissingVariableException
     *             naming the first referenced variable that is absent
     */
    public static String render(List<Segment> segments, Map<String, ?> variables) {
        for (Segment segment : segments) {
            if (segment.isVariable() && (variables == null || !variables.containsKey(segment.variable()))) {
                throw new MissingVariableException(segment.variable());
            }
        }
        StringBuilder sb = new StringBuilder();
        for (Segment segment : segments) {
            if (segment.isVariable()) {
                sb.append(renderValue(variables.get(segment.variable())));
            } else {
                sb.append(segment.literal());
            }
        }
        return sb.toString();
    }

    /**
     * Renders a variable value as prompt text. Message lists render as
     * {@code role: content} lines, documents as their content separated by blank
     * lines, other structured values as JSON.
     */
    public static String renderValue(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof CharSequence || value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        if (value instanceof Message message) {
            return Message.render(List.of(message));
        }
        if (value instanceof List<?> list && !list.isEmpty()
                && list.stream().allMatch(Message.class::isInstance)) {
            List<Message> messages = new ArrayList<>();
            list.forEach(item -> messages.add((Message) item));
            return Message.render(messages);
        }
        if (value instanceof List<?> list && !list.isEmpty()
                && list.stream().allMatch(Document.class::isInstance)) {
            StringBuilder sb = new StringBuilder();
            for (Object item : list) {
                if (!sb.isEmpty()) {
                    sb.append("\n\n");
                }
                sb.append(((Document) item).getPageContent());
            }
            return sb.toString();
        }
        if (value instanceof List<?> list && list.isEmpty()) {
            return "";
        }
        try {
            return OBJECT_MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value of type " + value.getClass().getName()
                    + " cannot be rendered into a prompt", e);
        }
    }

    private static List<Segment> compileFString(String template) {
        List<Segment> segments = new ArrayList<>();
        StringBuilder literal = new StringBuilder();
        int i = 0;
        int length = template.length();
        while (i < length) {
            char c = template.charAt(i);
            if (c == '{') {
                if (i + 1 < length && template.charAt(i + 1) == '{') {
                    literal.append('{');
                    i += 2;
                    continue;
                }
                int close = template.indexOf('}', i + 1);
                if (close < 0) {
                    throw new MalformedTemplateException(template, i, "unclosed '{'");
                }
                String body = template.substring(i + 1, close);
                if (body.indexOf('{') >= 0) {
                    throw new MalformedTemplateException(template, i, "nested placeholder");
                }
                String name = placeholderName(template, i, body);
                flush(literal, segments);
                segments.add(Segment.placeholder(name));
                i = close + 1;
            } else if (c == '}') {
                if (i + 1 < length && template.charAt(i + 1) == '}') {
                    literal.append('}');
                    i += 2;
                    continue;
                }
                throw new MalformedTemplateException(template, i, "unmatched '}'");
            } else {
                literal.append(c);
                i++;
            }
        }
        flush(literal, segments);
        return List.copyOf(segments);
    }

    private static List<Segment> compileJinja2(String template) {
        List<Segment> segments = new ArrayList<>();
        StringBuilder literal = new StringBuilder();
        int i = 0;
        int length = template.length();
        while (i < length) {
            if (template.startsWith("{%", i) || template.startsWith("{#", i)) {
                throw new MalformedTemplateException(template, i, "unsupported directive '"
                        + template.substring(i, i + 2) + "'");
            }
            if (template.startsWith("{{", i)) {
                int close = template.indexOf("}}", i + 2);
                if (close < 0) {
                    throw new MalformedTemplateException(template, i, "unclosed '{{'");
                }
                String body = template.substring(i + 2, close);
                if (body.indexOf('{') >= 0 || body.indexOf('}') >= 0) {
                    throw new MalformedTemplateException(template, i, "nested placeholder");
                }
                String name = placeholderName(template, i, body);
                flush(literal, segments);
                segments.add(Segment.placeholder(name));
                i = close + 2;
                continue;
            }
            if (template.startsWith("}}", i)) {
                throw new MalformedTemplateException(template, i, "unmatched '}}'");
            }
            literal.append(template.charAt(i));
            i++;
        }
        flush(literal, segments);
        return List.copyOf(segments);
    }

    private static String placeholderName(String template, int position, String body) {
        String name = body.trim();
        if (name.isEmpty()) {
            throw new MalformedTemplateException(template, position, "empty placeholder");
        }
        if (!VARIABLE_NAME.matcher(name).matches()) {
            throw new MalformedTemplateException(template, position, "unsupported placeholder '" + name + "'");
        }
        return name;
    }

    private static void flush(StringBuilder literal, List<Segment> segments) {
        if (!literal.isEmpty()) {
            segments.add(Segment.text(literal.toString()));
            literal.setLength(0);
        }
    }
}
