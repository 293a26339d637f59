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

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import me.golemcore.chains.domain.exception.MissingVariableException;
import me.golemcore.chains.domain.model.ChainValues;
import me.golemcore.chains.domain.model.PromptValue;
import me.golemcore.chains.domain.model.StringPromptValue;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Text template with named placeholders, compiled once at construction.
 *
 * <p>
 * The required variables are the placeholders found in the template plus any
 * names declared explicitly. Formatting fails before producing output when any
 * of them is missing.
 */
@Getter
@ToString(of = { "template", "format" })
@EqualsAndHashCode(of = { "template", "format", "inputVariables" })
public final class PromptTemplate implements PromptFormatter {

    private final String template;
    private final TemplateFormat format;
    private final Set<String> inputVariables;

    @Getter(lombok.AccessLevel.NONE)
    private final List<TemplateEngine.Segment> segments;

    public PromptTemplate(String template, TemplateFormat format, Collection<String> declaredVariables) {
        this.template = template;
        this.format = format != null ? format : TemplateFormat.FSTRING;
        this.segments = TemplateEngine.compile(template, this.format);
        Set<String> names = new LinkedHashSet<>(TemplateEngine.variablesOf(segments));
        if (declaredVariables != null) {
            names.addAll(declaredVariables);
        }
        this.inputVariables = Collections.unmodifiableSet(names);
    }

    /**
     * Creates a template using {@code {name}} placeholders.
     */
    public static PromptTemplate fromTemplate(String template) {
        return new PromptTemplate(template, TemplateFormat.FSTRING, null);
    }

    /**
     * Creates a template using {@code {{ name }}} placeholders.
     */
    public static PromptTemplate jinja2(String template) {
        return new PromptTemplate(template, TemplateFormat.JINJA2, null);
    }

    public String format(Map<String, ?> variables) {
        for (String name : inputVariables) {
            if (variables == null || !variables.containsKey(name)) {
                throw new MissingVariableException(name);
            }
        }
        return TemplateEngine.render(segments, variables);
    }

    public String format(ChainValues values) {
        return format(values.asMap());
    }

    @Override
    public PromptValue formatPrompt(ChainValues values) {
        return new StringPromptValue(format(values));
    }
}
