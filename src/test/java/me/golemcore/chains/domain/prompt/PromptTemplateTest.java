package me.golemcore.chains.domain.prompt;

import me.golemcore.chains.domain.exception.MissingVariableException;
import me.golemcore.chains.domain.model.ChainValues;
import me.golemcore.chains.domain.model.PromptValue;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PromptTemplateTest {

    private static final String JOKE_TEMPLATE = "Tell me a {adjective} joke about {content}.";

    @Test
    void shouldFormatWhenAllVariablesPresent() {
        PromptTemplate template = PromptTemplate.fromTemplate(JOKE_TEMPLATE);

        String result = template.format(Map.of("adjective", "funny", "content", "chickens"));

        assertEquals("Tell me a funny joke about chickens.", result);
        assertFalse(result.contains("{"));
    }

    @Test
    void shouldIgnoreExtraVariables() {
        PromptTemplate template = PromptTemplate.fromTemplate(JOKE_TEMPLATE);

        String result = template.format(Map.of("adjective", "dry", "content", "cats", "unused", "x"));

        assertEquals("Tell me a dry joke about cats.", result);
    }

    @Test
    void shouldFailWithMissingVariableBeforeRendering() {
        PromptTemplate template = PromptTemplate.fromTemplate(JOKE_TEMPLATE);

        MissingVariableException error = assertThrows(MissingVariableException.class,
                () -> template.format(Map.of("adjective", "funny")));

        assertEquals("content", error.getVariableName());
    }

    @Test
    void shouldRequireDeclaredVariablesEvenWhenUnused() {
        PromptTemplate template = new PromptTemplate("Hello {name}", TemplateFormat.FSTRING, List.of("locale"));

        assertEquals(Set.of("name", "locale"), template.getInputVariables());
        assertThrows(MissingVariableException.class, () -> template.format(Map.of("name", "Ann")));
    }

    @Test
    void shouldFormatJinja2Templates() {
        PromptTemplate template = PromptTemplate.jinja2("Question: {{ question }}");

        PromptValue value = template.formatPrompt(ChainValues.of("question", "Why?"));

        assertEquals("Question: Why?", value.toText());
        assertEquals(1, value.toMessages().size());
        assertEquals("Question: Why?", value.toMessages().get(0).getContent());
    }
}
