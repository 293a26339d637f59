package me.golemcore.chains.domain.prompt;

import me.golemcore.chains.domain.exception.MalformedTemplateException;
import me.golemcore.chains.domain.exception.MissingVariableException;
import me.golemcore.chains.domain.model.ChainValues;
import me.golemcore.chains.domain.model.Message;
import me.golemcore.chains.domain.model.MessageRole;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class MessageFormatterTest {

    private static final String HISTORY = "history";
    private static final Message SYSTEM = Message.system("You are terse.");

    private final MessageFormatter formatter = MessageFormatter.of(
            new LiteralMessage(SYSTEM),
            TemplatedMessage.human("Topic: {topic}"),
            new HistoryPlaceholder(HISTORY));

    @Test
    void shouldProduceTwoPlusHistoryMessagesInOrder() {
        List<Message> history = List.of(Message.human("a"), Message.ai("b"), Message.human("c"));
        ChainValues values = ChainValues.of("topic", "rust", HISTORY, history);

        List<Message> messages = formatter.formatMessages(values);

        assertEquals(5, messages.size());
        assertEquals(SYSTEM, messages.get(0));
        assertEquals(MessageRole.HUMAN, messages.get(1).getRole());
        assertEquals("Topic: rust", messages.get(1).getContent());
        assertEquals(history, messages.subList(2, 5));
    }

    @Test
    void shouldBeIdempotent() {
        ChainValues values = ChainValues.of("topic", "go", HISTORY, List.of(Message.ai("x")));

        assertEquals(formatter.formatMessages(values), formatter.formatMessages(values));
    }

    @Test
    void shouldExposeInputVariablesOfAllNodes() {
        assertEquals(Set.of("topic", HISTORY), formatter.getInputVariables());
    }

    @Test
    void shouldFailWhenHistoryIsMissing() {
        MissingVariableException error = assertThrows(MissingVariableException.class,
                () -> formatter.formatMessages(ChainValues.of("topic", "java")));

        assertEquals(HISTORY, error.getVariableName());
    }

    @Test
    void shouldRejectHistoryOfWrongType() {
        ChainValues values = ChainValues.of("topic", "java", HISTORY, "not a list");

        assertThrows(MalformedTemplateException.class, () -> formatter.formatMessages(values));
    }

    @Test
    void shouldRenderChatPromptAsText() {
        ChainValues values = ChainValues.of("topic", "kotlin", HISTORY, List.of());

        assertEquals("system: You are terse.\nhuman: Topic: kotlin", formatter.formatPrompt(values).toText());
    }
}
