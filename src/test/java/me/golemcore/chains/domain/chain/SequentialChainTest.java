package me.golemcore.chains.domain.chain;

import me.golemcore.chains.domain.exception.KeyMismatchException;
import me.golemcore.chains.domain.model.ChainResult;
import me.golemcore.chains.domain.model.ChainValues;
import me.golemcore.chains.domain.prompt.PromptTemplate;
import me.golemcore.chains.testsupport.ScriptedLlmPort;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SequentialChainTest {

    private final ScriptedLlmPort llm = new ScriptedLlmPort();

    private LlmChain llmChain(String template, String outputKey) {
        return LlmChain.builder()
                .llmPort(llm)
                .prompt(PromptTemplate.fromTemplate(template))
                .outputKey(outputKey)
                .build();
    }

    @Test
    void shouldPipeOutputsIntoNextChain() {
        llm.reply("X").reply("Review of X");
        LlmChain synopsis = llmChain("Write a synopsis of {title}", "output");
        LlmChain review = llmChain("Review this synopsis: {output}", "review");

        SequentialChain pipeline = SequentialChain.builder().chain(synopsis).chain(review).build();
        ChainResult result = pipeline.call(ChainValues.of("title", "Dune")).join();

        assertEquals("Review of X", result.text());
        assertEquals("X", result.outputs().get("output"));
        assertEquals("Review of X", result.outputs().get("review"));
        assertEquals("Review this synopsis: X", llm.lastRequest().getMessages().get(0).getContent());
        assertEquals(20, result.usage().getInputTokens());
        assertEquals(List.of("title"), pipeline.getInputKeys());
    }

    @Test
    void shouldNotAlterSecondChainResult() {
        llm.reply("X").reply("final");
        LlmChain first = llmChain("Step one for {topic}", "output");
        LlmChain second = llmChain("Step two with {output}", "text");
        SequentialChain pipeline = SequentialChain.builder().chain(first).chain(second).build();

        String composed = pipeline.run(ChainValues.of("topic", "t")).join();

        ScriptedLlmPort direct = new ScriptedLlmPort().reply("final");
        String alone = LlmChain.builder()
                .llmPort(direct)
                .prompt(PromptTemplate.fromTemplate("Step two with {output}"))
                .build()
                .run(ChainValues.of("output", "X"))
                .join();
        assertEquals(alone, composed);
        assertEquals(direct.lastRequest().getMessages(), llm.lastRequest().getMessages());
    }

    @Test
    void shouldRejectMissingInputKeyAtConstruction() {
        LlmChain first = llmChain("Summarize {text_in}", "output");
        LlmChain second = llmChain("Translate {foo}", "translation");

        KeyMismatchException error = assertThrows(KeyMismatchException.class,
                () -> SequentialChain.builder().chain(first).chain(second).build());

        assertTrue(error.getMessage().contains("foo"));
        assertEquals(0, llm.getCallCount());
    }

    @Test
    void shouldRejectOutputKeyCollision() {
        LlmChain first = llmChain("A {input}", "input");

        assertThrows(KeyMismatchException.class, () -> SequentialChain.builder().chain(first).build());
    }

    @Test
    void shouldRejectInputShadowingProducedKeyBeforeAnyModelCall() {
        llm.reply("Dune is a novel").reply("A classic");
        SequentialChain chain = SequentialChain.builder()
                .chain(llmChain("Describe {title}", "output"))
                .chain(llmChain("Review {output}", "review"))
                .build();

        CompletionException error = assertThrows(CompletionException.class,
                () -> chain.call(ChainValues.of("title", "Dune", "output", "stale")).join());

        KeyMismatchException mismatch = assertInstanceOf(KeyMismatchException.class, error.getCause());
        assertTrue(mismatch.getMessage().contains("output"));
        assertEquals(0, llm.getCallCount());
    }

    @Test
    void shouldRejectUnknownRequestedOutputKey() {
        LlmChain first = llmChain("A {input}", "output");

        assertThrows(KeyMismatchException.class,
                () -> SequentialChain.builder().chain(first).outputKeys(List.of("missing")).build());
    }

    @Test
    void shouldReturnOnlyRequestedOutputKeys() {
        llm.reply("one").reply("two");
        LlmChain first = llmChain("A {input}", "a");
        LlmChain second = llmChain("B {a}", "b");

        ChainResult result = SequentialChain.builder()
                .chain(first)
                .chain(second)
                .outputKeys(List.of("b"))
                .build()
                .call(ChainValues.of("input", "go"))
                .join();

        assertEquals(ChainValues.of("b", "two"), result.outputs());
    }
}
