package me.golemcore.chains.domain.chain;

import me.golemcore.chains.adapter.outbound.memory.SimpleMemory;
import me.golemcore.chains.domain.component.MemoryComponent;
import me.golemcore.chains.domain.exception.ChainException;
import me.golemcore.chains.domain.exception.MemoryException;
import me.golemcore.chains.domain.model.ChainResult;
import me.golemcore.chains.domain.model.ChainValues;
import me.golemcore.chains.domain.model.Document;
import me.golemcore.chains.domain.model.Message;
import me.golemcore.chains.port.outbound.RetrieverPort;
import me.golemcore.chains.testsupport.ScriptedLlmPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RetrievalChainsTest {

    private static final List<Document> DOCUMENTS = List.of(
            Document.of("Oslo is the capital of Norway."),
            Document.of("Oslo has about 700,000 inhabitants."));

    @Mock
    private RetrieverPort retriever;

    private ScriptedLlmPort llm;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        llm = new ScriptedLlmPort();
    }

    @Test
    void stuffChainShouldJoinDocumentsIntoContext() {
        llm.reply("Oslo");
        StuffDocumentsChain chain = StuffDocumentsChain.qa(llm);

        ChainResult result = chain.call(ChainValues.of("input_documents", DOCUMENTS,
                "question", "What is the capital of Norway?")).join();

        assertEquals("Oslo", result.text());
        String prompt = llm.lastRequest().getMessages().get(0).getContent();
        assertTrue(prompt.contains("Oslo is the capital of Norway.\n\nOslo has about 700,000 inhabitants."));
        assertTrue(prompt.contains("Question:What is the capital of Norway?"));
        assertEquals(List.of("input_documents", "question"), chain.getInputKeys());
    }

    @Test
    void shouldAnswerWithoutCondensingWhenHistoryIsEmpty() {
        when(retriever.getRelevantDocuments(eq("Capital of Norway?"), isNull()))
                .thenReturn(CompletableFuture.completedFuture(DOCUMENTS));
        llm.reply("Oslo");
        SimpleMemory memory = new SimpleMemory();
        ConversationalRetrievalChain chain = ConversationalRetrievalChain.withDefaults(llm, retriever)
                .memory(memory)
                .returnSourceDocuments(true)
                .build();

        ChainResult result = chain.call(ChainValues.of("question", "Capital of Norway?")).join();

        assertEquals("Oslo", result.outputs().get("output"));
        assertEquals(DOCUMENTS, result.outputs().get("source_documents"));
        assertEquals(1, llm.getCallCount());
        assertEquals(List.of(Message.human("Capital of Norway?"), Message.ai("Oslo")), memory.load());
    }

    @Test
    void shouldCondenseFollowUpQuestionWithHistory() {
        when(retriever.getRelevantDocuments(eq("How many people live in Oslo?"), eq(2)))
                .thenReturn(CompletableFuture.completedFuture(DOCUMENTS));
        llm.reply("  How many people live in Oslo?  ").reply("About 700,000.");
        SimpleMemory memory = new SimpleMemory();
        memory.save(Message.human("Capital of Norway?"), Message.ai("Oslo"));
        ConversationalRetrievalChain chain = ConversationalRetrievalChain.withDefaults(llm, retriever)
                .memory(memory)
                .returnGeneratedQuestion(true)
                .build();

        ChainResult result = chain.call(ChainValues.of("question", "How many people live there?"),
                ChainCallOptions.builder().topK(2).build()).join();

        assertEquals("About 700,000.", result.text());
        assertEquals("How many people live in Oslo?", result.outputs().get("generated_question"));
        assertEquals(20, result.usage().getInputTokens());
        String condensePrompt = llm.getRequests().get(0).getMessages().get(0).getContent();
        assertTrue(condensePrompt.contains("human: Capital of Norway?\nai: Oslo"));
        assertEquals(4, memory.load().size());
    }

    @Test
    void shouldSkipCondensingWhenRephraseDisabled() {
        when(retriever.getRelevantDocuments(eq("How many people live there?"), isNull()))
                .thenReturn(CompletableFuture.completedFuture(List.of()));
        llm.reply("I don't know.");
        SimpleMemory memory = new SimpleMemory();
        memory.save(Message.human("Capital of Norway?"), Message.ai("Oslo"));

        ConversationalRetrievalChain.withDefaults(llm, retriever)
                .memory(memory)
                .rephraseQuestion(false)
                .build()
                .call(ChainValues.of("question", "How many people live there?"))
                .join();

        assertEquals(1, llm.getCallCount());
        verify(retriever).getRelevantDocuments(eq("How many people live there?"), isNull());
    }

    @Test
    void shouldWrapRetrieverFailureAndKeepMemoryUnchanged() {
        when(retriever.getRelevantDocuments(anyString(), isNull()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("index offline")));
        SimpleMemory memory = new SimpleMemory();
        ConversationalRetrievalChain chain = ConversationalRetrievalChain.withDefaults(llm, retriever)
                .memory(memory)
                .build();

        CompletionException error = assertThrows(CompletionException.class,
                () -> chain.call(ChainValues.of("question", "anything")).join());

        assertInstanceOf(ChainException.class, error.getCause());
        assertTrue(error.getCause().getMessage().contains("index offline"));
        assertEquals(0, llm.getCallCount());
        assertTrue(memory.load().isEmpty());
    }

    @Test
    void shouldFailWhenMemorySaveThrows() {
        when(retriever.getRelevantDocuments(anyString(), isNull()))
                .thenReturn(CompletableFuture.completedFuture(DOCUMENTS));
        llm.reply("About 700,000.");
        MemoryComponent failing = mock(MemoryComponent.class);
        when(failing.load()).thenReturn(List.of());
        doThrow(new IllegalStateException("disk full")).when(failing).save(any(), any());
        ConversationalRetrievalChain chain = ConversationalRetrievalChain.withDefaults(llm, retriever)
                .memory(failing)
                .build();

        CompletableFuture<ChainResult> call = chain.call(ChainValues.of("question", "How many people live in Oslo?"));

        assertTrue(call.isDone());
        CompletionException error = assertThrows(CompletionException.class, call::join);
        assertInstanceOf(MemoryException.class, error.getCause());
    }

    @Test
    void shouldCancelPendingRetrievalAndSkipAnswer() {
        CompletableFuture<List<Document>> pending = new CompletableFuture<>();
        when(retriever.getRelevantDocuments(anyString(), isNull())).thenReturn(pending);
        SimpleMemory memory = new SimpleMemory();
        ConversationalRetrievalChain chain = ConversationalRetrievalChain.withDefaults(llm, retriever)
                .memory(memory)
                .build();

        CompletableFuture<ChainResult> call = chain.call(ChainValues.of("question", "How many people live in Oslo?"));
        call.cancel(true);

        assertTrue(pending.isCancelled());
        assertEquals(0, llm.getCallCount());
        assertTrue(memory.load().isEmpty());
    }
}
