package me.golemcore.chains.adapter.outbound.retrieval;

import me.golemcore.chains.domain.model.Document;
import me.golemcore.chains.port.outbound.VectorStorePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class VectorStoreRetrieverTest {

    private VectorStorePort vectorStore;

    @BeforeEach
    void setUp() {
        vectorStore = mock(VectorStorePort.class);
    }

    @Test
    void shouldUseDefaultTopKWhenNotGiven() {
        List<Document> found = List.of(Document.of("Oslo"));
        when(vectorStore.similaritySearch("capital", 4)).thenReturn(CompletableFuture.completedFuture(found));

        List<Document> result = new VectorStoreRetriever(vectorStore).getRelevantDocuments("capital", null).join();

        assertEquals(found, result);
    }

    @Test
    void shouldPassRequestedTopK() {
        when(vectorStore.similaritySearch("capital", 2)).thenReturn(CompletableFuture.completedFuture(null));

        List<Document> result = new VectorStoreRetriever(vectorStore, 8).getRelevantDocuments("capital", 2).join();

        assertTrue(result.isEmpty());
        verify(vectorStore).similaritySearch("capital", 2);
    }

    @Test
    void shouldDelegateDocumentIngestion() {
        List<Document> documents = List.of(Document.of("Oslo"));
        when(vectorStore.addDocuments(documents)).thenReturn(CompletableFuture.completedFuture(List.of("doc-1")));

        assertEquals(List.of("doc-1"), new VectorStoreRetriever(vectorStore).addDocuments(documents).join());
    }

    @Test
    void shouldRejectNonPositiveTopK() {
        assertThrows(IllegalArgumentException.class, () -> new VectorStoreRetriever(vectorStore, 0));
    }
}
