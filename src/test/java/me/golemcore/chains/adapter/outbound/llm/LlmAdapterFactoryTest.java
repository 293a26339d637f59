package me.golemcore.chains.adapter.outbound.llm;

import me.golemcore.chains.domain.model.LlmRequest;
import me.golemcore.chains.domain.model.LlmResponse;
import me.golemcore.chains.infrastructure.config.ChainsProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class LlmAdapterFactoryTest {

    private ChainsProperties properties;
    private LlmProviderAdapter remote;
    private NoOpLlmAdapter noOp;

    @BeforeEach
    void setUp() {
        properties = new ChainsProperties();
        remote = mock(LlmProviderAdapter.class);
        when(remote.getProviderId()).thenReturn("langchain4j");
        when(remote.isAvailable()).thenReturn(true);
        when(remote.getCurrentModel()).thenReturn("gpt-4o-mini");
        noOp = new NoOpLlmAdapter();
    }

    @Test
    void shouldSelectConfiguredProvider() {
        properties.getLlm().setProvider("langchain4j");
        LlmRequest request = LlmRequest.builder().build();
        when(remote.chat(request)).thenReturn(CompletableFuture.completedFuture(
                LlmResponse.builder().content("remote").build()));

        LlmAdapterFactory factory = new LlmAdapterFactory(properties, List.of(noOp, remote));

        assertSame(remote, factory.getActiveAdapter());
        assertEquals("langchain4j", factory.getProviderId());
        assertEquals("gpt-4o-mini", factory.getCurrentModel());
        assertEquals("remote", factory.chat(request).join().getContent());
        verify(remote).chat(request);
    }

    @Test
    void shouldFallBackToNoOpForUnknownProvider() {
        properties.getLlm().setProvider("unknown");

        LlmAdapterFactory factory = new LlmAdapterFactory(properties, List.of(remote, noOp));

        assertSame(noOp, factory.getActiveAdapter());
        assertFalse(factory.isAvailable());
    }

    @Test
    void shouldFallBackToFirstAdapterWithoutNoOp() {
        properties.getLlm().setProvider("unknown");

        LlmAdapterFactory factory = new LlmAdapterFactory(properties, List.of(remote));

        assertSame(remote, factory.getActiveAdapter());
    }

    @Test
    void shouldReportProviderAvailability() {
        LlmAdapterFactory factory = new LlmAdapterFactory(properties, List.of(noOp, remote));

        assertTrue(factory.isProviderAvailable("langchain4j"));
        assertFalse(factory.isProviderAvailable("none"));
        assertFalse(factory.isProviderAvailable("missing"));
        assertSame(remote, factory.getAdapter("langchain4j"));
    }

    @Test
    void shouldFailWhenNoAdapterRegistered() {
        LlmAdapterFactory factory = new LlmAdapterFactory(properties, List.of());

        CompletionException error = assertThrows(CompletionException.class,
                () -> factory.chat(LlmRequest.builder().build()).join());

        assertInstanceOf(IllegalStateException.class, error.getCause());
        assertTrue(error.getCause().getMessage().startsWith("[llm.provider.not_configured]"));
        StepVerifier.create(factory.chatStream(LlmRequest.builder().build()))
                .expectError(IllegalStateException.class)
                .verify();
        assertFalse(factory.supportsStreaming());
    }

    @Test
    void shouldDelegateStreamingSupport() {
        properties.getLlm().setProvider("langchain4j");
        when(remote.supportsStreaming()).thenReturn(true);
        when(remote.chatStream(any())).thenReturn(Flux.empty());

        LlmAdapterFactory factory = new LlmAdapterFactory(properties, List.of(remote));

        assertTrue(factory.supportsStreaming());
        StepVerifier.create(factory.chatStream(LlmRequest.builder().build())).verifyComplete();
    }
}
