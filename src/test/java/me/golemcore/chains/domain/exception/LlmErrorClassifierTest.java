package me.golemcore.chains.domain.exception;

import dev.langchain4j.exception.AuthenticationException;
import dev.langchain4j.exception.ContentFilteredException;
import dev.langchain4j.exception.HttpException;
import dev.langchain4j.exception.InternalServerException;
import dev.langchain4j.exception.ModelNotFoundException;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.exception.TimeoutException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.net.SocketTimeoutException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LlmErrorClassifierTest {

    @Test
    void shouldClassifyRateLimitFromCauseChain() {
        Throwable throwable = new CompletionException(
                new RuntimeException("wrapper", new RateLimitException("too many requests")));

        assertEquals(LlmErrorClassifier.LANGCHAIN4J_RATE_LIMIT, LlmErrorClassifier.classifyFromThrowable(throwable));
    }

    @ParameterizedTest
    @CsvSource({
            "429, llm.langchain4j.rate_limit",
            "403, llm.langchain4j.authentication",
            "504, llm.langchain4j.timeout",
            "502, llm.langchain4j.internal_server",
            "422, llm.langchain4j.invalid_request"
    })
    void shouldClassifyHttpStatuses(int statusCode, String expectedCode) {
        assertEquals(expectedCode, LlmErrorClassifier.classifyFromThrowable(new HttpException(statusCode, "status")));
    }

    @Test
    void shouldClassifyProviderExceptions() {
        assertEquals(LlmErrorClassifier.LANGCHAIN4J_AUTHENTICATION,
                LlmErrorClassifier.classifyFromThrowable(new AuthenticationException("auth")));
        assertEquals(LlmErrorClassifier.LANGCHAIN4J_CONTENT_FILTERED,
                LlmErrorClassifier.classifyFromThrowable(new ContentFilteredException("filtered")));
        assertEquals(LlmErrorClassifier.LANGCHAIN4J_INTERNAL_SERVER,
                LlmErrorClassifier.classifyFromThrowable(new InternalServerException("internal")));
        assertEquals(LlmErrorClassifier.LANGCHAIN4J_MODEL_NOT_FOUND,
                LlmErrorClassifier.classifyFromThrowable(new ModelNotFoundException("gone")));
        assertEquals(LlmErrorClassifier.LANGCHAIN4J_TIMEOUT,
                LlmErrorClassifier.classifyFromThrowable(new TimeoutException("slow")));
    }

    @Test
    void shouldClassifyJdkAbortAndTimeout() {
        assertEquals(LlmErrorClassifier.REQUEST_ABORTED,
                LlmErrorClassifier.classifyFromThrowable(new CancellationException("cancelled")));
        assertEquals(LlmErrorClassifier.REQUEST_TIMEOUT,
                LlmErrorClassifier.classifyFromThrowable(new SocketTimeoutException("socket timeout")));
    }

    @Test
    void shouldDetectContextLengthFromMessage() {
        assertEquals(LlmErrorClassifier.CONTEXT_LENGTH_EXCEEDED, LlmErrorClassifier.classifyFromThrowable(
                new IllegalStateException("This model's maximum context length is 8192 tokens")));
    }

    @Test
    void shouldPreferEmbeddedCode() {
        assertEquals("llm.custom.synthetic", LlmErrorClassifier.classifyFromThrowable(
                new RateLimitException("[llm.custom.synthetic] explicit code")));
        assertNull(LlmErrorClassifier.extractCode("[other.code] ignored"));
        assertEquals(LlmErrorClassifier.UNKNOWN, LlmErrorClassifier.classifyFromThrowable(null));
    }

    @Test
    void shouldPrefixMessageOnce() {
        String once = LlmErrorClassifier.withCode(LlmErrorClassifier.REQUEST_TIMEOUT, "slow");

        assertEquals("[llm.request.timeout] slow", once);
        assertEquals(once, LlmErrorClassifier.withCode(LlmErrorClassifier.REQUEST_TIMEOUT, once));
        assertEquals("[llm.request.timeout]", LlmErrorClassifier.withCode(LlmErrorClassifier.REQUEST_TIMEOUT, null));
    }

    @Test
    void shouldTreatRateLimitAndTimeoutsAsTransient() {
        assertTrue(LlmErrorClassifier.isTransientCode(LlmErrorClassifier.LANGCHAIN4J_RATE_LIMIT));
        assertTrue(LlmErrorClassifier.isTransientCode(LlmErrorClassifier.REQUEST_TIMEOUT));
        assertFalse(LlmErrorClassifier.isTransientCode(LlmErrorClassifier.LANGCHAIN4J_AUTHENTICATION));
        assertFalse(LlmErrorClassifier.isTransientCode(null));
    }
}
