package me.golemcore.chains.domain.exception;

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

import lombok.extern.slf4j.Slf4j;

import java.lang.reflect.InvocationTargetException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

/**
 * Maps model provider failures to stable {@code llm.*} reason codes. A code
 * already embedded in a message as {@code "[llm.x] ..."} wins over the
 * exception type.
 *
 * <p>
 * langchain4j exceptions are matched by simple class name so the domain does
 * not depend on the provider library at compile time.
 */
@Slf4j
public final class LlmErrorClassifier {

    public static final String REQUEST_ABORTED = "llm.request.aborted";
    public static final String REQUEST_TIMEOUT = "llm.request.timeout";
    public static final String CONTEXT_LENGTH_EXCEEDED = "llm.context.length_exceeded";
    public static final String PROVIDER_NOT_CONFIGURED = "llm.provider.not_configured";
    public static final String LANGCHAIN4J_RATE_LIMIT = "llm.langchain4j.rate_limit";
    public static final String LANGCHAIN4J_TIMEOUT = "llm.langchain4j.timeout";
    public static final String LANGCHAIN4J_AUTHENTICATION = "llm.langchain4j.authentication";
    public static final String LANGCHAIN4J_INVALID_REQUEST = "llm.langchain4j.invalid_request";
    public static final String LANGCHAIN4J_MODEL_NOT_FOUND = "llm.langchain4j.model_not_found";
    public static final String LANGCHAIN4J_CONTENT_FILTERED = "llm.langchain4j.content_filtered";
    public static final String LANGCHAIN4J_INTERNAL_SERVER = "llm.langchain4j.internal_server";
    public static final String LANGCHAIN4J_RETRIABLE = "llm.langchain4j.retriable";
    public static final String LANGCHAIN4J_ERROR = "llm.langchain4j.error";
    public static final String UNKNOWN = "llm.error.unknown";

    private static final String PROVIDER_PACKAGE = "dev.langchain4j.exception.";

    private static final Map<String, String> PROVIDER_CODES = Map.ofEntries(
            Map.entry("RateLimitException", LANGCHAIN4J_RATE_LIMIT),
            Map.entry("TimeoutException", LANGCHAIN4J_TIMEOUT),
            Map.entry("AuthenticationException", LANGCHAIN4J_AUTHENTICATION),
            Map.entry("InvalidRequestException", LANGCHAIN4J_INVALID_REQUEST),
            Map.entry("ModelNotFoundException", LANGCHAIN4J_MODEL_NOT_FOUND),
            Map.entry("ContentFilteredException", LANGCHAIN4J_CONTENT_FILTERED),
            Map.entry("InternalServerException", LANGCHAIN4J_INTERNAL_SERVER),
            Map.entry("RetriableException", LANGCHAIN4J_RETRIABLE),
            Map.entry("NonRetriableException", LANGCHAIN4J_ERROR),
            Map.entry("LangChain4jException", LANGCHAIN4J_ERROR));

    private static final Set<String> TRANSIENT_CODES = Set.of(
            LANGCHAIN4J_RATE_LIMIT,
            LANGCHAIN4J_TIMEOUT,
            LANGCHAIN4J_INTERNAL_SERVER,
            LANGCHAIN4J_RETRIABLE,
            REQUEST_TIMEOUT);

    private static final String[] CONTEXT_LENGTH_MARKERS = {
            "context length", "context window", "maximum context", "token limit exceeded", "prompt is too long"
    };

    private LlmErrorClassifier() {
    }

    /**
     * Walks the cause chain and returns the first code found, or
     * {@link #UNKNOWN}.
     */
    public static String classifyFromThrowable(Throwable throwable) {
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Throwable current = throwable; current != null && seen.add(current); current = current.getCause()) {
            String code = classifyOne(current);
            if (code != null) {
                return code;
            }
        }
        return UNKNOWN;
    }

    /**
     * Prefixes a message with {@code [code]} unless it already carries it.
     */
    public static String withCode(String code, String message) {
        String prefix = "[" + code + "]";
        if (message == null || message.isBlank()) {
            return prefix;
        }
        return message.startsWith(prefix) ? message : prefix + " " + message;
    }

    /**
     * Returns the {@code llm.*} code at the start of a message, if any.
     */
    public static String extractCode(String message) {
        if (message == null || !message.startsWith("[llm.")) {
            return null;
        }
        int end = message.indexOf(']');
        return end > 1 ? message.substring(1, end) : null;
    }

    public static boolean isTransientCode(String code) {
        return code != null && TRANSIENT_CODES.contains(code);
    }

    private static String classifyOne(Throwable error) {
        String embedded = extractCode(error.getMessage());
        if (embedded != null) {
            return embedded;
        }
        if (error instanceof CancellationException || error instanceof InterruptedException) {
            return REQUEST_ABORTED;
        }
        if (error instanceof SocketTimeoutException || error instanceof HttpTimeoutException
                || error instanceof TimeoutException) {
            return REQUEST_TIMEOUT;
        }
        String className = error.getClass().getName();
        if (className.startsWith(PROVIDER_PACKAGE)) {
            String simpleName = className.substring(PROVIDER_PACKAGE.length());
            if ("HttpException".equals(simpleName)) {
                return fromHttpStatus(statusCodeOf(error));
            }
            String code = PROVIDER_CODES.get(simpleName);
            if (code != null) {
                return code;
            }
        }
        return mentionsContextLength(error.getMessage()) ? CONTEXT_LENGTH_EXCEEDED : null;
    }

    private static String fromHttpStatus(Integer status) {
        if (status == null) {
            return LANGCHAIN4J_ERROR;
        }
        return switch (status) {
        case 429 -> LANGCHAIN4J_RATE_LIMIT;
        case 401, 403 -> LANGCHAIN4J_AUTHENTICATION;
        case 408, 504 -> LANGCHAIN4J_TIMEOUT;
        default -> status >= 500 ? LANGCHAIN4J_INTERNAL_SERVER
                : status >= 400 ? LANGCHAIN4J_INVALID_REQUEST : LANGCHAIN4J_ERROR;
        };
    }

    private static Integer statusCodeOf(Throwable error) {
        try {
            Object status = error.getClass().getMethod("statusCode").invoke(error);
            return status instanceof Integer code ? code : null;
        } catch (NoSuchMethodException | IllegalAccessException | InvocationTargetException e) {
            log.trace("[LLM] No status code on {}: {}", error.getClass().getSimpleName(), e.toString());
            return null;
        }
    }

    private static boolean mentionsContextLength(String message) {
        if (message == null) {
            return false;
        }
        String normalized = message.toLowerCase(Locale.ROOT);
        for (String marker : CONTEXT_LENGTH_MARKERS) {
            if (normalized.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
