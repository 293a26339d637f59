package me.golemcore.chains.adapter.outbound.llm;

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
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.anthropic.AnthropicStreamingChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.chat.response.StreamingChatResponseHandler;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiStreamingChatModel;
import dev.langchain4j.model.output.TokenUsage;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.chains.domain.exception.LlmErrorClassifier;
import me.golemcore.chains.domain.model.LlmChunk;
import me.golemcore.chains.domain.model.LlmRequest;
import me.golemcore.chains.domain.model.LlmResponse;
import me.golemcore.chains.domain.model.LlmUsage;
import me.golemcore.chains.domain.model.Message;
import me.golemcore.chains.domain.model.ToolCall;
import me.golemcore.chains.domain.model.ToolDefinition;
import me.golemcore.chains.infrastructure.config.ChainsProperties;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * LLM adapter on top of langchain4j.
 *
 * <p>
 * Supports any OpenAI-compatible endpoint and Anthropic, selected by
 * {@code chains.llm.api-type}. Tool definitions are sent as langchain4j tool
 * specifications and tool calls in the reply are mapped back to
 * {@link ToolCall}s. Rate limits are retried with exponential backoff,
 * honouring a server supplied {@code reset_seconds} when present.
 *
 * <p>
 * Provider ID: {@code "langchain4j"}
 */
@Slf4j
public class Langchain4jAdapter implements LlmProviderAdapter {

    public static final String PROVIDER_ID = "langchain4j";

    private static final int MAX_RETRIES = 5;
    private static final long INITIAL_BACKOFF_MS = 5_000;
    private static final double BACKOFF_MULTIPLIER = 2.0;
    private static final String API_TYPE_ANTHROPIC = "anthropic";
    private static final int ANTHROPIC_DEFAULT_MAX_TOKENS = 4096;
    private static final String SCHEMA_KEY_PROPERTIES = "properties";
    private static final Pattern RESET_SECONDS_PATTERN = Pattern.compile("\"reset_seconds\"\\s*:\\s*(\\d+)");
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final ChainsProperties.LlmProperties config;
    private final ObjectMapper objectMapper;

    private ChatModel chatModel;
    private StreamingChatModel streamingModel;
    private volatile boolean initialized;

    public Langchain4jAdapter(ChainsProperties properties, ObjectMapper objectMapper) {
        this.config = properties.getLlm();
        this.objectMapper = objectMapper;
    }

    /**
     * Visible for testing: uses the given models instead of building them from
     * configuration.
     */
    public Langchain4jAdapter(ChainsProperties properties, ObjectMapper objectMapper, ChatModel chatModel,
            StreamingChatModel streamingModel) {
        this(properties, objectMapper);
        this.chatModel = chatModel;
        this.streamingModel = streamingModel;
        this.initialized = true;
    }

    public synchronized void initialize() {
        if (initialized) {
            return;
        }
        if (config.getApiKey() == null || config.getApiKey().isBlank()) {
            throw new IllegalStateException(LlmErrorClassifier.withCode(LlmErrorClassifier.PROVIDER_NOT_CONFIGURED,
                    "Set chains.llm.api-key to use the langchain4j provider"));
        }
        boolean anthropic = API_TYPE_ANTHROPIC.equalsIgnoreCase(config.getApiType());
        this.chatModel = anthropic ? createAnthropicModel() : createOpenAiModel();
        if (config.isStreaming()) {
            this.streamingModel = anthropic ? createAnthropicStreamingModel() : createOpenAiStreamingModel();
        }
        initialized = true;
        log.info("[LLM] langchain4j adapter initialized: apiType={}, model={}, streaming={}",
                config.getApiType(), config.getModel(), streamingModel != null);
    }

    private ChatModel createOpenAiModel() {
        var builder = OpenAiChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(config.getModel())
                .maxRetries(0) // retried by the backoff loop
                .timeout(config.getTimeout())
                .temperature(config.getTemperature())
                .maxTokens(config.getMaxTokens());
        if (config.getBaseUrl() != null) {
            builder.baseUrl(config.getBaseUrl());
        }
        return builder.build();
    }

    private StreamingChatModel createOpenAiStreamingModel() {
        var builder = OpenAiStreamingChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(config.getModel())
                .timeout(config.getTimeout())
                .temperature(config.getTemperature())
                .maxTokens(config.getMaxTokens());
        if (config.getBaseUrl() != null) {
            builder.baseUrl(config.getBaseUrl());
        }
        return builder.build();
    }

    private ChatModel createAnthropicModel() {
        var builder = AnthropicChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(config.getModel())
                .maxRetries(0)
                .timeout(config.getTimeout())
                .temperature(config.getTemperature())
                .maxTokens(config.getMaxTokens() != null ? config.getMaxTokens() : ANTHROPIC_DEFAULT_MAX_TOKENS);
        if (config.getBaseUrl() != null) {
            builder.baseUrl(config.getBaseUrl());
        }
        return builder.build();
    }

    private StreamingChatModel createAnthropicStreamingModel() {
        var builder = AnthropicStreamingChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(config.getModel())
                .timeout(config.getTimeout())
                .temperature(config.getTemperature())
                .maxTokens(config.getMaxTokens() != null ? config.getMaxTokens() : ANTHROPIC_DEFAULT_MAX_TOKENS);
        if (config.getBaseUrl() != null) {
            builder.baseUrl(config.getBaseUrl());
        }
        return builder.build();
    }

    private void ensureInitialized() {
        if (!initialized) {
            initialize();
        }
    }

    @Override
    public String getProviderId() {
        return PROVIDER_ID;
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            ensureInitialized();
            ChatRequest chatRequest = toChatRequest(request);

            for (int attempt = 0; attempt <= MAX_RETRIES; attempt++) {
                try {
                    return convertResponse(chatModel.chat(chatRequest), request);
                } catch (RuntimeException e) {
                    if (!isRateLimitError(e) || attempt == MAX_RETRIES) {
                        log.error("[LLM] Chat failed", e);
                        throw new IllegalStateException("LLM chat failed: " + e.getMessage(), e);
                    }
                    backoff(attempt, e);
                }
            }
            throw new IllegalStateException("LLM chat failed: max retries exhausted");
        });
    }

    private void backoff(int attempt, Throwable error) {
        long exponentialBackoffMs = (long) (INITIAL_BACKOFF_MS * Math.pow(BACKOFF_MULTIPLIER, attempt));
        long resetSeconds = extractResetSeconds(error);
        long backoffMs = resetSeconds > 0
                ? Math.max(resetSeconds * 1000 + 1000, exponentialBackoffMs)
                : exponentialBackoffMs;
        log.warn("[LLM] Rate limit hit (attempt {}/{}), retrying in {}ms{}", attempt + 1, MAX_RETRIES, backoffMs,
                resetSeconds > 0 ? " (server requested " + resetSeconds + "s)" : "");
        sleepBeforeRetry(backoffMs);
    }

    protected void sleepBeforeRetry(long backoffMs) {
        try {
            Thread.sleep(backoffMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(LlmErrorClassifier.withCode(LlmErrorClassifier.REQUEST_ABORTED,
                    "LLM chat interrupted during retry backoff"), ie);
        }
    }

    @Override
    public Flux<LlmChunk> chatStream(LlmRequest request) {
        return Flux.defer(() -> {
            ensureInitialized();
            if (streamingModel == null) {
                return Mono.fromFuture(() -> chat(request))
                        .flux()
                        .map(response -> LlmChunk.builder()
                                .text(response.getContent())
                                .done(true)
                                .usage(response.getUsage())
                                .finishReason(response.getFinishReason())
                                .build());
            }
            ChatRequest chatRequest = toChatRequest(request);
            return Flux.<LlmChunk>create(sink -> streamingModel.chat(chatRequest,
                    new StreamingChatResponseHandler() {
                        @Override
                        public void onPartialResponse(String partialResponse) {
                            sink.next(LlmChunk.builder().text(partialResponse).build());
                        }

                        @Override
                        public void onCompleteResponse(ChatResponse response) {
                            sink.next(LlmChunk.builder()
                                    .done(true)
                                    .usage(convertUsage(response.tokenUsage(), request))
                                    .finishReason(finishReason(response))
                                    .build());
                            sink.complete();
                        }

                        @Override
                        public void onError(Throwable error) {
                            log.warn("[LLM] Streaming failed: {}", error.getMessage());
                            sink.error(error);
                        }
                    }));
        });
    }

    @Override
    public boolean supportsStreaming() {
        return config.isStreaming() || streamingModel != null;
    }

    @Override
    public String getCurrentModel() {
        return config.getModel();
    }

    @Override
    public boolean isAvailable() {
        return chatModel != null || (config.getApiKey() != null && !config.getApiKey().isBlank());
    }

    private ChatRequest toChatRequest(LlmRequest request) {
        ChatRequest.Builder builder = ChatRequest.builder()
                .messages(convertMessages(request.getMessages()));
        List<ToolSpecification> tools = convertTools(request.getTools());
        if (!tools.isEmpty()) {
            log.trace("[LLM] Calling model with {} tools", tools.size());
            builder.toolSpecifications(tools);
        }
        if (request.getModel() != null) {
            builder.modelName(request.getModel());
        }
        if (request.getTemperature() != null) {
            builder.temperature(request.getTemperature());
        }
        if (request.getMaxTokens() != null) {
            builder.maxOutputTokens(request.getMaxTokens());
        }
        if (request.getStopWords() != null && !request.getStopWords().isEmpty()) {
            builder.stopSequences(request.getStopWords());
        }
        return builder.build();
    }

    List<ChatMessage> convertMessages(List<Message> source) {
        List<ChatMessage> messages = new ArrayList<>();
        for (Message msg : source) {
            switch (msg.getRole()) {
            case SYSTEM -> {
                if (!msg.getContent().isBlank()) {
                    messages.add(SystemMessage.from(msg.getContent()));
                }
            }
            case HUMAN -> {
                if (msg.getContent().isBlank()) {
                    log.trace("[LLM] Skipping blank human message");
                } else {
                    messages.add(UserMessage.from(msg.getContent()));
                }
            }
            case AI -> {
                if (msg.hasToolCalls()) {
                    List<ToolExecutionRequest> toolRequests = msg.getToolCalls().stream()
                            .map(tc -> ToolExecutionRequest.builder()
                                    .id(tc.getId())
                                    .name(tc.getName())
                                    .arguments(convertArgsToJson(tc.getArguments()))
                                    .build())
                            .toList();
                    messages.add(msg.getContent().isBlank()
                            ? AiMessage.from(toolRequests)
                            : AiMessage.from(msg.getContent(), toolRequests));
                } else {
                    messages.add(AiMessage.from(msg.getContent()));
                }
            }
            case TOOL -> messages.add(ToolExecutionResultMessage.from(
                    msg.getToolCallId(), msg.getToolName(), msg.getContent()));
            }
        }
        return messages;
    }

    private List<ToolSpecification> convertTools(List<ToolDefinition> tools) {
        if (tools == null || tools.isEmpty()) {
            return Collections.emptyList();
        }
        return tools.stream().map(this::convertToolDefinition).toList();
    }

    @SuppressWarnings("unchecked")
    private ToolSpecification convertToolDefinition(ToolDefinition tool) {
        ToolSpecification.Builder builder = ToolSpecification.builder()
                .name(tool.getName())
                .description(tool.getDescription());

        Map<String, Object> schema = tool.getInputSchema();
        if (schema != null && schema.get(SCHEMA_KEY_PROPERTIES) instanceof Map<?, ?> properties) {
            JsonObjectSchema.Builder schemaBuilder = JsonObjectSchema.builder();
            for (Map.Entry<?, ?> entry : properties.entrySet()) {
                schemaBuilder.addProperty(String.valueOf(entry.getKey()),
                        toJsonSchemaElement((Map<String, Object>) entry.getValue()));
            }
            List<String> required = (List<String>) schema.get("required");
            if (required != null && !required.isEmpty()) {
                schemaBuilder.required(required);
            }
            builder.parameters(schemaBuilder.build());
        }
        return builder.build();
    }

    @SuppressWarnings("unchecked")
    private JsonSchemaElement toJsonSchemaElement(Map<String, Object> paramSchema) {
        String type = (String) paramSchema.get("type");
        String description = (String) paramSchema.get("description");
        boolean described = description != null && !description.isBlank();
        List<String> enumValues = (List<String>) paramSchema.get("enum");

        if (enumValues != null && !enumValues.isEmpty()) {
            JsonEnumSchema.Builder builder = JsonEnumSchema.builder().enumValues(enumValues);
            return described ? builder.description(description).build() : builder.build();
        }

        switch (type == null ? "string" : type) {
        case "integer" -> {
            JsonIntegerSchema.Builder builder = JsonIntegerSchema.builder();
            return described ? builder.description(description).build() : builder.build();
        }
        case "number" -> {
            JsonNumberSchema.Builder builder = JsonNumberSchema.builder();
            return described ? builder.description(description).build() : builder.build();
        }
        case "boolean" -> {
            JsonBooleanSchema.Builder builder = JsonBooleanSchema.builder();
            return described ? builder.description(description).build() : builder.build();
        }
        case "array" -> {
            JsonArraySchema.Builder builder = JsonArraySchema.builder();
            if (described) {
                builder.description(description);
            }
            if (paramSchema.get("items") instanceof Map<?, ?> items) {
                builder.items(toJsonSchemaElement((Map<String, Object>) items));
            }
            return builder.build();
        }
        case "object" -> {
            JsonObjectSchema.Builder builder = JsonObjectSchema.builder();
            if (described) {
                builder.description(description);
            }
            if (paramSchema.get(SCHEMA_KEY_PROPERTIES) instanceof Map<?, ?> nested) {
                for (Map.Entry<?, ?> entry : nested.entrySet()) {
                    builder.addProperty(String.valueOf(entry.getKey()),
                            toJsonSchemaElement((Map<String, Object>) entry.getValue()));
                }
            }
            return builder.build();
        }
        default -> {
            JsonStringSchema.Builder builder = JsonStringSchema.builder();
            return described ? builder.description(description).build() : builder.build();
        }
        }
    }

    private LlmResponse convertResponse(ChatResponse response, LlmRequest request) {
        AiMessage aiMessage = response.aiMessage();

        List<ToolCall> toolCalls = null;
        if (aiMessage.hasToolExecutionRequests()) {
            toolCalls = aiMessage.toolExecutionRequests().stream()
                    .map(ter -> ToolCall.builder()
                            .id(ter.id())
                            .name(ter.name())
                            .arguments(parseJsonArgs(ter.arguments()))
                            .build())
                    .toList();
            log.trace("[LLM] Parsed {} tool calls from response", toolCalls.size());
        }

        return LlmResponse.builder()
                .content(aiMessage.text() != null ? aiMessage.text() : "")
                .toolCalls(toolCalls)
                .usage(convertUsage(response.tokenUsage(), request))
                .model(request.getModel() != null ? request.getModel() : config.getModel())
                .finishReason(finishReason(response))
                .build();
    }

    private LlmUsage convertUsage(TokenUsage tokenUsage, LlmRequest request) {
        if (tokenUsage == null) {
            return null;
        }
        return LlmUsage.builder()
                .inputTokens(orZero(tokenUsage.inputTokenCount()))
                .outputTokens(orZero(tokenUsage.outputTokenCount()))
                .totalTokens(orZero(tokenUsage.totalTokenCount()))
                .model(request.getModel() != null ? request.getModel() : config.getModel())
                .build();
    }

    private static int orZero(Integer value) {
        return value != null ? value : 0;
    }

    private static String finishReason(ChatResponse response) {
        return response.finishReason() != null ? response.finishReason().name() : "stop";
    }

    private boolean isRateLimitError(Throwable e) {
        Throwable current = e;
        while (current != null) {
            // langchain4j maps HTTP 429 to RateLimitException regardless of body content
            if (current instanceof RateLimitException) {
                return true;
            }
            String msg = current.getMessage();
            if (msg != null && (msg.contains("rate_limit") || msg.contains("Too Many Requests")
                    || msg.contains("429") || msg.contains("model_cooldown"))) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private long extractResetSeconds(Throwable e) {
        Throwable current = e;
        while (current != null) {
            String msg = current.getMessage();
            if (msg != null && msg.contains("reset_seconds")) {
                Matcher matcher = RESET_SECONDS_PATTERN.matcher(msg);
                if (matcher.find()) {
                    return Long.parseLong(matcher.group(1));
                }
            }
            current = current.getCause();
        }
        return -1;
    }

    private String convertArgsToJson(Map<String, Object> args) {
        if (args == null || args.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(args);
        } catch (JsonProcessingException e) {
            log.warn("[LLM] Failed to serialize tool arguments: {}", e.getMessage());
            return "{}";
        }
    }

    private Map<String, Object> parseJsonArgs(String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE_REF);
        } catch (JsonProcessingException e) {
            log.warn("[LLM] Failed to parse tool arguments: {}", e.getMessage());
            return Collections.emptyMap();
        }
    }
}
