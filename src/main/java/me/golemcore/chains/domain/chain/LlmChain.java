package me.golemcore.chains.domain.chain;

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

import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.chains.domain.exception.ChainException;
import me.golemcore.chains.domain.exception.ChainsException;
import me.golemcore.chains.domain.exception.StreamingSinkException;
import me.golemcore.chains.domain.model.ChainResult;
import me.golemcore.chains.domain.model.ChainValues;
import me.golemcore.chains.domain.model.LlmChunk;
import me.golemcore.chains.domain.model.LlmRequest;
import me.golemcore.chains.domain.model.LlmResponse;
import me.golemcore.chains.domain.model.LlmUsage;
import me.golemcore.chains.domain.model.PromptValue;
import me.golemcore.chains.domain.model.ToolDefinition;
import me.golemcore.chains.domain.parser.SimpleOutputParser;
import me.golemcore.chains.domain.parser.TextOutputParser;
import me.golemcore.chains.domain.prompt.PromptFormatter;
import me.golemcore.chains.port.outbound.LlmPort;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Formats a prompt, makes one model call and stores the parsed completion
 * under {@link #getOutputKey()}.
 *
 * <p>
 * The prompt is formatted before the model is contacted, so missing or
 * malformed variables never cost a model call. With a streaming sink in the
 * call options each delta is handed to the sink in arrival order and the
 * returned text is exactly the concatenation of the deltas.
 */
@Slf4j
@Getter
public class LlmChain implements Chain {

    public static final String DEFAULT_OUTPUT_KEY = "text";

    private final LlmPort llmPort;
    private final PromptFormatter prompt;
    private final String outputKey;
    private final TextOutputParser outputParser;
    private final List<ToolDefinition> tools;
    private final ChainCallOptions defaultOptions;

    @Builder
    private LlmChain(LlmPort llmPort, PromptFormatter prompt, String outputKey, TextOutputParser outputParser,
            List<ToolDefinition> tools, ChainCallOptions defaultOptions) {
        this.llmPort = Objects.requireNonNull(llmPort, "llmPort");
        this.prompt = Objects.requireNonNull(prompt, "prompt");
        this.outputKey = outputKey != null ? outputKey : DEFAULT_OUTPUT_KEY;
        this.outputParser = outputParser != null ? outputParser : new SimpleOutputParser();
        this.tools = tools != null ? List.copyOf(tools) : List.of();
        this.defaultOptions = defaultOptions != null ? defaultOptions : ChainCallOptions.defaults();
        this.defaultOptions.validate();
    }

    @Override
    public CompletableFuture<ChainResult> call(ChainValues inputs, ChainCallOptions options) {
        CompletableFuture<LlmResponse> generation = generate(inputs, options);
        return ChainFutures.propagateCancellation(generation.thenApply(response -> {
            String text = outputParser.parse(response.getContent());
            return new ChainResult(ChainValues.of(outputKey, text), text, response.getUsage(), List.of());
        }), generation);
    }

    /**
     * Runs the model call and returns the raw response, including any tool
     * calls the model requested.
     */
    public CompletableFuture<LlmResponse> generate(ChainValues inputs, ChainCallOptions options) {
        ChainCallOptions effective;
        LlmRequest request;
        try {
            effective = defaultOptions.mergeWith(options);
            effective.validate();
            request = buildRequest(inputs, effective, effective.getStreamingSink() != null);
        } catch (ChainsException | IllegalArgumentException e) {
            return CompletableFuture.failedFuture(e);
        }

        StreamingSink sink = effective.getStreamingSink();
        if (sink == null) {
            return chatResponse(request);
        }
        if (!llmPort.supportsStreaming()) {
            log.debug("[Chain] Provider {} does not stream, delivering the completion as one delta",
                    llmPort.getProviderId());
            CompletableFuture<LlmResponse> response = chatResponse(request);
            return ChainFutures.propagateCancellation(response.thenApply(completed -> {
                deliver(sink, completed.getContent());
                return completed;
            }), response);
        }
        return streamResponse(request, sink);
    }

    @Override
    public Flux<String> stream(ChainValues inputs) {
        return Flux.defer(() -> llmPort.chatStream(buildRequest(inputs, defaultOptions, true)))
                .filter(LlmChunk::hasText)
                .map(LlmChunk::getText)
                .onErrorMap(e -> !(e instanceof ChainsException), e -> ChainFutures.toChainFailure(e, "Model stream"));
    }

    @Override
    public List<String> getInputKeys() {
        return List.copyOf(prompt.getInputVariables());
    }

    @Override
    public List<String> getOutputKeys() {
        return List.of(outputKey);
    }

    private LlmRequest buildRequest(ChainValues inputs, ChainCallOptions options, boolean stream) {
        PromptValue promptValue = prompt.formatPrompt(inputs);
        if (log.isTraceEnabled()) {
            log.trace("[Chain] Prompt:\n{}", promptValue.toText());
        }
        return LlmRequest.builder()
                .model(options.getModel())
                .messages(new ArrayList<>(promptValue.toMessages()))
                .tools(new ArrayList<>(tools))
                .temperature(options.getTemperature())
                .maxTokens(options.getMaxTokens())
                .stopWords(options.getStopWords() != null ? new ArrayList<>(options.getStopWords()) : new ArrayList<>())
                .stream(stream)
                .build();
    }

    private CompletableFuture<LlmResponse> chatResponse(LlmRequest request) {
        CompletableFuture<LlmResponse> future;
        try {
            future = llmPort.chat(request);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(ChainFutures.toChainFailure(e, "Model call"));
        }
        return ChainFutures.propagateCancellation(future.handle((response, error) -> {
            if (error != null) {
                RuntimeException failure = ChainFutures.toChainFailure(error, "Model call");
                log.warn("[Chain] Model call failed: {}", failure.getMessage());
                throw failure;
            }
            if (response == null) {
                throw new ChainException("Model call returned no response", null);
            }
            log.debug("[Chain] Model call completed, finishReason={}", response.getFinishReason());
            return response;
        }), future);
    }

    private CompletableFuture<LlmResponse> streamResponse(LlmRequest request, StreamingSink sink) {
        StringBuilder assembled = new StringBuilder();
        AtomicReference<LlmUsage> usage = new AtomicReference<>();
        AtomicReference<String> finishReason = new AtomicReference<>();

        return Flux.defer(() -> llmPort.chatStream(request))
                .<LlmChunk>handle((chunk, out) -> {
                    if (chunk.getUsage() != null) {
                        usage.set(chunk.getUsage());
                    }
                    if (chunk.getFinishReason() != null) {
                        finishReason.set(chunk.getFinishReason());
                    }
                    if (chunk.hasText()) {
                        try {
                            sink.onDelta(chunk.getText());
                        } catch (RuntimeException e) {
                            out.error(new StreamingSinkException(e));
                            return;
                        }
                        assembled.append(chunk.getText());
                    }
                    out.next(chunk);
                })
                .onErrorMap(e -> !(e instanceof ChainsException), e -> ChainFutures.toChainFailure(e, "Model stream"))
                .doOnError(e -> log.warn("[Chain] Streaming call aborted: {}", e.getMessage()))
                .then(Mono.fromSupplier(() -> LlmResponse.builder()
                        .content(assembled.toString())
                        .usage(usage.get())
                        .model(request.getModel() != null ? request.getModel() : llmPort.getCurrentModel())
                        .finishReason(finishReason.get() != null ? finishReason.get() : "stop")
                        .build()))
                .toFuture();
    }

    private static void deliver(StreamingSink sink, String text) {
        if (text == null || text.isEmpty()) {
            return;
        }
        try {
            sink.onDelta(text);
        } catch (RuntimeException e) {
            throw new StreamingSinkException(e);
        }
    }
}
