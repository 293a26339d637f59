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
import me.golemcore.chains.domain.component.MemoryComponent;
import me.golemcore.chains.domain.exception.ChainsException;
import me.golemcore.chains.domain.exception.MemoryException;
import me.golemcore.chains.domain.model.ChainResult;
import me.golemcore.chains.domain.model.ChainValues;
import me.golemcore.chains.domain.model.Message;
import me.golemcore.chains.domain.parser.TextOutputParser;
import me.golemcore.chains.domain.prompt.PromptFormatter;
import me.golemcore.chains.domain.prompt.PromptTemplate;
import me.golemcore.chains.port.outbound.LlmPort;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * LLM chain with conversation memory.
 *
 * <p>
 * Before formatting, the history loaded from memory is injected under
 * {@link #getMemoryKey()}. After the call completes successfully the human
 * input and the AI answer are appended to memory. A failed or cancelled call
 * leaves memory untouched. Without a memory the history is always empty and
 * nothing is saved.
 */
@Slf4j
@Getter
public class ConversationalChain implements Chain {

    public static final String DEFAULT_INPUT_KEY = "input";

    public static final String DEFAULT_TEMPLATE = """
            The following is a friendly conversation between a human and an AI. The AI is talkative and \
            provides lots of specific details from its context. If the AI does not know the answer to a \
            question, it truthfully says it does not know.

            Current conversation:
            {history}
            Human: {input}
            AI:""";

    private final LlmChain llmChain;
    private final MemoryComponent memory;
    private final String inputKey;
    private final String memoryKey;

    @Builder
    private ConversationalChain(LlmPort llmPort, PromptFormatter prompt, MemoryComponent memory, String inputKey,
            String memoryKey, String outputKey, TextOutputParser outputParser, ChainCallOptions defaultOptions) {
        this.llmChain = LlmChain.builder()
                .llmPort(llmPort)
                .prompt(prompt != null ? prompt : PromptTemplate.fromTemplate(DEFAULT_TEMPLATE))
                .outputKey(outputKey)
                .outputParser(outputParser)
                .defaultOptions(defaultOptions)
                .build();
        this.memory = memory;
        this.inputKey = inputKey != null ? inputKey : DEFAULT_INPUT_KEY;
        this.memoryKey = memoryKey != null ? memoryKey : MemoryComponent.DEFAULT_MEMORY_KEY;
    }

    @Override
    public CompletableFuture<ChainResult> call(ChainValues inputs, ChainCallOptions options) {
        String input;
        List<Message> history;
        try {
            input = inputs.getText(inputKey);
            history = ConversationMemory.load(memory);
        } catch (ChainsException e) {
            return CompletableFuture.failedFuture(e);
        }
        log.debug("[Chain] Conversational call with {} history messages", history.size());

        CompletableFuture<ChainResult> result = new CompletableFuture<>();
        CompletableFuture<ChainResult> inner = llmChain.call(inputs.with(memoryKey, history), options);
        ChainFutures.propagateCancellation(result, inner);
        inner.whenComplete((chainResult, error) -> {
            if (error != null) {
                result.completeExceptionally(ChainFutures.unwrap(error));
                return;
            }
            if (result.isDone()) {
                log.debug("[Chain] Call was cancelled, memory left unchanged");
                return;
            }
            try {
                ConversationMemory.saveTurn(memory, input, chainResult.text());
            } catch (MemoryException e) {
                result.completeExceptionally(e);
                return;
            }
            result.complete(chainResult);
        });
        return result;
    }

    @Override
    public List<String> getInputKeys() {
        List<String> keys = new ArrayList<>(llmChain.getInputKeys());
        keys.remove(memoryKey);
        if (!keys.contains(inputKey)) {
            keys.add(0, inputKey);
        }
        return keys;
    }

    @Override
    public List<String> getOutputKeys() {
        return llmChain.getOutputKeys();
    }
}
