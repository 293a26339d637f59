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
import me.golemcore.chains.domain.model.Document;
import me.golemcore.chains.domain.model.LlmUsage;
import me.golemcore.chains.domain.model.Message;
import me.golemcore.chains.port.outbound.LlmPort;
import me.golemcore.chains.port.outbound.RetrieverPort;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Question answering over retrieved documents with conversation memory.
 *
 * <p>
 * When memory holds a history and rephrasing is enabled, the follow-up
 * question is first condensed into a standalone question. That question is
 * sent to the retriever, the documents are answered over with a
 * {@link StuffDocumentsChain}, and the turn is saved to memory.
 */
@Slf4j
@Getter
public class ConversationalRetrievalChain implements Chain {

    public static final String DEFAULT_INPUT_KEY = "question";
    public static final String DEFAULT_OUTPUT_KEY = "output";
    public static final String SOURCE_DOCUMENTS_KEY = "source_documents";
    public static final String GENERATED_QUESTION_KEY = "generated_question";
    static final String CHAT_HISTORY_VARIABLE = "chat_history";
    static final String QUESTION_VARIABLE = "question";

    private final RetrieverPort retriever;
    private final StuffDocumentsChain combineDocumentsChain;
    private final LlmChain condenseQuestionChain;
    private final MemoryComponent memory;
    private final String inputKey;
    private final String outputKey;
    private final boolean rephraseQuestion;
    private final boolean returnSourceDocuments;
    private final boolean returnGeneratedQuestion;

    @Builder
    private ConversationalRetrievalChain(RetrieverPort retriever, StuffDocumentsChain combineDocumentsChain,
            LlmChain condenseQuestionChain, MemoryComponent memory, String inputKey, String outputKey,
            Boolean rephraseQuestion, boolean returnSourceDocuments, boolean returnGeneratedQuestion) {
        this.retriever = Objects.requireNonNull(retriever, "retriever");
        this.combineDocumentsChain = Objects.requireNonNull(combineDocumentsChain, "combineDocumentsChain");
        this.condenseQuestionChain = condenseQuestionChain;
        this.memory = memory;
        this.inputKey = inputKey != null ? inputKey : DEFAULT_INPUT_KEY;
        this.outputKey = outputKey != null ? outputKey : DEFAULT_OUTPUT_KEY;
        this.rephraseQuestion = rephraseQuestion == null || rephraseQuestion;
        this.returnSourceDocuments = returnSourceDocuments;
        this.returnGeneratedQuestion = returnGeneratedQuestion;
    }

    /**
     * Builder preset with the default QA and condense-question prompts.
     */
    public static ConversationalRetrievalChainBuilder withDefaults(LlmPort llmPort, RetrieverPort retriever) {
        return ConversationalRetrievalChain.builder()
                .retriever(retriever)
                .combineDocumentsChain(StuffDocumentsChain.qa(llmPort))
                .condenseQuestionChain(LlmChain.builder()
                        .llmPort(llmPort)
                        .prompt(QuestionAnsweringPrompts.condenseQuestion())
                        .build());
    }

    @Override
    public CompletableFuture<ChainResult> call(ChainValues inputs, ChainCallOptions options) {
        String question;
        List<Message> history;
        try {
            question = inputs.getText(inputKey);
            history = ConversationMemory.load(memory);
        } catch (ChainsException e) {
            return CompletableFuture.failedFuture(e);
        }

        CompletableFuture<ChainResult> result = new CompletableFuture<>();
        AtomicReference<CompletableFuture<?>> current = new AtomicReference<>();
        result.whenComplete((ignored, error) -> {
            CompletableFuture<?> step = current.get();
            if (result.isCancelled() && step != null) {
                step.cancel(true);
            }
        });
        stage(result, current, () -> condense(question, history, options))
                .thenCompose(condensed -> stage(result, current, () -> retrieve(condensed, options))
                        .thenCompose(retrieved -> stage(result, current,
                                () -> answer(inputs, condensed, retrieved, options))))
                .whenComplete((answer, error) -> {
                    if (error != null) {
                        result.completeExceptionally(ChainFutures.unwrap(error));
                        return;
                    }
                    if (result.isDone()) {
                        log.debug("[Chain] Retrieval call was cancelled, memory left unchanged");
                        return;
                    }
                    try {
                        ConversationMemory.saveTurn(memory, question, answer.text());
                    } catch (MemoryException e) {
                        result.completeExceptionally(e);
                        return;
                    }
                    result.complete(answer);
                });
        return result;
    }

    private static <T> CompletableFuture<T> stage(CompletableFuture<ChainResult> result,
            AtomicReference<CompletableFuture<?>> current, Supplier<CompletableFuture<T>> next) {
        if (result.isCancelled()) {
            return CompletableFuture.failedFuture(new CancellationException("Retrieval call cancelled"));
        }
        CompletableFuture<T> step = next.get();
        current.set(step);
        // a cancel that raced the assignment above
        if (result.isCancelled()) {
            step.cancel(true);
        }
        return step;
    }

    private CompletableFuture<Condensed> condense(String question, List<Message> history, ChainCallOptions options) {
        if (!rephraseQuestion || history.isEmpty() || condenseQuestionChain == null) {
            return CompletableFuture.completedFuture(new Condensed(question, null));
        }
        ChainValues values = ChainValues.of(CHAT_HISTORY_VARIABLE, Message.render(history),
                QUESTION_VARIABLE, question);
        // the condensed question is internal, never streamed to the caller
        ChainCallOptions condenseOptions = options != null
                ? options.toBuilder().streamingSink(null).build()
                : ChainCallOptions.defaults();
        CompletableFuture<ChainResult> call = condenseQuestionChain.call(values, condenseOptions);
        return ChainFutures.propagateCancellation(call.thenApply(r -> {
            String standalone = r.text().trim();
            log.debug("[Chain] Condensed question: {}", standalone);
            return new Condensed(standalone.isEmpty() ? question : standalone, r.usage());
        }), call);
    }

    private CompletableFuture<Retrieved> retrieve(Condensed condensed, ChainCallOptions options) {
        Integer topK = options != null ? options.getTopK() : null;
        CompletableFuture<List<Document>> documents;
        try {
            documents = retriever.getRelevantDocuments(condensed.question(), topK);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(ChainFutures.toChainFailure(e, "Retrieval"));
        }
        return ChainFutures.propagateCancellation(documents.handle((docs, error) -> {
            if (error != null) {
                throw ChainFutures.toChainFailure(error, "Retrieval");
            }
            List<Document> found = docs != null ? docs : List.of();
            log.debug("[Chain] Retrieved {} documents", found.size());
            return new Retrieved(found);
        }), documents);
    }

    private CompletableFuture<ChainResult> answer(ChainValues inputs, Condensed condensed, Retrieved retrieved,
            ChainCallOptions options) {
        ChainValues values = inputs.without(inputKey)
                .with(combineDocumentsChain.getInputKey(), retrieved.documents())
                .with(QUESTION_VARIABLE, condensed.question());
        CompletableFuture<ChainResult> call = combineDocumentsChain.call(values, options);
        return ChainFutures.propagateCancellation(call.thenApply(r -> {
            ChainValues outputs = ChainValues.of(outputKey, r.text());
            if (returnSourceDocuments) {
                outputs = outputs.with(SOURCE_DOCUMENTS_KEY, retrieved.documents());
            }
            if (returnGeneratedQuestion) {
                outputs = outputs.with(GENERATED_QUESTION_KEY, condensed.question());
            }
            return new ChainResult(outputs, r.text(), LlmUsage.sum(condensed.usage(), r.usage()), List.of());
        }), call);
    }

    @Override
    public List<String> getInputKeys() {
        return List.of(inputKey);
    }

    @Override
    public List<String> getOutputKeys() {
        List<String> keys = new ArrayList<>();
        keys.add(outputKey);
        if (returnSourceDocuments) {
            keys.add(SOURCE_DOCUMENTS_KEY);
        }
        if (returnGeneratedQuestion) {
            keys.add(GENERATED_QUESTION_KEY);
        }
        return keys;
    }

    private record Condensed(String question, LlmUsage usage) {
    }

    private record Retrieved(List<Document> documents) {
    }
}
