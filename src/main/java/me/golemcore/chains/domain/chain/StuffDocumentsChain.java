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
import me.golemcore.chains.domain.model.ChainResult;
import me.golemcore.chains.domain.model.ChainValues;
import me.golemcore.chains.domain.model.Document;
import me.golemcore.chains.port.outbound.LlmPort;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Joins a list of documents into one context variable and answers with an
 * {@link LlmChain}.
 */
@Slf4j
@Getter
public class StuffDocumentsChain implements Chain {

    public static final String DEFAULT_INPUT_KEY = "input_documents";
    public static final String DEFAULT_DOCUMENT_VARIABLE = "context";
    public static final String DEFAULT_SEPARATOR = "\n\n";

    private final LlmChain llmChain;
    private final String inputKey;
    private final String documentVariableName;
    private final String separator;

    @Builder
    private StuffDocumentsChain(LlmChain llmChain, String inputKey, String documentVariableName, String separator) {
        this.llmChain = Objects.requireNonNull(llmChain, "llmChain");
        this.inputKey = inputKey != null ? inputKey : DEFAULT_INPUT_KEY;
        this.documentVariableName = documentVariableName != null ? documentVariableName : DEFAULT_DOCUMENT_VARIABLE;
        this.separator = separator != null ? separator : DEFAULT_SEPARATOR;
    }

    /**
     * Question answering over documents with the default QA prompt, reading
     * {@code question} and {@code input_documents}.
     */
    public static StuffDocumentsChain qa(LlmPort llmPort) {
        return StuffDocumentsChain.builder()
                .llmChain(LlmChain.builder()
                        .llmPort(llmPort)
                        .prompt(QuestionAnsweringPrompts.stuffQa())
                        .build())
                .build();
    }

    @Override
    public CompletableFuture<ChainResult> call(ChainValues inputs, ChainCallOptions options) {
        List<Document> documents;
        try {
            documents = inputs.getDocuments(inputKey);
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(e);
        }
        log.debug("[Chain] Stuffing {} documents into '{}'", documents.size(), documentVariableName);
        ChainValues values = inputs.without(inputKey).with(documentVariableName, join(documents));
        return llmChain.call(values, options);
    }

    public String join(List<Document> documents) {
        StringBuilder sb = new StringBuilder();
        for (Document document : documents) {
            if (!sb.isEmpty()) {
                sb.append(separator);
            }
            sb.append(document.getPageContent() != null ? document.getPageContent() : "");
        }
        return sb.toString();
    }

    @Override
    public List<String> getInputKeys() {
        List<String> keys = new ArrayList<>();
        keys.add(inputKey);
        for (String key : llmChain.getInputKeys()) {
            if (!key.equals(documentVariableName)) {
                keys.add(key);
            }
        }
        return keys;
    }

    @Override
    public List<String> getOutputKeys() {
        return llmChain.getOutputKeys();
    }
}
