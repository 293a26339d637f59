package me.golemcore.chains.adapter.outbound.retrieval;

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

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.chains.domain.model.Document;
import me.golemcore.chains.port.outbound.RetrieverPort;
import me.golemcore.chains.port.outbound.VectorStorePort;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Retrieves documents by similarity search over a {@link VectorStorePort}.
 */
@Slf4j
public class VectorStoreRetriever implements RetrieverPort {

    public static final int DEFAULT_TOP_K = 4;

    private final VectorStorePort vectorStore;
    @Getter
    private final int defaultTopK;

    public VectorStoreRetriever(VectorStorePort vectorStore) {
        this(vectorStore, DEFAULT_TOP_K);
    }

    public VectorStoreRetriever(VectorStorePort vectorStore, int defaultTopK) {
        if (defaultTopK <= 0) {
            throw new IllegalArgumentException("defaultTopK must be positive, got " + defaultTopK);
        }
        this.vectorStore = Objects.requireNonNull(vectorStore, "vectorStore");
        this.defaultTopK = defaultTopK;
    }

    @Override
    public CompletableFuture<List<Document>> getRelevantDocuments(String query, Integer topK) {
        int k = topK != null ? topK : defaultTopK;
        log.debug("[Retriever] Searching top {} documents", k);
        return vectorStore.similaritySearch(query, k)
                .thenApply(documents -> documents == null ? List.<Document>of() : List.copyOf(documents));
    }

    public CompletableFuture<List<String>> addDocuments(List<Document> documents) {
        return vectorStore.addDocuments(documents);
    }
}
