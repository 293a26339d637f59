package me.golemcore.chains.port.outbound;

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

import me.golemcore.chains.domain.model.Document;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Similarity search backend. Storage format and embeddings are the backend's
 * concern.
 */
public interface VectorStorePort {

    CompletableFuture<List<String>> addDocuments(List<Document> documents);

    /**
     * Returns up to {@code k} documents, most similar first, with their score
     * set.
     */
    CompletableFuture<List<Document>> similaritySearch(String query, int k);
}
