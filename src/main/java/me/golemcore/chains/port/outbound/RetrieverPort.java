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
 * Source of documents relevant to a query, consumed by retrieval chains.
 */
public interface RetrieverPort {

    /**
     * @param topK
     *            number of documents wanted; {@code null} uses the retriever's
     *            default
     */
    CompletableFuture<List<Document>> getRelevantDocuments(String query, Integer topK);
}
