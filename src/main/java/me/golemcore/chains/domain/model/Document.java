package me.golemcore.chains.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * Piece of text returned by a retriever, with its metadata and similarity
 * score.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Document {

    private String pageContent;

    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();

    private Double score;

    public static Document of(String pageContent) {
        return Document.builder().pageContent(pageContent).build();
    }
}
