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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.chains.domain.model.LlmChunk;
import me.golemcore.chains.domain.model.LlmRequest;
import me.golemcore.chains.domain.model.LlmResponse;
import me.golemcore.chains.domain.model.LlmUsage;
import reactor.core.publisher.Flux;

import java.util.concurrent.CompletableFuture;

/**
 * Placeholder provider used when no model is configured. Answers every request
 * with {@value #PLACEHOLDER} and never contacts a remote API.
 */
@Slf4j
public class NoOpLlmAdapter implements LlmProviderAdapter {

    public static final String PROVIDER_ID = "none";
    public static final String PLACEHOLDER = "[No LLM configured]";

    @Override
    public String getProviderId() {
        return PROVIDER_ID;
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        log.warn("[LLM] chat() called but no provider is configured");
        return CompletableFuture.completedFuture(LlmResponse.builder()
                .content(PLACEHOLDER)
                .model(PROVIDER_ID)
                .finishReason("stop")
                .usage(LlmUsage.of(0, 0))
                .build());
    }

    @Override
    public Flux<LlmChunk> chatStream(LlmRequest request) {
        return Flux.just(LlmChunk.builder()
                .text(PLACEHOLDER)
                .done(true)
                .finishReason("stop")
                .build());
    }

    @Override
    public String getCurrentModel() {
        return PROVIDER_ID;
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
