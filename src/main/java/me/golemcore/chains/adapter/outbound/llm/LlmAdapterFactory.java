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
import me.golemcore.chains.infrastructure.config.ChainsProperties;
import me.golemcore.chains.port.outbound.LlmPort;
import reactor.core.publisher.Flux;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Selects the active provider adapter from {@code chains.llm.provider} and
 * delegates every {@link LlmPort} call to it.
 *
 * <p>
 * An unknown provider falls back to {@code none}, or to the first registered
 * adapter when no no-op adapter is present.
 *
 * @see Langchain4jAdapter
 * @see NoOpLlmAdapter
 */
@Slf4j
public class LlmAdapterFactory implements LlmPort {

    private final Map<String, LlmProviderAdapter> adaptersByProvider = new LinkedHashMap<>();
    private final LlmProviderAdapter activeAdapter;

    public LlmAdapterFactory(ChainsProperties properties, List<LlmProviderAdapter> adapters) {
        for (LlmProviderAdapter adapter : adapters) {
            adaptersByProvider.put(adapter.getProviderId(), adapter);
            log.debug("[LLM] Registered adapter: {}", adapter.getProviderId());
        }

        String provider = properties.getLlm().getProvider();
        LlmProviderAdapter selected = adaptersByProvider.get(provider);
        if (selected == null) {
            selected = adaptersByProvider.get(NoOpLlmAdapter.PROVIDER_ID);
            if (selected == null && !adapters.isEmpty()) {
                selected = adapters.get(0);
            }
            log.warn("[LLM] Provider '{}' not found, using: {}", provider,
                    selected != null ? selected.getProviderId() : NoOpLlmAdapter.PROVIDER_ID);
        } else {
            log.info("[LLM] Active provider: {}", provider);
        }
        this.activeAdapter = selected;
    }

    public LlmPort getActiveAdapter() {
        return activeAdapter;
    }

    public LlmPort getAdapter(String providerId) {
        return adaptersByProvider.get(providerId);
    }

    public boolean isProviderAvailable(String providerId) {
        LlmProviderAdapter adapter = adaptersByProvider.get(providerId);
        return adapter != null && adapter.isAvailable();
    }

    @Override
    public String getProviderId() {
        return activeAdapter != null ? activeAdapter.getProviderId() : NoOpLlmAdapter.PROVIDER_ID;
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        if (activeAdapter == null) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("[llm.provider.not_configured] No LLM adapter registered"));
        }
        return activeAdapter.chat(request);
    }

    @Override
    public Flux<LlmChunk> chatStream(LlmRequest request) {
        if (activeAdapter == null) {
            return Flux.error(new IllegalStateException("[llm.provider.not_configured] No LLM adapter registered"));
        }
        return activeAdapter.chatStream(request);
    }

    @Override
    public boolean supportsStreaming() {
        return activeAdapter != null && activeAdapter.supportsStreaming();
    }

    @Override
    public String getCurrentModel() {
        return activeAdapter != null ? activeAdapter.getCurrentModel() : NoOpLlmAdapter.PROVIDER_ID;
    }

    @Override
    public boolean isAvailable() {
        return activeAdapter != null && activeAdapter.isAvailable();
    }
}
