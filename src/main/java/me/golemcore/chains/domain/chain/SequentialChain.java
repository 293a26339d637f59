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
import lombok.Singular;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.chains.domain.exception.KeyMismatchException;
import me.golemcore.chains.domain.model.ChainResult;
import me.golemcore.chains.domain.model.ChainValues;
import me.golemcore.chains.domain.model.LlmUsage;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Runs chains one after another, feeding every output produced so far into
 * the next chain.
 *
 * <p>
 * Wiring is checked when the pipeline is built: each chain's input keys must
 * be produced by the initial inputs or an earlier chain, and no output key may
 * shadow an existing value. Inputs that collide with a produced key are
 * rejected before the first chain runs.
 */
@Slf4j
public class SequentialChain implements Chain {

    private final List<Chain> chains;
    private final List<String> inputKeys;
    private final List<String> outputKeys;
    private final Set<String> producedKeys;

    @Builder
    private SequentialChain(@Singular List<Chain> chains, List<String> inputKeys, List<String> outputKeys) {
        if (chains == null || chains.isEmpty()) {
            throw new IllegalArgumentException("A sequential chain needs at least one chain");
        }
        this.chains = List.copyOf(chains);
        this.inputKeys = inputKeys != null && !inputKeys.isEmpty()
                ? List.copyOf(inputKeys)
                : this.chains.get(0).getInputKeys();

        Set<String> available = new LinkedHashSet<>(this.inputKeys);
        Set<String> produced = new LinkedHashSet<>();
        for (int i = 0; i < this.chains.size(); i++) {
            Chain chain = this.chains.get(i);
            Set<String> missing = new LinkedHashSet<>(chain.getInputKeys());
            missing.removeAll(available);
            if (!missing.isEmpty()) {
                throw new KeyMismatchException("Chain #" + (i + 1) + " (" + chain.getClass().getSimpleName()
                        + ") requires " + missing + " but only " + available + " are available", missing);
            }
            for (String key : chain.getOutputKeys()) {
                if (!available.add(key)) {
                    throw new KeyMismatchException("Chain #" + (i + 1) + " (" + chain.getClass().getSimpleName()
                            + ") output key '" + key + "' collides with an existing value", Set.of(key));
                }
                produced.add(key);
            }
        }

        this.producedKeys = Set.copyOf(produced);

        if (outputKeys != null && !outputKeys.isEmpty()) {
            Set<String> unknown = new LinkedHashSet<>(outputKeys);
            unknown.removeAll(available);
            if (!unknown.isEmpty()) {
                throw new KeyMismatchException("Requested output keys " + unknown + " are never produced", unknown);
            }
            this.outputKeys = List.copyOf(outputKeys);
        } else {
            this.outputKeys = List.copyOf(produced);
        }
    }

    @Override
    public CompletableFuture<ChainResult> call(ChainValues inputs, ChainCallOptions options) {
        Set<String> shadowed = new LinkedHashSet<>(inputs.keySet());
        shadowed.retainAll(producedKeys);
        if (!shadowed.isEmpty()) {
            return CompletableFuture.failedFuture(new KeyMismatchException(
                    "Inputs " + shadowed + " collide with keys produced by the pipeline", shadowed));
        }
        CompletableFuture<Progress> progress = CompletableFuture.completedFuture(new Progress(inputs, "", null));
        for (Chain chain : chains) {
            progress = progress.thenCompose(state -> {
                log.debug("[Chain] Sequential step {} with keys {}", chain.getClass().getSimpleName(),
                        state.values().keySet());
                return chain.call(state.values(), options).thenApply(result -> state.advance(result));
            });
        }
        return progress.thenApply(state -> {
            ChainValues outputs = ChainValues.empty();
            for (String key : outputKeys) {
                outputs = outputs.with(key, state.values().get(key));
            }
            return new ChainResult(outputs, state.text(), state.usage(), List.of());
        });
    }

    @Override
    public List<String> getInputKeys() {
        return inputKeys;
    }

    @Override
    public List<String> getOutputKeys() {
        return outputKeys;
    }

    public List<Chain> getChains() {
        return new ArrayList<>(chains);
    }

    private record Progress(ChainValues values, String text, LlmUsage usage) {

        Progress advance(ChainResult result) {
            return new Progress(values.merge(result.outputs()), result.text(), LlmUsage.sum(usage, result.usage()));
        }
    }
}
