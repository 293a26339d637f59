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

import me.golemcore.chains.domain.model.ChainResult;
import me.golemcore.chains.domain.model.ChainValues;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Runnable unit mapping input variables to output variables.
 *
 * <p>
 * A chain definition holds no per-call state, so one instance may serve many
 * concurrent calls. Failures complete the returned future exceptionally with a
 * {@link me.golemcore.chains.domain.exception.ChainsException}; callers see it
 * as the cause of the {@link java.util.concurrent.CompletionException} thrown
 * by {@code join()}.
 */
public interface Chain {

    CompletableFuture<ChainResult> call(ChainValues inputs, ChainCallOptions options);

    default CompletableFuture<ChainResult> call(ChainValues inputs) {
        return call(inputs, ChainCallOptions.defaults());
    }

    /**
     * Runs the chain and returns its output variables.
     */
    default CompletableFuture<ChainValues> invoke(ChainValues inputs) {
        return call(inputs).thenApply(ChainResult::outputs);
    }

    /**
     * Runs the chain and returns its primary output text.
     */
    default CompletableFuture<String> run(ChainValues inputs) {
        return call(inputs).thenApply(ChainResult::text);
    }

    List<String> getInputKeys();

    List<String> getOutputKeys();

    default String getPrimaryOutputKey() {
        return getOutputKeys().get(0);
    }

    /**
     * Streams the text deltas of the chain's model call.
     */
    default Flux<String> stream(ChainValues inputs) {
        return Flux.error(new UnsupportedOperationException(getClass().getSimpleName() + " does not stream"));
    }
}
