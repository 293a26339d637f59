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

import me.golemcore.chains.domain.exception.ChainException;
import me.golemcore.chains.domain.exception.ChainsException;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Helpers for mapping asynchronous failures onto the chains error taxonomy.
 */
public final class ChainFutures {

    private ChainFutures() {
    }

    /**
     * Strips {@link CompletionException} and {@link ExecutionException} wrappers.
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Keeps library failures as they are and wraps anything else from a model
     * call into a {@link ChainException}.
     */
    public static RuntimeException toChainFailure(Throwable error, String what) {
        Throwable cause = unwrap(error);
        if (cause instanceof ChainsException chainsException) {
            return chainsException;
        }
        return new ChainException(what + " failed: " + cause.getMessage(), cause);
    }

    /**
     * Cancels {@code source} when {@code derived} is cancelled. Dependent
     * stages never propagate cancellation upstream on their own.
     */
    public static <T> CompletableFuture<T> propagateCancellation(CompletableFuture<T> derived,
            CompletableFuture<?> source) {
        derived.whenComplete((ignored, error) -> {
            if (derived.isCancelled() && !source.isDone()) {
                source.cancel(true);
            }
        });
        return derived;
    }
}
