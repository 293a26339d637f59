package me.golemcore.chains.domain.exception;

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

/**
 * Root of all failures raised by the chains library.
 *
 * <p>
 * Callers branch on {@link #getKind()} and {@link #isRetryable()} instead of on
 * concrete subclasses. Only model failures classified as transient are
 * retryable; everything else is a configuration or contract error.
 */
@Getter
public class ChainsException extends RuntimeException {

    private final ErrorKind kind;
    private final boolean retryable;

    public ChainsException(ErrorKind kind, String message) {
        this(kind, message, null, false);
    }

    public ChainsException(ErrorKind kind, String message, Throwable cause) {
        this(kind, message, cause, false);
    }

    protected ChainsException(ErrorKind kind, String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.kind = kind;
        this.retryable = retryable;
    }

    public String getCode() {
        return kind.getCode();
    }
}
