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

import java.util.Set;

/**
 * Chain composition wiring error, raised while building a pipeline.
 */
@Getter
public class KeyMismatchException extends ChainsException {

    private final Set<String> keys;

    public KeyMismatchException(String message) {
        this(message, Set.of());
    }

    public KeyMismatchException(String message, Set<String> keys) {
        super(ErrorKind.KEY_MISMATCH, message);
        this.keys = Set.copyOf(keys);
    }
}
