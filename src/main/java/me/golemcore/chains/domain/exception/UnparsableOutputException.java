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
 * Model output matched none of the shapes a parser recognises. Agents recover
 * from it by asking the model to follow the format again.
 */
@Getter
public class UnparsableOutputException extends ChainsException {

    private final String rawText;

    public UnparsableOutputException(String rawText, String reason) {
        super(ErrorKind.UNPARSABLE_OUTPUT, "Could not parse model output: " + reason);
        this.rawText = rawText;
    }
}
