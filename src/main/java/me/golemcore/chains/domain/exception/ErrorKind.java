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

/**
 * Machine-readable category of a {@link ChainsException}.
 */
public enum ErrorKind {

    MISSING_VARIABLE("chains.template.missing_variable"),
    MALFORMED_TEMPLATE("chains.template.malformed"),
    KEY_MISMATCH("chains.composition.key_mismatch"),
    CHAIN("chains.model.error"),
    TOOL("chains.tool.error"),
    UNPARSABLE_OUTPUT("chains.parser.unparsable_output"),
    PARSE_ERROR("chains.agent.parse_error"),
    MAX_ITERATIONS_EXCEEDED("chains.agent.max_iterations_exceeded"),
    TIMEOUT_EXCEEDED("chains.agent.timeout_exceeded"),
    STREAMING_SINK("chains.streaming.sink_failed"),
    MEMORY("chains.memory.error");

    private final String code;

    ErrorKind(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
