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

public enum ToolFailureKind {

    /**
     * The model asked for a tool that is not registered with the agent.
     */
    NOT_FOUND,

    /**
     * The tool has already been used as many times as it allows in this
     * invocation.
     */
    USAGE_LIMIT_EXCEEDED,

    /**
     * The tool ran and failed (exception, failed future or failure result).
     */
    EXECUTION_FAILED,

    /**
     * The model output could not be parsed into a decision.
     */
    INVALID_FORMAT
}
