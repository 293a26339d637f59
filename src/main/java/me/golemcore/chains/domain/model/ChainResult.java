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

import java.util.List;

/**
 * Result of one chain call: the output variables, the primary text and the
 * token usage of the model calls it made. {@code steps} is filled by agent
 * executors only.
 */
public record ChainResult(ChainValues outputs, String text, LlmUsage usage, List<AgentStep> steps) {

    public ChainResult {
        outputs = outputs != null ? outputs : ChainValues.empty();
        text = text != null ? text : "";
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    public static ChainResult of(String outputKey, String text, LlmUsage usage) {
        return new ChainResult(ChainValues.of(outputKey, text), text, usage, List.of());
    }
}
