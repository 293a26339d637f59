package me.golemcore.chains.domain.agent;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * Loop bounds and policies of {@link AgentExecutor}. {@code maxIterations} and
 * {@code timeout} can be overridden per call through
 * {@link me.golemcore.chains.domain.chain.ChainCallOptions}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AgentExecutorSettings {

    public static final String DEFAULT_OUTPUT_KEY = "output";
    public static final String INTERMEDIATE_STEPS_KEY = "intermediate_steps";

    /** Maximum number of model calls per invocation. */
    @Builder.Default
    private int maxIterations = 10;

    /** Wall-clock budget; {@code null} means unbounded. */
    private Duration timeout;

    /** Consecutive unparsable replies tolerated before failing. */
    @Builder.Default
    private int maxParseRetries = 3;

    @Builder.Default
    private boolean stopOnToolFailure = false;

    /** Ask for a final answer before the last allowed model call. */
    @Builder.Default
    private boolean forceFinalAnswer = true;

    @Builder.Default
    private boolean returnIntermediateSteps = false;

    @Builder.Default
    private String outputKey = DEFAULT_OUTPUT_KEY;

    public static AgentExecutorSettings defaults() {
        return AgentExecutorSettings.builder().build();
    }
}
