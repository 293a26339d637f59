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

import me.golemcore.chains.domain.chain.ChainCallOptions;
import me.golemcore.chains.domain.component.ToolComponent;
import me.golemcore.chains.domain.model.AgentDecision;
import me.golemcore.chains.domain.model.AgentStep;
import me.golemcore.chains.domain.model.ChainValues;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Decides the next step of an agent from the task input and the scratchpad.
 * Agents hold no per-invocation state; the scratchpad is owned by
 * {@link AgentExecutor}.
 */
public interface Agent {

    String CHAT_HISTORY_KEY = "chat_history";
    String SCRATCHPAD_KEY = "agent_scratchpad";
    String INPUT_KEY = "input";

    /**
     * Makes one model call and parses the reply. An unparsable reply completes
     * the future with
     * {@link me.golemcore.chains.domain.exception.UnparsableOutputException}.
     */
    CompletableFuture<AgentDecision> plan(List<AgentStep> steps, ChainValues inputs, ChainCallOptions options);

    List<ToolComponent> getTools();

    default List<String> getInputKeys() {
        return List.of(INPUT_KEY);
    }
}
