package me.golemcore.chains.domain.component;

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

import me.golemcore.chains.domain.model.ToolDefinition;
import me.golemcore.chains.domain.model.ToolResult;

import java.util.concurrent.CompletableFuture;

/**
 * Named capability an agent may invoke with text input.
 *
 * <p>
 * Name and description are copied verbatim into the agent prompt. A failure
 * may be reported as a failed {@link ToolResult}, a failed future or a thrown
 * exception; agents turn all three into an observation.
 */
public interface ToolComponent extends Component {

    @Override
    default String getComponentType() {
        return "tool";
    }

    /**
     * Returns the tool definition with the JSON Schema used for native function
     * calling.
     */
    ToolDefinition getDefinition();

    /**
     * Runs the tool.
     *
     * @param input
     *            the action input; when the model sent {@code {"input": "x"}}
     *            this is {@code x}, other JSON arrives as compact JSON text
     * @return a future containing the tool execution result
     */
    CompletableFuture<ToolResult> execute(String input);

    default String getToolName() {
        return getDefinition().getName();
    }

    default String getDescription() {
        return getDefinition().getDescription();
    }

    /**
     * Maximum number of calls per agent invocation; {@code 0} means unlimited.
     */
    default int getUsageLimit() {
        return 0;
    }
}
