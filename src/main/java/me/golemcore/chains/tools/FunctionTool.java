package me.golemcore.chains.tools;

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

import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.chains.domain.component.ToolComponent;
import me.golemcore.chains.domain.model.ToolDefinition;
import me.golemcore.chains.domain.model.ToolResult;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Tool backed by a plain text function. An exception thrown by the function is
 * reported as a failed {@link ToolResult}.
 *
 * <pre>{@code
 * ToolComponent upper = FunctionTool.builder()
 *         .name("upper")
 *         .description("Upper-cases the input")
 *         .function(String::toUpperCase)
 *         .build();
 * }</pre>
 */
@Slf4j
public class FunctionTool implements ToolComponent {

    private final ToolDefinition definition;
    private final Function<String, String> function;
    private final int usageLimit;

    @Builder
    private FunctionTool(String name, String description, Function<String, String> function, int usageLimit) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Tool name must not be blank");
        }
        if (usageLimit < 0) {
            throw new IllegalArgumentException("usageLimit must not be negative");
        }
        this.definition = ToolDefinition.textInput(name, description != null ? description : "");
        this.function = Objects.requireNonNull(function, "function");
        this.usageLimit = usageLimit;
    }

    @Override
    public ToolDefinition getDefinition() {
        return definition;
    }

    @Override
    public CompletableFuture<ToolResult> execute(String input) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return ToolResult.success(function.apply(input));
            } catch (RuntimeException e) {
                log.debug("[Tool] {} failed: {}", definition.getName(), e.getMessage());
                return ToolResult.failure(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }
        });
    }

    @Override
    public int getUsageLimit() {
        return usageLimit;
    }
}
