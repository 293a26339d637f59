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

import java.util.Locale;

/**
 * Author of a {@link Message}. The wire value is the lower-case name used in
 * rendered history ("human: hello").
 */
public enum MessageRole {

    SYSTEM("system"),
    HUMAN("human"),
    AI("ai"),
    TOOL("tool");

    private final String value;

    MessageRole(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Resolves a role from its wire value. Accepts the provider aliases
     * {@code user} and {@code assistant}.
     */
    public static MessageRole fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Message role must not be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
        case "system" -> SYSTEM;
        case "human", "user" -> HUMAN;
        case "ai", "assistant" -> AI;
        case "tool", "function" -> TOOL;
        default -> throw new IllegalArgumentException("Unknown message role: " + value);
        };
    }
}
