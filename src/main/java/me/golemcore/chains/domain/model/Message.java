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

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Single immutable message exchanged with a model. Two messages are equal when
 * role, content, metadata and tool correlation fields are equal.
 */
@Value
public class Message {

    MessageRole role;
    String content;
    Map<String, Object> metadata;

    List<ToolCall> toolCalls;
    String toolCallId; // For tool response messages
    String toolName; // For tool response messages

    @Builder(toBuilder = true)
    private Message(MessageRole role, String content, Map<String, Object> metadata, List<ToolCall> toolCalls,
            String toolCallId, String toolName) {
        if (role == null) {
            throw new IllegalArgumentException("Message role must not be null");
        }
        this.role = role;
        this.content = content != null ? content : "";
        this.metadata = metadata == null || metadata.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        this.toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
        this.toolCallId = toolCallId;
        this.toolName = toolName;
    }

    public static Message system(String content) {
        return Message.builder().role(MessageRole.SYSTEM).content(content).build();
    }

    public static Message human(String content) {
        return Message.builder().role(MessageRole.HUMAN).content(content).build();
    }

    public static Message ai(String content) {
        return Message.builder().role(MessageRole.AI).content(content).build();
    }

    /**
     * Creates an AI message that requests the given tool calls.
     */
    public static Message ai(String content, List<ToolCall> toolCalls) {
        return Message.builder().role(MessageRole.AI).content(content).toolCalls(toolCalls).build();
    }

    /**
     * Creates a tool result message answering the call with {@code toolCallId}.
     */
    public static Message tool(String toolCallId, String toolName, String content) {
        return Message.builder()
                .role(MessageRole.TOOL)
                .toolCallId(toolCallId)
                .toolName(toolName)
                .content(content)
                .build();
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }

    /**
     * Renders a history as one {@code role: content} line per message.
     */
    public static String render(List<Message> messages) {
        if (messages == null || messages.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (Message message : messages) {
            if (!sb.isEmpty()) {
                sb.append('\n');
            }
            sb.append(message.getRole().getValue()).append(": ").append(message.getContent());
        }
        return sb.toString();
    }
}
