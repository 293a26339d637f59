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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.chains.domain.chain.ChainCallOptions;
import me.golemcore.chains.domain.chain.ChainFutures;
import me.golemcore.chains.domain.chain.LlmChain;
import me.golemcore.chains.domain.component.ToolComponent;
import me.golemcore.chains.domain.model.AgentAction;
import me.golemcore.chains.domain.model.AgentActions;
import me.golemcore.chains.domain.model.AgentDecision;
import me.golemcore.chains.domain.model.AgentFinish;
import me.golemcore.chains.domain.model.AgentStep;
import me.golemcore.chains.domain.model.ChainValues;
import me.golemcore.chains.domain.model.LlmResponse;
import me.golemcore.chains.domain.model.Message;
import me.golemcore.chains.domain.model.MessageRole;
import me.golemcore.chains.domain.model.ToolCall;
import me.golemcore.chains.domain.model.ToolDefinition;
import me.golemcore.chains.domain.model.ToolFailureKind;
import me.golemcore.chains.domain.prompt.HistoryPlaceholder;
import me.golemcore.chains.domain.prompt.LiteralMessage;
import me.golemcore.chains.domain.prompt.MessageFormatter;
import me.golemcore.chains.domain.prompt.PromptTemplate;
import me.golemcore.chains.domain.prompt.TemplatedMessage;
import me.golemcore.chains.port.outbound.LlmPort;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Agent using the provider's native function calling. Tool definitions are
 * sent with the request and every tool call in the reply becomes an action
 * carrying the call id, so parallel results can be matched to their request.
 */
@Slf4j
public class ToolCallingAgent implements Agent {

    public static final String DEFAULT_SYSTEM_PROMPT = "You are a helpful assistant. Use the provided tools when "
            + "they help to answer, then reply with your final answer.";

    @Getter
    private final LlmChain chain;
    private final ToolCatalog catalog;
    private final ToolInputs toolInputs;

    @Builder
    private ToolCallingAgent(LlmPort llmPort, List<ToolComponent> tools, String systemPrompt,
            ChainCallOptions defaultOptions, ObjectMapper objectMapper) {
        this.catalog = new ToolCatalog(tools != null ? tools : List.of());
        this.toolInputs = new ToolInputs(objectMapper != null ? objectMapper : new ObjectMapper());
        List<ToolDefinition> definitions = catalog.getTools().stream()
                .map(ToolComponent::getDefinition)
                .toList();
        this.chain = LlmChain.builder()
                .llmPort(llmPort)
                .prompt(MessageFormatter.of(
                        new LiteralMessage(Message.system(systemPrompt != null ? systemPrompt : DEFAULT_SYSTEM_PROMPT)),
                        new HistoryPlaceholder(CHAT_HISTORY_KEY),
                        new TemplatedMessage(MessageRole.HUMAN, PromptTemplate.jinja2("{{input}}")),
                        new HistoryPlaceholder(SCRATCHPAD_KEY)))
                .tools(definitions)
                .defaultOptions(defaultOptions)
                .build();
    }

    @Override
    public CompletableFuture<AgentDecision> plan(List<AgentStep> steps, ChainValues inputs, ChainCallOptions options) {
        ChainValues values = inputs.with(SCRATCHPAD_KEY, scratchpad(steps));
        if (!values.containsKey(CHAT_HISTORY_KEY)) {
            values = values.with(CHAT_HISTORY_KEY, List.of());
        }
        int turn = steps.size();
        CompletableFuture<LlmResponse> generation = chain.generate(values, options);
        return ChainFutures.propagateCancellation(generation.thenApply(response -> toDecision(response, turn)),
                generation);
    }

    private AgentDecision toDecision(LlmResponse response, int turn) {
        if (!response.hasToolCalls()) {
            return AgentFinish.of(response.getContent());
        }
        List<AgentAction> actions = new ArrayList<>();
        List<ToolCall> toolCalls = response.getToolCalls();
        for (int i = 0; i < toolCalls.size(); i++) {
            ToolCall call = toolCalls.get(i);
            String id = call.getId() != null ? call.getId() : "call_" + turn + "_" + i;
            actions.add(new AgentAction(id, call.getName(), toolInputs.toActionInput(call.getArguments()),
                    response.getContent()));
        }
        log.debug("[Agent] Model requested {} tool call(s)", actions.size());
        return new AgentActions(actions);
    }

    List<Message> scratchpad(List<AgentStep> steps) {
        List<Message> messages = new ArrayList<>();
        for (AgentStep step : steps) {
            AgentAction action = step.action();
            if (action == null || action.id() == null || step.failureKind() == ToolFailureKind.INVALID_FORMAT) {
                messages.add(Message.human(step.observation()));
                continue;
            }
            ToolCall call = ToolCall.builder()
                    .id(action.id())
                    .name(action.tool())
                    .arguments(toolInputs.toArguments(action.toolInput()))
                    .build();
            messages.add(Message.ai("", List.of(call)));
            messages.add(Message.tool(action.id(), action.tool(), step.observation()));
        }
        return messages;
    }

    @Override
    public List<ToolComponent> getTools() {
        return catalog.getTools();
    }
}
