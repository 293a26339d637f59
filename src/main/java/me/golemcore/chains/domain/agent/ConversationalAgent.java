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

import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.chains.domain.chain.ChainCallOptions;
import me.golemcore.chains.domain.chain.ChainFutures;
import me.golemcore.chains.domain.chain.LlmChain;
import me.golemcore.chains.domain.component.ToolComponent;
import me.golemcore.chains.domain.model.AgentDecision;
import me.golemcore.chains.domain.model.AgentStep;
import me.golemcore.chains.domain.model.ChainValues;
import me.golemcore.chains.domain.model.LlmResponse;
import me.golemcore.chains.domain.model.Message;
import me.golemcore.chains.domain.model.MessageRole;
import me.golemcore.chains.domain.parser.AgentOutputParser;
import me.golemcore.chains.domain.parser.JsonAgentOutputParser;
import me.golemcore.chains.domain.prompt.HistoryPlaceholder;
import me.golemcore.chains.domain.prompt.LiteralMessage;
import me.golemcore.chains.domain.prompt.MessageFormatter;
import me.golemcore.chains.domain.prompt.PromptTemplate;
import me.golemcore.chains.domain.prompt.TemplatedMessage;
import me.golemcore.chains.port.outbound.LlmPort;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Text-protocol agent: the tool catalogue and reply format are described in
 * the prompt and the reply is parsed by an {@link AgentOutputParser} (JSON by
 * default).
 *
 * <p>
 * Prompt layout: system prompt, chat history, the task with format
 * instructions, then the scratchpad as alternating AI replies and tool
 * responses.
 */
@Slf4j
public class ConversationalAgent implements Agent {

    static final String TOOLS_KEY = "tools";
    static final String TOOL_NAMES_KEY = "tool_names";
    static final String OBSERVATION_KEY = "observation";

    @Getter
    private final LlmChain chain;
    private final ToolCatalog catalog;
    private final AgentOutputParser outputParser;
    private final PromptTemplate toolResponseTemplate = PromptTemplate.jinja2(AgentPrompts.TOOL_RESPONSE_TEMPLATE);

    @Builder
    private ConversationalAgent(LlmPort llmPort, List<ToolComponent> tools, String systemPrompt, String initialPrompt,
            AgentOutputParser outputParser, ChainCallOptions defaultOptions) {
        this.catalog = new ToolCatalog(tools != null ? tools : List.of());
        this.outputParser = outputParser != null ? outputParser : new JsonAgentOutputParser();
        this.chain = LlmChain.builder()
                .llmPort(llmPort)
                .prompt(createPrompt(
                        systemPrompt != null ? systemPrompt : AgentPrompts.DEFAULT_SYSTEM_PROMPT,
                        initialPrompt != null ? initialPrompt : AgentPrompts.DEFAULT_INITIAL_PROMPT))
                .defaultOptions(defaultOptions)
                .build();
    }

    static MessageFormatter createPrompt(String systemPrompt, String initialPrompt) {
        return MessageFormatter.of(
                new LiteralMessage(Message.system(systemPrompt)),
                new HistoryPlaceholder(CHAT_HISTORY_KEY),
                new TemplatedMessage(MessageRole.HUMAN,
                        PromptTemplate.jinja2(AgentPrompts.FORMAT_INSTRUCTIONS + "\n\n" + initialPrompt)),
                new HistoryPlaceholder(SCRATCHPAD_KEY));
    }

    @Override
    public CompletableFuture<AgentDecision> plan(List<AgentStep> steps, ChainValues inputs, ChainCallOptions options) {
        ChainValues values = inputs
                .with(TOOLS_KEY, catalog.describe())
                .with(TOOL_NAMES_KEY, catalog.names())
                .with(SCRATCHPAD_KEY, scratchpad(steps));
        if (!values.containsKey(CHAT_HISTORY_KEY)) {
            values = values.with(CHAT_HISTORY_KEY, List.of());
        }
        CompletableFuture<LlmResponse> generation = chain.generate(values, options);
        return ChainFutures.propagateCancellation(generation.thenApply(response -> {
            log.debug("[Agent] Model reply:\n{}", response.getContent());
            return outputParser.parse(response.getContent());
        }), generation);
    }

    List<Message> scratchpad(List<AgentStep> steps) {
        List<Message> thoughts = new ArrayList<>();
        for (AgentStep step : steps) {
            if (step.action() != null) {
                thoughts.add(Message.ai(step.action().log()));
            }
            thoughts.add(Message.human(toolResponseTemplate.format(Map.of(OBSERVATION_KEY, step.observation()))));
        }
        return thoughts;
    }

    @Override
    public List<ToolComponent> getTools() {
        return catalog.getTools();
    }
}
