package me.golemcore.chains.domain.prompt;

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

import me.golemcore.chains.domain.exception.MissingVariableException;
import me.golemcore.chains.domain.model.ChatPromptValue;
import me.golemcore.chains.domain.model.ChainValues;
import me.golemcore.chains.domain.model.Message;
import me.golemcore.chains.domain.model.PromptValue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered sequence of {@link TemplateNode}s producing a chat prompt.
 *
 * <p>
 * All required variables of all nodes are validated before any node is
 * expanded. The output holds one message per literal or templated node and the
 * full expansion of each placeholder, in node order.
 */
public final class MessageFormatter implements PromptFormatter {

    private final List<TemplateNode> nodes;
    private final Set<String> inputVariables;

    public MessageFormatter(List<TemplateNode> nodes) {
        this.nodes = List.copyOf(nodes);
        Set<String> names = new LinkedHashSet<>();
        for (TemplateNode node : this.nodes) {
            names.addAll(node.getRequiredVariables());
        }
        this.inputVariables = Collections.unmodifiableSet(names);
    }

    public static MessageFormatter of(TemplateNode... nodes) {
        return new MessageFormatter(Arrays.asList(nodes));
    }

    public List<TemplateNode> getNodes() {
        return nodes;
    }

    @Override
    public Set<String> getInputVariables() {
        return inputVariables;
    }

    public List<Message> formatMessages(ChainValues values) {
        for (TemplateNode node : nodes) {
            for (String name : node.getRequiredVariables()) {
                if (!values.containsKey(name)) {
                    throw new MissingVariableException(name);
                }
            }
        }
        List<Message> messages = new ArrayList<>();
        for (TemplateNode node : nodes) {
            messages.addAll(node.expand(values));
        }
        return Collections.unmodifiableList(messages);
    }

    @Override
    public PromptValue formatPrompt(ChainValues values) {
        return new ChatPromptValue(formatMessages(values));
    }
}
