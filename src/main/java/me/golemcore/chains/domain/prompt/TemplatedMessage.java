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

import me.golemcore.chains.domain.model.ChainValues;
import me.golemcore.chains.domain.model.Message;
import me.golemcore.chains.domain.model.MessageRole;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Message whose content is produced by a {@link PromptTemplate}.
 */
public record TemplatedMessage(MessageRole role, PromptTemplate template) implements TemplateNode {

    public TemplatedMessage {
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(template, "template");
    }

    public static TemplatedMessage system(String template) {
        return new TemplatedMessage(MessageRole.SYSTEM, PromptTemplate.fromTemplate(template));
    }

    public static TemplatedMessage human(String template) {
        return new TemplatedMessage(MessageRole.HUMAN, PromptTemplate.fromTemplate(template));
    }

    public static TemplatedMessage ai(String template) {
        return new TemplatedMessage(MessageRole.AI, PromptTemplate.fromTemplate(template));
    }

    @Override
    public Set<String> getRequiredVariables() {
        return template.getInputVariables();
    }

    @Override
    public List<Message> expand(ChainValues values) {
        return List.of(Message.builder()
                .role(role)
                .content(template.format(values))
                .build());
    }
}
