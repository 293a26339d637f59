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

import me.golemcore.chains.domain.exception.MalformedTemplateException;
import me.golemcore.chains.domain.model.ChainValues;
import me.golemcore.chains.domain.model.Message;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Expands to the message list stored under {@code variableName}, in the order
 * supplied.
 */
public record HistoryPlaceholder(String variableName) implements TemplateNode {

    public HistoryPlaceholder {
        Objects.requireNonNull(variableName, "variableName");
    }

    @Override
    public Set<String> getRequiredVariables() {
        return Set.of(variableName);
    }

    @Override
    public List<Message> expand(ChainValues values) {
        try {
            return values.getMessages(variableName);
        } catch (IllegalArgumentException e) {
            throw new MalformedTemplateException(variableName, 0,
                    "placeholder '" + variableName + "' expects a list of messages");
        }
    }
}
