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

import java.util.List;
import java.util.Set;

/**
 * One entry of a {@link MessageFormatter}: {@link LiteralMessage},
 * {@link TemplatedMessage} or {@link HistoryPlaceholder}.
 */
public interface TemplateNode {

    /**
     * Variables this node reads.
     */
    Set<String> getRequiredVariables();

    /**
     * Expands the node into zero or more messages. Callers validate required
     * variables first.
     */
    List<Message> expand(ChainValues values);
}
