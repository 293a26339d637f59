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

import me.golemcore.chains.domain.model.Message;

import java.util.List;

/**
 * Conversation history that outlives a single chain call.
 *
 * <p>
 * Chains call {@link #save(Message, Message)} only after a call completed
 * successfully. Implementations assume one writer per conversation; callers
 * sharing a memory between concurrent calls must serialise them.
 */
public interface MemoryComponent extends Component {

    String DEFAULT_MEMORY_KEY = "history";

    @Override
    default String getComponentType() {
        return "memory";
    }

    /**
     * Returns the current history, oldest first.
     */
    List<Message> load();

    /**
     * Appends one conversation turn.
     */
    default void save(Message human, Message ai) {
        addMessage(human);
        addMessage(ai);
    }

    void addMessage(Message message);

    void clear();
}
