package me.golemcore.chains.adapter.outbound.memory;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.chains.domain.component.MemoryComponent;
import me.golemcore.chains.domain.model.Message;

import java.util.ArrayList;
import java.util.List;

/**
 * Unbounded in-process conversation history.
 */
@Slf4j
public class SimpleMemory implements MemoryComponent {

    private final List<Message> messages = new ArrayList<>();

    @Override
    public synchronized List<Message> load() {
        return List.copyOf(messages);
    }

    @Override
    public synchronized void save(Message human, Message ai) {
        messages.add(human);
        messages.add(ai);
        log.debug("[Memory] Saved turn, {} message(s) stored", messages.size());
    }

    @Override
    public synchronized void addMessage(Message message) {
        messages.add(message);
    }

    @Override
    public synchronized void clear() {
        messages.clear();
    }
}
