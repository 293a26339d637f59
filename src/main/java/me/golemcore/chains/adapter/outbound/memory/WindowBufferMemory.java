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

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.chains.domain.component.MemoryComponent;
import me.golemcore.chains.domain.model.Message;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Keeps the most recent {@code windowSize} messages; older messages are
 * dropped as new ones arrive.
 */
@Slf4j
public class WindowBufferMemory implements MemoryComponent {

    public static final int DEFAULT_WINDOW_SIZE = 10;

    @Getter
    private final int windowSize;
    private final Deque<Message> messages = new ArrayDeque<>();

    public WindowBufferMemory() {
        this(DEFAULT_WINDOW_SIZE);
    }

    public WindowBufferMemory(int windowSize) {
        if (windowSize <= 0) {
            throw new IllegalArgumentException("windowSize must be positive, got " + windowSize);
        }
        this.windowSize = windowSize;
    }

    @Override
    public synchronized List<Message> load() {
        return List.copyOf(messages);
    }

    @Override
    public synchronized void save(Message human, Message ai) {
        addMessage(human);
        addMessage(ai);
    }

    @Override
    public synchronized void addMessage(Message message) {
        messages.addLast(message);
        while (messages.size() > windowSize) {
            messages.removeFirst();
            log.trace("[Memory] Window full, dropped oldest message");
        }
    }

    @Override
    public synchronized void clear() {
        messages.clear();
    }
}
