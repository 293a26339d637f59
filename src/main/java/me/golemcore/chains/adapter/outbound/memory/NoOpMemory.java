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

import me.golemcore.chains.domain.component.MemoryComponent;
import me.golemcore.chains.domain.model.Message;

import java.util.List;

/**
 * Memory that remembers nothing.
 */
public class NoOpMemory implements MemoryComponent {

    @Override
    public List<Message> load() {
        return List.of();
    }

    @Override
    public void addMessage(Message message) {
        // nothing is kept
    }

    @Override
    public void clear() {
        // nothing is kept
    }
}
