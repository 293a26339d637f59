package me.golemcore.chains.domain.chain;

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
import me.golemcore.chains.domain.exception.MemoryException;
import me.golemcore.chains.domain.model.Message;

import java.util.List;

/**
 * Memory access shared by the memory-backed chains. A missing memory behaves
 * like the no-op memory and failures surface as {@link MemoryException}.
 */
@Slf4j
public final class ConversationMemory {

    private ConversationMemory() {
    }

    public static List<Message> load(MemoryComponent memory) {
        if (memory == null) {
            return List.of();
        }
        try {
            return memory.load();
        } catch (RuntimeException e) {
            log.warn("[Memory] Failed to load history: {}", e.getMessage());
            throw new MemoryException("load", e);
        }
    }

    public static void saveTurn(MemoryComponent memory, String human, String ai) {
        if (memory == null) {
            return;
        }
        try {
            memory.save(Message.human(human), Message.ai(ai));
        } catch (RuntimeException e) {
            log.warn("[Memory] Failed to save turn: {}", e.getMessage());
            throw new MemoryException("save", e);
        }
    }
}
