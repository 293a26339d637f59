package me.golemcore.chains.adapter.outbound.memory;

import me.golemcore.chains.domain.model.Message;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MemoryAdaptersTest {

    @Test
    void simpleMemoryShouldAppendTurnsInOrder() {
        SimpleMemory memory = new SimpleMemory();

        memory.save(Message.human("Hi"), Message.ai("Hello"));
        memory.save(Message.human("How are you?"), Message.ai("Fine"));

        List<Message> history = memory.load();
        assertEquals(4, history.size());
        assertEquals(Message.human("How are you?"), history.get(2));
        assertEquals(Message.ai("Fine"), history.get(3));
    }

    @Test
    void simpleMemoryShouldReturnSnapshot() {
        SimpleMemory memory = new SimpleMemory();
        List<Message> before = memory.load();

        memory.addMessage(Message.system("Be brief"));

        assertTrue(before.isEmpty());
        assertThrows(UnsupportedOperationException.class, () -> memory.load().add(Message.human("x")));
        memory.clear();
        assertTrue(memory.load().isEmpty());
    }

    @Test
    void windowMemoryShouldDropOldestMessages() {
        WindowBufferMemory memory = new WindowBufferMemory(3);

        memory.save(Message.human("one"), Message.ai("two"));
        memory.save(Message.human("three"), Message.ai("four"));

        assertEquals(List.of(Message.ai("two"), Message.human("three"), Message.ai("four")), memory.load());
        assertEquals(3, memory.getWindowSize());
    }

    @Test
    void windowMemoryShouldRejectNonPositiveSize() {
        assertThrows(IllegalArgumentException.class, () -> new WindowBufferMemory(0));
        assertEquals(WindowBufferMemory.DEFAULT_WINDOW_SIZE, new WindowBufferMemory().getWindowSize());
    }

    @Test
    void noOpMemoryShouldForgetEverything() {
        NoOpMemory memory = new NoOpMemory();

        memory.save(Message.human("Hi"), Message.ai("Hello"));

        assertTrue(memory.load().isEmpty());
    }
}
