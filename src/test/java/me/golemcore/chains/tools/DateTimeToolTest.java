package me.golemcore.chains.tools;

import me.golemcore.chains.domain.model.ToolResult;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class DateTimeToolTest {

    private final DateTimeTool tool = new DateTimeTool(
            Clock.fixed(Instant.parse("2026-01-01T12:00:00Z"), ZoneId.of("UTC")));

    @Test
    void shouldUseClockZoneForBlankInput() {
        ToolResult result = tool.execute("  ").join();

        assertEquals("2026-01-01 12:00:00 UTC, Thursday", result.getOutput());
    }

    @Test
    void shouldConvertToRequestedTimezone() {
        ToolResult result = tool.execute("Asia/Tokyo").join();

        assertEquals("2026-01-01 21:00:00 JST, Thursday", result.getOutput());
    }

    @Test
    void shouldRejectUnknownTimezone() {
        ToolResult result = tool.execute("Mars/Olympus").join();

        assertFalse(result.isSuccess());
        assertEquals("Invalid timezone: Mars/Olympus", result.getError());
    }

    @Test
    void shouldExposeTextInputDefinition() {
        assertEquals(DateTimeTool.NAME, tool.getDefinition().getName());
    }
}
