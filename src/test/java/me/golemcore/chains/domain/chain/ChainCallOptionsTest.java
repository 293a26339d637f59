package me.golemcore.chains.domain.chain;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ChainCallOptionsTest {

    @Test
    void shouldReadRecognisedOptionsAndIgnoreUnknownOnes() {
        List<String> deltas = new ArrayList<>();
        StreamingSink sink = deltas::add;
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("streaming_sink", sink);
        raw.put("max_iterations", 5);
        raw.put("timeout", "PT30S");
        raw.put("top_k", 3);
        raw.put("future_option", "whatever");

        ChainCallOptions options = ChainCallOptions.fromMap(raw);

        assertSame(sink, options.getStreamingSink());
        assertEquals(5, options.getMaxIterations());
        assertEquals(Duration.ofSeconds(30), options.getTimeout());
        assertEquals(3, options.getTopK());
        assertNull(options.getTemperature());
    }

    @Test
    void shouldRejectNonPositiveBounds() {
        assertThrows(IllegalArgumentException.class, () -> ChainCallOptions.fromMap(Map.of("max_iterations", 0)));
        assertThrows(IllegalArgumentException.class, () -> ChainCallOptions.fromMap(Map.of("timeout", "PT0S")));
        assertThrows(IllegalArgumentException.class, () -> ChainCallOptions.fromMap(Map.of("temperature", 2.5)));
    }

    @Test
    void shouldLetOverridesWin() {
        ChainCallOptions defaults = ChainCallOptions.builder().topK(4).temperature(0.1).build();

        ChainCallOptions merged = defaults.mergeWith(ChainCallOptions.builder().topK(8).build());

        assertEquals(8, merged.getTopK());
        assertEquals(0.1, merged.getTemperature());
        assertSame(defaults, defaults.mergeWith(null));
    }

    @Test
    void shouldReturnDefaultsForEmptyMap() {
        assertEquals(ChainCallOptions.defaults(), ChainCallOptions.fromMap(Map.of()));
    }
}
