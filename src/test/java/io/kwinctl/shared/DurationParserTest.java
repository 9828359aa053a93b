package io.kwinctl.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class DurationParserTest {
    @Test
    void parsesSeconds() {
        Optional<Duration> duration = DurationParser.parse("30s");
        assertTrue(duration.isPresent());
        assertEquals(Duration.ofSeconds(30), duration.get());
    }

    @Test
    void parsesMinutes() {
        assertEquals(Duration.ofMinutes(2), DurationParser.parse("2m").orElseThrow());
    }

    @Test
    void parsesExplicitMilliseconds() {
        assertEquals(Duration.ofMillis(250), DurationParser.parse("250ms").orElseThrow());
    }

    @Test
    void parsesMillisecondsByDefault() {
        assertEquals(Duration.ofMillis(1500), DurationParser.parse("1500").orElseThrow());
    }

    @Test
    void blankIsAbsent() {
        assertTrue(DurationParser.parse("  ").isEmpty());
        assertEquals(Duration.ofSeconds(5), DurationParser.parseOrDefault(null, Duration.ofSeconds(5)));
    }

    @Test
    void rejectsGarbageAndNegativeValues() {
        assertThrows(IllegalArgumentException.class, () -> DurationParser.parse("soon"));
        assertThrows(IllegalArgumentException.class, () -> DurationParser.parse("-3s"));
    }
}
