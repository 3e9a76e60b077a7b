package com.openclaw.scheduler.common.infra;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class DurationParserTest {

    @ParameterizedTest
    @CsvSource({
            "500ms, 500",
            "30s, 30000",
            "10m, 600000",
            "24h, 86400000",
            "7d, 604800000",
            "1h30m, 5400000",
            "1500, 1500"
    })
    void parseDurationMs_units(String raw, long expected) {
        assertEquals(expected, DurationParser.parseDurationMs(raw));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = { "false", "abc", "10x", "h1" })
    void parseDurationMs_invalid_returnsNull(String raw) {
        assertNull(DurationParser.parseDurationMs(raw));
    }

    @Test
    void parseByteSize_units() {
        assertEquals(2_000_000L, DurationParser.parseByteSize("2000000"));
        assertEquals(512L * 1024, DurationParser.parseByteSize("512kb"));
        assertEquals(2L * 1024 * 1024, DurationParser.parseByteSize("2mb"));
        assertNull(DurationParser.parseByteSize("lots"));
    }
}
