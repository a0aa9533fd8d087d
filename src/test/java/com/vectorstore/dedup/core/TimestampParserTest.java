package com.vectorstore.dedup.core;

import com.vectorstore.dedup.core.model.AttributeValue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TimestampParser Tests")
class TimestampParserTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "2024-06-01T10:15:30Z|2024-06-01T10:15:30Z",
            "2024-06-01T12:15:30+02:00|2024-06-01T10:15:30Z",
            "Sat, 1 Jun 2024 10:15:30 GMT|2024-06-01T10:15:30Z",
            "2024-06-01T10:15:30|2024-06-01T10:15:30Z",
            "2024-06-01|2024-06-01T00:00:00Z",
            "  2024-06-01  |2024-06-01T00:00:00Z"
    })
    @DisplayName("Supported formats parse to the same instant")
    void supportedFormats(String text, String expected) {
        assertEquals(Instant.parse(expected), TimestampParser.parse(text).orElseThrow());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "yesterday", "2024-13-45", "01/06/2024"})
    @DisplayName("Unsupported text does not parse")
    void unsupported(String text) {
        assertTrue(TimestampParser.parse(text).isEmpty());
    }

    @Test
    @DisplayName("Numbers are epoch milliseconds, other kinds never parse")
    void attributeValues() {
        assertEquals(Instant.ofEpochMilli(1_700_000_000_000L),
                TimestampParser.parse(AttributeValue.of(1_700_000_000_000.0)).orElseThrow());
        assertEquals(Instant.parse("2024-06-01T00:00:00Z"),
                TimestampParser.parse(AttributeValue.of("2024-06-01")).orElseThrow());
        assertTrue(TimestampParser.parse(AttributeValue.of(true)).isEmpty());
        assertTrue(TimestampParser.parse(AttributeValue.NULL).isEmpty());
        assertTrue(TimestampParser.parse((AttributeValue) null).isEmpty());
        assertTrue(TimestampParser.parse((String) null).isEmpty());
    }
}
