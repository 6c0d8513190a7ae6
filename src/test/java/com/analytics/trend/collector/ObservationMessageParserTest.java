package com.analytics.trend.collector;

import com.analytics.trend.exception.ValidationException;
import com.analytics.trend.model.DataPoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ObservationMessageParser")
class ObservationMessageParserTest {

    private final ObservationMessageParser parser = new ObservationMessageParser();

    // ========== VALID MESSAGES ==========

    @Test
    @DisplayName("Parses epoch-millis timestamp with source and metadata")
    void epochMillis() {
        DataPoint point = parser.parse(
                "{\"category\":\"sales\",\"value\":12.5,\"timestamp\":1708128000000,"
                        + "\"source\":\"erp\",\"metadata\":{\"region\":\"eu\",\"units\":3}}");

        assertEquals("sales", point.getCategory());
        assertEquals(12.5, point.getValue());
        assertEquals(Instant.ofEpochMilli(1708128000000L), point.getTimestamp());
        assertEquals("erp", point.getSource());
        assertEquals("eu", point.getMetadata().get("region"));
        assertEquals(3, point.getMetadata().get("units"));
    }

    @Test
    @DisplayName("Parses ISO-8601 timestamp and defaults the source")
    void isoTimestamp() {
        DataPoint point = parser.parse("{\"category\":\"sales\",\"value\":7,\"timestamp\":\"2024-02-17T00:00:00Z\"}");

        assertEquals(Instant.parse("2024-02-17T00:00:00Z"), point.getTimestamp());
        assertEquals(7.0, point.getValue());
        assertEquals(ObservationMessageParser.DEFAULT_SOURCE, point.getSource());
        assertTrue(point.getMetadata().isEmpty());
    }

    // ========== INVALID MESSAGES ==========

    @ParameterizedTest
    @ValueSource(strings = {
            "",
            "not json",
            "[1, 2, 3]",
            "{\"value\":1,\"timestamp\":0}",
            "{\"category\":\" \",\"value\":1,\"timestamp\":0}",
            "{\"category\":\"a\",\"value\":\"12\",\"timestamp\":0}",
            "{\"category\":\"a\",\"value\":1}",
            "{\"category\":\"a\",\"value\":1,\"timestamp\":\"yesterday\"}",
            "{\"category\":\"a\",\"value\":1,\"timestamp\":true}"
    })
    @DisplayName("Rejects malformed or incomplete messages")
    void rejectsInvalid(String json) {
        assertThrows(ValidationException.class, () -> parser.parse(json));
    }
}
