package com.analytics.trend.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Trend enums")
class TrendEnumsTest {

    @Test
    @DisplayName("Strength and impact are ordered")
    void ordering() {
        assertTrue(TrendStrength.VERY_STRONG.isAtLeast(TrendStrength.STRONG));
        assertFalse(TrendStrength.MODERATE.isAtLeast(TrendStrength.STRONG));
        assertEquals(TrendStrength.STRONG, TrendStrength.max(TrendStrength.WEAK, TrendStrength.STRONG));
        assertEquals(TrendImpact.CRITICAL, TrendImpact.max(TrendImpact.CRITICAL, TrendImpact.HIGH));
    }

    @Test
    @DisplayName("Codes map back to constants")
    void codes() {
        assertEquals(TrendType.FINANCIAL, TrendType.fromCode("financial"));
        assertEquals(TrendDirection.SEASONAL, TrendDirection.fromCode("seasonal"));
        assertEquals(PatternType.RECURRENCE, PatternType.fromCode("recurrence"));
        assertEquals(TrendStrength.VERY_STRONG, TrendStrength.fromCode(TrendStrength.VERY_STRONG.getCode()));
        assertThrows(IllegalArgumentException.class, () -> TrendType.fromCode("astrological"));
    }

    @Test
    @DisplayName("Alert validity depends on type")
    void alertValidity() {
        assertEquals(Duration.ofDays(7), AlertType.CRITICAL_IMPACT.getValidity());
        assertEquals(Duration.ofDays(14), AlertType.STRONG_TREND.getValidity());
    }
}
