package com.analytics.trend.analysis;

import com.analytics.trend.EngineConfig;
import com.analytics.trend.SeriesFixtures;
import com.analytics.trend.model.DetectedTrend;
import com.analytics.trend.model.PatternType;
import com.analytics.trend.model.TimeSeries;
import com.analytics.trend.model.TrendDirection;
import com.analytics.trend.model.TrendPattern;
import com.analytics.trend.model.TrendStrength;
import com.analytics.trend.model.TrendType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PatternIdentifier")
class PatternIdentifierTest {

    private static final Instant NOW = SeriesFixtures.ORIGIN.plus(Duration.ofDays(90));

    private final PatternIdentifier identifier = new PatternIdentifier(EngineConfig.defaults());

    // ========== ACCELERATION ==========

    @Test
    @DisplayName("Late jump in an increasing trend is acceleration")
    void acceleration() {
        double[] values = SeriesFixtures.constant(100, 12);
        values[11] = 200;
        DetectedTrend trend = trend(TrendDirection.INCREASING, TrendStrength.MODERATE);
        TimeSeries support = SeriesFixtures.daily(values);

        TrendPattern pattern = identifier.detectAcceleration(trend, support, NOW);

        assertNotNull(pattern);
        assertEquals(PatternType.ACCELERATION, pattern.getType());
        assertEquals(10.0, pattern.getParameters().get("acceleration_rate"), 1e-9);
        assertEquals(0.8, pattern.getConfidence());
        assertEquals(trend.getId(), pattern.getTrendId());
        assertEquals(support.getStart(), pattern.getStartDate());
        assertEquals(support.getEnd(), pattern.getEndDate());
    }

    @Test
    @DisplayName("Acceleration is only checked for increasing trends")
    void accelerationNeedsIncreasing() {
        double[] values = SeriesFixtures.constant(100, 12);
        values[11] = 200;

        List<TrendPattern> patterns = identifier.identify(
                trend(TrendDirection.DECREASING, TrendStrength.MODERATE), SeriesFixtures.daily(values), NOW);

        assertTrue(patterns.isEmpty());
    }

    // ========== STABILIZATION ==========

    @Test
    @DisplayName("Flat tail of a weak trend is stabilization")
    void stabilization() {
        double[] values = new double[20];
        for (int i = 0; i < values.length; i++) {
            values[i] = i < 10 ? (i % 2 == 0 ? 50 : 150) : 100;
        }
        TimeSeries support = SeriesFixtures.daily(values);

        List<TrendPattern> patterns = identifier.identify(trend(TrendDirection.STABLE, TrendStrength.WEAK), support, NOW);

        TrendPattern pattern = patterns.stream()
                .filter(p -> p.getType() == PatternType.STABILIZATION)
                .findFirst()
                .orElseThrow();
        assertEquals(1.0, pattern.getStrength(), 1e-9);
        assertEquals(0.0, pattern.getParameters().get("stability_coefficient"), 1e-9);
        assertEquals(support.timestampAt(10), pattern.getStartDate());
        assertEquals(9, pattern.getDurationDays());
    }

    @Test
    @DisplayName("Stabilization is skipped for non-weak trends")
    void stabilizationNeedsWeak() {
        TimeSeries support = SeriesFixtures.daily(SeriesFixtures.constant(100, 20));
        assertNull(findType(identifier.identify(trend(TrendDirection.STABLE, TrendStrength.STRONG), support, NOW),
                PatternType.STABILIZATION));
    }

    // ========== RECURRENCE ==========

    @Test
    @DisplayName("Periodic support yields recurrence at the first autocorrelation peak")
    void recurrence() {
        TimeSeries support = SeriesFixtures.daily(SeriesFixtures.sine(100, 20, 12, 0, 60, 1));

        TrendPattern pattern = identifier.detectRecurrence(trend(TrendDirection.CYCLICAL, TrendStrength.STRONG), support, NOW);

        assertNotNull(pattern);
        assertEquals(12.0, pattern.getParameters().get("recurrence_period"));
        assertEquals(0.8, pattern.getParameters().get("recurrence_strength"), 1e-6);
        assertEquals(0.7, pattern.getConfidence());
    }

    @Test
    @DisplayName("Patterns below the confidence threshold are dropped")
    void confidenceGate() {
        PatternIdentifier strict = new PatternIdentifier(SeriesFixtures.config("detection.confidence.threshold", "0.85"));
        TimeSeries support = SeriesFixtures.daily(SeriesFixtures.sine(100, 20, 12, 0, 60, 1));

        assertTrue(strict.identify(trend(TrendDirection.CYCLICAL, TrendStrength.STRONG), support, NOW).isEmpty());
    }

    private static TrendPattern findType(List<TrendPattern> patterns, PatternType type) {
        return patterns.stream().filter(p -> p.getType() == type).findFirst().orElse(null);
    }

    private static DetectedTrend trend(TrendDirection direction, TrendStrength strength) {
        return DetectedTrend.builder()
                .name("test")
                .type(TrendType.MARKET)
                .direction(direction)
                .strength(strength)
                .confidence(0.8)
                .startDate(SeriesFixtures.ORIGIN)
                .detectionDate(NOW)
                .build();
    }
}
