package com.analytics.trend.detectors;

import com.analytics.trend.EngineConfig;
import com.analytics.trend.SeriesFixtures;
import com.analytics.trend.model.DetectedTrend;
import com.analytics.trend.model.TimeSeries;
import com.analytics.trend.model.TrendDirection;
import com.analytics.trend.model.TrendImpact;
import com.analytics.trend.model.TrendStrength;
import com.analytics.trend.model.TrendType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BreakpointTrendDetector")
class BreakpointTrendDetectorTest {

    private static final Instant NOW = SeriesFixtures.ORIGIN.plusSeconds(120 * 86_400L);

    private final BreakpointTrendDetector detector = new BreakpointTrendDetector();
    private final EngineConfig config = EngineConfig.defaults();

    // ========== DETECTION ==========

    @Test
    @DisplayName("Clean level shift is located exactly")
    void cleanStep() {
        TimeSeries series = SeriesFixtures.daily(SeriesFixtures.step(10, 20, 15, 0, 30, 1));

        List<DetectedTrend> trends = detector.detect(series, config, NOW);

        assertEquals(1, trends.size());
        DetectedTrend trend = trends.get(0);
        assertEquals(TrendType.STRATEGIC, trend.getType());
        assertEquals(TrendDirection.INCREASING, trend.getDirection());
        assertEquals(TrendStrength.VERY_STRONG, trend.getStrength());
        assertEquals(TrendImpact.CRITICAL, trend.getImpact());
        assertEquals(15, trend.getMetadata().get("breakpoint_index"));
        assertEquals(10.0, (Double) trend.getMetadata().get("before_mean"), 1e-9);
        assertEquals(20.0, (Double) trend.getMetadata().get("after_mean"), 1e-9);
        assertEquals(1.0, trend.getConfidence(), 1e-9);
        assertEquals(SeriesFixtures.ORIGIN.plus(Duration.ofDays(15)), trend.getStartDate());
    }

    @Test
    @DisplayName("Noisy three-sigma shift is located within two points")
    void noisyStep() {
        TimeSeries series = SeriesFixtures.daily(SeriesFixtures.step(100, 103, 50, 1, 100, 11));

        DetectedTrend trend = detector.detect(series, config, NOW).get(0);

        int index = (Integer) trend.getMetadata().get("breakpoint_index");
        assertTrue(Math.abs(index - 50) <= 2, "breakpoint at " + index);
        assertEquals(TrendDirection.INCREASING, trend.getDirection());
        assertEquals(0.05 / 8, (Double) trend.getMetadata().get("significance_level"), 1e-12);
    }

    @Test
    @DisplayName("One-sigma shift is located within two points")
    void oneSigmaStep() {
        TimeSeries series = SeriesFixtures.daily(SeriesFixtures.step(100, 105, 50, 5, 100, 11));

        List<DetectedTrend> trends = detector.detect(series, config, NOW);

        assertEquals(1, trends.size());
        int index = (Integer) trends.get(0).getMetadata().get("breakpoint_index");
        assertTrue(Math.abs(index - 50) <= 2, "breakpoint at " + index);
        assertEquals(TrendDirection.INCREASING, trends.get(0).getDirection());
    }

    @Test
    @DisplayName("Two-sigma shift is located within two points")
    void twoSigmaStep() {
        TimeSeries series = SeriesFixtures.daily(SeriesFixtures.step(100, 110, 50, 5, 100, 10));

        List<DetectedTrend> trends = detector.detect(series, config, NOW);

        assertEquals(1, trends.size());
        int index = (Integer) trends.get(0).getMetadata().get("breakpoint_index");
        assertTrue(Math.abs(index - 50) <= 2, "breakpoint at " + index);
    }

    @Test
    @DisplayName("Effective test count divides scanned positions by the window")
    void effectiveTests() {
        assertEquals(8, BreakpointTrendDetector.effectiveTests(80, 10));
        assertEquals(35, BreakpointTrendDetector.effectiveTests(345, 10));
        assertEquals(1, BreakpointTrendDetector.effectiveTests(10, 10));
        assertEquals(1, BreakpointTrendDetector.effectiveTests(0, 5));
    }

    @Test
    @DisplayName("Downward shift is reported decreasing")
    void downwardStep() {
        TimeSeries series = SeriesFixtures.daily(SeriesFixtures.step(50, 20, 20, 0, 40, 1));

        DetectedTrend trend = detector.detect(series, config, NOW).get(0);

        assertEquals(TrendDirection.DECREASING, trend.getDirection());
        assertEquals("Breakpoint decreasing", trend.getName());
    }

    @Test
    @DisplayName("Uncorrected significance level is used as configured")
    void uncorrectedSignificance() {
        EngineConfig uncorrected = SeriesFixtures.config("breakpoint.correct.multiple.tests", "false");
        TimeSeries series = SeriesFixtures.daily(SeriesFixtures.step(10, 20, 15, 0, 30, 1));

        DetectedTrend trend = detector.detect(series, uncorrected, NOW).get(0);

        assertEquals(0.05, (Double) trend.getMetadata().get("significance_level"), 1e-12);
    }

    // ========== REJECTION ==========

    @Test
    @DisplayName("Constant series has no breakpoint")
    void constantSeries() {
        TimeSeries series = SeriesFixtures.daily(SeriesFixtures.constant(42, 40));
        assertTrue(detector.detect(series, config, NOW).isEmpty());
    }

    @Test
    @DisplayName("Fewer than fifteen points produce nothing")
    void insufficientPoints() {
        TimeSeries series = SeriesFixtures.daily(SeriesFixtures.step(10, 20, 7, 0, 14, 1));
        assertTrue(detector.detect(series, config, NOW).isEmpty());
    }
}
