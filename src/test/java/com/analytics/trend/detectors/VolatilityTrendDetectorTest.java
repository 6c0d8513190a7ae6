package com.analytics.trend.detectors;

import com.analytics.trend.EngineConfig;
import com.analytics.trend.SeriesFixtures;
import com.analytics.trend.model.DetectedTrend;
import com.analytics.trend.model.TrendDirection;
import com.analytics.trend.model.TrendImpact;
import com.analytics.trend.model.TrendStrength;
import com.analytics.trend.model.TrendType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("VolatilityTrendDetector")
class VolatilityTrendDetectorTest {

    private static final Instant NOW = SeriesFixtures.ORIGIN.plusSeconds(60 * 86_400L);

    private final VolatilityTrendDetector detector = new VolatilityTrendDetector();
    private final EngineConfig config = EngineConfig.defaults();

    @Test
    @DisplayName("Steady large swings are high volatility")
    void highVolatility() {
        double[] values = new double[40];
        for (int i = 0; i < values.length; i++) {
            values[i] = i % 2 == 0 ? 20 : 180;
        }

        DetectedTrend trend = detector.detect(SeriesFixtures.daily(values), config, NOW).get(0);

        assertEquals("High volatility", trend.getName());
        assertEquals(TrendType.FINANCIAL, trend.getType());
        assertEquals(TrendDirection.VOLATILE, trend.getDirection());
        assertEquals(TrendStrength.VERY_STRONG, trend.getStrength());
        assertEquals(TrendImpact.CRITICAL, trend.getImpact());
        assertEquals(0.8, (Double) trend.getMetadata().get("average_volatility"), 1e-9);
        assertEquals(0.9, trend.getConfidence(), 1e-9);
        assertEquals(SeriesFixtures.ORIGIN.plus(Duration.ofDays(10)), trend.getStartDate());
    }

    @Test
    @DisplayName("Growing swings are reported as increasing volatility")
    void increasingVolatility() {
        double[] values = new double[40];
        for (int i = 0; i < values.length; i++) {
            values[i] = 100 + (i % 2 == 0 ? 2.0 * i : -2.0 * i);
        }

        DetectedTrend trend = detector.detect(SeriesFixtures.daily(values), config, NOW).get(0);

        assertEquals("Volatility increasing", trend.getName());
        assertEquals(TrendDirection.VOLATILE, trend.getDirection());
        assertTrue((Double) trend.getMetadata().get("volatility_trend") > 0.01);
    }

    @Test
    @DisplayName("Constant series is low volatility")
    void lowVolatility() {
        DetectedTrend trend = detector.detect(SeriesFixtures.daily(SeriesFixtures.constant(100, 30)), config, NOW).get(0);

        assertEquals("Low volatility", trend.getName());
        assertEquals(TrendDirection.STABLE, trend.getDirection());
        assertEquals(TrendStrength.WEAK, trend.getStrength());
    }

    @Test
    @DisplayName("A zero-mean window leaves volatility undefined")
    void zeroMeanWindow() {
        double[] values = new double[20];
        for (int i = 0; i < values.length; i++) {
            values[i] = i % 2 == 0 ? -1 : 1;
        }
        assertTrue(detector.detect(SeriesFixtures.daily(values), config, NOW).isEmpty());
    }

    @Test
    @DisplayName("Fewer than ten points produce nothing")
    void insufficientPoints() {
        assertTrue(detector.detect(SeriesFixtures.daily(SeriesFixtures.constant(100, 9)), config, NOW).isEmpty());
    }
}
