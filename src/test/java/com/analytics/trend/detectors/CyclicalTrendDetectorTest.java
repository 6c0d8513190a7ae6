package com.analytics.trend.detectors;

import com.analytics.trend.EngineConfig;
import com.analytics.trend.SeriesFixtures;
import com.analytics.trend.model.DetectedTrend;
import com.analytics.trend.model.TimeSeries;
import com.analytics.trend.model.TrendDirection;
import com.analytics.trend.model.TrendStrength;
import com.analytics.trend.model.TrendType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CyclicalTrendDetector")
class CyclicalTrendDetectorTest {

    private static final Instant NOW = SeriesFixtures.ORIGIN.plusSeconds(365 * 86_400L);

    private final CyclicalTrendDetector detector = new CyclicalTrendDetector();
    private final EngineConfig config = EngineConfig.defaults();

    @Test
    @DisplayName("First autocorrelation peak gives the cycle length")
    void cycleOfTwelve() {
        TimeSeries series = SeriesFixtures.daily(SeriesFixtures.sine(100, 20, 12, 0, 120, 1));

        List<DetectedTrend> trends = detector.detect(series, config, NOW);

        assertEquals(1, trends.size());
        DetectedTrend trend = trends.get(0);
        assertEquals(TrendType.MARKET, trend.getType());
        assertEquals(TrendDirection.CYCLICAL, trend.getDirection());
        assertEquals(TrendStrength.STRONG, trend.getStrength());
        assertEquals(12, trend.getMetadata().get("cycle_length"));
        assertEquals(0.9, trend.getConfidence(), 1e-6);
        assertEquals("Cyclical trend (cycle: 12 points)", trend.getName());
    }

    @Test
    @DisplayName("White noise has no qualifying peak")
    void whiteNoise() {
        TimeSeries series = SeriesFixtures.daily(SeriesFixtures.whiteNoise(100, 5, 365, 42));
        assertTrue(detector.detect(series, config, NOW).isEmpty());
    }

    @Test
    @DisplayName("Fewer than twenty points produce nothing")
    void insufficientPoints() {
        TimeSeries series = SeriesFixtures.daily(SeriesFixtures.sine(100, 20, 4, 0, 19, 1));
        assertTrue(detector.detect(series, config, NOW).isEmpty());
    }
}
