package com.analytics.trend.storage;

import com.analytics.trend.SeriesFixtures;
import com.analytics.trend.model.AlertType;
import com.analytics.trend.model.DataPoint;
import com.analytics.trend.model.DetectedTrend;
import com.analytics.trend.model.PatternType;
import com.analytics.trend.model.TrendAlert;
import com.analytics.trend.model.TrendDirection;
import com.analytics.trend.model.TrendForecast;
import com.analytics.trend.model.TrendImpact;
import com.analytics.trend.model.TrendPattern;
import com.analytics.trend.model.TrendStrength;
import com.analytics.trend.model.TrendType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SQLiteTrendRepository")
class SQLiteTrendRepositoryTest {

    private static final Instant T0 = SeriesFixtures.ORIGIN;

    @TempDir
    Path tempDir;

    private SQLiteTrendRepository repository;

    @BeforeEach
    void setUp() {
        repository = new SQLiteTrendRepository(tempDir.resolve("nested/trends.db").toString());
    }

    @AfterEach
    void tearDown() {
        repository.close();
    }

    // ========== DATA POINTS ==========

    @Test
    @DisplayName("Creates the database file and its parent directories")
    void createsDatabase() {
        assertTrue(Files.exists(tempDir.resolve("nested/trends.db")));
    }

    @Test
    @DisplayName("Recent points are filtered by timestamp and ordered")
    void recentPoints() {
        repository.savePoint(new DataPoint(day(5), 2.0, "erp", "sales", Map.of("region", "eu")));
        repository.savePoint(new DataPoint(day(1), 1.0, "erp", "sales", null));
        repository.savePoint(new DataPoint(day(9), 3.0, "crm", "leads", null));

        List<DataPoint> points = repository.loadRecentPoints(day(2));

        assertEquals(2, points.size());
        assertEquals(day(5), points.get(0).getTimestamp());
        assertEquals("eu", points.get(0).getMetadata().get("region"));
        assertEquals("leads", points.get(1).getCategory());
        assertEquals(3.0, points.get(1).getValue());
    }

    // ========== TRENDS AND RESULTS ==========

    @Test
    @DisplayName("Trend round-trips with indicators, factors and metadata")
    void trendRoundTrip() {
        DetectedTrend trend = DetectedTrend.builder()
                .name("Breakpoint increasing")
                .type(TrendType.STRATEGIC)
                .direction(TrendDirection.INCREASING)
                .strength(TrendStrength.VERY_STRONG)
                .impact(TrendImpact.CRITICAL)
                .confidence(0.99)
                .startDate(day(15))
                .detectionDate(day(30))
                .supportingPointCount(30)
                .keyIndicators(List.of("breakpoint_magnitude", "relative_change"))
                .correlationFactor("change_magnitude", 10.0)
                .metadata("algorithm", "breakpoint_ttest")
                .metadata("breakpoint_index", 15)
                .build();

        repository.saveTrend(trend);
        List<DetectedTrend> loaded = repository.loadRecentTrends(day(29));

        assertEquals(1, loaded.size());
        DetectedTrend copy = loaded.get(0);
        assertEquals(trend.getId(), copy.getId());
        assertEquals(trend.getName(), copy.getName());
        assertEquals(TrendType.STRATEGIC, copy.getType());
        assertEquals(TrendStrength.VERY_STRONG, copy.getStrength());
        assertEquals(TrendImpact.CRITICAL, copy.getImpact());
        assertEquals(0.99, copy.getConfidence());
        assertEquals(day(15), copy.getStartDate());
        assertEquals(30, copy.getSupportingPointCount());
        assertEquals(trend.getKeyIndicators(), copy.getKeyIndicators());
        assertEquals(10.0, copy.getCorrelationFactors().get("change_magnitude"));
        assertEquals("breakpoint_ttest", copy.getAlgorithm());
        assertEquals(15, copy.getMetadata().get("breakpoint_index"));
    }

    @Test
    @DisplayName("Recent trends are newest first and saving twice replaces")
    void recentTrendsOrdering() {
        DetectedTrend older = trend(day(10));
        DetectedTrend newer = trend(day(20));
        repository.saveTrend(older);
        repository.saveTrend(newer);
        repository.saveTrend(newer);

        List<DetectedTrend> loaded = repository.loadRecentTrends(day(0));

        assertEquals(2, loaded.size());
        assertEquals(newer.getId(), loaded.get(0).getId());
        assertEquals(older.getId(), loaded.get(1).getId());
        assertTrue(repository.loadRecentTrends(day(21)).isEmpty());
    }

    @Test
    @DisplayName("Patterns, alerts and forecasts are loaded by trend id")
    void childRecords() {
        DetectedTrend trend = trend(day(30));
        repository.saveTrend(trend);
        repository.savePattern(TrendPattern.create(trend.getId(), PatternType.RECURRENCE, day(0), day(29),
                0.8, 0.7, Map.of("recurrence_period", 12.0), day(30)));
        repository.saveAlert(TrendAlert.create(trend.getId(), AlertType.STRONG_TREND, TrendImpact.HIGH,
                "Strong trend detected: increasing", List.of("Increase monitoring"), day(30)));
        repository.saveForecast(TrendForecast.create(trend.getId(), 2, List.of(1.0, 2.0),
                List.of(new TrendForecast.Interval(0.5, 1.5), new TrendForecast.Interval(1.5, 2.5)),
                0.9, "linear_regression", day(30)));

        List<TrendPattern> patterns = repository.loadPatternsForTrend(trend.getId());
        assertEquals(1, patterns.size());
        assertEquals(PatternType.RECURRENCE, patterns.get(0).getType());
        assertEquals(12.0, patterns.get(0).getParameters().get("recurrence_period"));
        assertEquals(Duration.ofDays(29), patterns.get(0).getDuration());

        List<TrendAlert> alerts = repository.loadAlertsForTrend(trend.getId());
        assertEquals(1, alerts.size());
        assertEquals(AlertType.STRONG_TREND, alerts.get(0).getType());
        assertEquals(day(44), alerts.get(0).getExpiresAt());
        assertEquals(List.of("Increase monitoring"), alerts.get(0).getRecommendations());

        List<TrendForecast> forecasts = repository.loadForecastsForTrend(trend.getId());
        assertEquals(1, forecasts.size());
        TrendForecast forecast = forecasts.get(0);
        assertEquals(List.of(1.0, 2.0), forecast.getPredictedValues());
        assertEquals(1.5, forecast.getConfidenceIntervals().get(1).getLow());
        assertEquals(2.5, forecast.getConfidenceIntervals().get(1).getHigh());
        assertEquals("linear_regression", forecast.getMethodology());

        assertTrue(repository.loadAlertsForTrend("other").isEmpty());
    }

    private static DetectedTrend trend(Instant detectedAt) {
        return DetectedTrend.builder()
                .name("Linear trend increasing")
                .type(TrendType.BUSINESS)
                .direction(TrendDirection.INCREASING)
                .confidence(0.8)
                .startDate(T0)
                .detectionDate(detectedAt)
                .build();
    }

    private static Instant day(int day) {
        return T0.plus(Duration.ofDays(day));
    }
}
