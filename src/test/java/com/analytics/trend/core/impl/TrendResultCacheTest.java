package com.analytics.trend.core.impl;

import com.analytics.trend.SeriesFixtures;
import com.analytics.trend.model.DetectedTrend;
import com.analytics.trend.model.TrendDirection;
import com.analytics.trend.model.TrendType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TrendResultCache")
class TrendResultCacheTest {

    private static final Instant T0 = SeriesFixtures.ORIGIN;

    private final TrendResultCache cache = new TrendResultCache();

    @Test
    @DisplayName("Latest run per category replaces the previous one")
    void latestRun() {
        DetectedTrend first = trend();
        DetectedTrend second = trend();

        cache.put("a", List.of(first), T0);
        cache.put("a", List.of(second), T0.plusSeconds(60));

        assertEquals(List.of(second), cache.getLatest("a"));
        assertSame(first, cache.getTrend(first.getId()));
        assertEquals(2, cache.size());
        assertTrue(cache.getLatest("b").isEmpty());
    }

    @Test
    @DisplayName("Null category maps to the all-categories key")
    void nullCategory() {
        DetectedTrend trend = trend();
        cache.put(null, List.of(trend), T0);

        assertEquals(List.of(trend), cache.getLatest(null));
        assertEquals(List.of(trend), cache.getLatest(TrendResultCache.ALL_CATEGORIES));
    }

    @Test
    @DisplayName("Category results older than the TTL are evicted, the trend index is kept")
    void runEviction() {
        DetectedTrend old = trend();
        DetectedTrend fresh = trend();
        cache.put("a", List.of(old), T0);
        cache.put("b", List.of(fresh), T0.plus(Duration.ofMinutes(50)));

        int evicted = cache.evictRunsOlderThan(Duration.ofHours(1), T0.plus(Duration.ofMinutes(90)));

        assertEquals(1, evicted);
        assertTrue(cache.getLatest("a").isEmpty());
        assertEquals(List.of(fresh), cache.getLatest("b"));
        assertSame(old, cache.getTrend(old.getId()));
        assertEquals(2, cache.allTrends().size());
    }

    @Test
    @DisplayName("Trends cached before the retention threshold are evicted")
    void trendEviction() {
        DetectedTrend old = trend();
        DetectedTrend fresh = trend();
        cache.put("a", List.of(old), T0);
        cache.put("a", List.of(fresh), T0.plus(Duration.ofDays(10)));

        int evicted = cache.evictTrendsBefore(T0.plus(Duration.ofDays(5)));

        assertEquals(1, evicted);
        assertNull(cache.getTrend(old.getId()));
        assertSame(fresh, cache.getTrend(fresh.getId()));
        assertEquals(List.of(fresh), cache.getLatest("a"));
    }

    private static DetectedTrend trend() {
        return DetectedTrend.builder()
                .name("t")
                .type(TrendType.BUSINESS)
                .direction(TrendDirection.STABLE)
                .startDate(T0)
                .detectionDate(T0)
                .build();
    }
}
