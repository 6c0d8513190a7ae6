package com.analytics.trend.core.impl;

import com.analytics.trend.SeriesFixtures;
import com.analytics.trend.model.DataPoint;
import com.analytics.trend.model.TimeSeries;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DataPointStore")
class DataPointStoreTest {

    private final DataPointStore store = new DataPointStore();

    @Test
    @DisplayName("Out-of-order writes come back sorted by timestamp")
    void sortedSnapshot() {
        store.add(point("a", 3, 30));
        store.add(point("a", 1, 10));
        assertEquals(3, store.add(point("a", 2, 20)));

        TimeSeries series = store.snapshot("a", null);

        assertArrayEquals(new double[]{10, 20, 30}, series.values(), 1e-9);
        assertEquals("a", series.getCategory());
    }

    @Test
    @DisplayName("Snapshot filters by category and start time")
    void filteredSnapshot() {
        store.addAll(List.of(point("a", 0, 1), point("a", 5, 2), point("b", 6, 3)));

        assertEquals(2, store.snapshot("a", null).size());
        assertEquals(1, store.snapshot("a", day(5)).size());
        assertEquals(2, store.snapshot(null, day(5)).size());
        assertTrue(store.snapshot("missing", null).isEmpty());
        assertEquals(Set.of("a", "b"), store.categories());
    }

    @Test
    @DisplayName("Eviction removes old points and empty categories")
    void eviction() {
        store.addAll(List.of(point("a", 0, 1), point("a", 5, 2), point("b", 1, 3)));

        assertEquals(2, store.evictBefore(day(3)));

        assertEquals(1, store.size());
        assertEquals(1, store.sizeOf("a"));
        assertEquals(0, store.sizeOf("b"));
        assertEquals(Set.of("a"), store.categories());
    }

    private static DataPoint point(String category, int day, double value) {
        return new DataPoint(day(day), value, "test", category, null);
    }

    private static Instant day(int day) {
        return SeriesFixtures.ORIGIN.plus(Duration.ofDays(day));
    }
}
