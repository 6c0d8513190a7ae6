package com.analytics.trend.core.impl;

import com.analytics.trend.model.DetectedTrend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 检测结果缓存。
 * 按分类保存最近一轮的结果（按 TTL 淘汰），
 * 同时按 id 索引保留期内的全部趋势，供摘要查询使用。
 */
public class TrendResultCache {

    private static final Logger log = LoggerFactory.getLogger(TrendResultCache.class);

    /** 跨分类检测的缓存键 */
    static final String ALL_CATEGORIES = "*";

    /** 分类 -> 最近一轮结果 */
    private final ConcurrentHashMap<String, CachedRun> latestByCategory = new ConcurrentHashMap<>();

    /** 趋势 id -> 趋势 */
    private final ConcurrentHashMap<String, CachedTrend> trendsById = new ConcurrentHashMap<>();

    public void put(String category, List<DetectedTrend> trends, Instant cachedAt) {
        String key = category != null ? category : ALL_CATEGORIES;
        latestByCategory.put(key, new CachedRun(Collections.unmodifiableList(new ArrayList<>(trends)), cachedAt));
        for (DetectedTrend trend : trends) {
            trendsById.put(trend.getId(), new CachedTrend(trend, cachedAt));
        }
    }

    public List<DetectedTrend> getLatest(String category) {
        CachedRun run = latestByCategory.get(category != null ? category : ALL_CATEGORIES);
        return run == null ? Collections.emptyList() : run.trends;
    }

    public DetectedTrend getTrend(String trendId) {
        CachedTrend cached = trendsById.get(trendId);
        return cached == null ? null : cached.trend;
    }

    public Collection<DetectedTrend> allTrends() {
        List<DetectedTrend> all = new ArrayList<>(trendsById.size());
        trendsById.values().forEach(c -> all.add(c.trend));
        return all;
    }

    /**
     * 淘汰缓存时间早于 now - ttl 的分类结果；趋势索引不受影响
     *
     * @return 淘汰的分类数
     */
    public int evictRunsOlderThan(Duration ttl, Instant now) {
        Instant threshold = now.minus(ttl);
        int before = latestByCategory.size();
        latestByCategory.values().removeIf(run -> run.cachedAt.isBefore(threshold));
        return before - latestByCategory.size();
    }

    /**
     * 淘汰检测时间早于 threshold 的趋势（连同其告警与预测）
     *
     * @return 淘汰的趋势数
     */
    public int evictTrendsBefore(Instant threshold) {
        int before = trendsById.size();
        trendsById.values().removeIf(c -> c.cachedAt.isBefore(threshold));
        int evicted = before - trendsById.size();
        if (evicted > 0) {
            log.debug("Evicted {} trends detected before {}", evicted, threshold);
        }
        return evicted;
    }

    public int size() {
        return trendsById.size();
    }

    private static final class CachedRun {
        final List<DetectedTrend> trends;
        final Instant cachedAt;

        CachedRun(List<DetectedTrend> trends, Instant cachedAt) {
            this.trends = trends;
            this.cachedAt = cachedAt;
        }
    }

    private static final class CachedTrend {
        final DetectedTrend trend;
        final Instant cachedAt;

        CachedTrend(DetectedTrend trend, Instant cachedAt) {
            this.trend = trend;
            this.cachedAt = cachedAt;
        }
    }
}
