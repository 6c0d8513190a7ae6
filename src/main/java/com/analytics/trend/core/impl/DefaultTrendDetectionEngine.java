package com.analytics.trend.core.impl;

import com.analytics.trend.EngineConfig;
import com.analytics.trend.analysis.AlertGenerator;
import com.analytics.trend.analysis.PatternIdentifier;
import com.analytics.trend.analysis.TrendConsolidator;
import com.analytics.trend.analysis.TrendForecaster;
import com.analytics.trend.core.DetectionExecutor;
import com.analytics.trend.core.TrendDetectionEngine;
import com.analytics.trend.core.TrendDetector;
import com.analytics.trend.core.TrendRepository;
import com.analytics.trend.detectors.TrendDetectors;
import com.analytics.trend.exception.ValidationException;
import com.analytics.trend.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 趋势检测引擎默认实现。
 * 持有数据点缓冲、结果缓存、异步写入器和检测线程池，管理两个后台循环：
 * 周期性全量扫描和缓存淘汰。
 */
public class DefaultTrendDetectionEngine implements TrendDetectionEngine {

    private static final Logger log = LoggerFactory.getLogger(DefaultTrendDetectionEngine.class);

    /** 全局摘要中“近期预测”的时间范围 */
    private static final Duration RECENT_FORECAST_WINDOW = Duration.ofDays(7);

    private final EngineConfig config;
    private final TrendRepository repository;
    private final List<TrendDetector> detectors;
    private final Clock clock;

    private final DataPointStore pointStore = new DataPointStore();
    private final TrendResultCache resultCache = new TrendResultCache();
    private final AsyncPersistenceWriter writer;
    private final DetectionExecutor executor;

    private final TrendConsolidator consolidator;
    private final PatternIdentifier patternIdentifier;
    private final TrendForecaster forecaster;
    private final AlertGenerator alertGenerator = new AlertGenerator();

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private Thread sweepThread;
    private Thread cacheEvictionThread;

    // ---- 统计 ----
    private final AtomicLong totalDataPoints = new AtomicLong(0);
    private final AtomicLong detectionRuns = new AtomicLong(0);
    private final AtomicLong trendsDetected = new AtomicLong(0);
    private final AtomicLong patternsIdentified = new AtomicLong(0);
    private final AtomicLong alertsGenerated = new AtomicLong(0);
    private final AtomicLong forecastsCreated = new AtomicLong(0);
    private final AtomicLong algorithmFailures = new AtomicLong(0);
    private final AtomicLong totalProcessingNanos = new AtomicLong(0);

    public DefaultTrendDetectionEngine(EngineConfig config, TrendRepository repository) {
        this(config, repository, TrendDetectors.standard(), Clock.systemUTC());
    }

    public DefaultTrendDetectionEngine(EngineConfig config, TrendRepository repository,
                                       List<TrendDetector> detectors, Clock clock) {
        this.config = config;
        this.repository = repository;
        this.detectors = List.copyOf(detectors);
        this.clock = clock;
        this.writer = new AsyncPersistenceWriter(repository,
                config.getWriterQueueCapacity(), config.getWriterMaxRetries());
        this.executor = new DefaultDetectionExecutor(
                config.getExecutorWorkers(), config.getExecutorQueueCapacity());
        this.consolidator = new TrendConsolidator(config.getConsolidationWindowDays());
        this.patternIdentifier = new PatternIdentifier(config);
        this.forecaster = new TrendForecaster(config);
    }

    // ==================== 生命周期 ====================

    @Override
    public void start() {
        if (stopped.get()) {
            throw new IllegalStateException("Engine has been shut down and cannot be restarted");
        }
        if (!running.compareAndSet(false, true)) {
            log.warn("Engine is already running, ignoring duplicate start.");
            return;
        }

        log.info("Starting trend detection engine with {}", config);

        // 回填保留期内的数据点
        Instant since = clock.instant().minus(Duration.ofDays(config.getPointsRetentionDays()));
        try {
            List<DataPoint> recent = repository.loadRecentPoints(since);
            pointStore.addAll(recent);
            totalDataPoints.addAndGet(recent.size());
            log.info("Loaded {} data points across {} categories from repository.",
                    recent.size(), pointStore.categories().size());
        } catch (RuntimeException e) {
            log.error("Failed to load recent data points, starting with an empty buffer: {}", e.getMessage(), e);
        }

        writer.start();

        if (config.isSweepEnabled()) {
            sweepThread = startLoop("trend-periodic-sweep",
                    Duration.ofSeconds(config.getSweepIntervalSeconds()), this::runPeriodicSweep);
        }
        cacheEvictionThread = startLoop("trend-cache-eviction",
                Duration.ofSeconds(config.getCacheSweepIntervalSeconds()), this::runCacheEviction);

        log.info("Trend detection engine started with {} detectors.", detectors.size());
    }

    @Override
    public void shutdown() {
        if (!stopped.compareAndSet(false, true)) {
            log.warn("Engine is already shut down, ignoring.");
            return;
        }
        running.set(false);
        log.info("Shutting down trend detection engine...");

        // 按与启动相反的顺序关闭
        stopLoop(cacheEvictionThread);
        stopLoop(sweepThread);
        executor.shutdown();
        writer.shutdown();

        log.info("Trend detection engine shut down. {}", getSystemStatistics());
    }

    private Thread startLoop(String name, Duration interval, Runnable body) {
        Thread thread = new Thread(() -> backgroundLoop(name, interval, body), name);
        // 非守护线程：main 返回后保持进程存活，直到 shutdown
        thread.setDaemon(false);
        thread.start();
        return thread;
    }

    /**
     * 后台循环：每轮开始时检查运行标志，然后休眠一个周期
     */
    private void backgroundLoop(String name, Duration interval, Runnable body) {
        log.info("Background loop '{}' started, interval {}s.", name, interval.getSeconds());
        while (running.get()) {
            try {
                Thread.sleep(interval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (!running.get()) {
                break;
            }
            try {
                body.run();
            } catch (RuntimeException e) {
                log.error("Error in background loop '{}'", name, e);
            }
        }
        log.info("Background loop '{}' stopped.", name);
    }

    private void stopLoop(Thread thread) {
        if (thread == null) return;
        thread.interrupt();
        try {
            thread.join(5_000L);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for {} to finish.", thread.getName());
        }
    }

    /**
     * 全量扫描：为每个已知分类提交一次检测
     */
    void runPeriodicSweep() {
        int submitted = 0;
        for (String category : pointStore.categories()) {
            if (submitDetection(category)) {
                submitted++;
            }
        }
        log.info("Periodic sweep submitted {} category detections.", submitted);
    }

    /**
     * 缓存淘汰：超过 TTL 的分类最新结果，以及超出保留期的趋势和数据点
     */
    void runCacheEviction() {
        Instant now = clock.instant();
        Instant retention = now.minus(Duration.ofDays(config.getPointsRetentionDays()));
        int runs = resultCache.evictRunsOlderThan(Duration.ofSeconds(config.getCacheTtlSeconds()), now);
        int trends = resultCache.evictTrendsBefore(retention);
        int points = pointStore.evictBefore(retention);
        log.info("Cache eviction removed {} category results, {} trends and {} data points.", runs, trends, points);
    }

    private boolean submitDetection(String category) {
        return executor.submit(category, () -> {
            // 关闭过程中不再运行排队的任务
            if (!stopped.get()) {
                detectTrends(category, config.getTrendWindowDays());
            }
        });
    }

    // ==================== 数据写入 ====================

    @Override
    public void addDataPoint(Instant timestamp, double value, String source, String category,
                             Map<String, Object> metadata) {
        ValidationResult validation = DataPointValidator.validate(timestamp, value, source, category);
        if (!validation.isValid()) {
            throw new ValidationException(validation);
        }

        DataPoint point = new DataPoint(timestamp, value, source, category, metadata);
        int categorySize = pointStore.add(point);
        totalDataPoints.incrementAndGet();
        writer.submitPoint(point);

        if (config.isRealtimeEnabled() && !stopped.get() && categorySize > config.getMinDataPoints()) {
            submitDetection(category);
        }
    }

    // ==================== 检测流水线 ====================

    @Override
    public List<DetectedTrend> detectTrends(String category, Integer windowDays) {
        if (stopped.get()) {
            throw new IllegalStateException("Engine has been shut down");
        }
        if (category != null && category.isBlank()) {
            throw new IllegalArgumentException("Category must not be blank");
        }
        if (windowDays != null && windowDays < 0) {
            throw new IllegalArgumentException("Window must not be negative, got: " + windowDays);
        }

        long startNanos = System.nanoTime();
        Instant now = clock.instant();
        try {
            Instant since = (windowDays == null || windowDays == 0) ? null : now.minus(Duration.ofDays(windowDays));
            TimeSeries series = pointStore.snapshot(category, since);

            if (series.size() < config.getMinDataPoints()) {
                log.warn("Not enough data for trend detection in category '{}': {} points, {} required.",
                        category, series.size(), config.getMinDataPoints());
                return Collections.emptyList();
            }

            List<DetectedTrend> candidates = runDetectors(series, now);
            List<DetectedTrend> consolidated = consolidator.consolidate(candidates, now);

            List<DetectedTrend> results = new ArrayList<>(consolidated.size());
            for (DetectedTrend trend : consolidated) {
                if (trend.getConfidence() < config.getConfidenceThreshold()) {
                    continue;
                }
                enrich(trend, series, now);
                results.add(trend);
            }

            trendsDetected.addAndGet(results.size());
            for (DetectedTrend trend : results) {
                writer.submitTrend(trend);
            }
            resultCache.put(category, results, now);

            log.info("{} trends detected for category '{}' from {} points in {} ms.",
                    results.size(), category, series.size(), (System.nanoTime() - startNanos) / 1_000_000);
            return Collections.unmodifiableList(results);
        } finally {
            detectionRuns.incrementAndGet();
            totalProcessingNanos.addAndGet(System.nanoTime() - startNanos);
        }
    }

    /**
     * 依次运行全部检测器，单个检测器失败不影响其他检测器
     */
    private List<DetectedTrend> runDetectors(TimeSeries series, Instant now) {
        List<DetectedTrend> candidates = new ArrayList<>();
        for (TrendDetector detector : detectors) {
            try {
                List<DetectedTrend> found = detector.detect(series, config, now);
                for (DetectedTrend trend : found) {
                    if (trend.getConfidence() >= config.getConfidenceThreshold()) {
                        candidates.add(trend);
                    }
                }
                log.debug("Detector '{}' produced {} candidates.", detector.getName(), found.size());
            } catch (RuntimeException e) {
                algorithmFailures.incrementAndGet();
                log.error("Detector '{}' failed on category '{}': {}",
                        detector.getName(), series.getCategory(), e.getMessage(), e);
            }
        }
        return candidates;
    }

    /**
     * 在趋势的支撑序列（起始时间之后的数据）上识别模式、生成预测和告警
     */
    private void enrich(DetectedTrend trend, TimeSeries series, Instant now) {
        TimeSeries support = series.since(trend.getStartDate());

        List<TrendPattern> patterns = patternIdentifier.identify(trend, support, now);
        trend.attachPatterns(patterns);
        patternsIdentified.addAndGet(patterns.size());

        List<TrendForecast> forecasts = new ArrayList<>(1);
        forecaster.forecast(trend, support, now).ifPresent(forecasts::add);
        trend.attachForecasts(forecasts);
        forecastsCreated.addAndGet(forecasts.size());

        List<TrendAlert> alerts = alertGenerator.generate(trend, now);
        trend.attachAlerts(alerts);
        alertsGenerated.addAndGet(alerts.size());
    }

    // ==================== 查询 ====================

    @Override
    public List<DetectedTrend> getLatestTrends(String category) {
        return resultCache.getLatest(category);
    }

    @Override
    public TrendSummary getTrendSummary(String trendId) {
        if (trendId != null) {
            DetectedTrend trend = resultCache.getTrend(trendId);
            if (trend != null) {
                return TrendSummary.forTrend(trend);
            }
        }

        Instant now = clock.instant();
        Instant recentThreshold = now.minus(RECENT_FORECAST_WINDOW);
        Map<TrendType, Integer> byType = new EnumMap<>(TrendType.class);
        Map<TrendImpact, Integer> byImpact = new EnumMap<>(TrendImpact.class);
        int total = 0;
        int activeAlerts = 0;
        int recentForecasts = 0;

        for (DetectedTrend trend : resultCache.allTrends()) {
            total++;
            byType.merge(trend.getType(), 1, Integer::sum);
            byImpact.merge(trend.getImpact(), 1, Integer::sum);
            for (TrendAlert alert : trend.getAlerts()) {
                if (alert.isActive(now)) activeAlerts++;
            }
            for (TrendForecast forecast : trend.getForecasts()) {
                if (!forecast.getCreatedAt().isBefore(recentThreshold)) recentForecasts++;
            }
        }

        return TrendSummary.global(total, byType, byImpact, activeAlerts, recentForecasts,
                config.getAlertThresholds(), getSystemStatistics());
    }

    @Override
    public SystemStatistics getSystemStatistics() {
        long runs = detectionRuns.get();
        double averageMs = runs == 0 ? 0.0 : totalProcessingNanos.get() / 1_000_000.0 / runs;
        return new SystemStatistics(
                totalDataPoints.get(),
                runs,
                trendsDetected.get(),
                patternsIdentified.get(),
                alertsGenerated.get(),
                forecastsCreated.get(),
                averageMs,
                algorithmFailures.get(),
                writer.getFailureCount(),
                executor.getCoalescedCount());
    }

    public boolean isRunning() { return running.get(); }
    public EngineConfig getConfig() { return config; }
    int getBufferedPointCount() { return pointStore.size(); }
}
