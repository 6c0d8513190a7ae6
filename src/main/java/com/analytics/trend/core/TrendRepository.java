package com.analytics.trend.core;

import com.analytics.trend.model.DataPoint;
import com.analytics.trend.model.DetectedTrend;
import com.analytics.trend.model.TrendAlert;
import com.analytics.trend.model.TrendForecast;
import com.analytics.trend.model.TrendPattern;

import java.time.Instant;
import java.util.List;

/**
 * 趋势仓库接口 —— 观测数据与检测结果的持久化层。
 *
 * 对引擎暴露统一抽象，默认由 SQLite 实现。
 * 引擎只通过异步写入线程调用 save 系列方法，
 * 因此实现可以是阻塞的，但必须允许多线程调用。
 *
 * 所有方法在存储失败时抛出 PersistenceException。
 */
public interface TrendRepository extends AutoCloseable {

    /**
     * 写入一个观测数据点。
     *
     * @param point 数据点
     */
    void savePoint(DataPoint point);

    /**
     * 写入检测到的趋势（不含挂载的模式、预测、告警，它们分别写入）。
     *
     * @param trend 趋势
     */
    void saveTrend(DetectedTrend trend);

    void savePattern(TrendPattern pattern);

    void saveForecast(TrendForecast forecast);

    void saveAlert(TrendAlert alert);

    /**
     * 读取时间戳不早于 since 的数据点，按时间戳升序排列。
     * 引擎启动时用于回填内存缓冲。
     *
     * @param since 起始时间（含）
     * @return 数据点列表
     */
    List<DataPoint> loadRecentPoints(Instant since);

    /**
     * 读取检测时间不早于 since 的趋势，按检测时间降序排列。
     *
     * @param since 起始时间（含）
     * @return 趋势列表
     */
    List<DetectedTrend> loadRecentTrends(Instant since);

    List<TrendPattern> loadPatternsForTrend(String trendId);

    List<TrendAlert> loadAlertsForTrend(String trendId);

    List<TrendForecast> loadForecastsForTrend(String trendId);

    /**
     * 释放底层连接。
     */
    @Override
    void close();
}
