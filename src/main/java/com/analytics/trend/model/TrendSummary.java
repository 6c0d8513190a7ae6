package com.analytics.trend.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * 趋势摘要：单个趋势的详情，或全部趋势的全局汇总。
 *
 * 两种形态共用一个类型，由 {@link #isGlobal()} 区分；
 * 不适用于当前形态的字段为 null 或 0。
 */
public final class TrendSummary implements Serializable {

    // ---- 单趋势形态 ----
    private final DetectedTrend trend;

    // ---- 全局形态 ----
    private final int totalTrends;
    private final Map<TrendType, Integer> trendsByType;
    private final Map<TrendImpact, Integer> trendsByImpact;
    private final int activeAlerts;
    private final int recentForecasts;
    private final Map<TrendImpact, Double> alertThresholds;
    private final SystemStatistics statistics;

    private TrendSummary(DetectedTrend trend, int totalTrends, Map<TrendType, Integer> trendsByType,
                         Map<TrendImpact, Integer> trendsByImpact, int activeAlerts, int recentForecasts,
                         Map<TrendImpact, Double> alertThresholds, SystemStatistics statistics) {
        this.trend = trend;
        this.totalTrends = totalTrends;
        this.trendsByType = trendsByType;
        this.trendsByImpact = trendsByImpact;
        this.activeAlerts = activeAlerts;
        this.recentForecasts = recentForecasts;
        this.alertThresholds = alertThresholds;
        this.statistics = statistics;
    }

    public static TrendSummary forTrend(DetectedTrend trend) {
        return new TrendSummary(trend, 1, null, null, 0, 0, null, null);
    }

    public static TrendSummary global(int totalTrends, Map<TrendType, Integer> trendsByType,
                                      Map<TrendImpact, Integer> trendsByImpact, int activeAlerts,
                                      int recentForecasts, Map<TrendImpact, Double> alertThresholds,
                                      SystemStatistics statistics) {
        return new TrendSummary(null, totalTrends,
                Collections.unmodifiableMap(new EnumMap<>(trendsByType)),
                Collections.unmodifiableMap(new EnumMap<>(trendsByImpact)),
                activeAlerts, recentForecasts,
                Collections.unmodifiableMap(new EnumMap<>(alertThresholds)),
                statistics);
    }

    public boolean isGlobal() {
        return trend == null;
    }

    // ---- 单趋势详情 ----

    public DetectedTrend getTrend() { return trend; }
    public String getTrendId() { return trend != null ? trend.getId() : null; }
    public String getName() { return trend != null ? trend.getName() : null; }
    public TrendType getType() { return trend != null ? trend.getType() : null; }
    public TrendDirection getDirection() { return trend != null ? trend.getDirection() : null; }
    public TrendStrength getStrength() { return trend != null ? trend.getStrength() : null; }
    public TrendImpact getImpact() { return trend != null ? trend.getImpact() : null; }
    public double getConfidence() { return trend != null ? trend.getConfidence() : 0.0; }
    public int getPatternCount() { return trend != null ? trend.getPatterns().size() : 0; }
    public int getForecastCount() { return trend != null ? trend.getForecasts().size() : 0; }
    public int getAlertCount() { return trend != null ? trend.getAlerts().size() : 0; }

    // ---- 全局汇总 ----

    public int getTotalTrends() { return totalTrends; }
    public Map<TrendType, Integer> getTrendsByType() { return trendsByType; }
    public Map<TrendImpact, Integer> getTrendsByImpact() { return trendsByImpact; }
    public int getActiveAlerts() { return activeAlerts; }
    public int getRecentForecasts() { return recentForecasts; }
    public Map<TrendImpact, Double> getAlertThresholds() { return alertThresholds; }
    public SystemStatistics getStatistics() { return statistics; }

    @Override
    public String toString() {
        if (isGlobal()) {
            return "TrendSummary{global, total=" + totalTrends + ", byType=" + trendsByType
                    + ", byImpact=" + trendsByImpact + ", activeAlerts=" + activeAlerts
                    + ", recentForecasts=" + recentForecasts + "}";
        }
        return "TrendSummary{" + trend + ", patterns=" + getPatternCount()
                + ", forecasts=" + getForecastCount() + ", alerts=" + getAlertCount() + "}";
    }
}
