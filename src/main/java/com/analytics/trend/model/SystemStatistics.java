package com.analytics.trend.model;

import java.io.Serializable;

/**
 * 引擎运行统计快照
 */
public final class SystemStatistics implements Serializable {
    private final long totalDataPoints;
    private final long detectionRuns;
    private final long trendsDetected;
    private final long patternsIdentified;
    private final long alertsGenerated;
    private final long forecastsCreated;
    /** 单次检测平均耗时（毫秒），按所有检测轮次求均值 */
    private final double averageProcessingTimeMs;
    private final long algorithmFailures;
    private final long persistenceFailures;
    private final long coalescedTriggers;

    public SystemStatistics(long totalDataPoints, long detectionRuns, long trendsDetected,
                            long patternsIdentified, long alertsGenerated, long forecastsCreated,
                            double averageProcessingTimeMs, long algorithmFailures,
                            long persistenceFailures, long coalescedTriggers) {
        this.totalDataPoints = totalDataPoints;
        this.detectionRuns = detectionRuns;
        this.trendsDetected = trendsDetected;
        this.patternsIdentified = patternsIdentified;
        this.alertsGenerated = alertsGenerated;
        this.forecastsCreated = forecastsCreated;
        this.averageProcessingTimeMs = averageProcessingTimeMs;
        this.algorithmFailures = algorithmFailures;
        this.persistenceFailures = persistenceFailures;
        this.coalescedTriggers = coalescedTriggers;
    }

    public long getTotalDataPoints() { return totalDataPoints; }
    public long getDetectionRuns() { return detectionRuns; }
    public long getTrendsDetected() { return trendsDetected; }
    public long getPatternsIdentified() { return patternsIdentified; }
    public long getAlertsGenerated() { return alertsGenerated; }
    public long getForecastsCreated() { return forecastsCreated; }
    public double getAverageProcessingTimeMs() { return averageProcessingTimeMs; }
    public long getAlgorithmFailures() { return algorithmFailures; }
    public long getPersistenceFailures() { return persistenceFailures; }
    public long getCoalescedTriggers() { return coalescedTriggers; }

    @Override
    public String toString() {
        return "SystemStatistics{points=" + totalDataPoints
                + ", runs=" + detectionRuns
                + ", trends=" + trendsDetected
                + ", patterns=" + patternsIdentified
                + ", alerts=" + alertsGenerated
                + ", forecasts=" + forecastsCreated
                + ", avgMs=" + String.format("%.2f", averageProcessingTimeMs)
                + ", algorithmFailures=" + algorithmFailures
                + ", persistenceFailures=" + persistenceFailures
                + ", coalesced=" + coalescedTriggers + "}";
    }
}
