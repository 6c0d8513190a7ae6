package com.analytics.trend;

import com.analytics.trend.model.TrendImpact;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Properties;

/**
 * 引擎配置类。
 * 对应配置文件中的检测参数、启发式常量和运行时参数，加载后不可变。
 */
public class EngineConfig {

    // ---- 检测 ----
    private int minDataPoints = 10;
    private int trendWindowDays = 30;
    private double volatilityThreshold = 0.2;
    private double correlationThreshold = 0.7;
    private double confidenceThreshold = 0.6;
    private int forecastHorizon = 30;

    // ---- 告警等级阈值 ----
    private double alertThresholdLow = 0.3;
    private double alertThresholdMedium = 0.5;
    private double alertThresholdHigh = 0.7;
    private double alertThresholdCritical = 0.9;

    // ---- 算法启发式常量 ----
    private double linearStableSlope = 0.1;
    private double linearStrongSlope = 1.0;
    private double seasonalMinPeriodDays = 7;
    private double seasonalMaxPeriodDays = 365;
    private double seasonalPeakRatio = 0.1;
    private double cyclicalMinPeakHeight = 0.3;
    private int cyclicalMinPeakDistance = 5;
    private int breakpointMaxWindow = 10;
    private double breakpointSignificance = 0.05;
    private double breakpointMinShiftStd = 0.5;
    private boolean breakpointCorrectMultipleTests = true;
    private int volatilityMaxWindow = 10;
    private int consolidationWindowDays = 7;
    private double recurrenceMinPeakHeight = 0.5;
    private int recurrenceMinPeakDistance = 3;

    // ---- 运行时 ----
    private int executorWorkers = 3;
    private int executorQueueCapacity = 256;
    private boolean realtimeEnabled = true;
    private boolean sweepEnabled = true;
    private long sweepIntervalSeconds = 3600;
    private long cacheSweepIntervalSeconds = 1800;
    private long cacheTtlSeconds = 3600;
    private int pointsRetentionDays = 90;
    private int writerQueueCapacity = 10_000;
    private int writerMaxRetries = 3;

    // ---- 存储 ----
    private String storagePath = "data/trends/trends.db";

    // ---- Kafka ----
    private boolean kafkaEnabled = false;
    private String kafkaBootstrapServers = "localhost:9092";
    private String kafkaTopic = "trend-observations";
    private String kafkaGroupId = "trend-detection-engine";

    private EngineConfig() {}

    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    /**
     * 从配置文件加载；文件不可读时使用默认值
     */
    public static EngineConfig load(String configPath) {
        Properties props = new Properties();
        try (InputStream in = new FileInputStream(configPath)) {
            props.load(in);
        } catch (IOException e) {
            System.err.println("Failed to load config from " + configPath
                    + ", using defaults. Error: " + e.getMessage());
            return defaults();
        }
        return fromProperties(props);
    }

    public static EngineConfig fromProperties(Properties props) {
        EngineConfig config = new EngineConfig();

        config.minDataPoints = intProp(props, "detection.min.data.points", config.minDataPoints);
        config.trendWindowDays = intProp(props, "detection.trend.window.days", config.trendWindowDays);
        config.volatilityThreshold = doubleProp(props, "detection.volatility.threshold", config.volatilityThreshold);
        config.correlationThreshold = doubleProp(props, "detection.correlation.threshold", config.correlationThreshold);
        config.confidenceThreshold = doubleProp(props, "detection.confidence.threshold", config.confidenceThreshold);
        config.forecastHorizon = intProp(props, "forecast.horizon", config.forecastHorizon);

        config.alertThresholdLow = doubleProp(props, "alert.threshold.low", config.alertThresholdLow);
        config.alertThresholdMedium = doubleProp(props, "alert.threshold.medium", config.alertThresholdMedium);
        config.alertThresholdHigh = doubleProp(props, "alert.threshold.high", config.alertThresholdHigh);
        config.alertThresholdCritical = doubleProp(props, "alert.threshold.critical", config.alertThresholdCritical);

        config.linearStableSlope = doubleProp(props, "linear.stable.slope", config.linearStableSlope);
        config.linearStrongSlope = doubleProp(props, "linear.strong.slope", config.linearStrongSlope);
        config.seasonalMinPeriodDays = doubleProp(props, "seasonal.min.period.days", config.seasonalMinPeriodDays);
        config.seasonalMaxPeriodDays = doubleProp(props, "seasonal.max.period.days", config.seasonalMaxPeriodDays);
        config.seasonalPeakRatio = doubleProp(props, "seasonal.peak.ratio", config.seasonalPeakRatio);
        config.cyclicalMinPeakHeight = doubleProp(props, "cyclical.min.peak.height", config.cyclicalMinPeakHeight);
        config.cyclicalMinPeakDistance = intProp(props, "cyclical.min.peak.distance", config.cyclicalMinPeakDistance);
        config.breakpointMaxWindow = intProp(props, "breakpoint.max.window", config.breakpointMaxWindow);
        config.breakpointSignificance = doubleProp(props, "breakpoint.significance", config.breakpointSignificance);
        config.breakpointMinShiftStd = doubleProp(props, "breakpoint.min.shift.std", config.breakpointMinShiftStd);
        config.breakpointCorrectMultipleTests = boolProp(props, "breakpoint.correct.multiple.tests",
                config.breakpointCorrectMultipleTests);
        config.volatilityMaxWindow = intProp(props, "volatility.max.window", config.volatilityMaxWindow);
        config.consolidationWindowDays = intProp(props, "consolidation.window.days", config.consolidationWindowDays);
        config.recurrenceMinPeakHeight = doubleProp(props, "pattern.recurrence.min.peak.height",
                config.recurrenceMinPeakHeight);
        config.recurrenceMinPeakDistance = intProp(props, "pattern.recurrence.min.peak.distance",
                config.recurrenceMinPeakDistance);

        config.executorWorkers = intProp(props, "executor.workers", config.executorWorkers);
        config.executorQueueCapacity = intProp(props, "executor.queue.capacity", config.executorQueueCapacity);
        config.realtimeEnabled = boolProp(props, "realtime.enabled", config.realtimeEnabled);
        config.sweepEnabled = boolProp(props, "sweep.enabled", config.sweepEnabled);
        config.sweepIntervalSeconds = longProp(props, "sweep.interval.seconds", config.sweepIntervalSeconds);
        config.cacheSweepIntervalSeconds = longProp(props, "cache.sweep.interval.seconds",
                config.cacheSweepIntervalSeconds);
        config.cacheTtlSeconds = longProp(props, "cache.ttl.seconds", config.cacheTtlSeconds);
        config.pointsRetentionDays = intProp(props, "points.retention.days", config.pointsRetentionDays);
        config.writerQueueCapacity = intProp(props, "writer.queue.capacity", config.writerQueueCapacity);
        config.writerMaxRetries = intProp(props, "writer.max.retries", config.writerMaxRetries);

        config.storagePath = props.getProperty("storage.path", config.storagePath);

        config.kafkaEnabled = boolProp(props, "kafka.enabled", config.kafkaEnabled);
        config.kafkaBootstrapServers = props.getProperty("kafka.bootstrap.servers", config.kafkaBootstrapServers);
        config.kafkaTopic = props.getProperty("kafka.topic", config.kafkaTopic);
        config.kafkaGroupId = props.getProperty("kafka.group.id", config.kafkaGroupId);

        config.validate();
        return config;
    }

    private void validate() {
        requireUnit("detection.volatility.threshold", volatilityThreshold);
        requireUnit("detection.correlation.threshold", correlationThreshold);
        requireUnit("detection.confidence.threshold", confidenceThreshold);
        requireUnit("alert.threshold.low", alertThresholdLow);
        requireUnit("alert.threshold.medium", alertThresholdMedium);
        requireUnit("alert.threshold.high", alertThresholdHigh);
        requireUnit("alert.threshold.critical", alertThresholdCritical);
        requireUnit("seasonal.peak.ratio", seasonalPeakRatio);
        requireUnit("cyclical.min.peak.height", cyclicalMinPeakHeight);
        requireUnit("breakpoint.significance", breakpointSignificance);
        requireUnit("pattern.recurrence.min.peak.height", recurrenceMinPeakHeight);

        requirePositive("detection.min.data.points", minDataPoints);
        requirePositive("detection.trend.window.days", trendWindowDays);
        requirePositive("forecast.horizon", forecastHorizon);
        requirePositive("cyclical.min.peak.distance", cyclicalMinPeakDistance);
        requirePositive("breakpoint.max.window", breakpointMaxWindow);
        requirePositive("volatility.max.window", volatilityMaxWindow);
        requirePositive("consolidation.window.days", consolidationWindowDays);
        requirePositive("pattern.recurrence.min.peak.distance", recurrenceMinPeakDistance);
        requirePositive("executor.workers", executorWorkers);
        requirePositive("executor.queue.capacity", executorQueueCapacity);
        requirePositive("sweep.interval.seconds", sweepIntervalSeconds);
        requirePositive("cache.sweep.interval.seconds", cacheSweepIntervalSeconds);
        requirePositive("cache.ttl.seconds", cacheTtlSeconds);
        requirePositive("points.retention.days", pointsRetentionDays);
        requirePositive("writer.queue.capacity", writerQueueCapacity);

        if (writerMaxRetries < 0) {
            throw new IllegalArgumentException("writer.max.retries must not be negative, got: " + writerMaxRetries);
        }
        if (linearStableSlope < 0 || linearStrongSlope < linearStableSlope) {
            throw new IllegalArgumentException("linear.strong.slope must be >= linear.stable.slope >= 0");
        }
        if (breakpointMinShiftStd < 0) {
            throw new IllegalArgumentException("breakpoint.min.shift.std must not be negative");
        }
        if (seasonalMinPeriodDays <= 0 || seasonalMinPeriodDays >= seasonalMaxPeriodDays) {
            throw new IllegalArgumentException("Seasonal period band must satisfy 0 < min < max, got: ["
                    + seasonalMinPeriodDays + ", " + seasonalMaxPeriodDays + "]");
        }
    }

    private static void requireUnit(String key, double value) {
        if (!(value >= 0.0 && value <= 1.0)) {
            throw new IllegalArgumentException(key + " must be within [0, 1], got: " + value);
        }
    }

    private static void requirePositive(String key, long value) {
        if (value <= 0) {
            throw new IllegalArgumentException(key + " must be positive, got: " + value);
        }
    }

    private static int intProp(Properties props, String key, int defaultValue) {
        String raw = props.getProperty(key);
        return raw == null ? defaultValue : Integer.parseInt(raw.trim());
    }

    private static long longProp(Properties props, String key, long defaultValue) {
        String raw = props.getProperty(key);
        return raw == null ? defaultValue : Long.parseLong(raw.trim());
    }

    private static double doubleProp(Properties props, String key, double defaultValue) {
        String raw = props.getProperty(key);
        return raw == null ? defaultValue : Double.parseDouble(raw.trim());
    }

    private static boolean boolProp(Properties props, String key, boolean defaultValue) {
        String raw = props.getProperty(key);
        return raw == null ? defaultValue : Boolean.parseBoolean(raw.trim());
    }

    /**
     * 告警等级到阈值的映射，供下游协作方使用
     */
    public Map<TrendImpact, Double> getAlertThresholds() {
        Map<TrendImpact, Double> thresholds = new EnumMap<>(TrendImpact.class);
        thresholds.put(TrendImpact.LOW, alertThresholdLow);
        thresholds.put(TrendImpact.MEDIUM, alertThresholdMedium);
        thresholds.put(TrendImpact.HIGH, alertThresholdHigh);
        thresholds.put(TrendImpact.CRITICAL, alertThresholdCritical);
        return Collections.unmodifiableMap(thresholds);
    }

    // ---- Getters ----
    public int getMinDataPoints() { return minDataPoints; }
    public int getTrendWindowDays() { return trendWindowDays; }
    public double getVolatilityThreshold() { return volatilityThreshold; }
    public double getCorrelationThreshold() { return correlationThreshold; }
    public double getConfidenceThreshold() { return confidenceThreshold; }
    public int getForecastHorizon() { return forecastHorizon; }
    public double getLinearStableSlope() { return linearStableSlope; }
    public double getLinearStrongSlope() { return linearStrongSlope; }
    public double getSeasonalMinPeriodDays() { return seasonalMinPeriodDays; }
    public double getSeasonalMaxPeriodDays() { return seasonalMaxPeriodDays; }
    public double getSeasonalPeakRatio() { return seasonalPeakRatio; }
    public double getCyclicalMinPeakHeight() { return cyclicalMinPeakHeight; }
    public int getCyclicalMinPeakDistance() { return cyclicalMinPeakDistance; }
    public int getBreakpointMaxWindow() { return breakpointMaxWindow; }
    public double getBreakpointSignificance() { return breakpointSignificance; }
    public double getBreakpointMinShiftStd() { return breakpointMinShiftStd; }
    public boolean isBreakpointCorrectMultipleTests() { return breakpointCorrectMultipleTests; }
    public int getVolatilityMaxWindow() { return volatilityMaxWindow; }
    public int getConsolidationWindowDays() { return consolidationWindowDays; }
    public double getRecurrenceMinPeakHeight() { return recurrenceMinPeakHeight; }
    public int getRecurrenceMinPeakDistance() { return recurrenceMinPeakDistance; }
    public int getExecutorWorkers() { return executorWorkers; }
    public int getExecutorQueueCapacity() { return executorQueueCapacity; }
    public boolean isRealtimeEnabled() { return realtimeEnabled; }
    public boolean isSweepEnabled() { return sweepEnabled; }
    public long getSweepIntervalSeconds() { return sweepIntervalSeconds; }
    public long getCacheSweepIntervalSeconds() { return cacheSweepIntervalSeconds; }
    public long getCacheTtlSeconds() { return cacheTtlSeconds; }
    public int getPointsRetentionDays() { return pointsRetentionDays; }
    public int getWriterQueueCapacity() { return writerQueueCapacity; }
    public int getWriterMaxRetries() { return writerMaxRetries; }
    public String getStoragePath() { return storagePath; }
    public boolean isKafkaEnabled() { return kafkaEnabled; }
    public String getKafkaBootstrapServers() { return kafkaBootstrapServers; }
    public String getKafkaTopic() { return kafkaTopic; }
    public String getKafkaGroupId() { return kafkaGroupId; }

    @Override
    public String toString() {
        return "EngineConfig{minPoints=" + minDataPoints
                + ", confidence=" + confidenceThreshold
                + ", horizon=" + forecastHorizon
                + ", workers=" + executorWorkers
                + ", realtime=" + realtimeEnabled
                + ", sweep=" + sweepEnabled
                + ", storagePath='" + storagePath + "'"
                + ", kafka=" + (kafkaEnabled ? "'" + kafkaBootstrapServers + "'" : "disabled") + "}";
    }
}
