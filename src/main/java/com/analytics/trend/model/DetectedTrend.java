package com.analytics.trend.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * 检测到的趋势。
 *
 * 由检测算法或合并过程创建，创建后核心属性不可变；
 * 同一轮检测内可以挂载子模式、预测和告警，之后视为时点快照。
 * 后续检测轮次产生新的趋势（新 id），不会原地更新旧趋势。
 */
public class DetectedTrend implements Serializable {
    private final String id;
    private final String name;
    private final TrendType type;
    private final TrendDirection direction;
    private final TrendStrength strength;
    private final TrendImpact impact;
    private final double confidence;
    private final Instant startDate;
    private final Instant detectionDate;
    private final int supportingPointCount;
    private final List<String> keyIndicators;
    private final Map<String, Double> correlationFactors;
    private final Map<String, Object> metadata;

    private volatile List<TrendPattern> patterns = Collections.emptyList();
    private volatile List<TrendForecast> forecasts = Collections.emptyList();
    private volatile List<TrendAlert> alerts = Collections.emptyList();

    private DetectedTrend(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.name = builder.name;
        this.type = builder.type;
        this.direction = builder.direction;
        this.strength = builder.strength;
        this.impact = builder.impact;
        this.confidence = builder.confidence;
        this.startDate = builder.startDate;
        this.detectionDate = builder.detectionDate;
        this.supportingPointCount = builder.supportingPointCount;
        this.keyIndicators = Collections.unmodifiableList(new ArrayList<>(builder.keyIndicators));
        this.correlationFactors = Collections.unmodifiableMap(new LinkedHashMap<>(builder.correlationFactors));
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---- 同一轮检测内的结果挂载 ----

    public void attachPatterns(List<TrendPattern> patterns) {
        this.patterns = Collections.unmodifiableList(new ArrayList<>(patterns));
    }

    public void attachForecasts(List<TrendForecast> forecasts) {
        this.forecasts = Collections.unmodifiableList(new ArrayList<>(forecasts));
    }

    public void attachAlerts(List<TrendAlert> alerts) {
        this.alerts = Collections.unmodifiableList(new ArrayList<>(alerts));
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public TrendType getType() { return type; }
    public TrendDirection getDirection() { return direction; }
    public TrendStrength getStrength() { return strength; }
    public TrendImpact getImpact() { return impact; }
    public double getConfidence() { return confidence; }
    public Instant getStartDate() { return startDate; }
    public Instant getDetectionDate() { return detectionDate; }
    public int getSupportingPointCount() { return supportingPointCount; }
    public List<String> getKeyIndicators() { return keyIndicators; }
    public Map<String, Double> getCorrelationFactors() { return correlationFactors; }
    public Map<String, Object> getMetadata() { return metadata; }
    public List<TrendPattern> getPatterns() { return patterns; }
    public List<TrendForecast> getForecasts() { return forecasts; }
    public List<TrendAlert> getAlerts() { return alerts; }

    /** 产生该趋势的算法名；合并趋势没有单一算法 */
    public String getAlgorithm() {
        Object algorithm = metadata.get("algorithm");
        return algorithm != null ? algorithm.toString() : "unknown";
    }

    @Override
    public String toString() {
        return "DetectedTrend{id='" + id + "', name='" + name + "', type=" + type.getCode()
                + ", direction=" + direction.getCode() + ", strength=" + strength.getCode()
                + ", impact=" + impact.getCode() + ", confidence=" + String.format("%.3f", confidence) + "}";
    }

    /**
     * 趋势构建器，支持链式调用
     */
    public static class Builder {
        private String id;
        private String name;
        private TrendType type;
        private TrendDirection direction;
        private TrendStrength strength = TrendStrength.WEAK;
        private TrendImpact impact = TrendImpact.LOW;
        private double confidence;
        private Instant startDate;
        private Instant detectionDate;
        private int supportingPointCount;
        private List<String> keyIndicators = new ArrayList<>();
        private Map<String, Double> correlationFactors = new LinkedHashMap<>();
        private Map<String, Object> metadata = new LinkedHashMap<>();

        private Builder() {}

        public Builder id(String id) { this.id = id; return this; }
        public Builder name(String name) { this.name = name; return this; }
        public Builder type(TrendType type) { this.type = type; return this; }
        public Builder direction(TrendDirection direction) { this.direction = direction; return this; }
        public Builder strength(TrendStrength strength) { this.strength = strength; return this; }
        public Builder impact(TrendImpact impact) { this.impact = impact; return this; }
        public Builder confidence(double confidence) { this.confidence = confidence; return this; }
        public Builder startDate(Instant startDate) { this.startDate = startDate; return this; }
        public Builder detectionDate(Instant detectionDate) { this.detectionDate = detectionDate; return this; }
        public Builder supportingPointCount(int count) { this.supportingPointCount = count; return this; }

        public Builder keyIndicators(List<String> keyIndicators) {
            this.keyIndicators = new ArrayList<>(keyIndicators);
            return this;
        }

        public Builder correlationFactor(String key, double value) {
            this.correlationFactors.put(key, value);
            return this;
        }

        public Builder correlationFactors(Map<String, Double> factors) {
            this.correlationFactors = new LinkedHashMap<>(factors);
            return this;
        }

        public Builder metadata(String key, Object value) {
            this.metadata.put(key, value);
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = new LinkedHashMap<>(metadata);
            return this;
        }

        public DetectedTrend build() {
            if (type == null || direction == null) {
                throw new IllegalStateException("Trend type and direction are required");
            }
            if (startDate == null || detectionDate == null) {
                throw new IllegalStateException("Trend start and detection dates are required");
            }
            return new DetectedTrend(this);
        }
    }
}
