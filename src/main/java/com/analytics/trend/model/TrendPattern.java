package com.analytics.trend.model;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * 趋势内部识别出的子模式，归属于唯一的趋势，时间范围是趋势跨度的子窗口
 */
public final class TrendPattern implements Serializable {
    private final String id;
    private final String trendId;
    private final PatternType type;
    private final Instant startDate;
    private final Instant endDate;
    private final double strength;
    private final double confidence;
    private final Map<String, Double> parameters;
    private final Instant detectedAt;

    public TrendPattern(String id, String trendId, PatternType type, Instant startDate, Instant endDate,
                        double strength, double confidence, Map<String, Double> parameters,
                        Instant detectedAt) {
        this.id = id;
        this.trendId = trendId;
        this.type = type;
        this.startDate = startDate;
        this.endDate = endDate;
        this.strength = strength;
        this.confidence = confidence;
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        this.detectedAt = detectedAt;
    }

    public static TrendPattern create(String trendId, PatternType type, Instant startDate, Instant endDate,
                                      double strength, double confidence, Map<String, Double> parameters,
                                      Instant detectedAt) {
        return new TrendPattern(UUID.randomUUID().toString(), trendId, type, startDate, endDate,
                strength, confidence, parameters, detectedAt);
    }

    public String getId() { return id; }
    public String getTrendId() { return trendId; }
    public PatternType getType() { return type; }
    public Instant getStartDate() { return startDate; }
    public Instant getEndDate() { return endDate; }
    public double getStrength() { return strength; }
    public double getConfidence() { return confidence; }
    public Map<String, Double> getParameters() { return parameters; }
    public Instant getDetectedAt() { return detectedAt; }

    public Duration getDuration() {
        return Duration.between(startDate, endDate);
    }

    public long getDurationDays() {
        return getDuration().toDays();
    }
}
