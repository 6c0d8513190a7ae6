package com.analytics.trend.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * 趋势预测结果，生成后不可变
 */
public final class TrendForecast implements Serializable {
    private final String id;
    private final String trendId;
    /** 预测步数 */
    private final int horizon;
    private final List<Double> predictedValues;
    private final List<Interval> confidenceIntervals;
    /** 拟合优度 R²，作为预测的置信度 */
    private final double accuracy;
    private final String methodology;
    private final Instant createdAt;

    public TrendForecast(String id, String trendId, int horizon, List<Double> predictedValues,
                         List<Interval> confidenceIntervals, double accuracy, String methodology,
                         Instant createdAt) {
        if (predictedValues.size() != horizon || confidenceIntervals.size() != horizon) {
            throw new IllegalArgumentException("Forecast series length must equal horizon " + horizon);
        }
        this.id = id;
        this.trendId = trendId;
        this.horizon = horizon;
        this.predictedValues = Collections.unmodifiableList(new ArrayList<>(predictedValues));
        this.confidenceIntervals = Collections.unmodifiableList(new ArrayList<>(confidenceIntervals));
        this.accuracy = accuracy;
        this.methodology = methodology;
        this.createdAt = createdAt;
    }

    public static TrendForecast create(String trendId, int horizon, List<Double> predictedValues,
                                       List<Interval> confidenceIntervals, double accuracy,
                                       String methodology, Instant createdAt) {
        return new TrendForecast(UUID.randomUUID().toString(), trendId, horizon, predictedValues,
                confidenceIntervals, accuracy, methodology, createdAt);
    }

    public String getId() { return id; }
    public String getTrendId() { return trendId; }
    public int getHorizon() { return horizon; }
    public List<Double> getPredictedValues() { return predictedValues; }
    public List<Interval> getConfidenceIntervals() { return confidenceIntervals; }
    public double getAccuracy() { return accuracy; }
    public String getMethodology() { return methodology; }
    public Instant getCreatedAt() { return createdAt; }

    /**
     * 单个预测点的置信区间
     */
    public static final class Interval implements Serializable {
        private final double low;
        private final double high;

        public Interval(double low, double high) {
            this.low = low;
            this.high = high;
        }

        public double getLow() { return low; }
        public double getHigh() { return high; }
        public double width() { return high - low; }
    }
}
