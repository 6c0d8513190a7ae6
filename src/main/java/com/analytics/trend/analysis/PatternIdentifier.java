package com.analytics.trend.analysis;

import com.analytics.trend.EngineConfig;
import com.analytics.trend.model.*;
import com.analytics.trend.stats.SeriesStatistics;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 子模式识别。
 * 在趋势的支撑序列上独立运行三项检查：
 * - 加速：仅对上升趋势，二阶差分均值超过 0.1·std
 * - 收敛：仅对弱趋势，最后10个点的变异系数小于0.05
 * - 重复：无条件，自相关峰高不低于 pattern.recurrence.min.peak.height
 * 低于置信度阈值的模式不输出。
 */
public class PatternIdentifier {

    private static final int ACCELERATION_MIN_POINTS = 10;
    private static final int STABILIZATION_MIN_POINTS = 15;
    private static final int STABILIZATION_TAIL = 10;
    private static final int RECURRENCE_MIN_POINTS = 20;

    private static final double ACCELERATION_CONFIDENCE = 0.8;
    private static final double STABILIZATION_CONFIDENCE = 0.9;
    private static final double RECURRENCE_CONFIDENCE = 0.7;
    private static final double STABILIZATION_MAX_CV = 0.05;

    private final EngineConfig config;

    public PatternIdentifier(EngineConfig config) {
        this.config = config;
    }

    public List<TrendPattern> identify(DetectedTrend trend, TimeSeries support, Instant detectionTime) {
        List<TrendPattern> patterns = new ArrayList<>();

        if (trend.getDirection() == TrendDirection.INCREASING) {
            TrendPattern acceleration = detectAcceleration(trend, support, detectionTime);
            if (acceleration != null) patterns.add(acceleration);
        }
        if (trend.getStrength() == TrendStrength.WEAK) {
            TrendPattern stabilization = detectStabilization(trend, support, detectionTime);
            if (stabilization != null) patterns.add(stabilization);
        }
        TrendPattern recurrence = detectRecurrence(trend, support, detectionTime);
        if (recurrence != null) patterns.add(recurrence);

        patterns.removeIf(p -> p.getConfidence() < config.getConfidenceThreshold());
        return patterns;
    }

    TrendPattern detectAcceleration(DetectedTrend trend, TimeSeries support, Instant detectionTime) {
        if (support.size() < ACCELERATION_MIN_POINTS) {
            return null;
        }
        double[] values = support.values();
        double[] secondDiff = SeriesStatistics.diff(SeriesStatistics.diff(values));
        double std = SeriesStatistics.std(values);
        double meanAcceleration = SeriesStatistics.mean(secondDiff);

        if (std == 0.0 || meanAcceleration <= std * 0.1) {
            return null;
        }

        Map<String, Double> parameters = new LinkedHashMap<>();
        parameters.put("acceleration_rate", meanAcceleration);
        return TrendPattern.create(trend.getId(), PatternType.ACCELERATION,
                support.getStart(), support.getEnd(),
                Math.min(1.0, Math.abs(meanAcceleration) / std),
                ACCELERATION_CONFIDENCE, parameters, detectionTime);
    }

    TrendPattern detectStabilization(DetectedTrend trend, TimeSeries support, Instant detectionTime) {
        int n = support.size();
        if (n < STABILIZATION_MIN_POINTS) {
            return null;
        }
        double[] values = support.values();
        int from = n - STABILIZATION_TAIL;
        double mean = SeriesStatistics.mean(values, from, STABILIZATION_TAIL);
        if (mean == 0.0) {
            return null;
        }
        double cv = SeriesStatistics.std(values, from, STABILIZATION_TAIL) / Math.abs(mean);
        if (cv >= STABILIZATION_MAX_CV) {
            return null;
        }

        Map<String, Double> parameters = new LinkedHashMap<>();
        parameters.put("stability_coefficient", cv);
        return TrendPattern.create(trend.getId(), PatternType.STABILIZATION,
                support.timestampAt(from), support.getEnd(),
                1.0 - cv * 10, STABILIZATION_CONFIDENCE, parameters, detectionTime);
    }

    TrendPattern detectRecurrence(DetectedTrend trend, TimeSeries support, Instant detectionTime) {
        if (support.size() < RECURRENCE_MIN_POINTS) {
            return null;
        }
        double[] acf = SeriesStatistics.autocorrelation(support.values());
        int[] peaks = SeriesStatistics.findPeaks(Arrays.copyOfRange(acf, 1, acf.length),
                config.getRecurrenceMinPeakHeight(), config.getRecurrenceMinPeakDistance());
        if (peaks.length == 0) {
            return null;
        }

        int period = peaks[0] + 1;
        double strength = acf[period];
        Map<String, Double> parameters = new LinkedHashMap<>();
        parameters.put("recurrence_period", (double) period);
        parameters.put("recurrence_strength", strength);
        return TrendPattern.create(trend.getId(), PatternType.RECURRENCE,
                support.getStart(), support.getEnd(),
                strength, RECURRENCE_CONFIDENCE, parameters, detectionTime);
    }
}
