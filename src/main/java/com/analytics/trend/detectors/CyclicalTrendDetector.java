package com.analytics.trend.detectors;

import com.analytics.trend.EngineConfig;
import com.analytics.trend.core.TrendDetector;
import com.analytics.trend.model.*;
import com.analytics.trend.stats.SeriesStatistics;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 周期性趋势检测。
 * 计算去均值序列的归一化自相关，取滞后0之后的第一个显著峰，
 * 峰的滞后即周期长度（点数），峰高即周期强度，同时作为置信度。
 *
 * 参数（来自 EngineConfig）：
 * - cyclical.min.peak.height: 最低峰高 (默认0.3)
 * - cyclical.min.peak.distance: 峰之间的最小间距 (默认5)
 */
public class CyclicalTrendDetector implements TrendDetector {

    public static final String NAME = "cyclical_autocorrelation";

    private static final int MIN_POINTS = 20;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int getMinimumPoints() {
        return MIN_POINTS;
    }

    @Override
    public List<DetectedTrend> detect(TimeSeries series, EngineConfig config, Instant detectionTime) {
        int n = series.size();
        if (n < MIN_POINTS) {
            return Collections.emptyList();
        }

        double[] acf = SeriesStatistics.autocorrelation(series.values());
        double[] lagged = Arrays.copyOfRange(acf, 1, acf.length);
        int[] peaks = SeriesStatistics.findPeaks(lagged,
                config.getCyclicalMinPeakHeight(), config.getCyclicalMinPeakDistance());
        if (peaks.length == 0) {
            return Collections.emptyList();
        }

        int cycleLength = peaks[0] + 1;
        double cycleStrength = acf[cycleLength];

        TrendStrength strength;
        TrendImpact impact;
        if (cycleStrength > 0.7) {
            strength = TrendStrength.STRONG;
            impact = TrendImpact.HIGH;
        } else if (cycleStrength > 0.5) {
            strength = TrendStrength.MODERATE;
            impact = TrendImpact.MEDIUM;
        } else {
            strength = TrendStrength.WEAK;
            impact = TrendImpact.LOW;
        }

        double confidence = cycleStrength;
        if (confidence < config.getConfidenceThreshold()) {
            return Collections.emptyList();
        }

        DetectedTrend trend = DetectedTrend.builder()
                .name("Cyclical trend (cycle: " + cycleLength + " points)")
                .type(TrendType.MARKET)
                .direction(TrendDirection.CYCLICAL)
                .strength(strength)
                .impact(impact)
                .confidence(confidence)
                .startDate(series.getStart())
                .detectionDate(detectionTime)
                .supportingPointCount(n)
                .keyIndicators(List.of("cycle_length", "cycle_strength", "autocorrelation"))
                .correlationFactor("cycle_length", cycleLength)
                .correlationFactor("cycle_strength", cycleStrength)
                .metadata("algorithm", NAME)
                .metadata("cycle_length", cycleLength)
                .metadata("cycle_strength", cycleStrength)
                .metadata("autocorrelation_peaks", peaks.length)
                .build();
        return List.of(trend);
    }
}
