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
 * 季节性趋势检测。
 * 对数值序列做离散傅里叶变换，在非零频率的前半谱中找主峰，
 * 峰值对应的周期换算为天数；周期超出 [min, max] 区间时不输出。
 * 季节振幅取 std/mean。
 *
 * 参数（来自 EngineConfig）：
 * - seasonal.min.period.days / seasonal.max.period.days: 周期合理区间 (默认7 / 365)
 * - seasonal.peak.ratio: 峰值相对最大幅度的最低比例 (默认0.1)
 */
public class SeasonalTrendDetector implements TrendDetector {

    public static final String NAME = "seasonal_fft";

    private static final int MIN_POINTS = 30;

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

        double[] values = series.values();
        double[] magnitudes = SeriesStatistics.magnitudeSpectrum(values);

        // 最大幅度包含直流分量
        double maxMagnitude = Arrays.stream(magnitudes).max().orElse(0.0);
        double[] halfSpectrum = Arrays.copyOfRange(magnitudes, 1, n / 2);
        int[] peaks = SeriesStatistics.findPeaks(halfSpectrum, maxMagnitude * config.getSeasonalPeakRatio(), 1);
        if (peaks.length == 0) {
            return Collections.emptyList();
        }

        int dominant = peaks[0];
        for (int peak : peaks) {
            if (halfSpectrum[peak] > halfSpectrum[dominant]) {
                dominant = peak;
            }
        }
        int bin = dominant + 1;
        double periodPoints = (double) n / bin;
        double periodDays = periodPoints * series.meanIntervalDays();
        if (periodDays < config.getSeasonalMinPeriodDays() || periodDays > config.getSeasonalMaxPeriodDays()) {
            return Collections.emptyList();
        }

        double mean = SeriesStatistics.mean(values);
        if (mean <= 0.0) {
            return Collections.emptyList();
        }
        double amplitude = SeriesStatistics.std(values) / mean;

        TrendStrength strength;
        TrendImpact impact;
        if (amplitude > 0.3) {
            strength = TrendStrength.STRONG;
            impact = TrendImpact.HIGH;
        } else if (amplitude > 0.15) {
            strength = TrendStrength.MODERATE;
            impact = TrendImpact.MEDIUM;
        } else {
            strength = TrendStrength.WEAK;
            impact = TrendImpact.LOW;
        }

        double confidence = Math.min(0.9, amplitude * 2);
        if (confidence < config.getConfidenceThreshold()) {
            return Collections.emptyList();
        }

        DetectedTrend trend = DetectedTrend.builder()
                .name(String.format("Seasonal trend (period: %.1f days)", periodDays))
                .type(TrendType.OPERATIONAL)
                .direction(TrendDirection.SEASONAL)
                .strength(strength)
                .impact(impact)
                .confidence(confidence)
                .startDate(series.getStart())
                .detectionDate(detectionTime)
                .supportingPointCount(n)
                .keyIndicators(List.of("period", "amplitude", "seasonal_strength"))
                .correlationFactor("period", periodDays)
                .correlationFactor("amplitude", amplitude)
                .metadata("algorithm", NAME)
                .metadata("period_days", periodDays)
                .metadata("period_points", periodPoints)
                .metadata("seasonal_amplitude", amplitude)
                .metadata("dominant_frequency", (double) bin / n)
                .build();
        return List.of(trend);
    }
}
