package com.analytics.trend.detectors;

import com.analytics.trend.EngineConfig;
import com.analytics.trend.core.TrendDetector;
import com.analytics.trend.model.*;
import com.analytics.trend.stats.LinearFit;
import com.analytics.trend.stats.SeriesStatistics;

import java.time.Instant;
import java.util.Collections;
import java.util.List;

/**
 * 波动率趋势检测。
 * 以 w = min(volatility.max.window, N/2) 为窗口计算滚动变异系数，
 * 对得到的波动率序列再做线性拟合：平均波动率决定强度和影响等级，
 * 波动率斜率区分“波动加剧”和“波动收敛”。
 */
public class VolatilityTrendDetector implements TrendDetector {

    public static final String NAME = "volatility_rolling_cv";

    private static final int MIN_POINTS = 10;
    private static final int MIN_VOLATILITY_SAMPLES = 5;
    private static final double SLOPE_EPSILON = 0.01;

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
        int window = Math.min(config.getVolatilityMaxWindow(), n / 2);
        if (n - window < MIN_VOLATILITY_SAMPLES) {
            return Collections.emptyList();
        }

        double[] volatilities = new double[n - window];
        for (int i = window; i < n; i++) {
            double cv = SeriesStatistics.coefficientOfVariation(values, i - window, window);
            if (Double.isNaN(cv)) {
                // 均值为0的窗口变异系数无定义
                return Collections.emptyList();
            }
            volatilities[i - window] = cv;
        }

        LinearFit fit = LinearFit.ofIndex(volatilities);
        double volatilityTrend = Double.isNaN(fit.getSlope()) ? 0.0 : fit.getSlope();
        double rSquared = Double.isNaN(fit.getRSquared()) ? 0.0 : fit.getRSquared();
        double avgVolatility = SeriesStatistics.mean(volatilities);

        TrendDirection direction;
        String name;
        if (avgVolatility > config.getVolatilityThreshold()) {
            if (volatilityTrend > SLOPE_EPSILON) {
                direction = TrendDirection.VOLATILE;
                name = "Volatility increasing";
            } else if (volatilityTrend < -SLOPE_EPSILON) {
                direction = TrendDirection.STABLE;
                name = "Volatility decreasing";
            } else {
                direction = TrendDirection.VOLATILE;
                name = "High volatility";
            }
        } else {
            direction = TrendDirection.STABLE;
            name = "Low volatility";
        }

        TrendStrength strength;
        TrendImpact impact;
        if (avgVolatility > 0.4) {
            strength = TrendStrength.VERY_STRONG;
            impact = TrendImpact.CRITICAL;
        } else if (avgVolatility > 0.3) {
            strength = TrendStrength.STRONG;
            impact = TrendImpact.HIGH;
        } else if (avgVolatility > 0.2) {
            strength = TrendStrength.MODERATE;
            impact = TrendImpact.MEDIUM;
        } else {
            strength = TrendStrength.WEAK;
            impact = TrendImpact.LOW;
        }

        double confidence = Math.min(0.9, rSquared + avgVolatility);
        if (confidence < config.getConfidenceThreshold()) {
            return Collections.emptyList();
        }

        DetectedTrend trend = DetectedTrend.builder()
                .name(name)
                .type(TrendType.FINANCIAL)
                .direction(direction)
                .strength(strength)
                .impact(impact)
                .confidence(confidence)
                .startDate(series.timestampAt(window))
                .detectionDate(detectionTime)
                .supportingPointCount(n)
                .keyIndicators(List.of("average_volatility", "volatility_trend", "stability"))
                .correlationFactor("avg_volatility", avgVolatility)
                .correlationFactor("volatility_trend", volatilityTrend)
                .correlationFactor("r2_score", rSquared)
                .metadata("algorithm", NAME)
                .metadata("average_volatility", avgVolatility)
                .metadata("volatility_trend", volatilityTrend)
                .metadata("window_size", window)
                .build();
        return List.of(trend);
    }
}
