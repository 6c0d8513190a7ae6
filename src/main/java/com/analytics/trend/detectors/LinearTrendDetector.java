package com.analytics.trend.detectors;

import com.analytics.trend.EngineConfig;
import com.analytics.trend.core.TrendDetector;
import com.analytics.trend.exception.AlgorithmFailureException;
import com.analytics.trend.model.*;
import com.analytics.trend.stats.LinearFit;
import com.analytics.trend.stats.SeriesStatistics;
import org.apache.commons.math3.stat.StatUtils;

import java.time.Instant;
import java.util.Collections;
import java.util.List;

/**
 * 线性趋势检测。
 * 以经过天数为自变量做最小二乘拟合，斜率决定方向和强度，
 * 相对变化量 |slope·N| / mean 决定影响等级，R² 作为置信度。
 *
 * 参数（来自 EngineConfig）：
 * - linear.stable.slope: 斜率绝对值低于此值视为平稳 (默认0.1)
 * - linear.strong.slope: 斜率绝对值高于此值视为强趋势 (默认1.0)
 */
public class LinearTrendDetector implements TrendDetector {

    public static final String NAME = "linear_regression";

    private static final int MIN_POINTS = 5;

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
        if (series.size() < MIN_POINTS) {
            return Collections.emptyList();
        }

        double[] x = series.elapsedDays();
        double[] y = series.values();
        LinearFit fit = LinearFit.of(x, y);
        if (fit.isDegenerate()) {
            throw new AlgorithmFailureException(NAME, "regression is undefined, all "
                    + series.size() + " points share one timestamp");
        }

        double slope = fit.getSlope();
        double absSlope = Math.abs(slope);

        TrendDirection direction;
        TrendStrength strength;
        if (absSlope < config.getLinearStableSlope()) {
            direction = TrendDirection.STABLE;
            strength = TrendStrength.WEAK;
        } else {
            direction = slope > 0 ? TrendDirection.INCREASING : TrendDirection.DECREASING;
            strength = absSlope > config.getLinearStrongSlope() ? TrendStrength.STRONG : TrendStrength.MODERATE;
        }

        double mean = SeriesStatistics.mean(y);
        double relativeChange = mean == 0.0
                ? Double.POSITIVE_INFINITY
                : Math.abs(slope * series.size()) / Math.abs(mean);

        TrendImpact impact;
        if (relativeChange > 0.5) {
            impact = TrendImpact.HIGH;
        } else if (relativeChange > 0.2) {
            impact = TrendImpact.MEDIUM;
        } else {
            impact = TrendImpact.LOW;
        }

        double confidence = SeriesStatistics.clamp(fit.getRSquared(), 0.1, 0.95);
        if (confidence < config.getConfidenceThreshold()) {
            return Collections.emptyList();
        }

        DetectedTrend trend = DetectedTrend.builder()
                .name("Linear trend " + direction.getCode())
                .type(TrendType.BUSINESS)
                .direction(direction)
                .strength(strength)
                .impact(impact)
                .confidence(confidence)
                .startDate(series.getStart())
                .detectionDate(detectionTime)
                .supportingPointCount(series.size())
                .keyIndicators(List.of("slope", "r2_score", "relative_change"))
                .correlationFactor("slope", slope)
                .correlationFactor("r2_score", fit.getRSquared())
                .correlationFactor("relative_change", relativeChange)
                .metadata("algorithm", NAME)
                .metadata("slope", slope)
                .metadata("intercept", fit.getIntercept())
                .metadata("r2_score", fit.getRSquared())
                .metadata("value_range", List.of(StatUtils.min(y), StatUtils.max(y)))
                .build();
        return List.of(trend);
    }
}
