package com.analytics.trend.detectors;

import com.analytics.trend.EngineConfig;
import com.analytics.trend.core.TrendDetector;
import com.analytics.trend.exception.AlgorithmFailureException;
import com.analytics.trend.model.*;
import com.analytics.trend.stats.SeriesStatistics;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.stat.inference.TTest;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 结构突变（均值漂移）检测。
 *
 * 滑动窗口大小 w = min(breakpoint.max.window, N/3)，对每个内部位置 i
 * 比较 [i-w, i) 与 [i, i+w) 两段的均值，用 Welch t 检验计算双侧 p 值。
 * 候选突变点需同时满足 p < 显著性水平 且 |Δmean| > breakpoint.min.shift.std × std(序列)。
 * 候选中均值变化最大者胜出，等值时取最早的位置。
 *
 * breakpoint.correct.multiple.tests 开启时显著性水平按有效检验次数校正：
 * 相邻位置的窗口大量重叠，有效检验次数取 ceil(扫描位置数 / w)。
 */
public class BreakpointTrendDetector implements TrendDetector {

    public static final String NAME = "breakpoint_ttest";

    private static final int MIN_POINTS = 15;

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
        int window = Math.min(config.getBreakpointMaxWindow(), n / 3);
        int positions = n - 2 * window;
        double alpha = config.isBreakpointCorrectMultipleTests()
                ? config.getBreakpointSignificance() / effectiveTests(positions, window)
                : config.getBreakpointSignificance();
        double minShift = SeriesStatistics.std(values) * config.getBreakpointMinShiftStd();

        TTest tTest = new TTest();
        int bestIndex = -1;
        double bestBefore = 0.0;
        double bestAfter = 0.0;
        double bestMagnitude = 0.0;
        double bestPValue = 1.0;
        int candidates = 0;

        for (int i = window; i < n - window; i++) {
            double[] before = Arrays.copyOfRange(values, i - window, i);
            double[] after = Arrays.copyOfRange(values, i, i + window);
            double beforeMean = SeriesStatistics.mean(before);
            double afterMean = SeriesStatistics.mean(after);
            double magnitude = Math.abs(afterMean - beforeMean);

            double pValue = welchPValue(tTest, before, after, beforeMean, afterMean);
            if (pValue < alpha && magnitude > minShift) {
                candidates++;
                // 严格大于，等值时保留最早的位置
                if (bestIndex < 0 || magnitude > bestMagnitude) {
                    bestIndex = i;
                    bestBefore = beforeMean;
                    bestAfter = afterMean;
                    bestMagnitude = magnitude;
                    bestPValue = pValue;
                }
            }
        }

        if (bestIndex < 0) {
            return Collections.emptyList();
        }

        TrendDirection direction = bestAfter > bestBefore ? TrendDirection.INCREASING : TrendDirection.DECREASING;
        double mean = SeriesStatistics.mean(values);
        double relativeChange = mean == 0.0 ? Double.POSITIVE_INFINITY : bestMagnitude / Math.abs(mean);

        TrendStrength strength;
        TrendImpact impact;
        if (relativeChange > 0.5) {
            strength = TrendStrength.VERY_STRONG;
            impact = TrendImpact.CRITICAL;
        } else if (relativeChange > 0.3) {
            strength = TrendStrength.STRONG;
            impact = TrendImpact.HIGH;
        } else if (relativeChange > 0.15) {
            strength = TrendStrength.MODERATE;
            impact = TrendImpact.MEDIUM;
        } else {
            strength = TrendStrength.WEAK;
            impact = TrendImpact.LOW;
        }

        double confidence = 1.0 - bestPValue;
        if (confidence < config.getConfidenceThreshold()) {
            return Collections.emptyList();
        }

        Instant breakpointTime = series.timestampAt(bestIndex);
        DetectedTrend trend = DetectedTrend.builder()
                .name("Breakpoint " + direction.getCode())
                .type(TrendType.STRATEGIC)
                .direction(direction)
                .strength(strength)
                .impact(impact)
                .confidence(confidence)
                .startDate(breakpointTime)
                .detectionDate(detectionTime)
                .supportingPointCount(n)
                .keyIndicators(List.of("breakpoint_magnitude", "statistical_significance", "relative_change"))
                .correlationFactor("change_magnitude", bestMagnitude)
                .correlationFactor("relative_change", relativeChange)
                .correlationFactor("p_value", bestPValue)
                .metadata("algorithm", NAME)
                .metadata("breakpoint_index", bestIndex)
                .metadata("breakpoint_timestamp", breakpointTime.toString())
                .metadata("before_mean", bestBefore)
                .metadata("after_mean", bestAfter)
                .metadata("window_size", window)
                .metadata("significance_level", alpha)
                .metadata("total_breakpoints", candidates)
                .build();
        return List.of(trend);
    }

    static int effectiveTests(int positions, int window) {
        return Math.max(1, (positions + window - 1) / window);
    }

    /**
     * Welch 双侧检验 p 值。两段方差都为0时检验无定义：均值不同视为 p=0，相同视为 p=1。
     */
    private double welchPValue(TTest tTest, double[] before, double[] after,
                               double beforeMean, double afterMean) {
        if (SeriesStatistics.std(before) == 0.0 && SeriesStatistics.std(after) == 0.0) {
            return beforeMean == afterMean ? 1.0 : 0.0;
        }
        try {
            return tTest.tTest(before, after);
        } catch (MathIllegalArgumentException | MathIllegalStateException e) {
            throw new AlgorithmFailureException(NAME, "t-test failed: " + e.getMessage(), e);
        }
    }
}
