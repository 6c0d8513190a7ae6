package com.analytics.trend.analysis;

import com.analytics.trend.model.DetectedTrend;
import com.analytics.trend.model.TrendImpact;
import com.analytics.trend.model.TrendStrength;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 趋势合并器。
 *
 * 把不同算法独立检测出的、描述同一现象的候选趋势合并为一个：
 * 类型相同、方向相同且起始时间相差小于窗口天数的趋势归为一组，
 * 以组内第一个趋势为种子贪心分组。单元素组原样返回。
 */
public class TrendConsolidator {

    private final Duration window;

    public TrendConsolidator(int windowDays) {
        this.window = Duration.ofDays(windowDays);
    }

    public List<DetectedTrend> consolidate(List<DetectedTrend> candidates, Instant detectionTime) {
        if (candidates.size() <= 1) {
            return new ArrayList<>(candidates);
        }

        List<DetectedTrend> result = new ArrayList<>();
        boolean[] used = new boolean[candidates.size()];

        for (int i = 0; i < candidates.size(); i++) {
            if (used[i]) continue;
            DetectedTrend seed = candidates.get(i);
            used[i] = true;

            List<DetectedTrend> group = new ArrayList<>();
            group.add(seed);
            for (int j = i + 1; j < candidates.size(); j++) {
                if (!used[j] && isSimilar(seed, candidates.get(j))) {
                    group.add(candidates.get(j));
                    used[j] = true;
                }
            }

            result.add(group.size() == 1 ? seed : merge(group, detectionTime));
        }
        return result;
    }

    private boolean isSimilar(DetectedTrend a, DetectedTrend b) {
        return a.getType() == b.getType()
                && a.getDirection() == b.getDirection()
                && Duration.between(a.getStartDate(), b.getStartDate()).abs().compareTo(window) < 0;
    }

    /**
     * 合并一组相似趋势：置信度取均值，数据点数求和，强度和影响取最大，
     * 相关因子按键求均值，关键指标取并集，起始时间取最早。
     */
    DetectedTrend merge(List<DetectedTrend> group, Instant detectionTime) {
        if (group.size() == 1) {
            return group.get(0);
        }

        DetectedTrend base = group.get(0);
        for (DetectedTrend trend : group) {
            if (trend.getConfidence() > base.getConfidence()) {
                base = trend;
            }
        }

        double confidenceSum = 0.0;
        int supportingPoints = 0;
        TrendStrength strength = TrendStrength.WEAK;
        TrendImpact impact = TrendImpact.LOW;
        Set<String> keyIndicators = new LinkedHashSet<>();
        Set<String> algorithms = new LinkedHashSet<>();
        List<String> originalIds = new ArrayList<>();
        Map<String, Double> factorSums = new LinkedHashMap<>();
        Map<String, Integer> factorCounts = new LinkedHashMap<>();

        for (DetectedTrend trend : group) {
            confidenceSum += trend.getConfidence();
            supportingPoints += trend.getSupportingPointCount();
            strength = TrendStrength.max(strength, trend.getStrength());
            impact = TrendImpact.max(impact, trend.getImpact());
            keyIndicators.addAll(trend.getKeyIndicators());
            algorithms.add(trend.getAlgorithm());
            originalIds.add(trend.getId());
            for (Map.Entry<String, Double> factor : trend.getCorrelationFactors().entrySet()) {
                factorSums.merge(factor.getKey(), factor.getValue(), Double::sum);
                factorCounts.merge(factor.getKey(), 1, Integer::sum);
            }
        }

        Map<String, Double> factors = new LinkedHashMap<>();
        factorSums.forEach((key, sum) -> factors.put(key, sum / factorCounts.get(key)));

        Instant earliestStart = group.stream()
                .map(DetectedTrend::getStartDate)
                .min(Comparator.naturalOrder())
                .orElse(base.getStartDate());

        return DetectedTrend.builder()
                .name(base.getName() + " (consolidated)")
                .type(base.getType())
                .direction(base.getDirection())
                .strength(strength)
                .impact(impact)
                .confidence(confidenceSum / group.size())
                .startDate(earliestStart)
                .detectionDate(detectionTime)
                .supportingPointCount(supportingPoints)
                .keyIndicators(new ArrayList<>(keyIndicators))
                .correlationFactors(factors)
                .metadata("consolidated_from", group.size())
                .metadata("source_algorithms", new ArrayList<>(algorithms))
                .metadata("original_trend_ids", originalIds)
                .build();
    }
}
