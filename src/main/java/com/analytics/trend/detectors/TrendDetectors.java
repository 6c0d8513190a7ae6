package com.analytics.trend.detectors;

import com.analytics.trend.core.TrendDetector;

import java.util.List;

/**
 * 检测器注册表。检测器集合固定，编排器按此顺序依次调用。
 */
public final class TrendDetectors {

    private TrendDetectors() {}

    public static List<TrendDetector> standard() {
        return List.of(
                new LinearTrendDetector(),
                new SeasonalTrendDetector(),
                new CyclicalTrendDetector(),
                new BreakpointTrendDetector(),
                new VolatilityTrendDetector()
        );
    }
}
