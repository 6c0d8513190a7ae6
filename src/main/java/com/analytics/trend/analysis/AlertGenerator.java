package com.analytics.trend.analysis;

import com.analytics.trend.model.AlertType;
import com.analytics.trend.model.DetectedTrend;
import com.analytics.trend.model.TrendAlert;
import com.analytics.trend.model.TrendImpact;
import com.analytics.trend.model.TrendStrength;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 告警生成。两条规则互不排斥：
 * - 影响等级为 critical：critical_impact 告警，有效期7天
 * - 强度为 strong 及以上：strong_trend 告警，严重度等于趋势影响等级，有效期14天
 */
public class AlertGenerator {

    static final List<String> CRITICAL_RECOMMENDATIONS = List.of(
            "Immediate analysis required",
            "Assess business impact",
            "Prepare an urgent action plan");

    static final List<String> STRONG_TREND_RECOMMENDATIONS = List.of(
            "Increase monitoring",
            "Adapt strategy",
            "Inform stakeholders");

    public List<TrendAlert> generate(DetectedTrend trend, Instant now) {
        List<TrendAlert> alerts = new ArrayList<>(2);

        if (trend.getImpact() == TrendImpact.CRITICAL) {
            alerts.add(TrendAlert.create(trend.getId(), AlertType.CRITICAL_IMPACT, TrendImpact.CRITICAL,
                    "Critical trend detected: " + trend.getName(),
                    CRITICAL_RECOMMENDATIONS, now));
        }

        if (trend.getStrength().isAtLeast(TrendStrength.STRONG)) {
            alerts.add(TrendAlert.create(trend.getId(), AlertType.STRONG_TREND, trend.getImpact(),
                    "Strong trend detected: " + trend.getDirection().getCode(),
                    STRONG_TREND_RECOMMENDATIONS, now));
        }

        return alerts;
    }
}
