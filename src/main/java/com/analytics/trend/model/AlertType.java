package com.analytics.trend.model;

import java.time.Duration;

/**
 * 告警类型，每种类型带固定的有效期
 */
public enum AlertType {
    /** 影响等级为 critical 的趋势 */
    CRITICAL_IMPACT("critical_impact", Duration.ofDays(7)),
    /** 强度为 strong 及以上的趋势 */
    STRONG_TREND("strong_trend", Duration.ofDays(14));

    private final String code;
    private final Duration validity;

    AlertType(String code, Duration validity) {
        this.code = code;
        this.validity = validity;
    }

    public String getCode() { return code; }
    public Duration getValidity() { return validity; }

    public static AlertType fromCode(String code) {
        for (AlertType type : values()) {
            if (type.code.equals(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown alert type: " + code);
    }
}
