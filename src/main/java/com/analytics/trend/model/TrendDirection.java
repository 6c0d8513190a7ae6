package com.analytics.trend.model;

/**
 * 趋势方向枚举
 */
public enum TrendDirection {
    INCREASING("increasing"),
    DECREASING("decreasing"),
    STABLE("stable"),
    VOLATILE("volatile"),
    CYCLICAL("cyclical"),
    SEASONAL("seasonal");

    private final String code;

    TrendDirection(String code) {
        this.code = code;
    }

    public String getCode() { return code; }

    public static TrendDirection fromCode(String code) {
        for (TrendDirection direction : values()) {
            if (direction.code.equals(code)) {
                return direction;
            }
        }
        throw new IllegalArgumentException("Unknown trend direction: " + code);
    }
}
