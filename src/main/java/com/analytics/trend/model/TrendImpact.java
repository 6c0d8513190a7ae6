package com.analytics.trend.model;

/**
 * 趋势影响等级枚举，同时作为告警严重程度使用
 */
public enum TrendImpact {
    LOW("low", 1),
    MEDIUM("medium", 2),
    HIGH("high", 3),
    CRITICAL("critical", 4);

    private final String code;
    private final int rank;

    TrendImpact(String code, int rank) {
        this.code = code;
        this.rank = rank;
    }

    public String getCode() { return code; }
    public int getRank() { return rank; }

    public static TrendImpact max(TrendImpact a, TrendImpact b) {
        return a.rank >= b.rank ? a : b;
    }

    public static TrendImpact fromCode(String code) {
        for (TrendImpact impact : values()) {
            if (impact.code.equals(code)) {
                return impact;
            }
        }
        throw new IllegalArgumentException("Unknown trend impact: " + code);
    }
}
