package com.analytics.trend.model;

/**
 * 趋势强度枚举，按序数由弱到强排列
 */
public enum TrendStrength {
    WEAK("weak", 1),
    MODERATE("moderate", 2),
    STRONG("strong", 3),
    VERY_STRONG("very_strong", 4);

    private final String code;
    /** 序数等级，合并趋势时取最大值 */
    private final int rank;

    TrendStrength(String code, int rank) {
        this.code = code;
        this.rank = rank;
    }

    public String getCode() { return code; }
    public int getRank() { return rank; }

    public boolean isAtLeast(TrendStrength other) {
        return rank >= other.rank;
    }

    public static TrendStrength max(TrendStrength a, TrendStrength b) {
        return a.rank >= b.rank ? a : b;
    }

    public static TrendStrength fromCode(String code) {
        for (TrendStrength strength : values()) {
            if (strength.code.equals(code)) {
                return strength;
            }
        }
        throw new IllegalArgumentException("Unknown trend strength: " + code);
    }
}
