package com.analytics.trend.model;

/**
 * 趋势内部子模式类型
 */
public enum PatternType {
    /** 加速增长 */
    ACCELERATION("acceleration"),
    /** 末段趋稳 */
    STABILIZATION("stabilization"),
    /** 周期性复现 */
    RECURRENCE("recurrence");

    private final String code;

    PatternType(String code) {
        this.code = code;
    }

    public String getCode() { return code; }

    public static PatternType fromCode(String code) {
        for (PatternType type : values()) {
            if (type.code.equals(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown pattern type: " + code);
    }
}
