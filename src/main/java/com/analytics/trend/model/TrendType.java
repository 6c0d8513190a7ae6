package com.analytics.trend.model;

/**
 * 趋势类型枚举
 */
public enum TrendType {
    MARKET("market"),
    TECHNOLOGY("technology"),
    BUSINESS("business"),
    FINANCIAL("financial"),
    OPERATIONAL("operational"),
    STRATEGIC("strategic"),
    COMPETITIVE("competitive"),
    REGULATORY("regulatory"),
    SOCIAL("social"),
    ENVIRONMENTAL("environmental");

    private final String code;

    TrendType(String code) {
        this.code = code;
    }

    public String getCode() { return code; }

    public static TrendType fromCode(String code) {
        for (TrendType type : values()) {
            if (type.code.equals(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown trend type: " + code);
    }
}
