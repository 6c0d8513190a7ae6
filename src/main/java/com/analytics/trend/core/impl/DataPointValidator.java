package com.analytics.trend.core.impl;

import com.analytics.trend.model.ValidationResult;

import java.time.Instant;

/**
 * 写入前的数据点校验
 */
public final class DataPointValidator {

    private DataPointValidator() {}

    public static ValidationResult validate(Instant timestamp, double value, String source, String category) {
        ValidationResult result = ValidationResult.success();
        if (timestamp == null) {
            result.addError("timestamp", "must not be null");
        }
        if (!Double.isFinite(value)) {
            result.addError("value", "must be a finite number, got " + value);
        }
        if (source == null || source.isBlank()) {
            result.addError("source", "must not be blank");
        }
        if (category == null || category.isBlank()) {
            result.addError("category", "must not be blank");
        }
        return result;
    }
}
