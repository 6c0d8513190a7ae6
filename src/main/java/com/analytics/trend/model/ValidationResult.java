package com.analytics.trend.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 输入数据点的校验结果
 */
public class ValidationResult implements Serializable {
    private final List<String> errors = new ArrayList<>();

    public static ValidationResult success() {
        return new ValidationResult();
    }

    public static ValidationResult failure(String field, String message) {
        ValidationResult result = new ValidationResult();
        result.addError(field, message);
        return result;
    }

    public ValidationResult addError(String field, String message) {
        this.errors.add(field + ": " + message);
        return this;
    }

    public boolean isValid() { return errors.isEmpty(); }
    public List<String> getErrors() { return Collections.unmodifiableList(errors); }

    @Override
    public String toString() {
        return isValid() ? "valid" : String.join("; ", errors);
    }
}
