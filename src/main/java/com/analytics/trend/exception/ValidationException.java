package com.analytics.trend.exception;

import com.analytics.trend.model.ValidationResult;

import java.util.List;

/**
 * 输入数据点校验失败
 */
public class ValidationException extends RuntimeException {

    private final List<String> errors;

    public ValidationException(ValidationResult result) {
        super("Invalid data point: " + result);
        this.errors = result.getErrors();
    }

    public ValidationException(String message) {
        super(message);
        this.errors = List.of(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
        this.errors = List.of(message);
    }

    public List<String> getErrors() {
        return errors;
    }
}
