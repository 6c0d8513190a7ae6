package com.analytics.trend.exception;

/**
 * 单个检测算法内部的数值失败（退化矩阵、非法统计量等）。
 * 由编排器按算法捕获，不影响其他算法。
 */
public class AlgorithmFailureException extends RuntimeException {

    private final String algorithm;

    public AlgorithmFailureException(String algorithm, String message) {
        super(algorithm + ": " + message);
        this.algorithm = algorithm;
    }

    public AlgorithmFailureException(String algorithm, String message, Throwable cause) {
        super(algorithm + ": " + message, cause);
        this.algorithm = algorithm;
    }

    public String getAlgorithm() {
        return algorithm;
    }
}
