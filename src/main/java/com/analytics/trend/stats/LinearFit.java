package com.analytics.trend.stats;

import org.apache.commons.math3.stat.regression.SimpleRegression;

/**
 * 一元最小二乘拟合结果（斜率、截距、R²、残差标准差）
 */
public final class LinearFit {

    private final double slope;
    private final double intercept;
    private final double rSquared;
    private final double residualStd;

    private LinearFit(double slope, double intercept, double rSquared, double residualStd) {
        this.slope = slope;
        this.intercept = intercept;
        this.rSquared = rSquared;
        this.residualStd = residualStd;
    }

    /**
     * 对 (x, y) 做普通最小二乘拟合。
     * x 方差为0时斜率为 NaN，由调用方决定如何处理。
     */
    public static LinearFit of(double[] x, double[] y) {
        if (x.length != y.length) {
            throw new IllegalArgumentException("x and y must have the same length: " + x.length + " vs " + y.length);
        }
        SimpleRegression regression = new SimpleRegression();
        for (int i = 0; i < x.length; i++) {
            regression.addData(x[i], y[i]);
        }

        double slope = regression.getSlope();
        double intercept = regression.getIntercept();

        // 常数序列被水平线完美拟合
        double rSquared = regression.getTotalSumSquares() == 0.0 ? 1.0 : regression.getRSquare();

        double[] residuals = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            residuals[i] = y[i] - (intercept + slope * x[i]);
        }
        double residualStd = residuals.length == 0 ? 0.0 : SeriesStatistics.std(residuals);

        return new LinearFit(slope, intercept, rSquared, residualStd);
    }

    /**
     * 以下标 0..n-1 为自变量拟合
     */
    public static LinearFit ofIndex(double[] y) {
        double[] x = new double[y.length];
        for (int i = 0; i < x.length; i++) {
            x[i] = i;
        }
        return of(x, y);
    }

    public double predict(double x) {
        return intercept + slope * x;
    }

    public boolean isDegenerate() {
        return Double.isNaN(slope) || Double.isNaN(intercept);
    }

    public double getSlope() { return slope; }
    public double getIntercept() { return intercept; }
    public double getRSquared() { return rSquared; }
    public double getResidualStd() { return residualStd; }
}
