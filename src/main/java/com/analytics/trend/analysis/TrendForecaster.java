package com.analytics.trend.analysis;

import com.analytics.trend.EngineConfig;
import com.analytics.trend.model.DetectedTrend;
import com.analytics.trend.model.TimeSeries;
import com.analytics.trend.model.TrendForecast;
import com.analytics.trend.stats.LinearFit;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 线性预测。
 * 在趋势的支撑序列上重新拟合最小二乘直线，从最后一个观测点起按平均采样间隔
 * 外推 forecast.horizon 步，置信带为 ±1.96 × 残差标准差，准确度取 R²。
 */
public class TrendForecaster {

    public static final String METHODOLOGY = "linear_regression";

    private static final int MIN_POINTS = 5;
    private static final double Z_95 = 1.96;

    private final EngineConfig config;

    public TrendForecaster(EngineConfig config) {
        this.config = config;
    }

    /**
     * @return 预测结果；数据不足、拟合退化或准确度低于置信度阈值时为空
     */
    public Optional<TrendForecast> forecast(DetectedTrend trend, TimeSeries support, Instant createdAt) {
        if (support.size() < MIN_POINTS) {
            return Optional.empty();
        }

        double[] x = support.elapsedDays();
        LinearFit fit = LinearFit.of(x, support.values());
        if (fit.isDegenerate()) {
            return Optional.empty();
        }

        double accuracy = fit.getRSquared();
        if (accuracy < config.getConfidenceThreshold()) {
            return Optional.empty();
        }

        int horizon = config.getForecastHorizon();
        double step = support.meanIntervalDays();
        if (step <= 0.0) {
            step = 1.0;
        }
        double lastX = x[x.length - 1];
        double band = Z_95 * fit.getResidualStd();

        List<Double> predicted = new ArrayList<>(horizon);
        List<TrendForecast.Interval> intervals = new ArrayList<>(horizon);
        for (int j = 1; j <= horizon; j++) {
            double value = fit.predict(lastX + step * j);
            predicted.add(value);
            intervals.add(new TrendForecast.Interval(value - band, value + band));
        }

        return Optional.of(TrendForecast.create(trend.getId(), horizon, predicted, intervals,
                accuracy, METHODOLOGY, createdAt));
    }
}
