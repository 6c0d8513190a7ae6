package com.analytics.trend.model;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * 时序序列，一次检测所用的按时间戳升序排列的数据点集合。
 * 构造时排序，不依赖写入顺序。
 */
public class TimeSeries implements Serializable {

    private static final double SECONDS_PER_DAY = 86_400.0;

    /** 分类标识；跨分类检测时为 null */
    private final String category;
    private final List<DataPoint> dataPoints;

    public TimeSeries(String category, List<DataPoint> points) {
        this.category = category;
        List<DataPoint> sorted = new ArrayList<>(points);
        sorted.sort(Comparator.comparing(DataPoint::getTimestamp));
        this.dataPoints = Collections.unmodifiableList(sorted);
    }

    public String getCategory() { return category; }
    public List<DataPoint> getDataPoints() { return dataPoints; }

    public int size() {
        return dataPoints.size();
    }

    public boolean isEmpty() {
        return dataPoints.isEmpty();
    }

    public DataPoint get(int index) {
        return dataPoints.get(index);
    }

    public Instant timestampAt(int index) {
        return dataPoints.get(index).getTimestamp();
    }

    public Instant getStart() {
        return dataPoints.get(0).getTimestamp();
    }

    public Instant getEnd() {
        return dataPoints.get(dataPoints.size() - 1).getTimestamp();
    }

    public double[] values() {
        double[] values = new double[dataPoints.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = dataPoints.get(i).getValue();
        }
        return values;
    }

    /**
     * 各点相对首个点的经过天数（含小数部分），作为回归的时间轴
     */
    public double[] elapsedDays() {
        double[] days = new double[dataPoints.size()];
        if (days.length == 0) return days;
        Instant origin = getStart();
        for (int i = 0; i < days.length; i++) {
            days[i] = Duration.between(origin, dataPoints.get(i).getTimestamp()).toMillis()
                    / 1000.0 / SECONDS_PER_DAY;
        }
        return days;
    }

    /**
     * 平均采样间隔（天）。少于两个点或时间戳全部相同时返回0。
     */
    public double meanIntervalDays() {
        if (dataPoints.size() < 2) return 0.0;
        double spanDays = Duration.between(getStart(), getEnd()).toMillis() / 1000.0 / SECONDS_PER_DAY;
        return spanDays / (dataPoints.size() - 1);
    }

    /**
     * 截取时间戳不早于 from 的子序列
     */
    public TimeSeries since(Instant from) {
        if (from == null || isEmpty() || !getStart().isBefore(from)) {
            return this;
        }
        List<DataPoint> tail = new ArrayList<>();
        for (DataPoint dp : dataPoints) {
            if (!dp.getTimestamp().isBefore(from)) {
                tail.add(dp);
            }
        }
        return new TimeSeries(category, tail);
    }
}
