package com.analytics.trend.stats;

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.transform.DftNormalization;
import org.apache.commons.math3.transform.FastFourierTransformer;
import org.apache.commons.math3.transform.TransformType;
import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.util.ArithmeticUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * 检测算法共用的数值工具：均值、总体标准差、变异系数、
 * 归一化自相关、带高度和最小间距约束的峰值搜索、DFT幅度谱。
 *
 * 全部为无状态静态方法。
 */
public final class SeriesStatistics {

    private SeriesStatistics() {}

    public static double mean(double[] values) {
        return StatUtils.mean(values);
    }

    public static double mean(double[] values, int from, int length) {
        return StatUtils.mean(values, from, length);
    }

    /** 总体标准差（除以 N） */
    public static double std(double[] values) {
        return new StandardDeviation(false).evaluate(values);
    }

    public static double std(double[] values, int from, int length) {
        return new StandardDeviation(false).evaluate(values, from, length);
    }

    /**
     * 变异系数 std/mean；均值为0时无定义，返回 NaN
     */
    public static double coefficientOfVariation(double[] values, int from, int length) {
        double mean = mean(values, from, length);
        if (mean == 0.0) {
            return Double.NaN;
        }
        return std(values, from, length) / mean;
    }

    /**
     * 一阶差分
     */
    public static double[] diff(double[] values) {
        if (values.length < 2) {
            return new double[0];
        }
        double[] out = new double[values.length - 1];
        for (int i = 0; i < out.length; i++) {
            out[i] = values[i + 1] - values[i];
        }
        return out;
    }

    /**
     * 去均值后的完整自相关（滞后 0..N-1），按滞后0归一化。
     * 常数序列返回全0。
     */
    public static double[] autocorrelation(double[] values) {
        int n = values.length;
        double[] acf = new double[n];
        if (n == 0) {
            return acf;
        }
        double mean = mean(values);
        double[] centered = new double[n];
        for (int i = 0; i < n; i++) {
            centered[i] = values[i] - mean;
        }
        for (int lag = 0; lag < n; lag++) {
            double sum = 0.0;
            for (int t = 0; t + lag < n; t++) {
                sum += centered[t] * centered[t + lag];
            }
            acf[lag] = sum;
        }
        double zero = acf[0];
        if (zero == 0.0) {
            Arrays.fill(acf, 0.0);
            return acf;
        }
        for (int lag = 0; lag < n; lag++) {
            acf[lag] /= zero;
        }
        return acf;
    }

    /**
     * 峰值搜索。
     * 1. 找局部极大值（平台取中点）
     * 2. 丢弃低于 minHeight 的峰
     * 3. 按高度从高到低，剔除与已保留峰间距小于 minDistance 的峰
     *
     * @return 保留的峰值下标，升序
     */
    public static int[] findPeaks(double[] x, double minHeight, int minDistance) {
        List<Integer> candidates = new ArrayList<>();
        int i = 1;
        int last = x.length - 1;
        while (i < last) {
            if (x[i - 1] < x[i]) {
                int ahead = i + 1;
                while (ahead < last && x[ahead] == x[i]) {
                    ahead++;
                }
                if (x[ahead] < x[i]) {
                    int left = i;
                    int right = ahead - 1;
                    candidates.add((left + right) / 2);
                    i = ahead;
                }
            }
            i++;
        }

        candidates.removeIf(p -> x[p] < minHeight);
        if (candidates.isEmpty() || minDistance <= 1) {
            return toArray(candidates);
        }

        int n = candidates.size();
        int[] peaks = toArray(candidates);
        boolean[] keep = new boolean[n];
        Arrays.fill(keep, true);

        // 按高度升序的稳定排序，从尾部遍历：等高时下标靠后的峰优先
        Integer[] order = new Integer[n];
        for (int k = 0; k < n; k++) {
            order[k] = k;
        }
        Arrays.sort(order, Comparator.comparingDouble(k -> x[peaks[k]]));

        for (int r = n - 1; r >= 0; r--) {
            int j = order[r];
            if (!keep[j]) {
                continue;
            }
            for (int k = j - 1; k >= 0 && peaks[j] - peaks[k] < minDistance; k--) {
                keep[k] = false;
            }
            for (int k = j + 1; k < n && peaks[k] - peaks[j] < minDistance; k++) {
                keep[k] = false;
            }
        }

        List<Integer> kept = new ArrayList<>();
        for (int k = 0; k < n; k++) {
            if (keep[k]) {
                kept.add(peaks[k]);
            }
        }
        return toArray(kept);
    }

    /**
     * 离散傅里叶变换幅度谱 |X_k|，k = 0..N-1。
     * 长度为2的幂时走 FFT，否则直接计算。
     */
    public static double[] magnitudeSpectrum(double[] values) {
        int n = values.length;
        double[] magnitudes = new double[n];
        if (n == 0) {
            return magnitudes;
        }
        if (ArithmeticUtils.isPowerOfTwo(n)) {
            FastFourierTransformer fft = new FastFourierTransformer(DftNormalization.STANDARD);
            Complex[] spectrum = fft.transform(values, TransformType.FORWARD);
            for (int k = 0; k < n; k++) {
                magnitudes[k] = spectrum[k].abs();
            }
            return magnitudes;
        }
        for (int k = 0; k < n; k++) {
            double re = 0.0;
            double im = 0.0;
            for (int t = 0; t < n; t++) {
                double angle = 2.0 * Math.PI * k * t / n;
                re += values[t] * Math.cos(angle);
                im -= values[t] * Math.sin(angle);
            }
            magnitudes[k] = Math.hypot(re, im);
        }
        return magnitudes;
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    private static int[] toArray(List<Integer> list) {
        int[] out = new int[list.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = list.get(i);
        }
        return out;
    }
}
