package com.stratlab.core.indicators;

import com.stratlab.core.model.Bar;

import java.util.Arrays;
import java.util.List;
import java.util.function.ToDoubleFunction;

/**
 * Elementwise and rolling-window helpers over bar-aligned series.
 * Windowed helpers yield NaN until the window is full, and for any window
 * that contains a NaN.
 */
public final class Series {

    private Series() {} // Utility class

    // ========== Extraction ==========

    public static double[] of(List<Bar> bars, ToDoubleFunction<Bar> field) {
        double[] result = new double[bars.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = field.applyAsDouble(bars.get(i));
        }
        return result;
    }

    public static double[] closes(List<Bar> bars) {
        return of(bars, Bar::close);
    }

    public static double[] constant(int length, double value) {
        double[] result = new double[length];
        Arrays.fill(result, value);
        return result;
    }

    public static double[] undefined(int length) {
        return constant(length, Double.NaN);
    }

    // ========== Rolling windows ==========

    public static double[] rollingMean(double[] values, int period) {
        int n = values.length;
        double[] result = undefined(n);
        if (period <= 0) return result;

        for (int i = period - 1; i < n; i++) {
            double sum = 0;
            for (int j = i - period + 1; j <= i; j++) {
                sum += values[j];
            }
            result[i] = sum / period;
        }
        return result;
    }

    /**
     * Rolling sample standard deviation (n - 1 denominator).
     */
    public static double[] rollingStd(double[] values, int period) {
        int n = values.length;
        double[] result = undefined(n);
        if (period <= 1) return result;

        double[] mean = rollingMean(values, period);
        for (int i = period - 1; i < n; i++) {
            double sumSq = 0;
            for (int j = i - period + 1; j <= i; j++) {
                double d = values[j] - mean[i];
                sumSq += d * d;
            }
            result[i] = Math.sqrt(sumSq / (period - 1));
        }
        return result;
    }

    public static double[] rollingMax(double[] values, int period) {
        int n = values.length;
        double[] result = undefined(n);
        if (period <= 0) return result;

        for (int i = period - 1; i < n; i++) {
            double max = Double.NEGATIVE_INFINITY;
            for (int j = i - period + 1; j <= i; j++) {
                max = Math.max(max, values[j]);   // Math.max propagates NaN
            }
            result[i] = max;
        }
        return result;
    }

    public static double[] rollingMin(double[] values, int period) {
        int n = values.length;
        double[] result = undefined(n);
        if (period <= 0) return result;

        for (int i = period - 1; i < n; i++) {
            double min = Double.POSITIVE_INFINITY;
            for (int j = i - period + 1; j <= i; j++) {
                min = Math.min(min, values[j]);
            }
            result[i] = min;
        }
        return result;
    }

    // ========== Shifts ==========

    /**
     * values[i] - values[i - lag]; NaN for the first {@code lag} entries.
     */
    public static double[] diff(double[] values, int lag) {
        int n = values.length;
        double[] result = undefined(n);
        if (lag < 0) return result;
        for (int i = lag; i < n; i++) {
            result[i] = values[i] - values[i - lag];
        }
        return result;
    }

    /**
     * values[i - lag]; NaN for the first {@code lag} entries.
     */
    public static double[] shift(double[] values, int lag) {
        int n = values.length;
        double[] result = undefined(n);
        if (lag < 0) return result;
        for (int i = lag; i < n; i++) {
            result[i] = values[i - lag];
        }
        return result;
    }
}
