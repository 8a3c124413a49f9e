package com.stratlab.core.indicators;

import com.stratlab.core.model.Bar;

import java.util.List;

/**
 * Weighted Moving Average with linear weights 1..period (newest heaviest).
 */
public final class WMA {

    private WMA() {}

    public static double[] calculate(List<Bar> bars, int period) {
        return calculate(Series.closes(bars), period);
    }

    public static double[] calculate(double[] values, int period) {
        int n = values.length;
        double[] result = Series.undefined(n);
        if (period <= 0) return result;

        double weightSum = period * (period + 1) / 2.0;
        for (int i = period - 1; i < n; i++) {
            double sum = 0;
            for (int w = 1; w <= period; w++) {
                sum += values[i - period + w] * w;
            }
            result[i] = sum / weightSum;
        }
        return result;
    }
}
