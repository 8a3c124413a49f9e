package com.stratlab.core.indicators;

import com.stratlab.core.model.Bar;

import java.util.List;

/**
 * Exponential Moving Average with smoothing factor 2 / (period + 1).
 * Seeded by the first defined observation, without bias adjustment, so the
 * output is defined from that observation onward.
 */
public final class EMA {

    private EMA() {}

    public static double[] calculate(List<Bar> bars, int period) {
        return calculate(Series.closes(bars), period);
    }

    public static double[] calculate(double[] values, int period) {
        int n = values.length;
        double[] result = Series.undefined(n);
        if (period <= 0) return result;

        double alpha = 2.0 / (period + 1);
        double ema = Double.NaN;
        for (int i = 0; i < n; i++) {
            double v = values[i];
            if (Double.isNaN(ema)) {
                ema = v;
            } else if (!Double.isNaN(v)) {
                ema = alpha * v + (1 - alpha) * ema;
            }
            result[i] = ema;
        }
        return result;
    }
}
