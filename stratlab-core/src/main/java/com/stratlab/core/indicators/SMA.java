package com.stratlab.core.indicators;

import com.stratlab.core.model.Bar;

import java.util.List;

/**
 * Simple Moving Average: mean of the last N values.
 */
public final class SMA {

    private SMA() {}

    public static double[] calculate(List<Bar> bars, int period) {
        return calculate(Series.closes(bars), period);
    }

    public static double[] calculate(double[] values, int period) {
        return Series.rollingMean(values, period);
    }

    public static int warmupBars(int period) {
        return period - 1;
    }
}
