package com.stratlab.core.indicators;

import com.stratlab.core.model.Bar;

import java.util.List;

/**
 * Rate of Change: percent change against the close {@code period} bars ago.
 */
public final class ROC {

    private ROC() {}

    public static double[] calculate(List<Bar> bars, int period) {
        double[] closes = Series.closes(bars);
        double[] past = Series.shift(closes, period);
        double[] result = new double[closes.length];
        for (int i = 0; i < closes.length; i++) {
            result[i] = (closes[i] - past[i]) / past[i] * 100;
        }
        return result;
    }
}
