package com.stratlab.core.indicators;

import com.stratlab.core.model.Bar;

import java.util.List;

/**
 * Commodity Channel Index over the typical price, scaled by 0.015 times the
 * mean absolute deviation.
 */
public final class CCI {

    private static final double SCALE = 0.015;

    private CCI() {}

    public static double[] calculate(List<Bar> bars, int period) {
        double[] tp = Series.of(bars, Bar::typicalPrice);
        double[] mean = Series.rollingMean(tp, period);

        int n = tp.length;
        double[] result = Series.undefined(n);
        for (int i = period - 1; i < n && period > 0; i++) {
            double deviation = 0;
            for (int j = i - period + 1; j <= i; j++) {
                deviation += Math.abs(tp[j] - mean[i]);
            }
            double mad = deviation / period;
            result[i] = (tp[i] - mean[i]) / (SCALE * mad);
        }
        return result;
    }
}
