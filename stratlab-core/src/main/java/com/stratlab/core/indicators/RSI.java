package com.stratlab.core.indicators;

import com.stratlab.core.model.Bar;

import java.util.List;

/**
 * Relative Strength Index over a plain rolling mean of gains and losses.
 * The change into the first bar counts as zero, so the output is defined
 * from index {@code period - 1}. A window with neither gains nor losses has
 * no value; a window with gains and no losses reads 100.
 */
public final class RSI {

    private RSI() {}

    public static double[] calculate(List<Bar> bars, int period) {
        return calculate(Series.closes(bars), period);
    }

    public static double[] calculate(double[] closes, int period) {
        int n = closes.length;
        double[] gains = new double[n];
        double[] losses = new double[n];
        for (int i = 1; i < n; i++) {
            double change = closes[i] - closes[i - 1];
            gains[i] = change > 0 ? change : 0;
            losses[i] = change < 0 ? -change : 0;
        }

        double[] avgGain = Series.rollingMean(gains, period);
        double[] avgLoss = Series.rollingMean(losses, period);

        double[] result = Series.undefined(n);
        for (int i = 0; i < n; i++) {
            double rs = avgGain[i] / avgLoss[i];
            result[i] = 100 - 100 / (1 + rs);
        }
        return result;
    }
}
