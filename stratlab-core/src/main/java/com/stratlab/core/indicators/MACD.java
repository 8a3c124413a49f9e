package com.stratlab.core.indicators;

import com.stratlab.core.model.Bar;

import java.util.List;

/**
 * Moving Average Convergence Divergence.
 * All three lines are EMA based and therefore defined from the first bar.
 */
public final class MACD {

    private MACD() {}

    /**
     * MACD result with line, signal, and histogram.
     */
    public record Result(double[] line, double[] signal, double[] histogram) {}

    public static Result calculate(List<Bar> bars, int fastPeriod, int slowPeriod, int signalPeriod) {
        double[] closes = Series.closes(bars);
        double[] fast = EMA.calculate(closes, fastPeriod);
        double[] slow = EMA.calculate(closes, slowPeriod);

        int n = closes.length;
        double[] line = new double[n];
        for (int i = 0; i < n; i++) {
            line[i] = fast[i] - slow[i];
        }

        double[] signal = EMA.calculate(line, signalPeriod);
        double[] histogram = new double[n];
        for (int i = 0; i < n; i++) {
            histogram[i] = line[i] - signal[i];
        }

        return new Result(line, signal, histogram);
    }
}
