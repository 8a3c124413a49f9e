package com.stratlab.core.indicators;

import com.stratlab.core.model.Bar;

import java.util.List;

/**
 * Bollinger Bands: SMA middle band, upper/lower at k sample standard deviations.
 */
public final class BollingerBands {

    private BollingerBands() {}

    public record Result(double[] upper, double[] middle, double[] lower) {}

    public static Result calculate(List<Bar> bars, int period, double stdDevMultiplier) {
        double[] closes = Series.closes(bars);
        double[] middle = Series.rollingMean(closes, period);
        double[] std = Series.rollingStd(closes, period);

        int n = closes.length;
        double[] upper = new double[n];
        double[] lower = new double[n];
        for (int i = 0; i < n; i++) {
            upper[i] = middle[i] + stdDevMultiplier * std[i];
            lower[i] = middle[i] - stdDevMultiplier * std[i];
        }
        return new Result(upper, middle, lower);
    }
}
