package com.stratlab.core.indicators;

import com.stratlab.core.model.Bar;

import java.util.List;

/**
 * Stochastic Oscillator - close relative to the high-low range of the last k bars.
 * A flat range divides by zero and yields an infinite or undefined %K.
 */
public final class Stochastic {

    private Stochastic() {}

    /**
     * Full Stochastic result with %K and %D lines.
     */
    public record Result(double[] k, double[] d) {}

    public static Result calculate(List<Bar> bars, int kPeriod, int dPeriod) {
        double[] lowest = Series.rollingMin(Series.of(bars, Bar::low), kPeriod);
        double[] highest = Series.rollingMax(Series.of(bars, Bar::high), kPeriod);

        int n = bars.size();
        double[] k = new double[n];
        for (int i = 0; i < n; i++) {
            k[i] = 100 * (bars.get(i).close() - lowest[i]) / (highest[i] - lowest[i]);
        }
        double[] d = Series.rollingMean(k, dPeriod);
        return new Result(k, d);
    }
}
