package com.stratlab.core.indicators;

import com.stratlab.core.model.Bar;

import java.util.List;

/**
 * Williams %R: inverse stochastic, from 0 (at the high) down to -100 (at the low).
 */
public final class WilliamsR {

    private WilliamsR() {}

    public static double[] calculate(List<Bar> bars, int period) {
        double[] highest = Series.rollingMax(Series.of(bars, Bar::high), period);
        double[] lowest = Series.rollingMin(Series.of(bars, Bar::low), period);

        int n = bars.size();
        double[] result = new double[n];
        for (int i = 0; i < n; i++) {
            result[i] = -100 * (highest[i] - bars.get(i).close()) / (highest[i] - lowest[i]);
        }
        return result;
    }
}
