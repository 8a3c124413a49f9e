package com.stratlab.core.indicators;

import com.stratlab.core.model.Bar;

import java.util.List;

/**
 * Volume Weighted Average Price, cumulative from the first bar of the series.
 */
public final class VWAP {

    private VWAP() {}

    public static double[] calculate(List<Bar> bars) {
        int n = bars.size();
        double[] result = new double[n];
        double cumPV = 0;
        double cumVolume = 0;
        for (int i = 0; i < n; i++) {
            Bar bar = bars.get(i);
            cumPV += bar.typicalPrice() * bar.volume();
            cumVolume += bar.volume();
            result[i] = cumPV / cumVolume;
        }
        return result;
    }
}
