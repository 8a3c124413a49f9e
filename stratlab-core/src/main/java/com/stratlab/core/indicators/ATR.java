package com.stratlab.core.indicators;

import com.stratlab.core.model.Bar;

import java.util.List;

/**
 * Average True Range as a plain rolling mean of true range.
 */
public final class ATR {

    private ATR() {}

    /**
     * True range per bar. The first bar has no previous close and uses high - low.
     */
    public static double[] trueRange(List<Bar> bars) {
        int n = bars.size();
        double[] tr = new double[n];
        for (int i = 0; i < n; i++) {
            Bar bar = bars.get(i);
            double hl = bar.high() - bar.low();
            if (i == 0) {
                tr[i] = hl;
                continue;
            }
            double prevClose = bars.get(i - 1).close();
            double hc = Math.abs(bar.high() - prevClose);
            double lc = Math.abs(bar.low() - prevClose);
            tr[i] = Math.max(hl, Math.max(hc, lc));
        }
        return tr;
    }

    public static double[] calculate(List<Bar> bars, int period) {
        return Series.rollingMean(trueRange(bars), period);
    }
}
