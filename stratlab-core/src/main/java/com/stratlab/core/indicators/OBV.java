package com.stratlab.core.indicators;

import com.stratlab.core.model.Bar;

import java.util.List;

/**
 * On-Balance Volume: running sum of volume signed by the close-to-close direction.
 */
public final class OBV {

    private OBV() {}

    public static double[] calculate(List<Bar> bars) {
        int n = bars.size();
        double[] result = new double[n];
        double obv = 0;
        for (int i = 1; i < n; i++) {
            double change = bars.get(i).close() - bars.get(i - 1).close();
            obv += Math.signum(change) * bars.get(i).volume();
            result[i] = obv;
        }
        return result;
    }
}
