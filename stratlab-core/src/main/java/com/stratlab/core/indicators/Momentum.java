package com.stratlab.core.indicators;

import com.stratlab.core.model.Bar;

import java.util.List;

/**
 * Momentum: raw close difference against {@code period} bars ago.
 */
public final class Momentum {

    private Momentum() {}

    public static double[] calculate(List<Bar> bars, int period) {
        return Series.diff(Series.closes(bars), period);
    }
}
