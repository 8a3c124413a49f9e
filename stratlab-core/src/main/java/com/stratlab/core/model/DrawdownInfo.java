package com.stratlab.core.model;

import java.time.LocalDate;

/**
 * Deepest peak-to-trough decline of an equity curve.
 * Dates and values are null/zero for a curve that never declines below a prior peak
 * or is empty.
 */
public record DrawdownInfo(
    double maxDrawdownPct,   // negative percentage, e.g. -25.0
    LocalDate peakDate,
    LocalDate troughDate,
    double peakValue,
    double troughValue
) {
    public static DrawdownInfo none() {
        return new DrawdownInfo(0, null, null, 0, 0);
    }
}
