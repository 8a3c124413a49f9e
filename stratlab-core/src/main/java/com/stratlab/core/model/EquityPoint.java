package com.stratlab.core.model;

import java.time.LocalDate;

/**
 * Portfolio valuation at the end of one simulated date.
 */
public record EquityPoint(
    LocalDate date,
    double equity,
    double cash,
    double positionsValue
) {}
