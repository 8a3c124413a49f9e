package com.stratlab.core.model;

/**
 * Distribution of closed-trade outcomes. Standard deviations are population
 * deviations.
 */
public record TradeDistribution(
    int count,
    double meanPnl,
    double medianPnl,
    double stdPnl,
    double meanPnlPct,
    double medianPnlPct,
    double stdPnlPct
) {
    public static TradeDistribution empty() {
        return new TradeDistribution(0, 0, 0, 0, 0, 0, 0);
    }
}
