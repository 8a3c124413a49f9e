package com.stratlab.core.model;

import java.util.List;

/**
 * Summary counters over a portfolio's closed trades.
 * A trade with pnl of exactly zero counts as losing.
 */
public record PortfolioStatistics(
    int totalTrades,
    int winningTrades,
    int losingTrades,
    double winRate,
    double totalPnl,
    double averageWin,
    double averageLoss,
    double totalCommission,
    double averageHoldingDays
) {
    public static PortfolioStatistics empty(double totalCommission) {
        return new PortfolioStatistics(0, 0, 0, 0, 0, 0, 0, totalCommission, 0);
    }

    /**
     * Summarize a trade history. {@code totalCommission} is the portfolio's running
     * commission total, which includes the commission of any still-open entry.
     */
    public static PortfolioStatistics of(List<Trade> trades, double totalCommission) {
        if (trades == null || trades.isEmpty()) {
            return empty(totalCommission);
        }

        int winners = 0;
        int losers = 0;
        double totalPnl = 0;
        double winSum = 0;
        double lossSum = 0;
        double holdingSum = 0;

        for (Trade t : trades) {
            double pnl = t.pnl();
            totalPnl += pnl;
            holdingSum += t.holdingDays();
            if (pnl > 0) {
                winners++;
                winSum += pnl;
            } else {
                losers++;
                lossSum += pnl;
            }
        }

        int total = trades.size();
        return new PortfolioStatistics(
            total,
            winners,
            losers,
            (double) winners / total * 100,
            totalPnl,
            winners > 0 ? winSum / winners : 0,
            losers > 0 ? lossSum / losers : 0,
            totalCommission,
            holdingSum / total
        );
    }
}
