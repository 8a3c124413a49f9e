package com.stratlab.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Performance metrics calculated from a finished equity curve and trade list.
 * Percentages are expressed in percent (12.5 means 12.5%).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PerformanceMetrics(
    double initialCapital,
    double finalEquity,
    double totalReturnPct,
    double cagrPct,
    double sharpeRatio,
    double sortinoRatio,
    DrawdownInfo drawdown,
    int totalTrades,
    int winningTrades,
    int losingTrades,
    double winRate,
    double profitFactor,
    double expectancy,
    double averageWin,
    double averageLoss,
    double largestWin,
    double largestLoss,
    double averageHoldingDays
) {
    /**
     * Create empty metrics (no equity, no trades)
     */
    public static PerformanceMetrics empty(double initialCapital) {
        return new PerformanceMetrics(
            initialCapital, initialCapital, 0, 0, 0, 0, DrawdownInfo.none(),
            0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0
        );
    }

    public double maxDrawdownPct() {
        return drawdown != null ? drawdown.maxDrawdownPct() : 0;
    }

    /**
     * Flat name → value view for reporting collaborators.
     */
    public Map<String, Double> asMap() {
        Map<String, Double> map = new LinkedHashMap<>();
        map.put("initial_capital", initialCapital);
        map.put("final_equity", finalEquity);
        map.put("total_return_pct", totalReturnPct);
        map.put("cagr_pct", cagrPct);
        map.put("sharpe_ratio", sharpeRatio);
        map.put("sortino_ratio", sortinoRatio);
        map.put("max_drawdown_pct", maxDrawdownPct());
        map.put("total_trades", (double) totalTrades);
        map.put("winning_trades", (double) winningTrades);
        map.put("losing_trades", (double) losingTrades);
        map.put("win_rate", winRate);
        map.put("profit_factor", profitFactor);
        map.put("expectancy", expectancy);
        map.put("avg_win", averageWin);
        map.put("avg_loss", averageLoss);
        map.put("largest_win", largestWin);
        map.put("largest_loss", largestLoss);
        map.put("avg_holding_days", averageHoldingDays);
        return map;
    }
}
