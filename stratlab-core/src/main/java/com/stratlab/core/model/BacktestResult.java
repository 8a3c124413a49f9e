package com.stratlab.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.LocalDate;
import java.util.List;

/**
 * Result of a backtest run. Produced once, never mutated afterwards.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BacktestResult(
    String strategyName,
    List<String> tickers,
    BacktestConfig config,
    List<Trade> trades,
    List<EquityPoint> equityCurve,
    PerformanceMetrics metrics,
    PortfolioStatistics portfolioStatistics,
    LocalDate startDate,
    LocalDate endDate,
    long duration,
    List<String> errors
) {
    public BacktestResult {
        tickers = tickers != null ? List.copyOf(tickers) : List.of();
        trades = trades != null ? List.copyOf(trades) : List.of();
        equityCurve = equityCurve != null ? List.copyOf(equityCurve) : List.of();
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    /**
     * Check if the backtest completed successfully
     */
    @JsonIgnore
    public boolean isSuccessful() {
        return errors.isEmpty();
    }

    /**
     * Get summary string
     */
    @JsonIgnore
    public String getSummary() {
        if (!isSuccessful()) {
            return String.format("%s %s: failed (%s)", strategyName, tickers, String.join("; ", errors));
        }
        return String.format(
            "%s %s: %d trades, %.1f%% win rate, %.2f profit factor, %+.2f%% return, %.2f%% max drawdown",
            strategyName,
            tickers,
            metrics.totalTrades(),
            metrics.winRate(),
            metrics.profitFactor(),
            metrics.totalReturnPct(),
            metrics.maxDrawdownPct()
        );
    }
}
