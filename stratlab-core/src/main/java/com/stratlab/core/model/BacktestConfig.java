package com.stratlab.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Parameters of a backtest run. Passed explicitly to the engine; there is no
 * process-wide configuration lookup.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BacktestConfig(
    double initialCapital,
    double commissionRate,     // fraction of traded value, e.g. 0.001 = 0.1%
    double slippageRate,       // fraction applied against each fill
    double riskFreeRate,       // annual, used by Sharpe/Sortino
    CommissionAttribution commissionAttribution
) {
    public static final double DEFAULT_INITIAL_CAPITAL = 100_000.0;
    public static final double DEFAULT_COMMISSION_RATE = 0.001;
    public static final double DEFAULT_SLIPPAGE_RATE = 0.0005;
    public static final double DEFAULT_RISK_FREE_RATE = 0.02;

    public BacktestConfig {
        if (commissionAttribution == null) {
            commissionAttribution = CommissionAttribution.PER_TRADE;
        }
    }

    /**
     * Create default config
     */
    public static BacktestConfig defaults() {
        return new BacktestConfig(
            DEFAULT_INITIAL_CAPITAL,
            DEFAULT_COMMISSION_RATE,
            DEFAULT_SLIPPAGE_RATE,
            DEFAULT_RISK_FREE_RATE,
            CommissionAttribution.PER_TRADE
        );
    }

    public BacktestConfig withSlippageRate(double rate) {
        return new BacktestConfig(initialCapital, commissionRate, rate, riskFreeRate, commissionAttribution);
    }

    public BacktestConfig withCommissionAttribution(CommissionAttribution attribution) {
        return new BacktestConfig(initialCapital, commissionRate, slippageRate, riskFreeRate, attribution);
    }

    /**
     * Fill price for a buy: the bar price raised by slippage.
     */
    public double buyPrice(double price) {
        return price * (1 + slippageRate);
    }

    /**
     * Fill price for a sell: the bar price reduced by slippage.
     */
    public double sellPrice(double price) {
        return price * (1 - slippageRate);
    }
}
