package com.stratlab.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Risk management section of a strategy document.
 * Percentages are relative to the entry fill price.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RiskManagement(
    @JsonProperty("stop_loss_pct") Double stopLossPct,
    @JsonProperty("take_profit_pct") Double takeProfitPct,
    @JsonProperty("trailing_stop") boolean trailingStop,
    @JsonProperty("trailing_stop_pct") Double trailingStopPct
) {
    public static RiskManagement none() {
        return new RiskManagement(null, null, false, null);
    }

    /**
     * Stop-loss price for an entry, or null when no stop is configured.
     */
    public Double stopLossPrice(double entryPrice) {
        return stopLossPct != null ? entryPrice * (1 - stopLossPct / 100) : null;
    }

    /**
     * Take-profit price for an entry, or null when no target is configured.
     */
    public Double takeProfitPrice(double entryPrice) {
        return takeProfitPct != null ? entryPrice * (1 + takeProfitPct / 100) : null;
    }

    /**
     * Trailing percentage handed to a new position; only set when trailing is enabled.
     */
    public Double effectiveTrailingPct() {
        return trailingStop ? trailingStopPct : null;
    }
}
