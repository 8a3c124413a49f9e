package com.stratlab.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Trading strategy with rule-language entry/exit conditions.
 * Stored as JSON in the strategies directory, one file per strategy.
 * Read-only for the duration of a backtest run.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Strategy(
    @JsonProperty("name") String name,
    @JsonProperty("description") String description,
    @JsonProperty("entry_rules") String entryRules,
    @JsonProperty("exit_rules") String exitRules,
    @JsonProperty("position_sizing") PositionSizing positionSizing,
    @JsonProperty("risk_management") RiskManagement riskManagement
) {
    public static final String DEFAULT_NAME = "New Strategy";

    /**
     * Template handed out for a new strategy.
     */
    public static Strategy createDefault() {
        return new Strategy(
            DEFAULT_NAME,
            "",
            "rsi(14) < 30 AND price > sma(200)",
            "rsi(14) > 70 OR price < entry_price * 0.95",
            PositionSizing.of(PositionSizingMethod.PERCENTAGE, 10),
            new RiskManagement(5.0, 15.0, false, null)
        );
    }

    /**
     * Sizing section, falling back to 10% of cash when the document omits it.
     */
    public PositionSizing sizingOrDefault() {
        return positionSizing != null ? positionSizing : PositionSizing.of(PositionSizingMethod.PERCENTAGE, 10);
    }

    /**
     * Risk section, or an empty one when the document omits it.
     */
    public RiskManagement riskOrNone() {
        return riskManagement != null ? riskManagement : RiskManagement.none();
    }

    public Strategy withName(String newName) {
        return new Strategy(newName, description, entryRules, exitRules, positionSizing, riskManagement);
    }

    public Strategy withRules(String entry, String exit) {
        return new Strategy(name, description, entry, exit, positionSizing, riskManagement);
    }

    public Strategy withPositionSizing(PositionSizing sizing) {
        return new Strategy(name, description, entryRules, exitRules, sizing, riskManagement);
    }

    public Strategy withRiskManagement(RiskManagement risk) {
        return new Strategy(name, description, entryRules, exitRules, positionSizing, risk);
    }
}
