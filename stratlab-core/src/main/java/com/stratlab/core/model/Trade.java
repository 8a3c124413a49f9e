package com.stratlab.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * A closed position. Immutable once appended to the portfolio's trade history.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Trade(
    String ticker,
    LocalDate entryDate,
    LocalDate exitDate,
    double entryPrice,
    double exitPrice,
    int quantity,
    double commission,
    ExitReason exitReason
) {
    /**
     * Profit/loss net of the recorded commission.
     */
    @JsonProperty(value = "pnl", access = JsonProperty.Access.READ_ONLY)
    public double pnl() {
        return (exitPrice - entryPrice) * quantity - commission;
    }

    /**
     * Price change in percent of the entry price (commission excluded).
     */
    @JsonProperty(value = "pnlPercent", access = JsonProperty.Access.READ_ONLY)
    public double pnlPercent() {
        return (exitPrice - entryPrice) / entryPrice * 100;
    }

    /**
     * Calendar days between entry and exit.
     */
    @JsonProperty(value = "holdingDays", access = JsonProperty.Access.READ_ONLY)
    public long holdingDays() {
        return ChronoUnit.DAYS.between(entryDate, exitDate);
    }

    @JsonIgnore
    public boolean isWin() {
        return pnl() > 0;
    }
}
