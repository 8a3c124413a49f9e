package com.stratlab.engine;

import java.time.LocalDate;

/**
 * An open holding in one ticker. Created and mutated only by {@link Portfolio}.
 */
public class Position {

    private final String ticker;
    private final LocalDate entryDate;
    private final double entryPrice;
    private final int quantity;
    private final Double takeProfit;
    private final Double trailingStopPct;
    private final double entryCommission;
    private Double stopLoss;

    Position(String ticker, LocalDate entryDate, double entryPrice, int quantity,
             Double stopLoss, Double takeProfit, Double trailingStopPct, double entryCommission) {
        this.ticker = ticker;
        this.entryDate = entryDate;
        this.entryPrice = entryPrice;
        this.quantity = quantity;
        this.stopLoss = stopLoss;
        this.takeProfit = takeProfit;
        this.trailingStopPct = trailingStopPct;
        this.entryCommission = entryCommission;
    }

    public String getTicker() { return ticker; }
    public LocalDate getEntryDate() { return entryDate; }
    public double getEntryPrice() { return entryPrice; }
    public int getQuantity() { return quantity; }
    public Double getStopLoss() { return stopLoss; }
    public Double getTakeProfit() { return takeProfit; }
    public Double getTrailingStopPct() { return trailingStopPct; }
    public double getEntryCommission() { return entryCommission; }

    public double costBasis() {
        return entryPrice * quantity;
    }

    public double currentValue(double currentPrice) {
        return currentPrice * quantity;
    }

    public double unrealizedPnl(double currentPrice) {
        return (currentPrice - entryPrice) * quantity;
    }

    public double unrealizedPnlPct(double currentPrice) {
        return (currentPrice - entryPrice) / entryPrice * 100;
    }

    /**
     * Move the stop up. Never lowers it.
     */
    boolean raiseStopLoss(double candidate) {
        if (stopLoss == null || candidate > stopLoss) {
            stopLoss = candidate;
            return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return String.format("Position[%s x%d @ %.4f since %s, stop=%s, target=%s]",
            ticker, quantity, entryPrice, entryDate, stopLoss, takeProfit);
    }
}
