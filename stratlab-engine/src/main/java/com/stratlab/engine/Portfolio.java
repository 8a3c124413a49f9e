package com.stratlab.engine;

import com.stratlab.core.model.BacktestConfig;
import com.stratlab.core.model.CommissionAttribution;
import com.stratlab.core.model.EquityPoint;
import com.stratlab.core.model.ExitReason;
import com.stratlab.core.model.PortfolioStatistics;
import com.stratlab.core.model.Trade;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Cash, open positions, trade history and equity history of one backtest run.
 * At most one position per ticker. Not thread-safe; owned by a single run.
 */
public class Portfolio {

    private static final Logger log = LoggerFactory.getLogger(Portfolio.class);

    private final double initialCapital;
    private final double commissionRate;
    private final CommissionAttribution commissionAttribution;

    private final Map<String, Position> positions = new LinkedHashMap<>();
    private final List<Trade> trades = new ArrayList<>();
    private final List<EquityPoint> equityCurve = new ArrayList<>();

    private double cash;
    private double totalCommission;

    public Portfolio(double initialCapital, double commissionRate) {
        this(initialCapital, commissionRate, CommissionAttribution.PER_TRADE);
    }

    public Portfolio(double initialCapital, double commissionRate, CommissionAttribution commissionAttribution) {
        this.initialCapital = initialCapital;
        this.commissionRate = commissionRate;
        this.commissionAttribution = commissionAttribution != null
            ? commissionAttribution : CommissionAttribution.PER_TRADE;
        this.cash = initialCapital;
    }

    public static Portfolio of(BacktestConfig config) {
        return new Portfolio(config.initialCapital(), config.commissionRate(), config.commissionAttribution());
    }

    // ========== Operations ==========

    /**
     * Open a position. Fails without side effects when the quantity is not
     * positive, the ticker already has an open position, or cost plus commission
     * exceeds cash.
     *
     * @return true if the position was opened
     */
    public boolean openPosition(String ticker, LocalDate date, double price, int quantity,
                                Double stopLoss, Double takeProfit, Double trailingStopPct) {
        if (quantity <= 0 || !(price > 0)) {
            return false;
        }
        if (positions.containsKey(ticker)) {
            log.debug("Ignoring entry for {} on {}: position already open", ticker, date);
            return false;
        }

        double cost = price * quantity;
        double commission = cost * commissionRate;
        double totalCost = cost * (1 + commissionRate);
        if (totalCost > cash) {
            log.debug("Insufficient cash for {} x{} @ {} on {} (need {}, have {})",
                ticker, quantity, price, date, totalCost, cash);
            return false;
        }

        Double trailing = trailingStopPct != null && trailingStopPct > 0 ? trailingStopPct : null;
        positions.put(ticker, new Position(ticker, date, price, quantity, stopLoss, takeProfit, trailing, commission));
        cash -= totalCost;
        totalCommission += commission;

        log.debug("Opened {} x{} @ {} on {}", ticker, quantity, price, date);
        return true;
    }

    /**
     * Close the open position in a ticker because of an exit signal.
     */
    public Optional<Trade> closePosition(String ticker, LocalDate date, double price) {
        return closePosition(ticker, date, price, ExitReason.SIGNAL);
    }

    /**
     * Close the open position in a ticker.
     *
     * @return the recorded trade, or empty when the ticker has no open position
     */
    public Optional<Trade> closePosition(String ticker, LocalDate date, double price, ExitReason reason) {
        Position position = positions.remove(ticker);
        if (position == null) {
            return Optional.empty();
        }

        double proceeds = price * position.getQuantity();
        double exitCommission = proceeds * commissionRate;

        double tradeCommission = switch (commissionAttribution) {
            case PER_TRADE -> position.getEntryCommission() + exitCommission;
            case CUMULATIVE -> totalCommission;
        };

        Trade trade = new Trade(
            ticker,
            position.getEntryDate(),
            date,
            position.getEntryPrice(),
            price,
            position.getQuantity(),
            tradeCommission,
            reason
        );

        cash += proceeds * (1 - commissionRate);
        totalCommission += exitCommission;
        trades.add(trade);

        log.debug("Closed {} x{} @ {} on {} ({}), pnl {}", ticker, trade.quantity(), price, date,
            reason.getValue(), String.format("%.2f", trade.pnl()));
        return Optional.of(trade);
    }

    /**
     * Ratchet the trailing stop of a position up to {@code price * (1 - pct/100)}.
     * Positions without a trailing percentage are left alone.
     */
    public void updateTrailingStop(String ticker, double currentPrice) {
        Position position = positions.get(ticker);
        if (position == null || position.getTrailingStopPct() == null) {
            return;
        }
        double candidate = currentPrice * (1 - position.getTrailingStopPct() / 100);
        position.raiseStopLoss(candidate);
    }

    /**
     * Stop-loss is tested against the bar's low, take-profit against its close.
     * Stop-loss wins when both trigger on the same bar.
     */
    public Optional<ExitReason> checkExitConditions(String ticker, double closePrice, double lowPrice) {
        Position position = positions.get(ticker);
        if (position == null) {
            return Optional.empty();
        }
        Double stop = position.getStopLoss();
        if (stop != null && stop > 0 && lowPrice <= stop) {
            return Optional.of(ExitReason.STOP_LOSS);
        }
        Double target = position.getTakeProfit();
        if (target != null && target > 0 && closePrice >= target) {
            return Optional.of(ExitReason.TAKE_PROFIT);
        }
        return Optional.empty();
    }

    /**
     * Append an equity point valued at the given prices. A position whose ticker
     * has no price is valued at its entry price.
     */
    public EquityPoint recordEquity(LocalDate date, Map<String, Double> currentPrices) {
        double equity = getTotalValue(currentPrices);
        EquityPoint point = new EquityPoint(date, equity, cash, equity - cash);
        equityCurve.add(point);
        return point;
    }

    public double getTotalValue(Map<String, Double> currentPrices) {
        double positionsValue = 0;
        for (Position position : positions.values()) {
            Double price = currentPrices.get(position.getTicker());
            positionsValue += position.currentValue(price != null ? price : position.getEntryPrice());
        }
        return cash + positionsValue;
    }

    // ========== Accessors ==========

    public double getInitialCapital() { return initialCapital; }
    public double getCommissionRate() { return commissionRate; }
    public double getCash() { return cash; }
    public double getTotalCommission() { return totalCommission; }

    public boolean hasPosition(String ticker) {
        return positions.containsKey(ticker);
    }

    public Optional<Position> getPosition(String ticker) {
        return Optional.ofNullable(positions.get(ticker));
    }

    public Map<String, Position> getPositions() {
        return Collections.unmodifiableMap(positions);
    }

    public List<Trade> getTrades() {
        return Collections.unmodifiableList(trades);
    }

    public List<EquityPoint> getEquityCurve() {
        return Collections.unmodifiableList(equityCurve);
    }

    /**
     * Sum of entry prices times quantities of open positions.
     */
    public double getTotalPositionCost() {
        return positions.values().stream().mapToDouble(Position::costBasis).sum();
    }

    public PortfolioStatistics getStatistics() {
        return PortfolioStatistics.of(trades, totalCommission);
    }
}
