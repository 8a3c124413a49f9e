package com.stratlab.engine;

import com.stratlab.core.model.DrawdownInfo;
import com.stratlab.core.model.EquityPoint;
import com.stratlab.core.model.PerformanceMetrics;
import com.stratlab.core.model.Trade;
import com.stratlab.core.model.TradeDistribution;

import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Return, risk and trade statistics of a finished run.
 * Degenerate inputs (flat curve, no losses, zero elapsed time) produce defined
 * values rather than exceptions.
 */
public class MetricsCalculator {

    public static final int TRADING_DAYS_PER_YEAR = 252;
    public static final double DAYS_PER_YEAR = 365.25;

    private final double riskFreeRate;

    public MetricsCalculator(double riskFreeRate) {
        this.riskFreeRate = riskFreeRate;
    }

    /**
     * Calculate all metrics. An empty equity curve yields {@link PerformanceMetrics#empty(double)}.
     */
    public PerformanceMetrics calculate(List<EquityPoint> equityCurve, List<Trade> trades, double initialCapital) {
        if (equityCurve == null || equityCurve.isEmpty()) {
            return PerformanceMetrics.empty(initialCapital);
        }

        double[] equity = equityCurve.stream().mapToDouble(EquityPoint::equity).toArray();
        double finalEquity = equity[equity.length - 1];
        long days = ChronoUnit.DAYS.between(equityCurve.get(0).date(), equityCurve.get(equityCurve.size() - 1).date());
        double[] returns = returns(equity);

        double sharpe = returns.length > 1 ? sharpeRatio(returns) : 0;
        double sortino = returns.length > 1 ? sortinoRatio(returns) : 0;

        int winners = 0;
        int losers = 0;
        double grossProfit = 0;
        double grossLoss = 0;
        double totalPnl = 0;
        double largestWin = 0;
        double largestLoss = 0;
        double holdingDays = 0;

        for (int i = 0; i < trades.size(); i++) {
            Trade t = trades.get(i);
            double pnl = t.pnl();
            totalPnl += pnl;
            holdingDays += t.holdingDays();
            if (i == 0) {
                largestWin = pnl;
                largestLoss = pnl;
            } else {
                largestWin = Math.max(largestWin, pnl);
                largestLoss = Math.min(largestLoss, pnl);
            }
            if (pnl > 0) {
                winners++;
                grossProfit += pnl;
            } else if (pnl < 0) {
                losers++;
                grossLoss += pnl;
            }
        }

        int total = trades.size();
        return new PerformanceMetrics(
            initialCapital,
            finalEquity,
            totalReturn(initialCapital, finalEquity),
            cagr(initialCapital, finalEquity, days / DAYS_PER_YEAR),
            sharpe,
            sortino,
            maxDrawdown(equityCurve),
            total,
            winners,
            losers,
            total > 0 ? (double) winners / total * 100 : 0,
            profitFactor(trades),
            total > 0 ? totalPnl / total : 0,
            winners > 0 ? grossProfit / winners : 0,
            losers > 0 ? grossLoss / losers : 0,
            largestWin,
            largestLoss,
            total > 0 ? holdingDays / total : 0
        );
    }

    // ========== Returns ==========

    public static double totalReturn(double initialCapital, double finalEquity) {
        return (finalEquity - initialCapital) / initialCapital * 100;
    }

    /**
     * Compound annual growth rate in percent. Zero when no time has elapsed or
     * capital is not positive; -100 when the run lost everything.
     */
    public static double cagr(double initialCapital, double finalEquity, double years) {
        if (years <= 0 || initialCapital <= 0) {
            return 0;
        }
        double ratio = finalEquity / initialCapital;
        if (ratio <= 0) {
            return -100;
        }
        return (Math.pow(ratio, 1 / years) - 1) * 100;
    }

    /**
     * Simple percentage change between consecutive values; the first return is zero.
     */
    public static double[] returns(double[] equity) {
        double[] result = new double[equity.length];
        for (int i = 1; i < equity.length; i++) {
            result[i] = (equity[i] - equity[i - 1]) / equity[i - 1];
        }
        return result;
    }

    // ========== Risk ==========

    /**
     * Annualized Sharpe ratio over daily returns. Zero for a flat series.
     */
    public double sharpeRatio(double[] returns) {
        double std = sampleStd(returns);
        if (returns.length < 2 || std == 0 || Double.isNaN(std)) {
            return 0;
        }
        return Math.sqrt(TRADING_DAYS_PER_YEAR) * meanExcess(returns) / std;
    }

    /**
     * Sharpe numerator over the deviation of negative returns only. Zero when
     * fewer than two returns are negative or they do not vary.
     */
    public double sortinoRatio(double[] returns) {
        double[] downside = Arrays.stream(returns).filter(r -> r < 0).toArray();
        if (downside.length < 2) {
            return 0;
        }
        double std = sampleStd(downside);
        if (std == 0 || Double.isNaN(std)) {
            return 0;
        }
        return Math.sqrt(TRADING_DAYS_PER_YEAR) * meanExcess(returns) / std;
    }

    private double meanExcess(double[] returns) {
        double periodRiskFree = riskFreeRate / TRADING_DAYS_PER_YEAR;
        return mean(returns) - periodRiskFree;
    }

    /**
     * Deepest decline from a running peak, in percent. The peak is the highest
     * value at or before the trough.
     */
    public static DrawdownInfo maxDrawdown(List<EquityPoint> equityCurve) {
        if (equityCurve == null || equityCurve.isEmpty()) {
            return DrawdownInfo.none();
        }

        double runningMax = Double.NEGATIVE_INFINITY;
        double maxDrawdown = 0;
        int troughIndex = 0;
        for (int i = 0; i < equityCurve.size(); i++) {
            double value = equityCurve.get(i).equity();
            runningMax = Math.max(runningMax, value);
            double drawdown = (value - runningMax) / runningMax * 100;
            if (drawdown < maxDrawdown) {
                maxDrawdown = drawdown;
                troughIndex = i;
            }
        }

        int peakIndex = 0;
        for (int i = 1; i <= troughIndex; i++) {
            if (equityCurve.get(i).equity() > equityCurve.get(peakIndex).equity()) {
                peakIndex = i;
            }
        }

        EquityPoint peak = equityCurve.get(peakIndex);
        EquityPoint trough = equityCurve.get(troughIndex);
        return new DrawdownInfo(maxDrawdown, peak.date(), trough.date(), peak.equity(), trough.equity());
    }

    // ========== Trades ==========

    /**
     * Gross profit over gross loss. Infinite with profits and no losses, zero
     * with no trades or neither.
     */
    public static double profitFactor(List<Trade> trades) {
        if (trades == null || trades.isEmpty()) {
            return 0;
        }
        double grossProfit = 0;
        double grossLoss = 0;
        for (Trade t : trades) {
            double pnl = t.pnl();
            if (pnl > 0) grossProfit += pnl;
            else if (pnl < 0) grossLoss += -pnl;
        }
        if (grossLoss == 0) {
            return grossProfit > 0 ? Double.POSITIVE_INFINITY : 0;
        }
        return grossProfit / grossLoss;
    }

    public static TradeDistribution tradeDistribution(List<Trade> trades) {
        if (trades == null || trades.isEmpty()) {
            return TradeDistribution.empty();
        }
        double[] pnls = trades.stream().mapToDouble(Trade::pnl).toArray();
        double[] pcts = trades.stream().mapToDouble(Trade::pnlPercent).toArray();
        return new TradeDistribution(
            trades.size(),
            mean(pnls), median(pnls), populationStd(pnls),
            mean(pcts), median(pcts), populationStd(pcts)
        );
    }

    /**
     * Month-over-month percentage change of month-end equity. The first month has
     * no prior month and is omitted.
     */
    public static Map<YearMonth, Double> monthlyReturns(List<EquityPoint> equityCurve) {
        Map<YearMonth, Double> monthEnd = new LinkedHashMap<>();
        for (EquityPoint point : equityCurve) {
            monthEnd.put(YearMonth.from(point.date()), point.equity());
        }

        Map<YearMonth, Double> result = new LinkedHashMap<>();
        Double previous = null;
        for (Map.Entry<YearMonth, Double> entry : monthEnd.entrySet()) {
            if (previous != null) {
                result.put(entry.getKey(), (entry.getValue() - previous) / previous * 100);
            }
            previous = entry.getValue();
        }
        return result;
    }

    // ========== Statistics ==========

    static double mean(double[] values) {
        if (values.length == 0) return 0;
        double sum = 0;
        for (double v : values) sum += v;
        return sum / values.length;
    }

    static double sampleStd(double[] values) {
        if (values.length < 2) return Double.NaN;
        double m = mean(values);
        double sumSq = 0;
        for (double v : values) sumSq += (v - m) * (v - m);
        return Math.sqrt(sumSq / (values.length - 1));
    }

    static double populationStd(double[] values) {
        if (values.length == 0) return 0;
        double m = mean(values);
        double sumSq = 0;
        for (double v : values) sumSq += (v - m) * (v - m);
        return Math.sqrt(sumSq / values.length);
    }

    static double median(double[] values) {
        List<Double> sorted = new ArrayList<>();
        for (double v : values) sorted.add(v);
        sorted.sort(Double::compare);
        int n = sorted.size();
        if (n == 0) return 0;
        return n % 2 == 1 ? sorted.get(n / 2) : (sorted.get(n / 2 - 1) + sorted.get(n / 2)) / 2;
    }
}
