package com.stratlab.core.indicators;

import com.stratlab.core.model.Bar;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Facade for technical indicator calculations.
 * Delegates to individual indicator classes for cleaner organization.
 * All methods return arrays where index corresponds to bar index.
 * Invalid values (warmup period) are Double.NaN.
 */
public final class Indicators {

    /** Moving average periods computed by {@link #calculateAll(List)}. */
    public static final int[] DEFAULT_MA_PERIODS = {10, 20, 50, 100, 200};

    private Indicators() {} // Utility class

    // ========== Moving averages ==========

    public static double[] sma(List<Bar> bars, int period) {
        return SMA.calculate(bars, period);
    }

    public static double[] ema(List<Bar> bars, int period) {
        return EMA.calculate(bars, period);
    }

    public static double[] wma(List<Bar> bars, int period) {
        return WMA.calculate(bars, period);
    }

    // ========== Oscillators ==========

    public static double[] rsi(List<Bar> bars, int period) {
        return RSI.calculate(bars, period);
    }

    public static MACD.Result macd(List<Bar> bars, int fastPeriod, int slowPeriod, int signalPeriod) {
        return MACD.calculate(bars, fastPeriod, slowPeriod, signalPeriod);
    }

    public static Stochastic.Result stochastic(List<Bar> bars, int kPeriod, int dPeriod) {
        return Stochastic.calculate(bars, kPeriod, dPeriod);
    }

    public static double[] cci(List<Bar> bars, int period) {
        return CCI.calculate(bars, period);
    }

    public static double[] roc(List<Bar> bars, int period) {
        return ROC.calculate(bars, period);
    }

    public static double[] momentum(List<Bar> bars, int period) {
        return Momentum.calculate(bars, period);
    }

    public static double[] williamsR(List<Bar> bars, int period) {
        return WilliamsR.calculate(bars, period);
    }

    // ========== Volatility / trend ==========

    public static BollingerBands.Result bollingerBands(List<Bar> bars, int period, double stdDevMultiplier) {
        return BollingerBands.calculate(bars, period, stdDevMultiplier);
    }

    public static double[] atr(List<Bar> bars, int period) {
        return ATR.calculate(bars, period);
    }

    public static double[] adx(List<Bar> bars, int period) {
        return ADX.calculate(bars, period).adx();
    }

    // ========== Volume ==========

    public static double[] obv(List<Bar> bars) {
        return OBV.calculate(bars);
    }

    public static double[] vwap(List<Bar> bars) {
        return VWAP.calculate(bars);
    }

    // ========== Batch ==========

    /**
     * Compute the standard indicator set once so rule evaluation can reuse the columns.
     * Multi-output indicators are computed once and split into their columns.
     */
    public static Map<IndicatorKey, double[]> calculateAll(List<Bar> bars) {
        Map<IndicatorKey, double[]> columns = new LinkedHashMap<>();

        for (int period : DEFAULT_MA_PERIODS) {
            columns.put(IndicatorKey.of(IndicatorKind.SMA, period), sma(bars, period));
            columns.put(IndicatorKey.of(IndicatorKind.EMA, period), ema(bars, period));
        }

        columns.put(IndicatorKey.defaults(IndicatorKind.RSI), rsi(bars, 14));

        MACD.Result macd = macd(bars, 12, 26, 9);
        columns.put(IndicatorKey.defaults(IndicatorKind.MACD), macd.line());
        columns.put(IndicatorKey.defaults(IndicatorKind.MACD_SIGNAL), macd.signal());
        columns.put(IndicatorKey.defaults(IndicatorKind.MACD_HIST), macd.histogram());

        BollingerBands.Result bb = bollingerBands(bars, 20, 2);
        columns.put(IndicatorKey.defaults(IndicatorKind.BB_UPPER), bb.upper());
        columns.put(IndicatorKey.defaults(IndicatorKind.BB_MIDDLE), bb.middle());
        columns.put(IndicatorKey.defaults(IndicatorKind.BB_LOWER), bb.lower());

        columns.put(IndicatorKey.defaults(IndicatorKind.ATR), atr(bars, 14));

        Stochastic.Result stoch = stochastic(bars, 14, 3);
        columns.put(IndicatorKey.defaults(IndicatorKind.STOCH_K), stoch.k());
        columns.put(IndicatorKey.defaults(IndicatorKind.STOCH_D), stoch.d());

        columns.put(IndicatorKey.defaults(IndicatorKind.ADX), adx(bars, 14));
        columns.put(IndicatorKey.defaults(IndicatorKind.OBV), obv(bars));
        columns.put(IndicatorKey.defaults(IndicatorKind.VWAP), vwap(bars));
        columns.put(IndicatorKey.defaults(IndicatorKind.CCI), cci(bars, 20));
        columns.put(IndicatorKey.defaults(IndicatorKind.ROC), roc(bars, 12));
        columns.put(IndicatorKey.defaults(IndicatorKind.WILLIAMS_R), williamsR(bars, 14));

        return columns;
    }
}
