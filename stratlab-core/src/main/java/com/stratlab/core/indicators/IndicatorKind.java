package com.stratlab.core.indicators;

import com.stratlab.core.model.Bar;

import java.util.ArrayList;
import java.util.List;

/**
 * The closed set of indicators the rule language can call.
 * Each kind knows its rule-language name, its default parameters and how many
 * leading bars it leaves undefined.
 */
public enum IndicatorKind {
    SMA("sma"),
    EMA("ema"),
    WMA("wma"),
    RSI("rsi", 14),
    MACD("macd", 12, 26, 9),
    MACD_SIGNAL("macd_signal", 12, 26, 9),
    MACD_HIST("macd_hist", 12, 26, 9),
    BB_UPPER("bb_upper", 20, 2),
    BB_MIDDLE("bb_middle", 20, 2),
    BB_LOWER("bb_lower", 20, 2),
    ATR("atr", 14),
    STOCH_K("stoch_k", 14, 3),
    STOCH_D("stoch_d", 14, 3),
    ADX("adx", 14),
    OBV("obv"),
    VWAP("vwap"),
    CCI("cci", 20),
    ROC("roc", 12),
    WILLIAMS_R("williams_r", 14),
    MOMENTUM("momentum", 10);

    private final String dslName;
    private final List<Double> defaults;

    IndicatorKind(String dslName, double... defaults) {
        this.dslName = dslName;
        List<Double> values = new ArrayList<>();
        for (double d : defaults) {
            values.add(d);
        }
        this.defaults = List.copyOf(values);
    }

    public String dslName() {
        return dslName;
    }

    public List<Double> defaults() {
        return defaults;
    }

    /**
     * Moving averages have no default period and need one from the call.
     */
    public boolean requiresPeriod() {
        return this == SMA || this == EMA || this == WMA;
    }

    /**
     * Look up a kind by its rule-language name (case-insensitive).
     *
     * @return the kind, or null if the name is not a known indicator
     */
    public static IndicatorKind fromDslName(String name) {
        if (name == null) return null;
        for (IndicatorKind kind : values()) {
            if (kind.dslName.equalsIgnoreCase(name)) {
                return kind;
            }
        }
        return null;
    }

    /**
     * Number of leading bars left undefined for the given parameters.
     */
    public int warmupBars(List<Double> params) {
        return switch (this) {
            case SMA, WMA, RSI, ATR, CCI, WILLIAMS_R, BB_UPPER, BB_MIDDLE, BB_LOWER, STOCH_K ->
                period(params, 0) - 1;
            case STOCH_D -> period(params, 0) + period(params, 1) - 2;
            case ADX -> 2 * period(params, 0) - 2;
            case ROC, MOMENTUM -> period(params, 0);
            case EMA, MACD, MACD_SIGNAL, MACD_HIST, OBV, VWAP -> 0;
        };
    }

    /**
     * Compute this indicator over the bars with fully resolved parameters.
     */
    public double[] compute(List<Bar> bars, List<Double> params) {
        return switch (this) {
            case SMA -> Indicators.sma(bars, period(params, 0));
            case EMA -> Indicators.ema(bars, period(params, 0));
            case WMA -> Indicators.wma(bars, period(params, 0));
            case RSI -> Indicators.rsi(bars, period(params, 0));
            case MACD -> Indicators.macd(bars, period(params, 0), period(params, 1), period(params, 2)).line();
            case MACD_SIGNAL -> Indicators.macd(bars, period(params, 0), period(params, 1), period(params, 2)).signal();
            case MACD_HIST -> Indicators.macd(bars, period(params, 0), period(params, 1), period(params, 2)).histogram();
            case BB_UPPER -> Indicators.bollingerBands(bars, period(params, 0), params.get(1)).upper();
            case BB_MIDDLE -> Indicators.bollingerBands(bars, period(params, 0), params.get(1)).middle();
            case BB_LOWER -> Indicators.bollingerBands(bars, period(params, 0), params.get(1)).lower();
            case ATR -> Indicators.atr(bars, period(params, 0));
            case STOCH_K -> Indicators.stochastic(bars, period(params, 0), period(params, 1)).k();
            case STOCH_D -> Indicators.stochastic(bars, period(params, 0), period(params, 1)).d();
            case ADX -> Indicators.adx(bars, period(params, 0));
            case OBV -> Indicators.obv(bars);
            case VWAP -> Indicators.vwap(bars);
            case CCI -> Indicators.cci(bars, period(params, 0));
            case ROC -> Indicators.roc(bars, period(params, 0));
            case WILLIAMS_R -> Indicators.williamsR(bars, period(params, 0));
            case MOMENTUM -> Indicators.momentum(bars, period(params, 0));
        };
    }

    private static int period(List<Double> params, int index) {
        return params.get(index).intValue();
    }
}
