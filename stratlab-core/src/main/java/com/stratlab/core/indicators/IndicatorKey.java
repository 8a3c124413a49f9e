package com.stratlab.core.indicators;

import com.stratlab.core.model.Bar;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Identifies one indicator column: a kind plus its fully resolved parameters.
 */
public record IndicatorKey(IndicatorKind kind, List<Double> params) {

    public IndicatorKey {
        params = List.copyOf(params);
    }

    public static IndicatorKey of(IndicatorKind kind, double... params) {
        List<Double> values = new ArrayList<>();
        for (double p : params) {
            values.add(p);
        }
        return new IndicatorKey(kind, values);
    }

    public static IndicatorKey defaults(IndicatorKind kind) {
        return new IndicatorKey(kind, kind.defaults());
    }

    /**
     * Resolve the numeric arguments of a call against the kind's defaults:
     * arguments replace defaults position by position.
     *
     * @return the key, or empty when a moving average was called without a period
     */
    public static Optional<IndicatorKey> resolve(IndicatorKind kind, List<Double> arguments) {
        List<Double> params = new ArrayList<>(kind.defaults());
        if (kind.requiresPeriod()) {
            if (arguments.isEmpty()) {
                return Optional.empty();
            }
            params.add(arguments.get(0));
            return Optional.of(new IndicatorKey(kind, params));
        }
        for (int i = 0; i < params.size() && i < arguments.size(); i++) {
            params.set(i, arguments.get(i));
        }
        return Optional.of(new IndicatorKey(kind, params));
    }

    /**
     * Column label, e.g. {@code SMA_200}, {@code MACD_SIGNAL_12_26_9}, {@code OBV}.
     */
    public String columnName() {
        StringBuilder sb = new StringBuilder(kind.name());
        for (Double p : params) {
            sb.append('_');
            if (p == Math.rint(p)) {
                sb.append(p.longValue());
            } else {
                sb.append(p);
            }
        }
        return sb.toString();
    }

    public int warmupBars() {
        return kind.warmupBars(params);
    }

    public double[] compute(List<Bar> bars) {
        return kind.compute(bars, params);
    }
}
