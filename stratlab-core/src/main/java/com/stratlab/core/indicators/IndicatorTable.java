package com.stratlab.core.indicators;

import com.stratlab.core.model.Bar;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A bar sequence with the indicator columns attached for one run.
 * Columns not precomputed are computed on first request and cached here.
 * Not thread-safe; each run owns its own table.
 */
public class IndicatorTable {

    private final List<Bar> bars;
    private final Map<IndicatorKey, double[]> columns = new HashMap<>();

    public IndicatorTable(List<Bar> bars) {
        this.bars = List.copyOf(bars);
    }

    /**
     * Table with the standard indicator set precomputed.
     */
    public static IndicatorTable withDefaults(List<Bar> bars) {
        IndicatorTable table = new IndicatorTable(bars);
        table.columns.putAll(Indicators.calculateAll(table.bars));
        return table;
    }

    public List<Bar> bars() {
        return bars;
    }

    public int size() {
        return bars.size();
    }

    public boolean isEmpty() {
        return bars.isEmpty();
    }

    public boolean hasColumn(IndicatorKey key) {
        return columns.containsKey(key);
    }

    /**
     * Column for the exact key, computed and cached if it is not attached yet.
     */
    public double[] column(IndicatorKey key) {
        return columns.computeIfAbsent(key, k -> k.compute(bars));
    }

    /**
     * ATR-14 at a bar, NaN during warmup. Feeds risk-based position sizing.
     */
    public double atr14At(int index) {
        return column(IndicatorKey.defaults(IndicatorKind.ATR))[index];
    }

    public int columnCount() {
        return columns.size();
    }
}
