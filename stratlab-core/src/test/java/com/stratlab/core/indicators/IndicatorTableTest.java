package com.stratlab.core.indicators;

import com.stratlab.core.model.Bar;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class IndicatorTableTest {

    @Test
    @DisplayName("withDefaults precomputes the standard columns")
    void defaultsArePrecomputed() {
        IndicatorTable table = IndicatorTable.withDefaults(IndicatorsTest.barsFromCloses(IndicatorsTest.ramp(40, 10, 1)));

        assertEquals(40, table.size());
        assertEquals(26, table.columnCount());
        assertTrue(table.hasColumn(IndicatorKey.of(IndicatorKind.SMA, 50)));
        assertTrue(table.hasColumn(IndicatorKey.defaults(IndicatorKind.RSI)));
        assertFalse(table.hasColumn(IndicatorKey.of(IndicatorKind.SMA, 7)));
    }

    @Test
    @DisplayName("Other parameters are computed on demand and cached")
    void onDemandColumnsAreCached() {
        List<Bar> bars = IndicatorsTest.barsFromCloses(1, 2, 3, 4, 5, 6, 7);
        IndicatorTable table = IndicatorTable.withDefaults(bars);
        IndicatorKey key = IndicatorKey.of(IndicatorKind.SMA, 7);

        double[] first = table.column(key);
        assertTrue(table.hasColumn(key));
        assertSame(first, table.column(key));
        assertEquals(4.0, first[6], 1e-9);
    }

    @Test
    @DisplayName("ATR-14 lookup is undefined during warmup")
    void atrLookup() {
        IndicatorTable table = IndicatorTable.withDefaults(IndicatorsTest.barsFromCloses(IndicatorsTest.ramp(20, 100, 0)));

        assertTrue(Double.isNaN(table.atr14At(12)));
        assertEquals(2.0, table.atr14At(13), 1e-9);
    }

    @Test
    @DisplayName("Call arguments replace defaults position by position")
    void resolveArguments() {
        assertEquals(List.of(14.0), IndicatorKey.resolve(IndicatorKind.RSI, List.of()).orElseThrow().params());
        assertEquals(List.of(7.0), IndicatorKey.resolve(IndicatorKind.RSI, List.of(7.0)).orElseThrow().params());
        assertEquals(List.of(5.0, 26.0, 9.0),
            IndicatorKey.resolve(IndicatorKind.MACD, List.of(5.0)).orElseThrow().params());
        assertEquals(List.of(20.0, 2.5),
            IndicatorKey.resolve(IndicatorKind.BB_UPPER, List.of(20.0, 2.5)).orElseThrow().params());
    }

    @Test
    @DisplayName("Moving average without a period has no key")
    void movingAverageNeedsPeriod() {
        Optional<IndicatorKey> key = IndicatorKey.resolve(IndicatorKind.SMA, List.of());
        assertTrue(key.isEmpty());
        assertEquals(List.of(200.0), IndicatorKey.resolve(IndicatorKind.SMA, List.of(200.0)).orElseThrow().params());
    }

    @Test
    @DisplayName("Column names follow KIND_params")
    void columnNames() {
        assertEquals("SMA_200", IndicatorKey.of(IndicatorKind.SMA, 200).columnName());
        assertEquals("MACD_SIGNAL_12_26_9", IndicatorKey.defaults(IndicatorKind.MACD_SIGNAL).columnName());
        assertEquals("BB_UPPER_20_2.5", IndicatorKey.of(IndicatorKind.BB_UPPER, 20, 2.5).columnName());
        assertEquals("OBV", IndicatorKey.defaults(IndicatorKind.OBV).columnName());
    }

    @Test
    @DisplayName("Warmup lengths match the computed columns")
    void warmupMatchesColumns() {
        List<Bar> bars = IndicatorsTest.barsFromCloses(IndicatorsTest.ramp(60, 100, 1));
        for (IndicatorKind kind : List.of(IndicatorKind.RSI, IndicatorKind.ATR, IndicatorKind.CCI,
                IndicatorKind.ROC, IndicatorKind.MOMENTUM, IndicatorKind.STOCH_D)) {
            IndicatorKey key = IndicatorKey.defaults(kind);
            double[] column = key.compute(bars);
            int warmup = key.warmupBars();
            assertTrue(Double.isNaN(column[warmup - 1]), kind + " should be undefined before " + warmup);
            assertFalse(Double.isNaN(column[warmup]), kind + " should be defined at " + warmup);
        }
    }

    @Test
    @DisplayName("Kinds are looked up by rule-language name")
    void fromDslName() {
        assertEquals(IndicatorKind.WILLIAMS_R, IndicatorKind.fromDslName("williams_r"));
        assertEquals(IndicatorKind.BB_LOWER, IndicatorKind.fromDslName("BB_LOWER"));
        assertNull(IndicatorKind.fromDslName("foo"));
        assertNull(IndicatorKind.fromDslName(null));
    }
}
