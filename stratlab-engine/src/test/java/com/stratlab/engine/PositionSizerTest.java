package com.stratlab.engine;

import com.stratlab.core.model.PositionSizing;
import com.stratlab.core.model.PositionSizingMethod;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PositionSizerTest {

    private final PositionSizer sizer = new PositionSizer();

    @Test
    @DisplayName("Fixed dollar amount buys whole shares")
    void fixed() {
        PositionSizing sizing = PositionSizing.of(PositionSizingMethod.FIXED, 5000);

        assertEquals(100, sizer.calculate(sizing, 100_000, 50, Double.NaN));
        assertEquals(101, sizer.calculate(sizing, 100_000, 49.5, Double.NaN));
        assertEquals(0, sizer.calculate(sizing, 100_000, 6000, Double.NaN));
    }

    @Test
    @DisplayName("Percentage of cash")
    void percentage() {
        PositionSizing sizing = PositionSizing.of(PositionSizingMethod.PERCENTAGE, 10);

        assertEquals(200, sizer.calculate(sizing, 100_000, 50, Double.NaN));
        assertEquals(0, sizer.calculate(sizing, 0, 50, Double.NaN));
    }

    @Test
    @DisplayName("Risk-based sizing uses a 2 x ATR stop distance")
    void riskBased() {
        PositionSizing sizing = PositionSizing.of(PositionSizingMethod.RISK_BASED, 2);

        // 2% of 100,000 = 2,000 at risk, 5 per share
        assertEquals(400, sizer.calculate(sizing, 100_000, 50, 2.5));
    }

    @Test
    @DisplayName("Risk-based sizing falls back to percentage without ATR")
    void riskBasedFallback() {
        PositionSizing sizing = PositionSizing.of(PositionSizingMethod.RISK_BASED, 2);

        assertEquals(40, sizer.calculate(sizing, 100_000, 50, Double.NaN));
        assertEquals(40, sizer.calculate(sizing, 100_000, 50, 0));
        assertEquals(40, sizer.calculate(sizing, 100_000, 50, -1));
    }

    @Test
    @DisplayName("Unknown method and negative values give no shares")
    void noShares() {
        assertEquals(0, sizer.calculate(new PositionSizing("kelly", 10), 100_000, 50, 1));
        assertEquals(0, sizer.calculate(PositionSizing.of(PositionSizingMethod.FIXED, -5000), 100_000, 50, 1));
    }

    @Test
    @DisplayName("Share count is capped at int range")
    void capped() {
        PositionSizing sizing = PositionSizing.of(PositionSizingMethod.FIXED, 1e12);
        assertEquals(Integer.MAX_VALUE, sizer.calculate(sizing, 0, 0.001, Double.NaN));
    }
}
