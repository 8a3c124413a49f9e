package com.stratlab.engine;

import com.stratlab.core.model.PositionSizing;
import com.stratlab.core.model.PositionSizingMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handles position sizing calculations for backtests.
 * Supports fixed dollar, percentage of cash and ATR risk-based sizing.
 */
public class PositionSizer {

    private static final Logger log = LoggerFactory.getLogger(PositionSizer.class);

    /** Risk-based sizing puts the notional stop at this many ATRs. */
    public static final double ATR_RISK_MULTIPLE = 2.0;

    /**
     * Calculate the number of whole shares to buy.
     *
     * @param sizing The strategy's sizing settings
     * @param cash Available cash
     * @param price Fill price of the entry
     * @param atr ATR-14 at the entry bar, NaN if not yet defined
     * @return shares to buy, never negative; 0 means no entry
     */
    public int calculate(PositionSizing sizing, double cash, double price, double atr) {
        PositionSizingMethod method = sizing.type();
        if (method == null) {
            log.warn("Unknown position sizing method '{}', skipping entry", sizing.method());
            return 0;
        }

        double value = sizing.value();
        double shares = switch (method) {
            case FIXED -> value / price;
            case PERCENTAGE -> percentageOfCash(cash, value, price);
            case RISK_BASED -> atr > 0
                ? (cash * value / 100) / (ATR_RISK_MULTIPLE * atr)
                : percentageOfCash(cash, value, price);
        };

        return clamp(shares);
    }

    private static double percentageOfCash(double cash, double value, double price) {
        return cash * (value / 100) / price;
    }

    private static int clamp(double shares) {
        if (Double.isNaN(shares) || shares <= 0) {
            return 0;
        }
        return (int) Math.min(Math.floor(shares), Integer.MAX_VALUE);
    }
}
