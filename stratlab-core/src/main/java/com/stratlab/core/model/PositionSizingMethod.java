package com.stratlab.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How many shares an entry signal buys.
 */
public enum PositionSizingMethod {
    /** Fixed dollar amount per trade: floor(value / price). */
    FIXED("fixed"),
    /** Percentage of available cash: floor(cash * value / 100 / price). */
    PERCENTAGE("percentage"),
    /** Risk value% of cash against a 2 x ATR stop distance. */
    RISK_BASED("risk_based");

    private final String value;

    PositionSizingMethod(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Look up a method by its document value.
     *
     * @return the method, or null if the value is not one of the known methods
     */
    public static PositionSizingMethod fromValue(String value) {
        if (value == null) return null;
        for (PositionSizingMethod method : values()) {
            if (method.value.equals(value)) {
                return method;
            }
        }
        return null;
    }
}
