package com.stratlab.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which commission figure a closed trade carries.
 */
public enum CommissionAttribution {
    /** Entry commission plus exit commission of that trade. */
    PER_TRADE("per_trade"),
    /**
     * Portfolio running commission total at the moment of closing, before the
     * exit commission is added. Reproduces legacy reports bit for bit.
     */
    CUMULATIVE("cumulative");

    private final String value;

    CommissionAttribution(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static CommissionAttribution fromValue(String value) {
        if (value == null) return PER_TRADE;
        for (CommissionAttribution attribution : values()) {
            if (attribution.value.equalsIgnoreCase(value) || attribution.name().equalsIgnoreCase(value)) {
                return attribution;
            }
        }
        return PER_TRADE;
    }
}
