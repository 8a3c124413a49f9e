package com.stratlab.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Position sizing section of a strategy document.
 * The method is kept as its document string so that an unknown method
 * reaches validation instead of failing deserialization.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PositionSizing(
    String method,   // "fixed", "percentage", "risk_based"
    double value     // dollars for fixed, percent otherwise
) {
    public static PositionSizing of(PositionSizingMethod method, double value) {
        return new PositionSizing(method.getValue(), value);
    }

    /**
     * Parsed sizing method, or null if {@link #method()} is unknown.
     */
    @JsonIgnore
    public PositionSizingMethod type() {
        return PositionSizingMethod.fromValue(method);
    }
}
