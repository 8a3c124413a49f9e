package com.stratlab.core.dsl;

import com.stratlab.core.model.PositionSizing;
import com.stratlab.core.model.RiskManagement;
import com.stratlab.core.model.Strategy;

/**
 * Validates a complete strategy definition before it is saved or run.
 * Never throws on bad input; problems come back as a {@link ValidationResult}.
 */
public class StrategyValidator {

    public static final int MAX_NAME_LENGTH = 100;

    private final Parser parser;

    public StrategyValidator() {
        this(new Parser());
    }

    public StrategyValidator(Parser parser) {
        this.parser = parser;
    }

    public ValidationResult validate(Strategy strategy) {
        if (strategy == null) {
            return ValidationResult.error("Strategy is missing");
        }

        String name = strategy.name();
        if (name == null || name.isEmpty() || name.codePointCount(0, name.length()) > MAX_NAME_LENGTH) {
            return ValidationResult.error("Strategy name must be 1-" + MAX_NAME_LENGTH + " characters");
        }

        if (strategy.entryRules() == null) {
            return ValidationResult.error("Missing required field: entry_rules");
        }
        if (strategy.exitRules() == null) {
            return ValidationResult.error("Missing required field: exit_rules");
        }

        Parser.ParseResult entry = parser.parse(strategy.entryRules());
        if (!entry.success()) {
            return ValidationResult.error("Invalid entry rules: " + entry.error());
        }

        Parser.ParseResult exit = parser.parse(strategy.exitRules());
        if (!exit.success()) {
            return ValidationResult.error("Invalid exit rules: " + exit.error());
        }

        PositionSizing sizing = strategy.positionSizing();
        if (sizing != null) {
            if (sizing.method() == null) {
                return ValidationResult.error("Position sizing method not specified");
            }
            if (sizing.type() == null) {
                return ValidationResult.error("Invalid position sizing method: " + sizing.method());
            }
        }

        RiskManagement risk = strategy.riskManagement();
        if (risk != null) {
            Double stop = risk.stopLossPct();
            if (stop != null && !(stop > 0 && stop <= 100)) {
                return ValidationResult.error("Stop loss percentage must be between 0 and 100");
            }
            Double target = risk.takeProfitPct();
            if (target != null && !(target > 0 && target <= 1000)) {
                return ValidationResult.error("Take profit percentage must be between 0 and 1000");
            }
        }

        return ValidationResult.ok();
    }

    /**
     * Outcome of validation; {@code error} is null when valid.
     */
    public record ValidationResult(boolean valid, String error) {
        public static ValidationResult ok() {
            return new ValidationResult(true, null);
        }

        public static ValidationResult error(String message) {
            return new ValidationResult(false, message);
        }
    }
}
