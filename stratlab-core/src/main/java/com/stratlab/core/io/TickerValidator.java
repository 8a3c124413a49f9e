package com.stratlab.core.io;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Input checks for ticker symbols and backtest date ranges.
 */
public final class TickerValidator {

    /** 1-5 letters, optionally followed by a dot and 1-2 letters (BRK.B). */
    private static final Pattern TICKER = Pattern.compile("^[A-Z]{1,5}(\\.[A-Z]{1,2})?$");

    private TickerValidator() {}

    public record TickerCheck(List<String> valid, List<String> invalid) {
        public boolean allValid() {
            return invalid.isEmpty();
        }
    }

    public static boolean isValidTicker(String ticker) {
        if (ticker == null || ticker.isBlank()) {
            return false;
        }
        return TICKER.matcher(ticker.trim().toUpperCase(Locale.ROOT)).matches();
    }

    /**
     * Normalize tickers to upper case and split them into valid and invalid.
     */
    public static TickerCheck validateTickers(List<String> tickers) {
        List<String> valid = new ArrayList<>();
        List<String> invalid = new ArrayList<>();
        for (String ticker : tickers) {
            String normalized = ticker.trim().toUpperCase(Locale.ROOT);
            if (isValidTicker(normalized)) {
                valid.add(normalized);
            } else {
                invalid.add(normalized);
            }
        }
        return new TickerCheck(List.copyOf(valid), List.copyOf(invalid));
    }

    /**
     * @return an error message, or empty if the range is usable
     */
    public static Optional<String> validateDateRange(LocalDate start, LocalDate end, LocalDate today) {
        if (start == null || end == null) {
            return Optional.empty();
        }
        if (!start.isBefore(end)) {
            return Optional.of("Start date must be before end date");
        }
        if (end.isAfter(today)) {
            return Optional.of("End date cannot be in the future");
        }
        return Optional.empty();
    }

    public static Optional<String> validateDateRange(LocalDate start, LocalDate end) {
        return validateDateRange(start, end, LocalDate.now());
    }
}
