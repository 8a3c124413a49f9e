package com.stratlab.core.model;

import java.time.LocalDate;

/**
 * One end-of-day OHLCV observation for a ticker.
 * Indicator columns computed for a run live alongside the bars in an
 * {@link com.stratlab.core.indicators.IndicatorTable}, aligned by index.
 */
public record Bar(
    LocalDate date,
    double open,
    double high,
    double low,
    double close,
    double volume
) {
    public static final String CSV_HEADER = "date,open,high,low,close,volume";

    /**
     * Parse one data row: ISO date followed by open, high, low, close, volume.
     *
     * @throws IllegalArgumentException if the row is malformed
     */
    public static Bar fromCsv(String line) {
        String[] parts = line.split(",");
        if (parts.length < 6) {
            throw new IllegalArgumentException("Invalid CSV line: " + line);
        }
        try {
            return new Bar(
                LocalDate.parse(parts[0].trim()),
                Double.parseDouble(parts[1].trim()),
                Double.parseDouble(parts[2].trim()),
                Double.parseDouble(parts[3].trim()),
                Double.parseDouble(parts[4].trim()),
                Double.parseDouble(parts[5].trim())
            );
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Invalid CSV line: " + line, e);
        }
    }

    public String toCsv() {
        return date + "," + open + "," + high + "," + low + "," + close + "," + volume;
    }

    /**
     * Typical price (H + L + C) / 3, used by VWAP and CCI.
     */
    public double typicalPrice() {
        return (high + low + close) / 3.0;
    }
}
