package com.stratlab.core.io;

import com.stratlab.core.model.Bar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Reads daily bars from {dataDir}/{TICKER}.csv files.
 * Expected header: date,open,high,low,close,volume
 */
public class BarCsvReader implements BarSource {

    private static final Logger log = LoggerFactory.getLogger(BarCsvReader.class);

    private final File dataDir;

    public BarCsvReader(File dataDir) {
        this.dataDir = dataDir;
    }

    public File fileFor(String ticker) {
        return new File(dataDir, ticker.toUpperCase(Locale.ROOT) + ".csv");
    }

    @Override
    public List<Bar> load(String ticker, LocalDate from, LocalDate to) throws IOException {
        File file = fileFor(ticker);
        if (!file.exists()) {
            log.warn("No data file for {}: {}", ticker, file);
            return List.of();
        }

        List<Bar> bars = new ArrayList<>();
        for (Bar bar : readFile(file)) {
            if (from != null && bar.date().isBefore(from)) continue;
            if (to != null && bar.date().isAfter(to)) continue;
            bars.add(bar);
        }

        log.debug("Loaded {} bars for {} from {}", bars.size(), ticker, file.getName());
        return bars;
    }

    /**
     * Read every row of a bar file, sorted by date with duplicate dates dropped
     * (first occurrence wins). Malformed rows are logged and skipped.
     */
    public List<Bar> readFile(File file) throws IOException {
        List<Bar> bars = new ArrayList<>();

        try (BufferedReader reader = new BufferedReader(new FileReader(file, StandardCharsets.UTF_8))) {
            String line;
            boolean firstLine = true;

            while ((line = reader.readLine()) != null) {
                line = line.trim();
                if (line.isEmpty()) continue;

                if (firstLine) {
                    firstLine = false;
                    if (line.toLowerCase(Locale.ROOT).startsWith("date")) {
                        continue;
                    }
                }

                try {
                    bars.add(Bar.fromCsv(line));
                } catch (IllegalArgumentException e) {
                    log.warn("Skipping malformed row in {}: {}", file.getName(), line);
                }
            }
        }

        bars.sort(Comparator.comparing(Bar::date));

        List<Bar> deduplicated = new ArrayList<>();
        LocalDate lastDate = null;
        for (Bar bar : bars) {
            if (!bar.date().equals(lastDate)) {
                deduplicated.add(bar);
                lastDate = bar.date();
            }
        }
        return deduplicated;
    }
}
