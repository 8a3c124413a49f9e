package com.stratlab.core.io;

import com.stratlab.core.model.Bar;

import java.io.IOException;
import java.time.LocalDate;
import java.util.List;

/**
 * Supplies daily bars for a ticker.
 */
public interface BarSource {

    /**
     * Bars for the ticker within [from, to] inclusive, ordered by date with
     * unique dates. Null bounds are open. Returns an empty list when the
     * ticker has no data.
     */
    List<Bar> load(String ticker, LocalDate from, LocalDate to) throws IOException;
}
