package com.stratlab.runner;

import com.stratlab.core.io.JsonStore;
import com.stratlab.core.model.BacktestResult;

import java.io.File;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Writes backtest results as indented JSON: {resultsDir}/{strategy}_{tickers}_{timestamp}.json
 */
public class ResultStore extends JsonStore<BacktestResult> {

    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    public ResultStore(File directory) {
        super(directory);
    }

    @Override
    protected Class<BacktestResult> getEntityClass() {
        return BacktestResult.class;
    }

    @Override
    protected String getEntityName() {
        return "backtest result";
    }

    @Override
    protected String keyOf(BacktestResult result) {
        String tickers = String.join("-", result.tickers());
        return result.strategyName() + "_" + tickers + "_" + LocalDateTime.now().format(STAMP);
    }
}
