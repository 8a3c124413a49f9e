package com.stratlab.engine;

import com.stratlab.core.dsl.AstNode;
import com.stratlab.core.indicators.IndicatorTable;
import com.stratlab.core.model.BacktestConfig;
import com.stratlab.core.model.BacktestResult;
import com.stratlab.core.model.Bar;
import com.stratlab.core.model.ExitReason;
import com.stratlab.core.model.PerformanceMetrics;
import com.stratlab.core.model.PortfolioStatistics;
import com.stratlab.core.model.PositionSizing;
import com.stratlab.core.model.RiskManagement;
import com.stratlab.core.model.Strategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.function.Consumer;

/**
 * Main backtesting engine: runs a strategy bar by bar over daily data.
 *
 * Every ticker is evaluated independently into entry and exit signals. The
 * simulation then walks the union of all tickers' dates in order; on each date
 * every ticker with a bar is processed in ticker order against one shared
 * portfolio before a single equity point is recorded. A single-ticker run is
 * the same loop with one ticker.
 *
 * Data-source agnostic: bars are passed in by the caller.
 */
public class BacktestEngine {

    private static final Logger log = LoggerFactory.getLogger(BacktestEngine.class);

    private final RuleEvaluator evaluator;
    private final PositionSizer positionSizer;

    public BacktestEngine() {
        this(new RuleEvaluator(), new PositionSizer());
    }

    public BacktestEngine(RuleEvaluator evaluator, PositionSizer positionSizer) {
        this.evaluator = evaluator;
        this.positionSizer = positionSizer;
    }

    /**
     * Run a backtest on a single ticker.
     */
    public BacktestResult run(Strategy strategy, BacktestConfig config, String ticker, List<Bar> bars) {
        return run(strategy, config, ticker, bars, null);
    }

    public BacktestResult run(Strategy strategy, BacktestConfig config, String ticker, List<Bar> bars,
                              Consumer<Progress> onProgress) {
        long startTime = System.currentTimeMillis();
        if (bars == null || bars.isEmpty()) {
            log.warn("No data available for {}", ticker);
            return createErrorResult(strategy, config, List.of(ticker), startTime,
                "No data available for " + ticker);
        }
        Map<String, List<Bar>> single = new LinkedHashMap<>();
        single.put(ticker, bars);
        return simulate(strategy, config, single, startTime, onProgress);
    }

    /**
     * Run a backtest over several tickers sharing one portfolio. Tickers
     * without data are skipped; the run fails only if none has data.
     *
     * @param barsByTicker bars per ticker, iterated in the map's order
     */
    public BacktestResult runMulti(Strategy strategy, BacktestConfig config, Map<String, List<Bar>> barsByTicker) {
        return runMulti(strategy, config, barsByTicker, null);
    }

    public BacktestResult runMulti(Strategy strategy, BacktestConfig config, Map<String, List<Bar>> barsByTicker,
                                   Consumer<Progress> onProgress) {
        long startTime = System.currentTimeMillis();

        Map<String, List<Bar>> withData = new LinkedHashMap<>();
        for (Map.Entry<String, List<Bar>> entry : barsByTicker.entrySet()) {
            if (entry.getValue() == null || entry.getValue().isEmpty()) {
                log.warn("No data available for {}, skipping", entry.getKey());
            } else {
                withData.put(entry.getKey(), entry.getValue());
            }
        }

        if (withData.isEmpty()) {
            return createErrorResult(strategy, config, List.copyOf(barsByTicker.keySet()), startTime,
                "No data available for any tickers");
        }
        return simulate(strategy, config, withData, startTime, onProgress);
    }

    // ========== Simulation ==========

    private BacktestResult simulate(Strategy strategy, BacktestConfig config, Map<String, List<Bar>> barsByTicker,
                                    long startTime, Consumer<Progress> onProgress) {
        report(onProgress, 0, 1, "Evaluating rules...");

        List<AstNode> entryNodes = evaluator.parseForRun(strategy.entryRules());
        List<AstNode> exitNodes = evaluator.parseForRun(strategy.exitRules());
        boolean exitUsesEntryPrice = RuleEvaluator.referencesEntryPrice(exitNodes);

        List<TickerRun> runs = new ArrayList<>();
        TreeSet<LocalDate> allDates = new TreeSet<>();
        for (Map.Entry<String, List<Bar>> entry : barsByTicker.entrySet()) {
            IndicatorTable table = IndicatorTable.withDefaults(entry.getValue());
            boolean[] entrySignal = evaluator.evaluate(entryNodes, table, Double.NaN);
            boolean[] exitSignal = evaluator.evaluate(exitNodes, table, Double.NaN);
            runs.add(new TickerRun(entry.getKey(), table, entrySignal, exitSignal));
            for (Bar bar : table.bars()) {
                allDates.add(bar.date());
            }
        }

        Portfolio portfolio = Portfolio.of(config);
        PositionSizing sizing = strategy.sizingOrDefault();
        RiskManagement risk = strategy.riskOrNone();

        int total = allDates.size();
        int processed = 0;
        for (LocalDate date : allDates) {
            Map<String, Double> currentPrices = new HashMap<>();

            for (TickerRun run : runs) {
                Integer index = run.indexByDate.get(date);
                if (index == null) {
                    continue;
                }
                Bar bar = run.table.bars().get(index);
                currentPrices.put(run.ticker, bar.close());
                step(run, index, bar, portfolio, config, sizing, risk, exitNodes, exitUsesEntryPrice);
            }

            portfolio.recordEquity(date, currentPrices);

            processed++;
            if (onProgress != null && (processed % 100 == 0 || processed == total)) {
                report(onProgress, processed, total, "Simulating " + date);
            }
        }

        // Force-close anything still open at each ticker's last bar
        for (TickerRun run : runs) {
            if (portfolio.hasPosition(run.ticker)) {
                Bar last = run.table.bars().get(run.table.size() - 1);
                portfolio.closePosition(run.ticker, last.date(), config.sellPrice(last.close()), ExitReason.END_OF_DATA);
            }
        }

        report(onProgress, total, total, "Calculating metrics...");
        MetricsCalculator calculator = new MetricsCalculator(config.riskFreeRate());
        PerformanceMetrics metrics = calculator.calculate(
            portfolio.getEquityCurve(), portfolio.getTrades(), config.initialCapital());

        BacktestResult result = new BacktestResult(
            strategy.name(),
            List.copyOf(barsByTicker.keySet()),
            config,
            portfolio.getTrades(),
            portfolio.getEquityCurve(),
            metrics,
            portfolio.getStatistics(),
            allDates.first(),
            allDates.last(),
            System.currentTimeMillis() - startTime,
            List.of()
        );

        log.info("Backtest complete: {}", result.getSummary());
        return result;
    }

    /**
     * One ticker on one date: manage the open position, or look for an entry.
     * A ticker that exits on a bar does not re-enter on the same bar.
     */
    private void step(TickerRun run, int index, Bar bar, Portfolio portfolio, BacktestConfig config,
                      PositionSizing sizing, RiskManagement risk,
                      List<AstNode> exitNodes, boolean exitUsesEntryPrice) {
        String ticker = run.ticker;
        double close = bar.close();

        if (portfolio.hasPosition(ticker)) {
            if (risk.trailingStop()) {
                portfolio.updateTrailingStop(ticker, close);
            }

            Optional<ExitReason> stopOrTarget = portfolio.checkExitConditions(ticker, close, bar.low());
            boolean exitSignal = run.activeExit[index];

            if (stopOrTarget.isPresent() || exitSignal) {
                portfolio.closePosition(ticker, bar.date(), config.sellPrice(close),
                    stopOrTarget.orElse(ExitReason.SIGNAL));
                run.activeExit = run.exitSignal;
            }
        } else if (run.entrySignal[index]) {
            double buyPrice = config.buyPrice(close);
            int shares = positionSizer.calculate(sizing, portfolio.getCash(), buyPrice, run.table.atr14At(index));
            if (shares <= 0) {
                return;
            }

            boolean opened = portfolio.openPosition(
                ticker,
                bar.date(),
                buyPrice,
                shares,
                risk.stopLossPrice(buyPrice),
                risk.takeProfitPrice(buyPrice),
                risk.effectiveTrailingPct()
            );

            if (opened && exitUsesEntryPrice) {
                run.activeExit = evaluator.evaluate(exitNodes, run.table, buyPrice);
            }
        }
    }

    private BacktestResult createErrorResult(Strategy strategy, BacktestConfig config, List<String> tickers,
                                             long startTime, String error) {
        return new BacktestResult(
            strategy.name(),
            tickers,
            config,
            List.of(),
            List.of(),
            PerformanceMetrics.empty(config.initialCapital()),
            PortfolioStatistics.empty(0),
            null,
            null,
            System.currentTimeMillis() - startTime,
            List.of(error)
        );
    }

    private static void report(Consumer<Progress> onProgress, int current, int total, String message) {
        if (onProgress != null) {
            int percentage = total > 0 ? (int) ((long) current * 100 / total) : 100;
            onProgress.accept(new Progress(current, total, percentage, message));
        }
    }

    /**
     * Per-ticker state of a run: bars with indicators, precomputed signals and
     * the exit signal in force for the currently open position.
     */
    private static final class TickerRun {
        final String ticker;
        final IndicatorTable table;
        final boolean[] entrySignal;
        final boolean[] exitSignal;
        final Map<LocalDate, Integer> indexByDate = new HashMap<>();
        boolean[] activeExit;

        TickerRun(String ticker, IndicatorTable table, boolean[] entrySignal, boolean[] exitSignal) {
            this.ticker = ticker;
            this.table = table;
            this.entrySignal = entrySignal;
            this.exitSignal = exitSignal;
            this.activeExit = exitSignal;
            List<Bar> bars = table.bars();
            for (int i = 0; i < bars.size(); i++) {
                indexByDate.put(bars.get(i).date(), i);
            }
        }
    }

    /**
     * Progress callback data
     */
    public record Progress(int current, int total, int percentage, String message) {}
}
