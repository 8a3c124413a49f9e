package com.stratlab.runner;

import com.stratlab.core.dsl.StrategyValidator;
import com.stratlab.core.io.BarCsvReader;
import com.stratlab.core.io.StrategyStore;
import com.stratlab.core.io.TickerValidator;
import com.stratlab.core.model.BacktestConfig;
import com.stratlab.core.model.BacktestResult;
import com.stratlab.core.model.Bar;
import com.stratlab.core.model.Strategy;
import com.stratlab.engine.BacktestEngine;
import com.stratlab.engine.ParallelBacktester;
import com.stratlab.runner.config.RunnerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Strategy Runner - command-line backtests.
 *
 * Loads a strategy document, reads each ticker's bars from the data directory,
 * runs the backtest and writes the result JSON to the results directory.
 */
public class StrategyRunnerApp {
    private static final Logger LOG = LoggerFactory.getLogger(StrategyRunnerApp.class);

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_USAGE = 2;

    static final String USAGE =
        "Usage: stratlab-runner <strategy.json> <TICKER> [TICKER...] "
            + "[--from YYYY-MM-DD] [--to YYYY-MM-DD] [--config file.yaml] [--each]";

    private final RunnerConfig config;

    public StrategyRunnerApp(RunnerConfig config) {
        this.config = config;
    }

    public static void main(String[] args) {
        System.exit(launch(args));
    }

    /**
     * Parse the command line, load configuration and run.
     *
     * @return process exit code
     */
    static int launch(String[] args) {
        Arguments arguments;
        try {
            arguments = Arguments.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(USAGE);
            return EXIT_USAGE;
        }

        RunnerConfig config;
        try {
            config = RunnerConfig.load(arguments.configFile());
        } catch (UncheckedIOException e) {
            LOG.error("{}: {}", e.getMessage(), e.getCause().getMessage());
            return EXIT_ERROR;
        } catch (IllegalArgumentException e) {
            LOG.error("Invalid runner configuration: {}", e.getMessage());
            return EXIT_ERROR;
        }
        return new StrategyRunnerApp(config).run(arguments);
    }

    /**
     * Run the backtest(s) described by the arguments.
     *
     * @return process exit code
     */
    public int run(Arguments arguments) {
        File strategyFile = resolveStrategyFile(arguments.strategyFile());
        Strategy strategy;
        try {
            strategy = StrategyStore.readFile(strategyFile);
        } catch (UncheckedIOException e) {
            LOG.error("Cannot read strategy {}: {}", strategyFile, e.getCause().getMessage());
            return EXIT_ERROR;
        }

        StrategyValidator.ValidationResult validation = new StrategyValidator().validate(strategy);
        if (!validation.valid()) {
            LOG.error("Invalid strategy: {}", validation.error());
            return EXIT_ERROR;
        }

        TickerValidator.TickerCheck check = TickerValidator.validateTickers(arguments.tickers());
        if (!check.allValid()) {
            LOG.error("Invalid tickers: {}", String.join(", ", check.invalid()));
            return EXIT_ERROR;
        }

        if (arguments.from() != null && arguments.to() != null) {
            Optional<String> rangeError = TickerValidator.validateDateRange(arguments.from(), arguments.to());
            if (rangeError.isPresent()) {
                LOG.error(rangeError.get());
                return EXIT_ERROR;
            }
        }

        Map<String, List<Bar>> barsByTicker;
        try {
            barsByTicker = loadBars(check.valid(), arguments.from(), arguments.to());
        } catch (IOException e) {
            LOG.error("Failed to read market data: {}", e.getMessage());
            return EXIT_ERROR;
        }

        BacktestConfig backtestConfig = config.toBacktestConfig();
        List<BacktestResult> results;
        try {
            results = execute(strategy, backtestConfig, barsByTicker, arguments.each());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.error("Interrupted while running backtests");
            return EXIT_ERROR;
        }

        ResultStore store = new ResultStore(config.resultsPath().toFile());
        boolean allSucceeded = true;
        for (BacktestResult result : results) {
            if (!result.isSuccessful()) {
                LOG.error(result.getSummary());
                allSucceeded = false;
                continue;
            }
            LOG.info(result.getSummary());
            try {
                store.save(result);
            } catch (UncheckedIOException e) {
                LOG.error("{}: {}", e.getMessage(), e.getCause().getMessage());
                allSucceeded = false;
            }
        }
        return allSucceeded ? EXIT_OK : EXIT_ERROR;
    }

    /**
     * A relative strategy path that does not exist is looked up in the
     * strategies directory.
     */
    File resolveStrategyFile(File file) {
        if (file.isAbsolute() || file.exists()) {
            return file;
        }
        File candidate = new File(config.getStrategiesDir(), file.getPath());
        return candidate.exists() ? candidate : file;
    }

    private Map<String, List<Bar>> loadBars(List<String> tickers, LocalDate from, LocalDate to) throws IOException {
        BarCsvReader reader = new BarCsvReader(config.dataPath().toFile());
        Map<String, List<Bar>> barsByTicker = new LinkedHashMap<>();
        for (String ticker : tickers) {
            barsByTicker.put(ticker, reader.load(ticker, from, to));
        }
        return barsByTicker;
    }

    private List<BacktestResult> execute(Strategy strategy, BacktestConfig backtestConfig,
                                         Map<String, List<Bar>> barsByTicker, boolean each)
        throws InterruptedException {
        if (each) {
            List<ParallelBacktester.Job> jobs = new ArrayList<>();
            barsByTicker.forEach((ticker, bars) -> jobs.add(new ParallelBacktester.Job(strategy, ticker, bars)));
            try (ParallelBacktester backtester = new ParallelBacktester(config.getThreads(), backtestConfig)) {
                return backtester.runAll(jobs);
            }
        }

        BacktestEngine engine = new BacktestEngine();
        if (barsByTicker.size() == 1) {
            Map.Entry<String, List<Bar>> only = barsByTicker.entrySet().iterator().next();
            return List.of(engine.run(strategy, backtestConfig, only.getKey(), only.getValue(),
                progress -> LOG.debug(progress.message())));
        }
        return List.of(engine.runMulti(strategy, backtestConfig, barsByTicker,
            progress -> LOG.debug(progress.message())));
    }

    /**
     * Parsed command line.
     */
    public record Arguments(
        File strategyFile,
        List<String> tickers,
        LocalDate from,
        LocalDate to,
        File configFile,
        boolean each
    ) {
        public Arguments {
            tickers = List.copyOf(tickers);
        }

        /**
         * @throws IllegalArgumentException on any usage error
         */
        public static Arguments parse(String[] args) {
            File strategyFile = null;
            List<String> tickers = new ArrayList<>();
            LocalDate from = null;
            LocalDate to = null;
            File configFile = null;
            boolean each = false;

            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                switch (arg) {
                    case "--from" -> from = parseDate(arg, valueAfter(args, ++i, arg));
                    case "--to" -> to = parseDate(arg, valueAfter(args, ++i, arg));
                    case "--config" -> configFile = new File(valueAfter(args, ++i, arg));
                    case "--each" -> each = true;
                    default -> {
                        if (arg.startsWith("--")) {
                            throw new IllegalArgumentException("Unknown option: " + arg);
                        }
                        if (strategyFile == null) {
                            strategyFile = new File(arg);
                        } else {
                            tickers.add(arg.toUpperCase(Locale.ROOT));
                        }
                    }
                }
            }

            if (strategyFile == null) {
                throw new IllegalArgumentException("Missing strategy file");
            }
            if (tickers.isEmpty()) {
                throw new IllegalArgumentException("At least one ticker is required");
            }
            return new Arguments(strategyFile, tickers, from, to, configFile, each);
        }

        private static String valueAfter(String[] args, int index, String option) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Missing value for " + option);
            }
            return args[index];
        }

        private static LocalDate parseDate(String option, String value) {
            try {
                return LocalDate.parse(value);
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("Invalid date for " + option + ": " + value, e);
            }
        }
    }
}
