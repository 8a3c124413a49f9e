package com.stratlab.runner;

import com.fasterxml.jackson.databind.JsonNode;
import com.stratlab.core.io.JsonStore;
import com.stratlab.core.io.StrategyStore;
import com.stratlab.core.model.Bar;
import com.stratlab.core.model.Strategy;
import com.stratlab.runner.config.RunnerConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the command-line runner.
 */
class StrategyRunnerAppTest {

    @Nested
    @DisplayName("Argument Parsing")
    class ArgumentTests {

        @Test
        @DisplayName("Parses strategy, tickers and options")
        void parsesAll() {
            StrategyRunnerApp.Arguments args = StrategyRunnerApp.Arguments.parse(new String[]{
                "rsi.json", "aapl", "MSFT", "--from", "2024-01-01", "--to", "2024-06-30", "--config", "my.yaml", "--each"
            });

            assertEquals(new File("rsi.json"), args.strategyFile());
            assertEquals(List.of("AAPL", "MSFT"), args.tickers());
            assertEquals(LocalDate.of(2024, 1, 1), args.from());
            assertEquals(LocalDate.of(2024, 6, 30), args.to());
            assertEquals(new File("my.yaml"), args.configFile());
            assertTrue(args.each());
        }

        @Test
        @DisplayName("Options are optional")
        void minimal() {
            StrategyRunnerApp.Arguments args = StrategyRunnerApp.Arguments.parse(new String[]{"s.json", "AAPL"});

            assertNull(args.from());
            assertNull(args.configFile());
            assertFalse(args.each());
        }

        @Test
        @DisplayName("Usage errors are reported")
        void usageErrors() {
            assertThrows(IllegalArgumentException.class, () -> StrategyRunnerApp.Arguments.parse(new String[]{}));
            assertThrows(IllegalArgumentException.class, () -> StrategyRunnerApp.Arguments.parse(new String[]{"s.json"}));
            assertThrows(IllegalArgumentException.class,
                () -> StrategyRunnerApp.Arguments.parse(new String[]{"s.json", "AAPL", "--from"}));
            assertThrows(IllegalArgumentException.class,
                () -> StrategyRunnerApp.Arguments.parse(new String[]{"s.json", "AAPL", "--from", "yesterday"}));
            assertThrows(IllegalArgumentException.class,
                () -> StrategyRunnerApp.Arguments.parse(new String[]{"s.json", "AAPL", "--verbose"}));
        }
    }

    @Nested
    @DisplayName("Running")
    class RunTests {

        @TempDir
        Path root;

        private RunnerConfig config;
        private File strategyFile;

        @BeforeEach
        void setUp() throws IOException {
            config = RunnerConfig.defaults();
            config.setDataDir(root.resolve("data").toString());
            config.setStrategiesDir(root.resolve("strategies").toString());
            config.setResultsDir(root.resolve("results").toString());
            config.setThreads(2);

            Files.createDirectories(root.resolve("data"));
            writeBars("AAPL", 100);
            writeBars("MSFT", 200);

            Strategy strategy = Strategy.createDefault()
                .withName("Dip Buyer")
                .withRules("close > 0", "close > entry_price * 1.05");
            strategyFile = new StrategyStore(root.resolve("strategies").toFile()).save(strategy);
        }

        private void writeBars(String ticker, double start) throws IOException {
            List<String> lines = new ArrayList<>();
            lines.add(Bar.CSV_HEADER);
            LocalDate date = LocalDate.of(2024, 1, 1);
            for (int i = 0; i < 30; i++) {
                double close = start + i;
                lines.add(new Bar(date.plusDays(i), close, close + 1, close - 1, close, 1000).toCsv());
            }
            Files.write(root.resolve("data").resolve(ticker + ".csv"), lines, StandardCharsets.UTF_8);
        }

        private File[] resultFiles() {
            File[] files = root.resolve("results").toFile().listFiles((dir, name) -> name.endsWith(".json"));
            return files != null ? files : new File[0];
        }

        private int run(String... args) {
            return new StrategyRunnerApp(config).run(StrategyRunnerApp.Arguments.parse(args));
        }

        @Test
        @DisplayName("Single ticker run writes one result")
        void singleTicker() throws IOException {
            assertEquals(StrategyRunnerApp.EXIT_OK, run(strategyFile.getPath(), "AAPL"));

            File[] files = resultFiles();
            assertEquals(1, files.length);
            JsonNode json = JsonStore.createMapper().readTree(files[0]);
            assertEquals("Dip Buyer", json.get("strategyName").asText());
            assertEquals("AAPL", json.get("tickers").get(0).asText());
            assertTrue(json.get("trades").size() > 0);
            assertEquals("2024-01-01", json.get("startDate").asText());
        }

        @Test
        @DisplayName("Several tickers share one portfolio")
        void multiTicker() throws IOException {
            assertEquals(StrategyRunnerApp.EXIT_OK, run(strategyFile.getPath(), "AAPL", "MSFT", "--to", "2024-01-20"));

            File[] files = resultFiles();
            assertEquals(1, files.length);
            JsonNode json = JsonStore.createMapper().readTree(files[0]);
            assertEquals(2, json.get("tickers").size());
            assertEquals("2024-01-20", json.get("endDate").asText());
        }

        @Test
        @DisplayName("--each runs every ticker on its own")
        void eachTicker() {
            assertEquals(StrategyRunnerApp.EXIT_OK, run(strategyFile.getPath(), "AAPL", "MSFT", "--each"));
            assertEquals(2, resultFiles().length);
        }

        @Test
        @DisplayName("Ticker without data is a run error")
        void missingData() {
            assertEquals(StrategyRunnerApp.EXIT_ERROR, run(strategyFile.getPath(), "GOOG"));
            assertEquals(0, resultFiles().length);
        }

        @Test
        @DisplayName("Invalid input is rejected before running")
        void invalidInput() throws IOException {
            assertEquals(StrategyRunnerApp.EXIT_ERROR, run(strategyFile.getPath(), "NOT_A_TICKER"));
            assertEquals(StrategyRunnerApp.EXIT_ERROR, run(root.resolve("missing.json").toString(), "AAPL"));
            assertEquals(StrategyRunnerApp.EXIT_ERROR,
                run(strategyFile.getPath(), "AAPL", "--from", "2024-02-01", "--to", "2024-01-01"));

            Path bad = root.resolve("bad.json");
            Files.writeString(bad, "{\"name\": \"Bad\", \"entry_rules\": \"foo(1) > 2\", \"exit_rules\": \"\"}",
                StandardCharsets.UTF_8);
            assertEquals(StrategyRunnerApp.EXIT_ERROR, run(bad.toString(), "AAPL"));

            assertEquals(0, resultFiles().length);
        }

        @Test
        @DisplayName("Unwritable results directory is a run error")
        void unwritableResults() throws IOException {
            Path notADirectory = root.resolve("results.txt");
            Files.writeString(notADirectory, "occupied", StandardCharsets.UTF_8);
            config.setResultsDir(notADirectory.toString());

            assertEquals(StrategyRunnerApp.EXIT_ERROR, run(strategyFile.getPath(), "AAPL"));
        }

        @Test
        @DisplayName("Reading the strategy leaves the strategies directory alone")
        void noStrategiesDirectoryCreated() {
            Path strategies = root.resolve("no-such-strategies");
            config.setStrategiesDir(strategies.toString());

            assertEquals(StrategyRunnerApp.EXIT_OK, run(strategyFile.getPath(), "AAPL"));
            assertFalse(Files.exists(strategies));
        }

        @Test
        @DisplayName("Relative strategy names are found in the strategies directory")
        void resolvesFromStrategiesDirectory() {
            assertEquals(StrategyRunnerApp.EXIT_OK, run(strategyFile.getName(), "AAPL"));
            assertEquals(1, resultFiles().length);
        }
    }

    @Nested
    @DisplayName("Launching")
    class LaunchTests {

        @TempDir
        Path root;

        @Test
        @DisplayName("Malformed config file exits with an error code")
        void malformedConfig() throws IOException {
            Path config = root.resolve("bad.yaml");
            Files.writeString(config, "initial_capital: [not, a, number]", StandardCharsets.UTF_8);

            int code = StrategyRunnerApp.launch(new String[]{"s.json", "AAPL", "--config", config.toString()});

            assertEquals(StrategyRunnerApp.EXIT_ERROR, code);
        }

        @Test
        @DisplayName("Missing config file exits with an error code")
        void missingConfig() {
            int code = StrategyRunnerApp.launch(
                new String[]{"s.json", "AAPL", "--config", root.resolve("absent.yaml").toString()});

            assertEquals(StrategyRunnerApp.EXIT_ERROR, code);
        }

        @Test
        @DisplayName("Usage errors exit with the usage code")
        void usageError() {
            assertEquals(StrategyRunnerApp.EXIT_USAGE, StrategyRunnerApp.launch(new String[]{"s.json"}));
        }
    }
}
