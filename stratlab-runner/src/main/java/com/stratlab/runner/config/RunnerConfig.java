package com.stratlab.runner.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.stratlab.core.model.BacktestConfig;
import com.stratlab.core.model.CommissionAttribution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Runner configuration, read from YAML with snake_case keys
 * ({@code initial_capital}, {@code results_dir}, ...). The same keys name the
 * {@code stratlab.<key>} properties and {@code STRATLAB_<KEY>} variables.
 *
 * Resolution order, later wins: bundled {@code stratlab-defaults.yaml}, the
 * user's config file, environment variables {@code STRATLAB_*}, system
 * properties {@code stratlab.*}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class RunnerConfig {

    private static final Logger log = LoggerFactory.getLogger(RunnerConfig.class);

    public static final String DEFAULTS_RESOURCE = "/stratlab-defaults.yaml";

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory())
        .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);

    private double initialCapital = BacktestConfig.DEFAULT_INITIAL_CAPITAL;
    private double commissionRate = BacktestConfig.DEFAULT_COMMISSION_RATE;
    private double slippageRate = BacktestConfig.DEFAULT_SLIPPAGE_RATE;
    private double riskFreeRate = BacktestConfig.DEFAULT_RISK_FREE_RATE;
    private String commissionAttribution = CommissionAttribution.PER_TRADE.getValue();
    private String dataDir = "data";
    private String strategiesDir = "strategies";
    private String resultsDir = "results";
    private int threads = 4;

    public RunnerConfig() {
    }

    // ==================== Loading ====================

    /**
     * Load defaults, then the given file (if any), then environment and
     * system property overrides.
     */
    public static RunnerConfig load(File file) {
        RunnerConfig config = defaults();
        if (file != null) {
            config.mergeFile(file);
        }
        config.applyOverrides(System::getProperty, System.getenv());
        return config;
    }

    /**
     * Configuration from the bundled defaults resource only.
     */
    public static RunnerConfig defaults() {
        RunnerConfig config = new RunnerConfig();
        try (InputStream in = RunnerConfig.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                log.warn("{} not found on classpath, using built-in defaults", DEFAULTS_RESOURCE);
                return config;
            }
            YAML.readerForUpdating(config).readValue(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + DEFAULTS_RESOURCE, e);
        }
        return config;
    }

    public void mergeFile(File file) {
        try {
            YAML.readerForUpdating(this).readValue(file);
            log.info("Loaded runner config from {}", file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read runner config " + file, e);
        }
    }

    /**
     * Apply {@code stratlab.<key>} properties and {@code STRATLAB_<KEY>} environment
     * variables; a property beats an environment variable.
     */
    public void applyOverrides(UnaryOperator<String> properties, Map<String, String> env) {
        initialCapital = Double.parseDouble(lookup("initial_capital", String.valueOf(initialCapital), properties, env));
        commissionRate = Double.parseDouble(lookup("commission_rate", String.valueOf(commissionRate), properties, env));
        slippageRate = Double.parseDouble(lookup("slippage_rate", String.valueOf(slippageRate), properties, env));
        riskFreeRate = Double.parseDouble(lookup("risk_free_rate", String.valueOf(riskFreeRate), properties, env));
        commissionAttribution = lookup("commission_attribution", commissionAttribution, properties, env);
        dataDir = lookup("data_dir", dataDir, properties, env);
        strategiesDir = lookup("strategies_dir", strategiesDir, properties, env);
        resultsDir = lookup("results_dir", resultsDir, properties, env);
        threads = Integer.parseInt(lookup("threads", String.valueOf(threads), properties, env));
    }

    private static String lookup(String key, String current, UnaryOperator<String> properties, Map<String, String> env) {
        String value = properties.apply("stratlab." + key);
        if (value == null) {
            value = env.get("STRATLAB_" + key.toUpperCase(Locale.ROOT));
        }
        return value != null ? value.trim() : current;
    }

    /**
     * Backtest parameters for the engine.
     */
    public BacktestConfig toBacktestConfig() {
        return new BacktestConfig(
            initialCapital,
            commissionRate,
            slippageRate,
            riskFreeRate,
            CommissionAttribution.fromValue(commissionAttribution)
        );
    }

    // ==================== Accessors ====================

    public double getInitialCapital() { return initialCapital; }
    public void setInitialCapital(double initialCapital) { this.initialCapital = initialCapital; }

    public double getCommissionRate() { return commissionRate; }
    public void setCommissionRate(double commissionRate) { this.commissionRate = commissionRate; }

    public double getSlippageRate() { return slippageRate; }
    public void setSlippageRate(double slippageRate) { this.slippageRate = slippageRate; }

    public double getRiskFreeRate() { return riskFreeRate; }
    public void setRiskFreeRate(double riskFreeRate) { this.riskFreeRate = riskFreeRate; }

    public String getCommissionAttribution() { return commissionAttribution; }
    public void setCommissionAttribution(String commissionAttribution) { this.commissionAttribution = commissionAttribution; }

    public String getDataDir() { return dataDir; }
    public void setDataDir(String dataDir) { this.dataDir = dataDir; }

    public String getStrategiesDir() { return strategiesDir; }
    public void setStrategiesDir(String strategiesDir) { this.strategiesDir = strategiesDir; }

    public String getResultsDir() { return resultsDir; }
    public void setResultsDir(String resultsDir) { this.resultsDir = resultsDir; }

    public int getThreads() { return threads; }
    public void setThreads(int threads) { this.threads = threads; }

    @JsonIgnore
    public Path dataPath() {
        return Path.of(dataDir);
    }

    @JsonIgnore
    public Path resultsPath() {
        return Path.of(resultsDir);
    }
}
