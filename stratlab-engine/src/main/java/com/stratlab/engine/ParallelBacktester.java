package com.stratlab.engine;

import com.stratlab.core.model.BacktestConfig;
import com.stratlab.core.model.BacktestResult;
import com.stratlab.core.model.Bar;
import com.stratlab.core.model.PerformanceMetrics;
import com.stratlab.core.model.PortfolioStatistics;
import com.stratlab.core.model.Strategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs independent single-ticker backtests on a fixed thread pool.
 * Each job gets its own engine, indicator table and portfolio; nothing mutable
 * is shared between jobs.
 */
public class ParallelBacktester implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ParallelBacktester.class);

    private final ExecutorService executor;
    private final BacktestConfig config;

    /**
     * One strategy on one ticker's bars.
     */
    public record Job(Strategy strategy, String ticker, List<Bar> bars) {}

    public ParallelBacktester(int threads, BacktestConfig config) {
        if (threads <= 0) {
            throw new IllegalArgumentException("threads must be positive: " + threads);
        }
        this.config = config;
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "backtest-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Run all jobs and wait for them.
     *
     * @return one result per job, in submission order; a job that threw is
     *         reported as an error result
     */
    public List<BacktestResult> runAll(List<Job> jobs) throws InterruptedException {
        List<Future<BacktestResult>> futures = new ArrayList<>();
        for (Job job : jobs) {
            futures.add(executor.submit(() -> new BacktestEngine().run(job.strategy(), config, job.ticker(), job.bars())));
        }

        List<BacktestResult> results = new ArrayList<>();
        for (int i = 0; i < jobs.size(); i++) {
            Job job = jobs.get(i);
            try {
                results.add(futures.get(i).get());
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.error("Backtest of {} on {} failed", job.strategy().name(), job.ticker(), cause);
                results.add(failed(job, cause));
            }
        }

        log.info("Completed {} backtests", results.size());
        return results;
    }

    private BacktestResult failed(Job job, Throwable cause) {
        return new BacktestResult(
            job.strategy().name(),
            List.of(job.ticker()),
            config,
            List.of(),
            List.of(),
            PerformanceMetrics.empty(config.initialCapital()),
            PortfolioStatistics.empty(0),
            null,
            null,
            0,
            List.of("Backtest failed: " + cause.getMessage())
        );
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
