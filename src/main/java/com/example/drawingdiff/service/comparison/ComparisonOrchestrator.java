package com.example.drawingdiff.service.comparison;

import com.example.drawingdiff.config.DrawingDiffProperties;
import com.example.drawingdiff.model.ComparisonBatch;
import com.example.drawingdiff.model.ComparisonOutcome;
import com.example.drawingdiff.model.ComparisonReport;
import com.example.drawingdiff.model.ComparisonStatus;
import com.example.drawingdiff.model.DrawingPair;
import com.example.drawingdiff.model.PageImage;
import com.example.drawingdiff.service.matching.DrawingMatcher;
import com.example.drawingdiff.util.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Compares every pair of a batch on a bounded worker pool.
 *
 * <p>Each pair gets its own {@link CancellationToken}, derived from the batch token. A watchdog
 * expires it once the pair has been running for longer than the configured budget and completes the
 * pair as {@link ComparisonStatus#TIMEOUT} right away, even when the worker is still inside a native
 * call. The worker notices the expired token at its next checkpoint and its late result is
 * discarded.
 */
@Service
public class ComparisonOrchestrator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ComparisonOrchestrator.class);

    private final DrawingMatcher drawingMatcher;
    private final PairPipeline pipeline;
    private final Duration pairTimeout;
    private final ExecutorService workers;
    private final ScheduledExecutorService watchdog;

    public ComparisonOrchestrator(DrawingMatcher drawingMatcher,
                                  PairPipeline pipeline,
                                  DrawingDiffProperties properties) {
        this.drawingMatcher = drawingMatcher;
        this.pipeline = pipeline;
        this.pairTimeout = properties.batch().pairTimeout();
        int threads = properties.batch().effectiveWorkerThreads();
        this.workers = Executors.newFixedThreadPool(threads, new CustomizableThreadFactory("pair-worker-"));
        CustomizableThreadFactory watchdogThreads = new CustomizableThreadFactory("pair-watchdog-");
        watchdogThreads.setDaemon(true);
        this.watchdog = Executors.newSingleThreadScheduledExecutor(watchdogThreads);
        log.info("Comparison pool started with {} worker threads and a {} ms pair budget",
                threads, pairTimeout.toMillis());
    }

    /**
     * Pairs the pages by identifier and compares every pair.
     *
     * @param oldPages pages of the old revision, each with {@code Revision.OLD}
     * @param newPages pages of the new revision, each with {@code Revision.NEW}
     * @throws IllegalArgumentException when a page is passed on the wrong side; this is checked
     *                                  before any pair runs
     */
    public ComparisonReport compare(List<PageImage> oldPages, List<PageImage> newPages) {
        return compare(drawingMatcher.match(oldPages, newPages));
    }

    public ComparisonReport compare(ComparisonBatch batch) {
        return compare(batch, CancellationToken.none());
    }

    /**
     * Runs the batch and blocks until every pair reached a terminal state. Cancelling
     * {@code batchToken} stops pairs that have not finished; they are reported as
     * {@link ComparisonStatus#ERROR}.
     */
    public ComparisonReport compare(ComparisonBatch batch, CancellationToken batchToken) {
        List<CompletableFuture<ComparisonOutcome>> pending = new ArrayList<>(batch.pairs().size());
        for (DrawingPair pair : batch.pairs()) {
            pending.add(submit(new PairExecution(pair, batchToken.child())));
        }

        List<ComparisonOutcome> outcomes = new ArrayList<>(pending.size());
        for (CompletableFuture<ComparisonOutcome> future : pending) {
            outcomes.add(future.join());
        }

        ComparisonReport report = new ComparisonReport(batch, outcomes);
        log.info("Comparison finished: {} matches found, {} successful, {} failed ({} alignment, {} error, {} timeout)",
                batch.pairs().size(), report.successful(), report.failed(),
                report.count(ComparisonStatus.ALIGNMENT_FAILED), report.count(ComparisonStatus.ERROR),
                report.count(ComparisonStatus.TIMEOUT));
        if (!batch.unmatchedOld().isEmpty() || !batch.unmatchedNew().isEmpty()) {
            log.info("Only in old: {}; only in new: {}", batch.unmatchedOld(), batch.unmatchedNew());
        }
        return report;
    }

    private CompletableFuture<ComparisonOutcome> submit(PairExecution execution) {
        CompletableFuture<ComparisonOutcome> result = new CompletableFuture<>();
        try {
            workers.execute(() -> runPair(execution, result));
        } catch (RejectedExecutionException e) {
            log.error("Worker pool rejected pair {}", execution.pair().identifier(), e);
            result.complete(execution.failed(ComparisonStatus.ERROR, null, "Worker pool is shut down"));
        }
        return result;
    }

    private void runPair(PairExecution execution, CompletableFuture<ComparisonOutcome> result) {
        ScheduledFuture<?> timer = scheduleTimeout(execution, result);
        try {
            result.complete(pipeline.run(execution));
        } finally {
            if (timer != null) {
                timer.cancel(false);
            }
            if (!result.isDone()) {
                result.complete(execution.failed(ComparisonStatus.ERROR, null, "Pair worker ended without an outcome"));
            }
        }
    }

    private ScheduledFuture<?> scheduleTimeout(PairExecution execution, CompletableFuture<ComparisonOutcome> result) {
        try {
            return watchdog.schedule(() -> {
                if (execution.token().expire()) {
                    log.warn("Pair {} exceeded its {} ms budget during {}", execution.pair().identifier(),
                            pairTimeout.toMillis(), PairExecution.describe(execution.stage()));
                    result.complete(execution.timedOut(pairTimeout));
                }
            }, pairTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("Watchdog is shut down, pair {} runs without a time budget", execution.pair().identifier());
            return null;
        }
    }

    @Override
    public void close() {
        workers.shutdownNow();
        watchdog.shutdownNow();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Pair workers did not stop within 5 seconds");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
