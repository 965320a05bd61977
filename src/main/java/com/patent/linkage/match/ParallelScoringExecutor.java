package com.patent.linkage.match;

import com.patent.linkage.core.model.MatchCandidate;
import com.patent.linkage.metrics.MetricsService;
import com.patent.linkage.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs fuzzy scoring over a list of sources with a fixed pool of workers.
 *
 * <p>Sources are split into contiguous chunks, one per worker. Every worker
 * reads the same {@link TargetIndex}. Chunk results are collected in chunk
 * order, so the concatenated output does not depend on which worker finishes
 * first. A chunk whose worker fails is re-run once on the calling thread; if
 * that also fails the run aborts with a {@link WorkerExecutionException}.</p>
 *
 * <p>Small inputs (fewer than {@code minParallelSources}) and single-worker
 * configurations are scored sequentially without starting a pool.</p>
 */
public class ParallelScoringExecutor {
    private static final Logger log = LoggerFactory.getLogger(ParallelScoringExecutor.class);

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final MetricsService metrics;

    public ParallelScoringExecutor() {
        this(new NoOpMetricsService());
    }

    public ParallelScoringExecutor(MetricsService metrics) {
        this.metrics = metrics;
    }

    /**
     * Scores every source and returns the surviving candidates in source order.
     */
    public List<MatchCandidate> score(List<SourceEntry> sources, TargetIndex targets, MatchOptions options) {
        if (sources.isEmpty() || targets.size() == 0) {
            return List.of();
        }
        FuzzyScorer scorer = new FuzzyScorer(options);
        int workers = Math.min(options.getEffectiveWorkers(), sources.size());

        if (workers <= 1 || sources.size() < options.getMinParallelSources()) {
            log.debug("fuzzy.sequential sources={} targets={}", sources.size(), targets.size());
            return runChunk(scorer, 0, sources, targets);
        }

        List<List<SourceEntry>> chunks = partition(sources, workers);
        log.debug("fuzzy.parallel sources={} targets={} workers={}", sources.size(), targets.size(), workers);

        ExecutorService pool = Executors.newFixedThreadPool(workers, workerThreadFactory());
        try {
            List<CompletableFuture<List<MatchCandidate>>> futures = new ArrayList<>(chunks.size());
            for (List<SourceEntry> chunk : chunks) {
                futures.add(CompletableFuture.supplyAsync(() -> scorer.scoreAll(chunk, targets), pool));
            }

            List<MatchCandidate> result = new ArrayList<>();
            for (int i = 0; i < chunks.size(); i++) {
                result.addAll(collect(futures.get(i), scorer, i, chunks.get(i), targets));
            }
            return result;
        } finally {
            shutdown(pool);
        }
    }

    private List<MatchCandidate> collect(CompletableFuture<List<MatchCandidate>> future, FuzzyScorer scorer,
                                         int chunkIndex, List<SourceEntry> chunk, TargetIndex targets) {
        try {
            return future.join();
        } catch (CompletionException | CancellationException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("fuzzy.chunk.failed chunk={} size={} error={}, retrying sequentially",
                    chunkIndex, chunk.size(), cause.toString());
            metrics.incrementChunkRetry();
            return runChunk(scorer, chunkIndex, chunk, targets);
        }
    }

    private List<MatchCandidate> runChunk(FuzzyScorer scorer, int chunkIndex, List<SourceEntry> chunk,
                                          TargetIndex targets) {
        try {
            return scorer.scoreAll(chunk, targets);
        } catch (RuntimeException e) {
            log.error("fuzzy.chunk.fatal chunk={} first='{}' last='{}'",
                    chunkIndex, chunk.get(0).name(), chunk.get(chunk.size() - 1).name(), e);
            throw new WorkerExecutionException(chunkIndex, chunk.get(0).name(),
                    chunk.get(chunk.size() - 1).name(), e);
        }
    }

    /**
     * Splits into {@code parts} contiguous chunks whose sizes differ by at most one.
     */
    static <T> List<List<T>> partition(List<T> items, int parts) {
        List<List<T>> chunks = new ArrayList<>(parts);
        int base = items.size() / parts;
        int remainder = items.size() % parts;
        int from = 0;
        for (int i = 0; i < parts; i++) {
            int size = base + (i < remainder ? 1 : 0);
            if (size == 0) {
                continue;
            }
            chunks.add(items.subList(from, from + size));
            from += size;
        }
        return chunks;
    }

    private static ThreadFactory workerThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "fuzzy-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static void shutdown(ExecutorService pool) {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
