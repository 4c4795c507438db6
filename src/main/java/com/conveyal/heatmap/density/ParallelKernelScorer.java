package com.conveyal.heatmap.density;

import com.conveyal.heatmap.HeatmapException;
import com.conveyal.heatmap.util.ExceptionUtils;
import com.conveyal.heatmap.util.LambdaCounter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

/**
 * Scores a list of query locations by splitting it into contiguous chunks, one per thread, and concatenating the
 * results in chunk order. Every later step relies on the score at position i belonging to query location i, so the
 * output never depends on how many threads were used or the order in which they finish.
 *
 * A pool is created for each call to score and shut down before it returns. Nothing is kept between calls.
 */
public class ParallelKernelScorer {

    private static final Logger LOG = LoggerFactory.getLogger(ParallelKernelScorer.class);

    private final int processes;

    public ParallelKernelScorer (int processes) {
        if (processes < 1) {
            throw HeatmapException.configuration("Processes must be a positive integer, was " + processes);
        }
        this.processes = processes;
    }

    /**
     * Split n items into p contiguous chunks whose sizes differ by at most one, with the larger chunks first.
     * Returns p + 1 boundaries: chunk i covers [bounds[i], bounds[i + 1]). Chunks may be empty when n < p.
     */
    public static int[] chunkBounds (int n, int p) {
        checkArgument(n >= 0 && p > 0);
        int[] bounds = new int[p + 1];
        int base = n / p;
        int extra = n % p;
        for (int i = 0; i < p; i++) {
            bounds[i + 1] = bounds[i] + base + (i < extra ? 1 : 0);
        }
        return bounds;
    }

    /**
     * Score every query location with the given scorer. Blocks until all chunks are done. Any failure in a chunk
     * aborts the whole call with a WORKER exception and no partial result.
     */
    public double[] score (SampleScorer scorer, double[] xs, double[] ys) {
        checkArgument(xs.length == ys.length, "Query coordinate arrays must be the same length.");
        final int n = xs.length;
        if (n == 0) return new double[0];
        if (processes == 1) {
            try {
                return scorer.scoreSamples(xs, ys, 0, n);
            } catch (HeatmapException e) {
                throw e;
            } catch (RuntimeException e) {
                throw HeatmapException.worker(e);
            }
        }
        final int[] bounds = chunkBounds(n, processes);
        LambdaCounter counter = new LambdaCounter(LOG, processes, 1, "Scored {} of {} chunks");
        List<Callable<double[]>> tasks = new ArrayList<>(processes);
        for (int c = 0; c < processes; c++) {
            final int from = bounds[c];
            final int to = bounds[c + 1];
            tasks.add(() -> {
                double[] chunkScores = scorer.scoreSamples(xs, ys, from, to);
                counter.increment();
                return chunkScores;
            });
        }
        ExecutorService executor = Executors.newFixedThreadPool(processes);
        try {
            // invokeAll returns futures in the same order as the tasks, whatever order they complete in.
            List<Future<double[]>> futures = executor.invokeAll(tasks);
            double[] scores = new double[n];
            for (int c = 0; c < processes; c++) {
                double[] chunkScores = futures.get(c).get();
                checkState(chunkScores.length == bounds[c + 1] - bounds[c], "Chunk returned the wrong number of scores.");
                System.arraycopy(chunkScores, 0, scores, bounds[c], chunkScores.length);
            }
            counter.done();
            return scores;
        } catch (ExecutionException e) {
            LOG.error("Scoring chunk failed, aborting: {}", ExceptionUtils.stackTraceString(e.getCause()));
            throw HeatmapException.worker(e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw HeatmapException.worker(e);
        } finally {
            executor.shutdownNow();
        }
    }

}
