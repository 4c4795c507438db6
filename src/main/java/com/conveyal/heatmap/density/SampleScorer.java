package com.conveyal.heatmap.density;

/**
 * Something that can assign a log-density score to a run of query locations. Implementations must be safe to call
 * from several threads at once.
 */
@FunctionalInterface
public interface SampleScorer {

    /**
     * Score the query locations with indexes in [from, to) of the given parallel coordinate arrays.
     * @return an array of length (to - from), in the same order as the queries.
     */
    double[] scoreSamples (double[] xs, double[] ys, int from, int to);

}
