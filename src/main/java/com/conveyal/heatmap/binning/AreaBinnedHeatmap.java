package com.conveyal.heatmap.binning;

import com.conveyal.heatmap.grid.GridTransform;

/**
 * Per-cell counts and arithmetic averages of the samples falling in each cell of a uniform grid, indexed
 * [row][col] with row zero at the north edge of the transform.
 */
public class AreaBinnedHeatmap {

    public final GridTransform transform;

    public final int[][] counts;

    public final double[][] average;

    public AreaBinnedHeatmap (GridTransform transform, int[][] counts, double[][] average) {
        this.transform = transform;
        this.counts = counts;
        this.average = average;
    }

    public int rows () {
        return counts.length;
    }

    public int cols () {
        return counts.length == 0 ? 0 : counts[0].length;
    }

}
