package com.conveyal.heatmap.output;

import com.conveyal.heatmap.grid.GridWindow;

/**
 * The count and average grids of a heatmap, both shaped like the evaluation window and indexed [row][col].
 */
public class OutputGrids {

    public final GridWindow window;

    /** Estimated number of observations whose disks overlap each cell; zero outside the evaluated region. */
    public final int[][] counts;

    /** Average observed value of the overlapping observations; the nodata value where none could be computed. */
    public final double[][] average;

    public OutputGrids (GridWindow window, int[][] counts, double[][] average) {
        this.window = window;
        this.counts = counts;
        this.average = average;
    }

}
