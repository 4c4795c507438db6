package com.conveyal.heatmap.density;

import com.conveyal.heatmap.grid.GridTransform;
import com.conveyal.heatmap.grid.GridWindow;
import com.conveyal.heatmap.mask.EvaluationMask;
import com.conveyal.heatmap.output.OutputGrids;

/**
 * The result of one call to DensityHeatmapGenerator. The grids cover the evaluation window, which sits at an offset
 * within the grid of the transform that was used. When the transform was derived from the data that offset is
 * normally zero; use windowTransform() to georeference the grids in all cases.
 */
public class DensityHeatmap {

    /** The transform actually used, whether supplied by the caller or derived from the data. */
    public final GridTransform transform;

    public final EvaluationMask mask;

    /** Indexed [row][col] within the window. */
    public final int[][] counts;

    /** Indexed [row][col] within the window. */
    public final double[][] average;

    /** May be passed back in a later call over the same sample locations to skip the unweighted pass. */
    public final FrequencyField frequencies;

    public DensityHeatmap (GridTransform transform, EvaluationMask mask, OutputGrids grids,
                           FrequencyField frequencies) {
        this.transform = transform;
        this.mask = mask;
        this.counts = grids.counts;
        this.average = grids.average;
        this.frequencies = frequencies;
    }

    public GridWindow window () {
        return mask.window;
    }

    /** The transform whose row and column zero are the first cell of the grids. */
    public GridTransform windowTransform () {
        return mask.window.transform(transform);
    }

    public int rows () {
        return mask.window.rows;
    }

    public int cols () {
        return mask.window.cols;
    }

}
