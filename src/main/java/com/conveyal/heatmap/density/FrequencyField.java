package com.conveyal.heatmap.density;

import com.conveyal.heatmap.HeatmapException;
import com.conveyal.heatmap.grid.GridTransform;
import com.conveyal.heatmap.grid.GridWindow;

import java.io.Serializable;

/**
 * The unweighted kernel density over the evaluated cells of a heatmap, scaled to an estimate of the number of
 * observations per unit area (density times sample count, with the noise floor applied). It depends only on the
 * sample locations, the grid and the radius, not on the sample values, so a caller generating heatmaps of several
 * quantities measured at the same locations can pass it back in to skip the unweighted scoring pass.
 *
 * Values are held in row-major order of the evaluated (unmasked) cells of the window they were computed for. The
 * grid, window and radius are recorded so that reuse with an incompatible call can be refused.
 */
public class FrequencyField implements Serializable {

    public final GridTransform transform;

    public final GridWindow window;

    public final double radius;

    private final double[] values;

    public FrequencyField (GridTransform transform, GridWindow window, double radius, double[] values) {
        this.transform = transform;
        this.window = window;
        this.radius = radius;
        this.values = values;
    }

    public int size () {
        return values.length;
    }

    public double get (int i) {
        return values[i];
    }

    /** A copy of the values, in row-major order of the evaluated cells. */
    public double[] toArray () {
        return values.clone();
    }

    /**
     * Throw a configuration error unless this field was computed over the same grid, window, radius and number of
     * evaluated cells as a new call is about to use.
     */
    public void checkCompatible (GridTransform transform, GridWindow window, double radius, int evaluatedCells) {
        if (!this.transform.equals(transform)) {
            throw HeatmapException.configuration("Supplied frequencies were computed on a different grid: " +
                    this.transform + " vs. " + transform);
        }
        if (!this.window.equals(window)) {
            throw HeatmapException.configuration("Supplied frequencies were computed over a different window: " +
                    this.window + " vs. " + window);
        }
        if (this.radius != radius) {
            throw HeatmapException.configuration("Supplied frequencies were computed with radius " + this.radius +
                    ", not " + radius);
        }
        if (values.length != evaluatedCells) {
            throw HeatmapException.configuration("Supplied frequencies cover " + values.length +
                    " cells but " + evaluatedCells + " are to be evaluated.");
        }
    }

}
