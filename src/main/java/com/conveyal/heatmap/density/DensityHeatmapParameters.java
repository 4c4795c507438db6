package com.conveyal.heatmap.density;

import com.conveyal.heatmap.HeatmapConfig;
import com.conveyal.heatmap.HeatmapException;
import com.conveyal.heatmap.grid.GridTransform;
import org.locationtech.jts.geom.Geometry;

/**
 * Options for a single call to DensityHeatmapGenerator. Fields are public and mutable so callers can set only what
 * they need; the defaults match those of the configuration file shipped with the library.
 */
public class DensityHeatmapParameters {

    /** Ground sample distance: the width and height of one output cell, in the units of the sample coordinates. */
    public double gsd = 1;

    /** Kernel bandwidth, which should be the sensing radius of the instrument. Same units as gsd. */
    public double radius = 1;

    /**
     * Square padding in cells added around the sample path. If null, the path is buffered by the radius alone.
     */
    public Integer padding = null;

    /** Written into the average grid wherever no average could be computed. */
    public double nodataValue = 0;

    /**
     * If null, a transform aligned on a global grid of step gsd will be derived from the data. If supplied, its cell
     * sizes must both equal gsd.
     */
    public GridTransform transform = null;

    /** Number of threads used for each scoring pass. */
    public int processes = 1;

    /**
     * Optional polygon restricting the portion of the traverse path that is evaluated. When no transform is supplied
     * the grid is derived from the envelope of this polygon instead of the envelope of the samples.
     */
    public Geometry sampleBounds = null;

    /** A FrequencyField returned by an earlier call with the same sample locations, to skip the unweighted pass. */
    public FrequencyField frequencies = null;

    /** Evaluate every cell touched by the buffered path, rather than only cells whose centers it covers. */
    public boolean allTouched = false;

    /** Seed per-call parameters with the defaults from a configuration. */
    public static DensityHeatmapParameters fromConfig (HeatmapConfig config) {
        DensityHeatmapParameters params = new DensityHeatmapParameters();
        params.gsd = config.gsd();
        params.radius = config.radius();
        params.processes = config.processes();
        params.nodataValue = config.nodataValue();
        params.allTouched = config.allTouched();
        return params;
    }

    /** The distance by which the sample path is buffered to find the cells that must be evaluated. */
    public double buffer () {
        if (padding == null) {
            return radius;
        } else {
            // Convert from cells of padding to a distance in coordinate units.
            return padding * gsd + radius;
        }
    }

    /** Throw a configuration error if any option is out of range on its own, before any work starts. */
    public void validate () {
        if (processes < 1) {
            throw HeatmapException.configuration("Processes must be a positive integer, was " + processes);
        }
        if (!(gsd > 0) || !Double.isFinite(gsd)) {
            throw HeatmapException.configuration("GSD must be a positive number, was " + gsd);
        }
        if (!(radius > 0) || !Double.isFinite(radius)) {
            throw HeatmapException.configuration("Radius must be a positive number, was " + radius);
        }
        if (padding != null && padding < 0) {
            throw HeatmapException.configuration("Padding must not be negative, was " + padding);
        }
        if (transform != null && !transform.hasCellSize(gsd)) {
            throw HeatmapException.configuration(String.format(
                    "The scale factors of the transform (%s, %s) must both equal the ground sample distance (%s).",
                    transform.cellWidth, transform.cellHeight, gsd));
        }
        if (sampleBounds != null && sampleBounds.isEmpty()) {
            throw HeatmapException.configuration("Sample bounds must not be empty.");
        }
    }

}
