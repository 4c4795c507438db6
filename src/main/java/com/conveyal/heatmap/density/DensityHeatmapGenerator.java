package com.conveyal.heatmap.density;

import com.conveyal.heatmap.HeatmapException;
import com.conveyal.heatmap.grid.GridTransform;
import com.conveyal.heatmap.grid.GridWindow;
import com.conveyal.heatmap.mask.EvaluationMask;
import com.conveyal.heatmap.mask.GeometryMasker;
import com.conveyal.heatmap.output.OutputAssembler;
import com.conveyal.heatmap.output.OutputGrids;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a continuous heatmap of scalar observations made along a traverse, using tophat kernel density estimation.
 *
 * The kernel is fitted twice over the sample locations. The unweighted fit estimates how many observations overlap
 * each cell (the frequency), and the fit weighted by the observed values estimates the total value at each cell.
 * Their ratio is the average observed value. Only cells near the traverse path are scored: the path is buffered by
 * the radius (plus any padding) and everything outside is masked out.
 *
 * All parameter checks happen before any masking, fitting or scoring, so a configuration error leaves nothing
 * half-done. The generator has no state of its own and may be shared.
 */
public class DensityHeatmapGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(DensityHeatmapGenerator.class);

    private final Kernel kernel;

    public DensityHeatmapGenerator () {
        this(TophatKernel.INSTANCE);
    }

    public DensityHeatmapGenerator (Kernel kernel) {
        this.kernel = kernel;
    }

    public DensityHeatmap generate (double[] x, double[] y, double[] values, DensityHeatmapParameters params) {
        params.validate();
        return generate(new SampleSet(x, y, values), params);
    }

    public DensityHeatmap generate (SampleSet samples, DensityHeatmapParameters params) {
        params.validate();
        final double buffer = params.buffer();
        LOG.debug("buffer: {}", buffer);
        GridTransform transform = params.transform;
        if (transform == null) {
            transform = deriveTransform(samples, params.sampleBounds, params.gsd, buffer);
        }
        Geometry path = samples.path();
        if (params.sampleBounds != null) {
            path = GeometryMasker.clipToSampleBounds(path, params.sampleBounds);
        }

        long start = System.currentTimeMillis();
        EvaluationMask mask = new GeometryMasker(transform, params.allTouched).mask(path, buffer);
        LOG.debug("Created mask in {} ms", System.currentTimeMillis() - start);
        GridWindow window = mask.window;
        if (params.frequencies != null) {
            params.frequencies.checkCompatible(transform, window, params.radius, mask.unmaskedCount());
        }

        // Coordinates of the centers of the unmasked cells, in row-major order.
        start = System.currentTimeMillis();
        GridTransform windowTransform = window.transform(transform);
        int[] cells = mask.unmaskedIndexes();
        double[] xs = new double[cells.length];
        double[] ys = new double[cells.length];
        for (int i = 0; i < cells.length; i++) {
            xs[i] = windowTransform.cellCenterX(cells[i] % window.cols);
            ys[i] = windowTransform.cellCenterY(cells[i] / window.cols);
        }
        LOG.debug("Created {} unmasked coordinates in {} ms", cells.length, System.currentTimeMillis() - start);

        ParallelKernelScorer scorer = new ParallelKernelScorer(params.processes);
        FrequencyField frequencies = params.frequencies;
        if (frequencies == null) {
            start = System.currentTimeMillis();
            KernelDensityModel unweighted = KernelDensityModel.fit(kernel, params.radius, samples.x, samples.y);
            LOG.debug("Trained unweighted KDE in {} ms", System.currentTimeMillis() - start);
            start = System.currentTimeMillis();
            double[] scores = scorer.score(unweighted, xs, ys);
            LOG.info("Sampled {} points (unweighted) in {} ms.", scores.length, System.currentTimeMillis() - start);
            frequencies = new FrequencyField(transform, window, params.radius, densities(scores, samples.size()));
        } else {
            LOG.info("Reusing {} supplied frequencies, skipping the unweighted pass.", frequencies.size());
        }

        start = System.currentTimeMillis();
        KernelDensityModel weighted =
                KernelDensityModel.fitWeighted(kernel, params.radius, samples.x, samples.y, samples.values);
        LOG.debug("Trained weighted KDE in {} ms", System.currentTimeMillis() - start);
        start = System.currentTimeMillis();
        double[] weightedDensities = densities(scorer.score(weighted, xs, ys), 1);
        LOG.info("Sampled {} points (weighted) in {} ms.", weightedDensities.length, System.currentTimeMillis() - start);

        OutputGrids grids = new OutputAssembler(mask, params.nodataValue).assemble(
                cells, frequencies.toArray(), weightedDensities, samples.sumOfValues(), params.radius);
        return new DensityHeatmap(transform, mask, grids, frequencies);
    }

    /**
     * Derive a grid-aligned transform northwest of the samples (or of the sample bounds polygon when one is given).
     * A gsd larger than the extent in both directions would put all the data in a single cell and is refused. Data
     * that are thin along one axis, such as a straight traverse, still span many cells along the other.
     */
    private static GridTransform deriveTransform (SampleSet samples, Geometry sampleBounds, double gsd, double buffer) {
        Envelope extent = sampleBounds == null ? samples.envelope() : sampleBounds.getEnvelopeInternal();
        if (gsd > extent.getWidth() && gsd > extent.getHeight()) {
            throw HeatmapException.configuration(String.format(
                    "GSD (%s) can not be larger than the bounds of the input data (%s x %s).",
                    gsd, extent.getWidth(), extent.getHeight()));
        }
        return GridTransform.fromBufferWithGrid(extent, buffer, gsd);
    }

    /** Exponentiate log-density scores, scale them, and zero anything under the noise floor. */
    static double[] densities (double[] logScores, double scale) {
        double[] result = new double[logScores.length];
        for (int i = 0; i < logScores.length; i++) {
            result[i] = OutputAssembler.applyNoiseFloor(Math.exp(logScores[i]) * scale);
        }
        return result;
    }

}
