package com.conveyal.heatmap.density;

import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.index.strtree.STRtree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.util.Arrays;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A kernel density estimate fitted over a set of sample locations, optionally weighted. Once constructed the model
 * is immutable: the training points, weights and spatial index are never modified, so a single instance is shared
 * read-only by every scoring thread.
 *
 * Scores are natural logs of density per unit area, normalized by the total weight so that the density integrates
 * to one. A location with no kernel mass scores negative infinity.
 */
public class KernelDensityModel implements SampleScorer, Serializable {

    private static final Logger LOG = LoggerFactory.getLogger(KernelDensityModel.class);

    public final Kernel kernel;

    public final double bandwidth;

    private final double[] x;

    private final double[] y;

    private final double[] weights;

    private final double totalWeight;

    /** Contains the index of every training point, keyed on its location. */
    private final STRtree spatialIndex = new STRtree();

    private KernelDensityModel (Kernel kernel, double bandwidth, double[] x, double[] y, double[] weights) {
        checkArgument(bandwidth > 0, "Kernel bandwidth must be positive.");
        checkArgument(x.length == y.length && x.length == weights.length, "Training arrays must be the same length.");
        kernel.checkInvariants(bandwidth);
        long start = System.currentTimeMillis();
        this.kernel = kernel;
        this.bandwidth = bandwidth;
        this.x = x;
        this.y = y;
        this.weights = weights;
        double total = 0;
        for (int i = 0; i < x.length; i++) {
            total += weights[i];
            spatialIndex.insert(new Envelope(x[i], x[i], y[i], y[i]), i);
        }
        this.totalWeight = total;
        // Building makes the index immutable, so it can then be queried from several threads.
        spatialIndex.build();
        LOG.debug("Indexed {} training points in {} ms.", x.length, System.currentTimeMillis() - start);
    }

    /** Fit with a weight of one per sample. */
    public static KernelDensityModel fit (Kernel kernel, double bandwidth, double[] x, double[] y) {
        double[] ones = new double[x.length];
        Arrays.fill(ones, 1);
        return new KernelDensityModel(kernel, bandwidth, x, y, ones);
    }

    /** Fit with one non-negative weight per sample. */
    public static KernelDensityModel fitWeighted (Kernel kernel, double bandwidth, double[] x, double[] y,
                                                  double[] weights) {
        for (double w : weights) {
            checkArgument(w >= 0, "Sample weights must not be negative.");
        }
        return new KernelDensityModel(kernel, bandwidth, x, y, weights);
    }

    public int size () {
        return x.length;
    }

    public double totalWeight () {
        return totalWeight;
    }

    /** The natural log of the estimated density at a single location. */
    public double logDensity (double qx, double qy) {
        if (totalWeight == 0) return Double.NEGATIVE_INFINITY;
        double reach = kernel.reachesZeroAt(bandwidth);
        Envelope searchEnvelope = new Envelope(qx - reach, qx + reach, qy - reach, qy + reach);
        double[] sum = new double[1];
        spatialIndex.query(searchEnvelope, item -> {
            int i = (Integer) item;
            double distance = Math.hypot(x[i] - qx, y[i] - qy);
            sum[0] += weights[i] * kernel.computeWeight(bandwidth, distance);
        });
        return Math.log(sum[0] / totalWeight / kernel.normalization(bandwidth));
    }

    @Override
    public double[] scoreSamples (double[] xs, double[] ys, int from, int to) {
        double[] scores = new double[to - from];
        for (int i = from; i < to; i++) {
            scores[i - from] = logDensity(xs[i], ys[i]);
        }
        return scores;
    }

}
