package com.conveyal.heatmap.density;

import java.io.Serializable;

import static com.google.common.base.Preconditions.checkState;

/**
 * A radially symmetric kernel used in two-dimensional density estimation. Each sample spreads a unit of mass (or
 * its weight) over the plane according to this function of distance, scaled by a bandwidth.
 *
 * Kernels are stateless and shared read-only between scoring threads.
 */
public abstract class Kernel implements Serializable {

    /**
     * Returns the distance at or beyond which this kernel contributes nothing, for the given bandwidth. This bounds
     * the spatial index queries made when scoring, so it must never be smaller than the true support.
     */
    public abstract double reachesZeroAt (double bandwidth);

    /**
     * The unnormalized contribution of a sample at the given distance, in the range [0...1].
     * Idempotent, no side effects.
     */
    public abstract double computeWeight (double bandwidth, double distance);

    /**
     * The integral of computeWeight over the plane for the given bandwidth. Dividing a sum of weights by this
     * value turns it into a density per unit area.
     */
    public abstract double normalization (double bandwidth);

    /**
     * Verify that the kernel has the expected characteristics at the given bandwidth before it is used.
     */
    public final void checkInvariants (double bandwidth) {
        double zero = reachesZeroAt(bandwidth);
        checkState(zero > 0, "Kernel support must be positive.");
        checkState(computeWeight(bandwidth, zero) == 0, "Kernel must contribute nothing at its zero point.");
        checkState(normalization(bandwidth) > 0, "Kernel normalization must be positive.");
        double prevWeight = Double.POSITIVE_INFINITY;
        for (int i = 0; i <= 100; i++) {
            double weight = computeWeight(bandwidth, zero * i / 100);
            checkState(weight >= 0 && weight <= 1, "Kernel weights must be in [0...1].");
            checkState(weight <= prevWeight, "Kernel must be monotonically decreasing with distance.");
            prevWeight = weight;
        }
    }

}
