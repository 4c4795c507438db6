package com.conveyal.heatmap.density;

/**
 * Uniform disk kernel: full weight strictly inside the bandwidth, nothing on or beyond it.
 */
public class TophatKernel extends Kernel {

    public static final TophatKernel INSTANCE = new TophatKernel();

    @Override
    public double reachesZeroAt (double bandwidth) {
        return bandwidth;
    }

    @Override
    public double computeWeight (double bandwidth, double distance) {
        if (distance < bandwidth) {
            return 1;
        } else {
            return 0;
        }
    }

    /** Area of the disk. */
    @Override
    public double normalization (double bandwidth) {
        return Math.PI * bandwidth * bandwidth;
    }

}
