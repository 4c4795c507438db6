package com.conveyal.heatmap.output;

import com.conveyal.heatmap.grid.GridWindow;
import com.conveyal.heatmap.mask.EvaluationMask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.BitSet;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

/**
 * Turns the per-cell density fields of the evaluated cells into count and average grids covering the whole window.
 * Cells that were not evaluated keep the nodata value in the average grid and zero in the count grid.
 */
public class OutputAssembler {

    private static final Logger LOG = LoggerFactory.getLogger(OutputAssembler.class);

    /** Densities below this are treated as floating point noise and replaced with zero. */
    public static final double NOISE_FLOOR = 1e-9;

    private final EvaluationMask mask;

    private final double nodataValue;

    public OutputAssembler (EvaluationMask mask, double nodataValue) {
        this.mask = mask;
        this.nodataValue = nodataValue;
    }

    public static double applyNoiseFloor (double density) {
        return density > NOISE_FLOOR ? density : 0;
    }

    /**
     * The average value at a cell: total weighted mass divided by frequency. The ratio is computed first and any
     * non-finite result (from a zero frequency) becomes the nodata value.
     */
    public double average (double frequency, double weightedDensity, double sumOfValues) {
        double avg = (sumOfValues * weightedDensity) / frequency;
        return Double.isFinite(avg) ? avg : nodataValue;
    }

    /**
     * Frequencies are the height of a cylinder whose base is the kernel disk; the observation count is its volume,
     * rounded half to even.
     */
    public static int count (double frequency, double radius) {
        return (int) Math.rint(frequency * Math.PI * radius * radius);
    }

    /**
     * Scatter the per-cell statistics into full window grids.
     *
     * @param cellIndexes row-major indexes of the evaluated cells, in the same order as the two fields.
     * @param frequencies unweighted density times sample count, noise floor applied.
     * @param weightedDensities weighted density, noise floor applied.
     */
    public OutputGrids assemble (int[] cellIndexes, double[] frequencies, double[] weightedDensities,
                                 double sumOfValues, double radius) {
        checkArgument(cellIndexes.length == frequencies.length && cellIndexes.length == weightedDensities.length,
                "Cell indexes and scored fields must have the same length.");
        long start = System.currentTimeMillis();
        GridWindow window = mask.window;
        int[][] counts = new int[window.rows][window.cols];
        double[][] average = new double[window.rows][window.cols];
        for (double[] row : average) {
            Arrays.fill(row, nodataValue);
        }
        BitSet visited = new BitSet(window.cellCount());
        for (int i = 0; i < cellIndexes.length; i++) {
            int cell = cellIndexes[i];
            int r = cell / window.cols;
            int c = cell % window.cols;
            checkState(!mask.isMasked(r, c), "Attempted to write a masked cell.");
            checkState(!visited.get(cell), "Cell was visited more than once.");
            visited.set(cell);
            average[r][c] = average(frequencies[i], weightedDensities[i], sumOfValues);
            counts[r][c] = count(frequencies[i], radius);
        }
        LOG.info("Computed stats for {} cells in {} ms.", cellIndexes.length, System.currentTimeMillis() - start);
        return new OutputGrids(window, counts, average);
    }

}
