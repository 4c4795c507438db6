package com.conveyal.heatmap.binning;

import com.conveyal.heatmap.HeatmapException;
import com.conveyal.heatmap.density.SampleSet;
import com.conveyal.heatmap.grid.GridTransform;
import org.locationtech.jts.geom.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A simple alternative to the kernel density heatmap: each sample is counted in the single grid cell containing it,
 * and each cell's average is the mean of the values counted there. No masking, kernel or threads are involved.
 *
 * Cells are half-open intervals, closed on the west and south edges, except that the easternmost column and the
 * northernmost row also include their outer edge, so samples lying exactly on the grid's east or north boundary
 * are still counted. Samples outside the grid are ignored.
 */
public abstract class AreaBinner {

    private static final Logger LOG = LoggerFactory.getLogger(AreaBinner.class);

    /**
     * Bin the samples into a grid of square cells of the given size, snapped outward onto multiples of the bin size
     * and then padded by the given distance on every side.
     */
    public static AreaBinnedHeatmap generate (SampleSet samples, double binSize, double padding, double nodataValue) {
        if (!(binSize > 0)) {
            throw HeatmapException.configuration("Bin size must be positive, was " + binSize);
        }
        Envelope env = samples.envelope();
        double xMin = binSize * Math.floor(env.getMinX() / binSize) - padding;
        double yMin = binSize * Math.floor(env.getMinY() / binSize) - padding;
        double xMax = binSize * Math.ceil(env.getMaxX() / binSize) + padding;
        double yMax = binSize * Math.ceil(env.getMaxY() / binSize) + padding;
        double width = xMax - xMin;
        double height = yMax - yMin;
        if (width < padding * 4 || height < padding * 4) {
            throw HeatmapException.configuration("Total padding should not be larger than the original shape of the data");
        }
        // When every sample shares an x or y coordinate that is a multiple of the bin size, widen to one bin.
        int cols = Math.max(1, (int) Math.round(width / binSize));
        int rows = Math.max(1, (int) Math.round(height / binSize));
        GridTransform transform = GridTransform.fromOrigin(xMin, yMin + rows * binSize, binSize);
        LOG.debug("Area binning {} samples into {} x {} cells of {}", samples.size(), rows, cols, binSize);
        return bin(samples, transform, rows, cols, nodataValue);
    }

    /** Bin the samples into the given number of rows and columns of an existing grid. */
    public static AreaBinnedHeatmap bin (SampleSet samples, GridTransform transform, int rows, int cols,
                                         double nodataValue) {
        checkArgument(rows > 0 && cols > 0, "Binning grid must contain at least one cell.");
        int[][] counts = new int[rows][cols];
        double[][] totals = new double[rows][cols];
        int outside = 0;
        for (int i = 0; i < samples.size(); i++) {
            int col = binIndex(transform.fractionalCol(samples.x[i]), cols);
            // Rows are counted up from the south edge here so that the half-open convention matches columns.
            int binFromSouth = binIndex(rows - transform.fractionalRow(samples.y[i]), rows);
            if (col < 0 || binFromSouth < 0) {
                outside++;
                continue;
            }
            int row = rows - 1 - binFromSouth;
            counts[row][col] += 1;
            totals[row][col] += samples.values[i];
        }
        if (outside > 0) {
            LOG.debug("{} samples fell outside the binning grid.", outside);
        }
        double[][] average = new double[rows][cols];
        for (int r = 0; r < rows; r++) {
            Arrays.fill(average[r], nodataValue);
            for (int c = 0; c < cols; c++) {
                if (counts[r][c] > 0) {
                    average[r][c] = totals[r][c] / counts[r][c];
                }
            }
        }
        return new AreaBinnedHeatmap(transform, counts, average);
    }

    /**
     * The bin containing a fractional position measured in bins from the lower edge, or -1 if it is outside
     * [0, n]. The upper edge itself belongs to the last bin.
     */
    private static int binIndex (double position, int n) {
        if (!(position >= 0 && position <= n)) return -1;
        return Math.min((int) Math.floor(position), n - 1);
    }

}
