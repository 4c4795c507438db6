package com.conveyal.heatmap.binning;

import com.conveyal.heatmap.HeatmapException;
import com.conveyal.heatmap.density.SampleSet;
import com.conveyal.heatmap.grid.GridTransform;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class AreaBinnerTest {

    /** One sample at the center of each cell of a 3x3 block, valued 10 * row from south + column. */
    private static SampleSet block () {
        double[] x = new double[9];
        double[] y = new double[9];
        double[] v = new double[9];
        for (int r = 0; r < 3; r++) {
            for (int c = 0; c < 3; c++) {
                x[r * 3 + c] = c + 0.5;
                y[r * 3 + c] = r + 0.5;
                v[r * 3 + c] = 10 * r + c;
            }
        }
        return new SampleSet(x, y, v);
    }

    @Test
    public void oneSamplePerCell () {
        AreaBinnedHeatmap heatmap = AreaBinner.generate(block(), 1, 0, 0);
        assertEquals(GridTransform.fromOrigin(0, 3, 1), heatmap.transform);
        assertEquals(3, heatmap.rows());
        assertEquals(3, heatmap.cols());
        for (int[] row : heatmap.counts) {
            assertArrayEquals(new int[] { 1, 1, 1 }, row);
        }
        // Row zero is the north edge.
        assertArrayEquals(new double[] { 20, 21, 22 }, heatmap.average[0], 0);
        assertArrayEquals(new double[] { 0, 1, 2 }, heatmap.average[2], 0);
    }

    @Test
    public void paddingAddsEmptyCells () {
        AreaBinnedHeatmap heatmap = AreaBinner.generate(block(), 1, 1, -1);
        assertEquals(GridTransform.fromOrigin(-1, 4, 1), heatmap.transform);
        assertEquals(5, heatmap.rows());
        assertEquals(5, heatmap.cols());
        assertEquals(0, heatmap.counts[0][0]);
        assertEquals(-1, heatmap.average[0][0], 0);
        assertEquals(1, heatmap.counts[1][1]);
        assertEquals(20, heatmap.average[1][1], 0);

        HeatmapException e = assertThrows(HeatmapException.class, () -> AreaBinner.generate(block(), 1, 2, 0));
        assertEquals(HeatmapException.Type.CONFIGURATION, e.type);
    }

    @Test
    public void samplesInSameCellAveraged () {
        SampleSet samples = new SampleSet(
                new double[] { 0.2, 0.7, 1.5, 3.9 },
                new double[] { 0.2, 0.9, 0.5, 0.1 },
                new double[] { 1, 3, 8, 4 });
        AreaBinnedHeatmap heatmap = AreaBinner.generate(samples, 2, 0, 0);
        assertEquals(1, heatmap.rows());
        assertEquals(2, heatmap.cols());
        assertArrayEquals(new int[] { 3, 1 }, heatmap.counts[0]);
        assertEquals(4, heatmap.average[0][0], 1e-12);
        assertEquals(4, heatmap.average[0][1], 0);
    }

    /** Cells include their west and south edges, and the grid's east and north edges belong to the last cells. */
    @Test
    public void edgeSemantics () {
        GridTransform transform = GridTransform.fromOrigin(0, 2, 1);
        SampleSet samples = new SampleSet(
                new double[] { 1, 2, 0, 2.5, -0.1 },
                new double[] { 1, 2, 0, 1, 1 },
                new double[] { 1, 2, 3, 4, 5 });
        AreaBinnedHeatmap heatmap = AreaBinner.bin(samples, transform, 2, 2, 0);
        // (1, 1) lies on interior edges and goes to the cell northeast of it.
        assertEquals(2, heatmap.counts[0][1]);
        // (2, 2) is the northeast corner of the grid, which belongs to the same cell.
        assertEquals(1.5, heatmap.average[0][1], 0);
        // (0, 0) is the southwest corner.
        assertEquals(1, heatmap.counts[1][0]);
        assertEquals(0, heatmap.counts[0][0]);
        assertEquals(0, heatmap.counts[1][1]);
    }

    @Test
    public void zeroWidthWidenedToOneBin () {
        SampleSet samples = new SampleSet(new double[] { 2, 2 }, new double[] { 0.5, 1.5 }, new double[] { 1, 2 });
        AreaBinnedHeatmap heatmap = AreaBinner.generate(samples, 1, 0, 0);
        assertEquals(1, heatmap.cols());
        assertEquals(2, heatmap.rows());
        assertEquals(GridTransform.fromOrigin(2, 2, 1), heatmap.transform);
        assertArrayEquals(new double[] { 2 }, heatmap.average[0], 0);
        assertArrayEquals(new double[] { 1 }, heatmap.average[1], 0);
    }

}
