package com.conveyal.heatmap.mask;

import com.conveyal.heatmap.grid.GridWindow;
import gnu.trove.list.array.TIntArrayList;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A boolean raster over a GridWindow telling which cells are excluded from kernel evaluation. True means the cell
 * lies outside the buffered support of the sample path and is skipped; false means the cell must be scored.
 * Instances are immutable once built.
 */
public class EvaluationMask {

    public final GridWindow window;

    /** Flattened in row-major order (columns vary fastest). */
    private final boolean[] skip;

    private final int unmaskedCount;

    /** Copies the supplied row-major array, which must have the window's dimensions. */
    public EvaluationMask (GridWindow window, boolean[][] skip) {
        checkArgument(skip.length == window.rows, "Mask row count does not match window.");
        this.window = window;
        this.skip = new boolean[window.cellCount()];
        int unmasked = 0;
        for (int r = 0; r < window.rows; r++) {
            checkArgument(skip[r].length == window.cols, "Mask column count does not match window.");
            for (int c = 0; c < window.cols; c++) {
                boolean s = skip[r][c];
                this.skip[r * window.cols + c] = s;
                if (!s) unmasked++;
            }
        }
        this.unmaskedCount = unmasked;
    }

    /** Takes ownership of a flattened array built by the masker. */
    EvaluationMask (GridWindow window, boolean[] skip) {
        checkArgument(skip.length == window.cellCount(), "Mask size does not match window.");
        this.window = window;
        this.skip = skip;
        int unmasked = 0;
        for (boolean s : skip) {
            if (!s) unmasked++;
        }
        this.unmaskedCount = unmasked;
    }

    public boolean isMasked (int row, int col) {
        return skip[row * window.cols + col];
    }

    /** The number of cells that must be scored. */
    public int unmaskedCount () {
        return unmaskedCount;
    }

    /**
     * Row-major flat indexes (row * cols + col) of the cells to be scored, in ascending order. This ordering is the
     * positional contract between the list of scored coordinates and every array of per-cell scores.
     */
    public int[] unmaskedIndexes () {
        TIntArrayList indexes = new TIntArrayList(unmaskedCount);
        for (int i = 0; i < skip.length; i++) {
            if (!skip[i]) indexes.add(i);
        }
        return indexes.toArray();
    }

    /** A fresh copy of the mask as a [row][col] array. */
    public boolean[][] toArray () {
        boolean[][] result = new boolean[window.rows][window.cols];
        for (int r = 0; r < window.rows; r++) {
            System.arraycopy(skip, r * window.cols, result[r], 0, window.cols);
        }
        return result;
    }

}
