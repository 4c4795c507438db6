package com.conveyal.heatmap.grid;

import org.locationtech.jts.geom.Envelope;

import java.io.Serializable;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A rectangular block of cells within the unbounded grid defined by a GridTransform. The offsets locate row and
 * column zero of the window within the transform's grid, so any array shaped like this window can be placed back
 * into a larger array sharing the same transform. Offsets may be negative when a transform was supplied whose
 * origin lies inside or beyond the data. Equals and hashcode are semantic.
 */
public class GridWindow implements Serializable {

    /**
     * Tolerance in cells when rounding fractional window edges, so that edges meant to fall exactly on cell
     * boundaries do not pick up an extra row or column through floating point error.
     */
    private static final double CELL_EPSILON = 1e-9;

    public final int rowOffset;

    public final int colOffset;

    public final int rows;

    public final int cols;

    public GridWindow (int rowOffset, int colOffset, int rows, int cols) {
        checkArgument(rows > 0 && cols > 0, "Grid windows must contain at least one cell.");
        this.rowOffset = rowOffset;
        this.colOffset = colOffset;
        this.rows = rows;
        this.cols = cols;
    }

    /**
     * The window whose corner is the cell containing the northwest corner of the given world envelope. Offsets are
     * rounded down and lengths rounded up to whole cells separately, so the dimensions of the window depend only on
     * the size of the envelope, not on where it falls within a cell. When the envelope starts partway into a cell
     * its east or south edge may therefore extend up to one cell beyond the window.
     */
    public static GridWindow fromBounds (Envelope bounds, GridTransform transform) {
        double colOff = transform.fractionalCol(bounds.getMinX());
        double rowOff = transform.fractionalRow(bounds.getMaxY());
        double width = bounds.getWidth() / transform.cellWidth;
        double height = bounds.getHeight() / transform.cellHeight;
        int cols = Math.max(1, (int) Math.ceil(width - CELL_EPSILON));
        int rows = Math.max(1, (int) Math.ceil(height - CELL_EPSILON));
        return new GridWindow(
                (int) Math.floor(rowOff + CELL_EPSILON),
                (int) Math.floor(colOff + CELL_EPSILON),
                rows,
                cols
        );
    }

    /** The transform of this window alone, with its own row and column zero at the window's corner. */
    public GridTransform transform (GridTransform parent) {
        return parent.translate(rowOffset, colOffset);
    }

    public int cellCount () {
        return rows * cols;
    }

    @Override
    public boolean equals (Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GridWindow other = (GridWindow) o;
        return rowOffset == other.rowOffset && colOffset == other.colOffset && rows == other.rows && cols == other.cols;
    }

    @Override
    public int hashCode () {
        return ((rowOffset * 31 + colOffset) * 31 + rows) * 31 + cols;
    }

    @Override
    public String toString () {
        return String.format("GridWindow(rowOffset=%d, colOffset=%d, rows=%d, cols=%d)", rowOffset, colOffset, rows, cols);
    }

}
