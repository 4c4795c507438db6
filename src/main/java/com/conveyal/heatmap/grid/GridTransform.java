package com.conveyal.heatmap.grid;

import com.conveyal.heatmap.common.GeometryUtils;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Polygon;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.util.Arrays;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A north-up affine mapping between integer grid (row, col) indices and world (x, y) coordinates. Row numbers
 * increase toward the south and column numbers toward the east, following raster conventions. The origin is the
 * northwest corner of the cell at row 0, column 0.
 *
 * Transforms derived from data are snapped onto a global grid anchored at the coordinate origin (0, 0), so that
 * grids produced by different calls with the same ground sample distance tile seamlessly and can be compared
 * cell by cell. Equals and hashcode are semantic.
 */
public class GridTransform implements Serializable {

    private static final Logger LOG = LoggerFactory.getLogger(GridTransform.class);

    /** The x coordinate of the west edge of column zero. */
    public final double west;

    /** The y coordinate of the north edge of row zero. */
    public final double north;

    /** Width of one cell in world units, always positive. */
    public final double cellWidth;

    /** Height of one cell in world units, always positive (rows still increase southward). */
    public final double cellHeight;

    public GridTransform (double west, double north, double cellWidth, double cellHeight) {
        checkArgument(Double.isFinite(west) && Double.isFinite(north), "Grid origin must be finite.");
        checkArgument(cellWidth > 0 && cellHeight > 0, "Grid cell sizes must be positive.");
        this.west = west;
        this.north = north;
        this.cellWidth = cellWidth;
        this.cellHeight = cellHeight;
    }

    /** A transform with square cells of the given ground sample distance. */
    public static GridTransform fromOrigin (double west, double north, double gsd) {
        return new GridTransform(west, north, gsd, gsd);
    }

    /**
     * Add a buffer to the given bounds and snap the result outward onto a grid with a step of the ground sample
     * distance, measured from the coordinate origin rather than from the data's own minimum. Left and bottom are
     * floored, right and top are ceiled, so the returned envelope always contains the buffered input.
     */
    public static Envelope padGridAlignBounds (Envelope bounds, double gsd, double buffer) {
        double left = Math.floor((bounds.getMinX() - buffer) / gsd) * gsd;
        double bottom = Math.floor((bounds.getMinY() - buffer) / gsd) * gsd;
        double right = Math.ceil((bounds.getMaxX() + buffer) / gsd) * gsd;
        double top = Math.ceil((bounds.getMaxY() + buffer) / gsd) * gsd;
        return new Envelope(left, right, bottom, top);
    }

    /**
     * Returns a transform whose origin lies northwest of the given bounds by at least the buffer distance, moved
     * further northwest as needed so that it is an integer number of gsd intervals from the coordinate origin.
     */
    public static GridTransform fromBufferWithGrid (Envelope bounds, double buffer, double gsd) {
        Envelope aligned = padGridAlignBounds(bounds, gsd, buffer);
        LOG.debug("west, north: {}, {}", aligned.getMinX(), aligned.getMaxY());
        return fromOrigin(aligned.getMinX(), aligned.getMaxY(), gsd);
    }

    /** True if both cell dimensions equal the given ground sample distance exactly. */
    public boolean hasCellSize (double gsd) {
        return cellWidth == gsd && cellHeight == gsd;
    }

    /** The x coordinate of the center of the given column. */
    public double cellCenterX (int col) {
        return west + (col + 0.5) * cellWidth;
    }

    /** The y coordinate of the center of the given row. */
    public double cellCenterY (int row) {
        return north - (row + 0.5) * cellHeight;
    }

    /** Column coordinate (possibly fractional) of the given x, measured from the west edge of column zero. */
    public double fractionalCol (double x) {
        return (x - west) / cellWidth;
    }

    /** Row coordinate (possibly fractional) of the given y, measured from the north edge of row zero. */
    public double fractionalRow (double y) {
        return (north - y) / cellHeight;
    }

    /** The column containing x. Points exactly on a cell edge belong to the cell to the east. */
    public int colForX (double x) {
        return (int) Math.floor(fractionalCol(x));
    }

    /** The row containing y. Points exactly on a cell edge belong to the cell to the south. */
    public int rowForY (double y) {
        return (int) Math.floor(fractionalRow(y));
    }

    /** A transform for the same grid whose row and column zero are at the given offsets within this one. */
    public GridTransform translate (int rowOffset, int colOffset) {
        return new GridTransform(west + colOffset * cellWidth, north - rowOffset * cellHeight, cellWidth, cellHeight);
    }

    /** The square footprint of a single cell, used when every cell touched by a shape must be evaluated. */
    public Polygon getCellGeometry (int row, int col) {
        double minX = west + col * cellWidth;
        double maxY = north - row * cellHeight;
        Coordinate[] ring = new Coordinate[] {
                new Coordinate(minX, maxY),
                new Coordinate(minX + cellWidth, maxY),
                new Coordinate(minX + cellWidth, maxY - cellHeight),
                new Coordinate(minX, maxY - cellHeight),
                new Coordinate(minX, maxY)
        };
        return GeometryUtils.geometryFactory.createPolygon(ring);
    }

    /** The six GDAL geotransform coefficients (north-up, so the rotation terms are zero and the y scale negative). */
    public double[] toGdal () {
        return new double[] { west, cellWidth, 0, north, 0, -cellHeight };
    }

    @Override
    public boolean equals (Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GridTransform other = (GridTransform) o;
        return west == other.west && north == other.north &&
                cellWidth == other.cellWidth && cellHeight == other.cellHeight;
    }

    @Override
    public int hashCode () {
        return Arrays.hashCode(new double[] { west, north, cellWidth, cellHeight });
    }

    @Override
    public String toString () {
        return String.format("GridTransform(west=%s, north=%s, cell=%sx%s)", west, north, cellWidth, cellHeight);
    }

}
