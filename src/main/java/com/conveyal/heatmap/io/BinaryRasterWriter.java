package com.conveyal.heatmap.io;

import com.conveyal.heatmap.grid.GridTransform;
import com.google.common.io.LittleEndianDataOutputStream;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Writes heatmap bands in a minimal little-endian binary raster format.
 *
 * The header is the 8 ASCII bytes "HEATGRID", then 32-bit integers for format version, rows, columns and band
 * count, then 64-bit doubles for the west and north edges, cell width, cell height and nodata value. The rest of
 * the file is each band in turn as 32-bit floats in row-major order (columns change faster than rows).
 */
public class BinaryRasterWriter implements RasterWriter {

    public static final String HEADER = "HEATGRID";

    public static final int VERSION = 0;

    @Override
    public String driverShortName () {
        return "HEATGRID";
    }

    @Override
    public void write (OutputStream outputStream, GridTransform transform, double nodataValue, double[][]... bands)
            throws IOException {
        checkArgument(bands.length > 0, "At least one band must be written.");
        int rows = bands[0].length;
        int cols = rows == 0 ? 0 : bands[0][0].length;
        for (double[][] band : bands) {
            checkArgument(band.length == rows, "All bands must have the same number of rows.");
            for (double[] row : band) {
                checkArgument(row.length == cols, "All bands must have the same number of columns.");
            }
        }
        // Java's DataOutputStream only writes big-endian; Guava gives us little-endian to match typed arrays.
        LittleEndianDataOutputStream out = new LittleEndianDataOutputStream(outputStream);
        out.write(HEADER.getBytes(StandardCharsets.US_ASCII));
        out.writeInt(VERSION);
        out.writeInt(rows);
        out.writeInt(cols);
        out.writeInt(bands.length);
        out.writeDouble(transform.west);
        out.writeDouble(transform.north);
        out.writeDouble(transform.cellWidth);
        out.writeDouble(transform.cellHeight);
        out.writeDouble(nodataValue);
        for (double[][] band : bands) {
            for (double[] row : band) {
                for (double value : row) {
                    out.writeFloat((float) value);
                }
            }
        }
        out.flush();
    }

}
