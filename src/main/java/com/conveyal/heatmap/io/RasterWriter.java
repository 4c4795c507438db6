package com.conveyal.heatmap.io;

import com.conveyal.heatmap.grid.GridTransform;

import java.io.BufferedOutputStream;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;

/**
 * Persists one or more equally shaped grids as the bands of a georeferenced raster. The coordinate reference
 * system is carried through as an opaque string; nothing here reprojects or validates it.
 */
public interface RasterWriter {

    /** A short name for the file format, reported in raster metadata like a GDAL driver name. */
    String driverShortName ();

    /** Write the bands, each indexed [row][col], georeferenced by the transform of their first cell. */
    void write (OutputStream outputStream, GridTransform transform, double nodataValue, double[][]... bands)
            throws IOException;

    /**
     * Write the bands to a file and describe the result.
     * @return metadata in the style of gdalinfo.
     */
    default RasterInfo write (File file, String crs, GridTransform transform, double nodataValue,
                              double[][]... bands) throws IOException {
        try (OutputStream out = new BufferedOutputStream(new FileOutputStream(file))) {
            write(out, transform, nodataValue, bands);
        }
        return RasterInfo.describe(driverShortName(), file.getPath(), crs, transform, nodataValue, bands);
    }

    /** Widen an integer grid such as a count grid so it can be written as a band. */
    static double[][] toBand (int[][] grid) {
        double[][] band = new double[grid.length][];
        for (int r = 0; r < grid.length; r++) {
            band[r] = new double[grid[r].length];
            for (int c = 0; c < grid[r].length; c++) {
                band[r][c] = grid[r][c];
            }
        }
        return band;
    }

}
