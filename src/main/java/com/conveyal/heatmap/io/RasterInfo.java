package com.conveyal.heatmap.io;

import com.conveyal.heatmap.grid.GridTransform;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.util.ArrayList;
import java.util.List;

/**
 * Metadata about a written raster, laid out like the JSON produced by gdalinfo so that it can be stored alongside
 * the raster or handed to the same tools. Fields are public for serialization with Jackson.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RasterInfo {

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    /** Rows, then columns. */
    public int[] size;

    public CoordinateSystem coordinateSystem;

    public double[] geoTransform;

    public Resolution resolution;

    public String driverShortName;

    public List<String> files = new ArrayList<>();

    public CornerCoordinates cornerCoordinates;

    public List<Band> bands = new ArrayList<>();

    public static class CoordinateSystem {
        public String wkt;
    }

    public static class Resolution {
        public double xResolution;
        public double yResolution;
    }

    public static class CornerCoordinates {
        public double[] upperLeft;
        public double[] lowerLeft;
        public double[] upperRight;
        public double[] lowerRight;
        public double[] center;
    }

    public static class Band {
        public int band;
        public String type = "Float32";
        public String description = "";
        public double noDataValue;
        public String colorInterpretation = "Gray";
    }

    /**
     * Describe bands that were written with the given transform. The crs may be null, in which case no coordinate
     * system is reported.
     */
    public static RasterInfo describe (String driverShortName, String file, String crs, GridTransform transform,
                                       double nodataValue, double[][]... bands) {
        RasterInfo info = new RasterInfo();
        int rows = bands.length == 0 ? 0 : bands[0].length;
        int cols = rows == 0 ? 0 : bands[0][0].length;
        info.size = new int[] { rows, cols };
        if (crs != null) {
            info.coordinateSystem = new CoordinateSystem();
            info.coordinateSystem.wkt = crs;
        }
        info.geoTransform = transform.toGdal();
        info.resolution = new Resolution();
        info.resolution.xResolution = info.geoTransform[1];
        info.resolution.yResolution = info.geoTransform[5];
        info.driverShortName = driverShortName;
        if (file != null) info.files.add(file);

        double east = transform.west + cols * transform.cellWidth;
        double south = transform.north - rows * transform.cellHeight;
        info.cornerCoordinates = new CornerCoordinates();
        info.cornerCoordinates.upperLeft = new double[] { transform.west, transform.north };
        info.cornerCoordinates.lowerLeft = new double[] { transform.west, south };
        info.cornerCoordinates.upperRight = new double[] { east, transform.north };
        info.cornerCoordinates.lowerRight = new double[] { east, south };
        info.cornerCoordinates.center = new double[] { (transform.west + east) / 2, (transform.north + south) / 2 };

        for (int b = 0; b < bands.length; b++) {
            Band band = new Band();
            band.band = b + 1;
            band.noDataValue = nodataValue;
            info.bands.add(band);
        }
        return info;
    }

    public String toJson () {
        try {
            return objectMapper.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Error serializing raster info.", e);
        }
    }

}
