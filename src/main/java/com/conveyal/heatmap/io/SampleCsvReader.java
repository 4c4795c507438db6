package com.conveyal.heatmap.io;

import com.conveyal.heatmap.HeatmapException;
import com.conveyal.heatmap.density.SampleSet;
import com.csvreader.CsvReader;
import gnu.trove.list.array.TDoubleArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Reads traverse observations from a CSV file with a header row. Coordinates must already be projected into linear
 * units. An empty value or the text "nan" (any case) is read as undefined, and such samples are dropped when the
 * SampleSet is built.
 */
public class SampleCsvReader {

    private static final Logger LOG = LoggerFactory.getLogger(SampleCsvReader.class);

    private final String xField;

    private final String yField;

    private final String valueField;

    public SampleCsvReader (String xField, String yField, String valueField) {
        this.xField = xField;
        this.yField = yField;
        this.valueField = valueField;
    }

    public SampleSet read (String filename) throws IOException {
        try (InputStream in = new FileInputStream(filename)) {
            return read(in);
        }
    }

    public SampleSet read (InputStream csvInputStream) throws IOException {
        CsvReader reader = new CsvReader(csvInputStream, ',', StandardCharsets.UTF_8);
        try {
            reader.readHeaders();
            int xCol = -1;
            int yCol = -1;
            int valueCol = -1;
            int nCols = reader.getHeaderCount();
            for (int c = 0; c < nCols; c++) {
                String header = reader.getHeader(c).trim();
                if (header.equalsIgnoreCase(xField)) {
                    xCol = c;
                } else if (header.equalsIgnoreCase(yField)) {
                    yCol = c;
                } else if (header.equalsIgnoreCase(valueField)) {
                    valueCol = c;
                }
            }
            if (xCol < 0 || yCol < 0 || valueCol < 0) {
                throw HeatmapException.configuration(String.format(
                        "CSV file did not contain the columns %s, %s and %s.", xField, yField, valueField));
            }
            TDoubleArrayList xs = new TDoubleArrayList();
            TDoubleArrayList ys = new TDoubleArrayList();
            TDoubleArrayList values = new TDoubleArrayList();
            while (reader.readRecord()) {
                if (reader.getColumnCount() != nCols) {
                    throw HeatmapException.configuration(String.format(
                            "CSV header has %d fields, record %d has %d fields.",
                            nCols, reader.getCurrentRecord(), reader.getColumnCount()));
                }
                xs.add(parseCoordinate(reader.get(xCol), reader.getCurrentRecord()));
                ys.add(parseCoordinate(reader.get(yCol), reader.getCurrentRecord()));
                values.add(parseValue(reader.get(valueCol), reader.getCurrentRecord()));
            }
            LOG.info("Read {} samples from CSV.", values.size());
            return new SampleSet(xs.toArray(), ys.toArray(), values.toArray());
        } finally {
            reader.close();
        }
    }

    private static double parseCoordinate (String text, long record) {
        try {
            return Double.parseDouble(text.trim());
        } catch (NumberFormatException e) {
            throw HeatmapException.configuration("Could not parse coordinate '" + text + "' in record " + record);
        }
    }

    private static double parseValue (String text, long record) {
        String trimmed = text.trim();
        if (trimmed.isEmpty() || trimmed.equalsIgnoreCase("nan")) {
            return Double.NaN;
        }
        try {
            return Double.parseDouble(trimmed);
        } catch (NumberFormatException e) {
            throw HeatmapException.configuration("Could not parse value '" + text + "' in record " + record);
        }
    }

}
