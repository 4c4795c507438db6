package com.conveyal.heatmap.density;

import com.conveyal.heatmap.HeatmapException;
import com.conveyal.heatmap.common.GeometryUtils;
import gnu.trove.list.array.TDoubleArrayList;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Point observations collected along a traverse: parallel arrays of x, y and scalar value, in traverse order.
 * Observations with an undefined (NaN) value are dropped together with their coordinates on construction, so every
 * instance holds at least one valid sample and nothing downstream needs to check for NaN.
 *
 * The arrays are exposed directly for speed and must not be modified.
 */
public class SampleSet {

    private static final Logger LOG = LoggerFactory.getLogger(SampleSet.class);

    public final double[] x;

    public final double[] y;

    public final double[] values;

    public SampleSet (double[] x, double[] y, double[] values) {
        if (x.length != y.length || x.length != values.length) {
            throw HeatmapException.configuration(String.format(
                    "Input arrays must be of the same length (x: %d, y: %d, values: %d).",
                    x.length, y.length, values.length));
        }
        TDoubleArrayList keptX = new TDoubleArrayList(x.length);
        TDoubleArrayList keptY = new TDoubleArrayList(x.length);
        TDoubleArrayList keptValues = new TDoubleArrayList(x.length);
        for (int i = 0; i < x.length; i++) {
            if (Double.isNaN(values[i])) continue;
            if (!Double.isFinite(x[i]) || !Double.isFinite(y[i])) {
                throw HeatmapException.configuration("Sample coordinates must be finite, found " + x[i] + ", " + y[i]);
            }
            if (values[i] < 0) {
                throw HeatmapException.configuration("Sample values are used as density weights and must not be " +
                        "negative, found " + values[i]);
            }
            keptX.add(x[i]);
            keptY.add(y[i]);
            keptValues.add(values[i]);
        }
        if (keptValues.isEmpty()) {
            throw HeatmapException.configuration("No samples with a defined value were supplied.");
        }
        if (keptValues.size() < values.length) {
            LOG.info("Dropped {} samples with undefined values, {} remain.",
                    values.length - keptValues.size(), keptValues.size());
        }
        this.x = keptX.toArray();
        this.y = keptY.toArray();
        this.values = keptValues.toArray();
    }

    public int size () {
        return values.length;
    }

    public double sumOfValues () {
        double sum = 0;
        for (double v : values) sum += v;
        return sum;
    }

    public Envelope envelope () {
        return GeometryUtils.envelope(x, y);
    }

    /** The path traced by the samples in order, which bounds the area where kernel mass can be found. */
    public Geometry path () {
        return GeometryUtils.pathGeometry(x, y);
    }

}
