package com.conveyal.heatmap.common;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Reusable methods for building and inspecting the planar geometries used to bound heatmap evaluation.
 * All coordinates are in the same projected linear units as the samples; nothing here knows about CRSs.
 */
public abstract class GeometryUtils {

    public static final GeometryFactory geometryFactory = new GeometryFactory();

    /**
     * Build the traverse path through the given coordinates in order. A single location, or several that all
     * coincide, yields a Point rather than a LineString, since JTS does not allow one-vertex lines.
     */
    public static Geometry pathGeometry (double[] xs, double[] ys) {
        checkArgument(xs.length == ys.length, "Path coordinate arrays must be the same length.");
        checkArgument(xs.length > 0, "A path needs at least one coordinate.");
        if (allCoincident(xs, ys)) {
            return geometryFactory.createPoint(new Coordinate(xs[0], ys[0]));
        }
        Coordinate[] coordinates = new Coordinate[xs.length];
        for (int i = 0; i < xs.length; i++) {
            coordinates[i] = new Coordinate(xs[i], ys[i]);
        }
        return geometryFactory.createLineString(coordinates);
    }

    private static boolean allCoincident (double[] xs, double[] ys) {
        for (int i = 1; i < xs.length; i++) {
            if (xs[i] != xs[0] || ys[i] != ys[0]) return false;
        }
        return true;
    }

    /** The envelope of a set of parallel coordinate arrays. */
    public static Envelope envelope (double[] xs, double[] ys) {
        Envelope envelope = new Envelope();
        for (int i = 0; i < xs.length; i++) {
            envelope.expandToInclude(xs[i], ys[i]);
        }
        return envelope;
    }

}
