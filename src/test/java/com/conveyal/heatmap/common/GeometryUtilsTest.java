package com.conveyal.heatmap.common;

import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.Point;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class GeometryUtilsTest {

    @Test
    public void pathFollowsSampleOrder () {
        Geometry path = GeometryUtils.pathGeometry(new double[] { 0, 2, 2 }, new double[] { 0, 0, 3 });
        assertTrue(path instanceof LineString);
        assertEquals(3, path.getNumPoints());
        assertEquals(5, path.getLength(), 0);
    }

    @Test
    public void coincidentLocationsGiveAPoint () {
        assertTrue(GeometryUtils.pathGeometry(new double[] { 4 }, new double[] { 5 }) instanceof Point);
        Geometry path = GeometryUtils.pathGeometry(new double[] { 4, 4, 4 }, new double[] { 5, 5, 5 });
        assertTrue(path instanceof Point);
        assertEquals(4, ((Point) path).getX(), 0);
        assertThrows(IllegalArgumentException.class,
                () -> GeometryUtils.pathGeometry(new double[0], new double[0]));
    }

    @Test
    public void envelopeOfCoordinates () {
        Envelope envelope = GeometryUtils.envelope(new double[] { 3, -1, 2 }, new double[] { 0, 7, -2 });
        assertEquals(new Envelope(-1, 3, -2, 7), envelope);
    }

}
