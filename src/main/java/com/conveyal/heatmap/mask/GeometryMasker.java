package com.conveyal.heatmap.mask;

import com.conveyal.heatmap.HeatmapException;
import com.conveyal.heatmap.common.GeometryUtils;
import com.conveyal.heatmap.grid.GridTransform;
import com.conveyal.heatmap.grid.GridWindow;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.prep.PreparedGeometry;
import org.locationtech.jts.geom.prep.PreparedGeometryFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Bounds the part of a potentially huge grid that must be evaluated by the kernel density estimator. The sample
 * path is buffered by the kernel radius plus any padding, and every cell outside the buffered shape is masked out.
 * Only the window covering the buffered shape is rasterized, never the full grid.
 */
public class GeometryMasker {

    private static final Logger LOG = LoggerFactory.getLogger(GeometryMasker.class);

    /**
     * Number of segments used to approximate a quarter circle when buffering. The buffered shape only needs to
     * over-approximate which cells can receive kernel mass, so curvature fidelity does not matter.
     */
    public static final int QUADRANT_SEGMENTS = 2;

    private final GridTransform transform;

    /**
     * If true, a cell is evaluated when any part of its square touches the buffered shape. Otherwise (the default)
     * a cell is evaluated when its center is covered by the shape.
     */
    private final boolean allTouched;

    public GeometryMasker (GridTransform transform, boolean allTouched) {
        this.transform = transform;
        this.allTouched = allTouched;
    }

    public GeometryMasker (GridTransform transform) {
        this(transform, false);
    }

    /**
     * Restrict the sample path to the portion inside the sampling polygon. The result may have several parts.
     * A path that misses the polygon entirely leaves nothing to evaluate, which is reported as a configuration error.
     */
    public static Geometry clipToSampleBounds (Geometry path, Geometry sampleBounds) {
        Geometry clipped = path.intersection(sampleBounds);
        if (clipped.isEmpty()) {
            throw HeatmapException.configuration("Sample bounds do not intersect the path through the samples.");
        }
        return clipped;
    }

    /**
     * Returns a mask over the window covering the path buffered by the given distance. In the returned mask, cells
     * that overlap the buffered shape are false (to be evaluated) and all others are true (skipped).
     */
    public EvaluationMask mask (Geometry path, double buffer) {
        long start = System.currentTimeMillis();
        LOG.debug("Path bounds: {}", path.getEnvelopeInternal());
        Geometry buffered = path.buffer(buffer, QUADRANT_SEGMENTS);
        if (buffered.isEmpty()) {
            throw HeatmapException.configuration("Buffering the sample path produced an empty shape.");
        }
        LOG.debug("Buffered geometries in {} ms, bounds {}", System.currentTimeMillis() - start,
                buffered.getEnvelopeInternal());

        GridWindow window = GridWindow.fromBounds(buffered.getEnvelopeInternal(), transform);
        GridTransform windowTransform = window.transform(transform);
        LOG.debug("Mask window: {}", window);

        start = System.currentTimeMillis();
        boolean[] skip = new boolean[window.cellCount()];
        Arrays.fill(skip, true);
        // A buffer may be a single Polygon or a MultiPolygon. Both expose their parts the same way, and each part is
        // only tested against the cells under its own envelope.
        for (int p = 0; p < buffered.getNumGeometries(); p++) {
            Geometry part = buffered.getGeometryN(p);
            if (part.isEmpty()) continue;
            burnPart(part, window, windowTransform, skip);
        }
        EvaluationMask mask = new EvaluationMask(window, skip);
        LOG.debug("Rasterized mask in {} ms, {} of {} cells to be evaluated.",
                System.currentTimeMillis() - start, mask.unmaskedCount(), window.cellCount());
        return mask;
    }

    private void burnPart (Geometry part, GridWindow window, GridTransform windowTransform, boolean[] skip) {
        PreparedGeometry prepared = PreparedGeometryFactory.prepare(part);
        Envelope env = part.getEnvelopeInternal();
        int minRow = Math.max(0, windowTransform.rowForY(env.getMaxY()));
        int maxRow = Math.min(window.rows - 1, windowTransform.rowForY(env.getMinY()));
        int minCol = Math.max(0, windowTransform.colForX(env.getMinX()));
        int maxCol = Math.min(window.cols - 1, windowTransform.colForX(env.getMaxX()));
        for (int r = minRow; r <= maxRow; r++) {
            for (int c = minCol; c <= maxCol; c++) {
                int i = r * window.cols + c;
                if (!skip[i]) continue; // Already claimed by another part.
                boolean inside;
                if (allTouched) {
                    inside = prepared.intersects(windowTransform.getCellGeometry(r, c));
                } else {
                    Coordinate center = new Coordinate(windowTransform.cellCenterX(c), windowTransform.cellCenterY(r));
                    inside = prepared.covers(GeometryUtils.geometryFactory.createPoint(center));
                }
                if (inside) {
                    skip[i] = false;
                }
            }
        }
    }

}
