package com.conveyal.heatmap;

import com.conveyal.heatmap.util.ExceptionUtils;

/**
 * The single exception type thrown out of heatmap generation. Configuration problems are detected before any
 * masking or kernel evaluation begins, so a CONFIGURATION exception never leaves partial state behind. Failures
 * inside scoring workers abort the whole call and are reported as WORKER exceptions wrapping the original cause.
 */
public class HeatmapException extends RuntimeException {

    public final Type type;

    public enum Type {
        CONFIGURATION,
        WORKER
    }

    public static HeatmapException configuration (String message) {
        return new HeatmapException(Type.CONFIGURATION, message, null);
    }

    public static HeatmapException worker (Throwable cause) {
        return new HeatmapException(Type.WORKER, "Scoring worker failed: " + ExceptionUtils.shortCauseString(cause), cause);
    }

    public HeatmapException (Type type, String message, Throwable cause) {
        super(message, cause);
        this.type = type;
    }

}
