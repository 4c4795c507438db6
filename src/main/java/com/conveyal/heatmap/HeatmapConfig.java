package com.conveyal.heatmap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Properties;

/**
 * Loads default parameters for heatmap generation. Per-call parameters are seeded from an instance of this class
 * (see DensityHeatmapParameters.fromConfig) and may then be adjusted by the caller.
 */
public class HeatmapConfig extends ConfigBase {

    private static final Logger LOG = LoggerFactory.getLogger(HeatmapConfig.class);

    public static final String DEFAULT_RESOURCE = "heatmap.properties";

    // INSTANCE FIELDS

    private final double  gsd;
    private final double  radius;
    private final int     processes;
    private final double  nodataValue;
    private final boolean allTouched;

    // CONSTRUCTORS

    private HeatmapConfig (Properties props) {
        super(props);
        gsd = doubleProp("gsd");
        radius = doubleProp("radius");
        processes = intProp("processes");
        nodataValue = doubleProp("nodata-value");
        allTouched = boolProp("all-touched");
        if (!keysWithErrors.contains("processes") && processes < 1) {
            LOG.error("Configuration option 'processes' must be a positive integer, was {}", processes);
            keysWithErrors.add("processes");
        }
        if (!keysWithErrors.contains("processes")) {
            LOG.info("Heatmap scoring will use {} of {} available processors.",
                    processes, Runtime.getRuntime().availableProcessors());
        }
        throwIfErrors();
    }

    public double  gsd ()         { return gsd; }
    public double  radius ()      { return radius; }
    public int     processes ()   { return processes; }
    public double  nodataValue () { return nodataValue; }
    public boolean allTouched ()  { return allTouched; }

    // STATIC FACTORY METHODS
    // Use these to construct HeatmapConfig objects for readability.

    public static HeatmapConfig fromProperties (Properties properties) {
        return new HeatmapConfig(properties);
    }

    public static HeatmapConfig fromFile (String filename) {
        return new HeatmapConfig(propsFromFile(filename));
    }

    /** The defaults shipped on the classpath, still subject to environment and system property overrides. */
    public static HeatmapConfig defaults () {
        return new HeatmapConfig(propsFromResource(DEFAULT_RESOURCE));
    }

}
