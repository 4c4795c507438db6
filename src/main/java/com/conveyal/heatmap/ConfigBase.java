package com.conveyal.heatmap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileReader;
import java.io.InputStream;
import java.io.Reader;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.TreeSet;

/**
 * Shared functionality for classes that load properties containing configuration information.
 *
 * Some validation may be performed here, but any interpretation or conditional logic belongs in the classes that
 * consume the configuration. All configuration parameters are required to avoid any confusion due to merging
 * layers of defaults. The default values live in a properties file shipped on the classpath.
 */
public class ConfigBase {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigBase.class);

    public static final String HEATMAP_PROPERTY_PREFIX = "heatmap-";

    // All access to these should be through the *Prop methods.
    private final Properties properties;

    protected final Set<String> keysWithErrors = new TreeSet<>();

    /**
     * Prepare to load config from the given properties, overriding from environment variables and system properties.
     * In the latter two sources, the keys may be in upper or lower case and use dashes, underscores, or dots as
     * separators. The usual config file keys must be prefixed with "heatmap", e.g. HEATMAP_PROCESSES=5 or
     * java -Dheatmap.processes=5. Precedence is: system properties > environment variables > config file.
     */
    protected ConfigBase (Properties properties) {
        this.properties = new Properties();
        this.properties.putAll(properties);
        setPropertiesFromMap(System.getenv(), "environment variable");
        setPropertiesFromMap(System.getProperties(), "system properties");
    }

    /** Static convenience method to uniformly load files into properties and catch errors. */
    protected static Properties propsFromFile (String filename) {
        try (Reader propsReader = new FileReader(filename)) {
            Properties properties = new Properties();
            properties.load(propsReader);
            return properties;
        } catch (Exception e) {
            throw new HeatmapException(HeatmapException.Type.CONFIGURATION,
                    "Could not load configuration properties from " + filename, e);
        }
    }

    /** Load properties from a resource on the classpath, such as the defaults shipped in the jar. */
    protected static Properties propsFromResource (String resourceName) {
        try (InputStream stream = ConfigBase.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (stream == null) {
                throw HeatmapException.configuration("Configuration resource not found: " + resourceName);
            }
            Properties properties = new Properties();
            properties.load(stream);
            return properties;
        } catch (HeatmapException e) {
            throw e;
        } catch (Exception e) {
            throw new HeatmapException(HeatmapException.Type.CONFIGURATION,
                    "Could not load configuration resource " + resourceName, e);
        }
    }

    // Always use the following *Prop methods to read properties. This will catch and log missing keys or parse
    // exceptions, allowing config loading to continue and reporting as many problems as possible at once.

    // Catches and records missing values,
    // so methods that wrap this and parse into non-String types can just ignore null values.
    protected String strProp (String key) {
        String value = properties.getProperty(key);
        if (value == null) {
            LOG.error("Missing configuration option {}", key);
            keysWithErrors.add(key);
        }
        return value == null ? null : value.trim();
    }

    protected int intProp (String key) {
        String val = strProp(key);
        if (val != null) {
            try {
                return Integer.parseInt(val);
            } catch (NumberFormatException nfe) {
                LOG.error("Value of configuration option '{}' could not be parsed as an integer: {}", key, val);
                keysWithErrors.add(key);
            }
        }
        return 0;
    }

    protected double doubleProp (String key) {
        String val = strProp(key);
        if (val != null) {
            try {
                return Double.parseDouble(val);
            } catch (NumberFormatException nfe) {
                LOG.error("Value of configuration option '{}' could not be parsed as a number: {}", key, val);
                keysWithErrors.add(key);
            }
        }
        return 0;
    }

    protected boolean boolProp (String key) {
        String val = strProp(key);
        if (val != null) {
            // Boolean.parseBoolean will return false for any string other than "true".
            // We want to be more strict.
            if ("true".equalsIgnoreCase(val) || "yes".equalsIgnoreCase(val)) {
                return true;
            } else if ("false".equalsIgnoreCase(val) || "no".equalsIgnoreCase(val)) {
                return false;
            } else {
                LOG.error("Value of configuration option '{}' could not be parsed as a boolean: {}", key, val);
                keysWithErrors.add(key);
            }
        }
        return false;
    }

    /** Call this after reading all properties to enforce the presence of all configuration options. */
    protected void throwIfErrors () {
        if (!keysWithErrors.isEmpty()) {
            throw HeatmapException.configuration(
                    "You must provide valid values for these configuration properties: " +
                    String.join(", ", keysWithErrors)
            );
        }
    }

    /**
     * Overwrite configuration options supplied in the config file with environment variables and system properties
     * (e.g. supplied on the JVM command line). Case and separators are normalized to conform to both properties and
     * environment variable conventions. Properties are Object-Object Maps so key and value are cast to String.
     */
    private void setPropertiesFromMap (Map<?, ?> map, String sourceDescription) {
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            // Normalize to String type, all lower case, all dash separators.
            String key = ((String) entry.getKey()).toLowerCase().replaceAll("[\\._-]", "-");
            String value = ((String) entry.getValue());
            if (key.startsWith(HEATMAP_PROPERTY_PREFIX)) {
                // Strip off the prefix to get the key that would be used in our config file.
                key = key.substring(HEATMAP_PROPERTY_PREFIX.length());
                String existingKey = properties.getProperty(key);
                if (existingKey != null) {
                    LOG.info("Overwriting existing config key {} to '{}' from {}.", key, value, sourceDescription);
                } else {
                    LOG.info("Setting configuration key {} to '{}' from {}.", key, value, sourceDescription);
                }
                properties.setProperty(key, value);
            }
        }
    }

}
