package org.lrcalc.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the engine configuration from its sources, highest precedence first:
 * <ol>
 *     <li>Environment variables</li>
 *     <li>JVM system properties ({@code -Dlrcalc.engine.number-type=long})</li>
 *     <li>The configuration file ({@code lrcalc.conf} in the working directory, or the given file or classpath resource)</li>
 *     <li>Defaults from {@code reference.conf} on the classpath</li>
 * </ol>
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /** Name of the configuration file looked up in the working directory. */
    public static final String CONFIG_FILE_NAME = "lrcalc.conf";

    private ConfigLoader() {
    }

    /**
     * Loads the configuration using {@code lrcalc.conf} from the working directory, if it exists.
     * @return The resolved configuration.
     */
    public static Config load() {
        final File configFile = new File(CONFIG_FILE_NAME);
        final Config fileConfig;
        if (configFile.isFile()) {
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            LOG.debug("Configuration file '{}' not found. Using defaults.", configFile.getPath());
            fileConfig = ConfigFactory.empty();
        }
        return merge(fileConfig);
    }

    /**
     * Loads the configuration using the given file, or the classpath resource of that name
     * if no such file exists.
     *
     * @param location A file path or a classpath resource name.
     * @return The resolved configuration.
     */
    public static Config load(final String location) {
        final File configFile = new File(location);
        Config fileConfig;
        if (configFile.isFile()) {
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            fileConfig = ConfigFactory.parseResources(location);
        }
        if (fileConfig.isEmpty()) {
            LOG.warn("Configuration file '{}' not found or is empty. Using defaults.", location);
        }
        return merge(fileConfig);
    }

    private static Config merge(final Config fileConfig) {
        // The config given first wins.
        return ConfigFactory.systemEnvironment()
                .withFallback(ConfigFactory.systemProperties())
                .withFallback(fileConfig)
                .withFallback(ConfigFactory.parseResources("reference.conf"))
                .resolve();
    }
}
