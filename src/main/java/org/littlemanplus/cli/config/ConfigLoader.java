package org.littlemanplus.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Responsible for loading the application configuration from various sources.
 * The loader respects a specific precedence order to allow for flexible configuration.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /** The configuration file looked up in the working directory. */
    public static final String CONFIG_FILE_NAME = "littleman.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration using {@value #CONFIG_FILE_NAME} from the working directory.
     * @return The resolved configuration.
     */
    public static Config load() {
        return load(new File(CONFIG_FILE_NAME));
    }

    /**
     * Loads the application configuration, respecting the precedence order:
     * 1. Environment Variables
     * 2. JVM System Properties (e.g., -Dlittleman.runner.max-cycles=500)
     * 3. The given configuration file, if it exists
     * 4. Default values (from reference.conf on the classpath)
     *
     * @param configFile The configuration file.
     * @return A resolved {@link Config} object containing the merged configuration.
     */
    public static Config load(final File configFile) {
        final Config fileConfig;
        if (configFile.exists() && !configFile.isDirectory()) {
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            LOG.debug("Configuration file '{}' not found. Using defaults.", configFile.getPath());
            fileConfig = ConfigFactory.empty();
        }
        return merge(fileConfig);
    }

    /**
     * Loads the configuration with a classpath resource in place of the configuration file.
     *
     * @param resourceName The classpath resource, e.g. {@code "config/test.conf"}.
     * @return The resolved configuration.
     */
    public static Config loadFromResource(final String resourceName) {
        return merge(ConfigFactory.parseResources(resourceName));
    }

    private static Config merge(final Config fileConfig) {
        // Environment variables keep their original names as keys.
        final Config envConfig = ConfigFactory.systemEnvironment();
        final Config cliConfig = ConfigFactory.systemProperties();
        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        // The one provided first wins.
        return envConfig
                .withFallback(cliConfig)
                .withFallback(fileConfig)
                .withFallback(defaultConfig)
                .resolve();
    }
}
