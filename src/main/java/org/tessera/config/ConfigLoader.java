package org.tessera.config;

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

    /**
     * The configuration file looked up in the working directory when none is given.
     */
    public static final String CONFIG_FILE_NAME = "tessera.conf";

    /**
     * The path of the layout section within the configuration.
     */
    public static final String LAYOUT_PATH = "tessera.layout";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration, looking for {@value #CONFIG_FILE_NAME} in the working directory.
     *
     * @return A resolved {@link Config} object containing the merged configuration.
     * @see #load(File)
     */
    public static Config load() {
        return load(null);
    }

    /**
     * Loads the application configuration, respecting the precedence order:
     * 1. Environment Variables
     * 2. System Properties (e.g., -Dtessera.layout.rowCount=8)
     * 3. Configuration File ({@code configFile}, or {@value #CONFIG_FILE_NAME} in the working directory)
     * 4. Default values (from reference.conf on the classpath)
     *
     * @param configFile An explicit configuration file, or {@code null} to use the default location.
     * @return A resolved {@link Config} object containing the merged configuration.
     * @throws IllegalArgumentException if an explicit configuration file does not exist.
     */
    public static Config load(final File configFile) {
        final Config envConfig = ConfigFactory.systemEnvironment();
        final Config cliConfig = ConfigFactory.systemProperties();

        final Config fileConfig;
        if (configFile != null) {
            if (!configFile.isFile()) {
                throw new IllegalArgumentException("Configuration file not found: " + configFile.getAbsolutePath());
            }
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            final File defaultFile = new File(CONFIG_FILE_NAME);
            if (defaultFile.isFile()) {
                LOG.info("Loading configuration from file: {}", defaultFile.getAbsolutePath());
                fileConfig = ConfigFactory.parseFile(defaultFile);
            } else {
                LOG.info("Configuration file '{}' not found. Using defaults from classpath.", defaultFile.getPath());
                fileConfig = ConfigFactory.empty();
            }
        }

        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        // The one provided first wins.
        return envConfig
            .withFallback(cliConfig)
            .withFallback(fileConfig)
            .withFallback(defaultConfig)
            .resolve();
    }

    /**
     * Extracts the layout section.
     *
     * @param config A configuration produced by {@link #load(File)}.
     * @return The {@value #LAYOUT_PATH} section.
     */
    public static Config layoutSection(final Config config) {
        return config.getConfig(LAYOUT_PATH);
    }
}
