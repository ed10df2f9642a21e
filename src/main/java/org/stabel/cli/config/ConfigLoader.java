package org.stabel.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigOriginFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Responsible for loading the application configuration from various sources.
 * The loader respects a specific precedence order to allow for flexible configuration.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /** Name of the configuration file looked up in the working directory. */
    public static final String CONFIG_FILE_NAME = "stabel.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the application configuration, respecting the precedence order:
     * 1. Java System Properties (e.g., -Dstabel.transpiler.stack-capacity=1024)
     * 2. Environment Variables
     * 3. Configuration File (the explicit file, or stabel.conf in the working directory)
     * 4. Default values (from reference.conf on the classpath)
     *
     * @param explicitFile A file given on the command line, or {@code null} to look for
     *                     {@value #CONFIG_FILE_NAME} in the working directory.
     * @return A resolved {@link Config} object containing the merged configuration.
     * @throws ConfigException.IO if an explicitly given file does not exist.
     */
    public static Config load(final File explicitFile) {
        return load(explicitFile, new File(CONFIG_FILE_NAME));
    }

    /**
     * Loads the configuration with a custom fallback file location.
     *
     * @param explicitFile A file given on the command line, or {@code null}.
     * @param defaultFile The file used when no explicit file is given; skipped if it does not exist.
     * @return A resolved {@link Config} object containing the merged configuration.
     * @throws ConfigException.IO if an explicitly given file does not exist.
     */
    public static Config load(final File explicitFile, final File defaultFile) {
        final Config fileConfig;
        if (explicitFile != null) {
            if (!explicitFile.isFile()) {
                throw new ConfigException.IO(ConfigOriginFactory.newFile(explicitFile.getPath()),
                        "Configuration file not found: " + explicitFile.getAbsolutePath());
            }
            LOG.info("Using configuration file specified via --config: {}", explicitFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(explicitFile);
        } else if (defaultFile != null && defaultFile.isFile()) {
            LOG.info("Using configuration file found in current directory: {}", defaultFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(defaultFile);
        } else {
            LOG.debug("No '{}' found. Using default configuration from classpath.", CONFIG_FILE_NAME);
            fileConfig = ConfigFactory.empty();
        }

        // The one provided first wins.
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(fileConfig)
                .withFallback(ConfigFactory.parseResources("reference.conf"))
                .resolve();
    }
}
