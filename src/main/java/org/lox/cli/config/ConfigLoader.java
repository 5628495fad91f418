package org.lox.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileNotFoundException;

/**
 * Responsible for loading the application configuration from various sources.
 * The loader respects a specific precedence order to allow for flexible configuration:
 * <ol>
 *   <li>Java system properties (e.g. {@code -Dlox.cli.prompt=">>> "})</li>
 *   <li>Environment variables</li>
 *   <li>A configuration file: the one given explicitly, else {@code -Dconfig.file},
 *       else {@code lox.conf} in the working directory</li>
 *   <li>Default values from {@code reference.conf} on the classpath</li>
 * </ol>
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    static final String CONFIG_FILE_NAME = "lox.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration.
     *
     * @param explicitFile A file chosen by the user, or {@code null}.
     * @return A resolved {@link Config} object containing the merged configuration.
     * @throws FileNotFoundException if an explicitly requested file does not exist.
     * @throws com.typesafe.config.ConfigException if a file cannot be parsed or resolved.
     */
    public static Config load(final File explicitFile) throws FileNotFoundException {
        final Config fileConfig = loadFileConfig(explicitFile);

        // The one provided first wins.
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(fileConfig)
                .withFallback(ConfigFactory.defaultReference())
                .resolve();
    }

    private static Config loadFileConfig(final File explicitFile) throws FileNotFoundException {
        if (explicitFile != null) {
            return parseRequired(explicitFile, "--config");
        }

        final String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            return parseRequired(new File(systemConfigPath).getAbsoluteFile(), "-Dconfig.file");
        }

        final File cwdConfigFile = new File(CONFIG_FILE_NAME);
        if (cwdConfigFile.isFile()) {
            LOG.info("Using configuration file found in current directory: {}", cwdConfigFile.getAbsolutePath());
            return ConfigFactory.parseFile(cwdConfigFile);
        }

        LOG.debug("No '{}' found in current directory. Using default configuration from classpath.", CONFIG_FILE_NAME);
        return ConfigFactory.empty();
    }

    private static Config parseRequired(final File file, final String origin) throws FileNotFoundException {
        if (!file.isFile()) {
            throw new FileNotFoundException("Configuration file specified via " + origin + " was not found: " + file.getAbsolutePath());
        }
        LOG.info("Using configuration file specified via {}: {}", origin, file.getAbsolutePath());
        return ConfigFactory.parseFile(file);
    }
}
