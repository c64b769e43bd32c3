package org.wiredsl.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the compiler configuration.
 * <p>
 * Precedence, highest first: Java system properties ({@code -Dwiredsl.layout.split-sidebar-width=300}),
 * the {@code wiredsl.conf} file in the working directory, {@code reference.conf} on the classpath.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    public static final String CONFIG_FILE_NAME = "wiredsl.conf";

    private ConfigLoader() {
    }

    /**
     * Loads the configuration using {@value #CONFIG_FILE_NAME} from the working directory.
     *
     * @return The resolved configuration.
     */
    public static Config load() {
        return load(new File(CONFIG_FILE_NAME));
    }

    /**
     * Loads the configuration with an explicit override file.
     *
     * @param configFile The HOCON file layered above the defaults. Skipped when it does not exist.
     * @return The resolved configuration.
     */
    public static Config load(final File configFile) {
        final Config propertiesConfig = ConfigFactory.systemProperties();

        final Config fileConfig;
        if (configFile.exists() && !configFile.isDirectory()) {
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            LOG.debug("Configuration file '{}' not found. Using defaults.", configFile.getPath());
            fileConfig = ConfigFactory.empty();
        }

        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        return propertiesConfig
            .withFallback(fileConfig)
            .withFallback(defaultConfig)
            .resolve();
    }
}
