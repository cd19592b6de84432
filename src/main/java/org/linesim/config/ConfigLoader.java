package org.linesim.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the configuration from several sources. Earlier sources win:
 * <ol>
 *     <li>environment variables</li>
 *     <li>Java system properties ({@code -Dkey=value})</li>
 *     <li>{@code linesim.conf} in the working directory, or a named classpath resource</li>
 *     <li>{@code reference.conf} on the classpath</li>
 * </ol>
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    private static final String CONFIG_FILE_NAME = "linesim.conf";

    private ConfigLoader() {
        // static helpers only
    }

    /**
     * Loads the configuration with {@code linesim.conf} from the working directory as file source.
     *
     * @return the resolved configuration
     */
    public static Config load() {
        final File configFile = new File(CONFIG_FILE_NAME);
        final Config fileConfig;
        if (configFile.isFile()) {
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            LOG.info("Configuration file '{}' not found or is a directory. Using defaults.", configFile.getPath());
            fileConfig = ConfigFactory.empty();
        }
        return merge(fileConfig);
    }

    /**
     * Loads the configuration with a classpath resource as file source.
     *
     * @param resource classpath resource name, e.g. {@code org/linesim/config/test-config.conf}
     * @return the resolved configuration
     */
    public static Config load(final String resource) {
        final Config resourceConfig = ConfigFactory.parseResources(resource);
        if (resourceConfig.isEmpty()) {
            LOG.warn("Configuration file '{}' not found or is empty. Using defaults.", resource);
        }
        return merge(resourceConfig);
    }

    private static Config merge(final Config fileConfig) {
        final Config envConfig = ConfigFactory.systemEnvironment();
        final Config sysConfig = ConfigFactory.systemProperties();
        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        // The one provided first wins.
        return envConfig
            .withFallback(sysConfig)
            .withFallback(fileConfig)
            .withFallback(defaultConfig)
            .resolve();
    }
}
