package org.battlebots.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.net.URISyntaxException;
import java.net.URL;
import java.security.CodeSource;
import java.security.ProtectionDomain;

/**
 * Resolves the HOCON configuration for every CLI entry point.
 * <p>
 * Layers, from highest to lowest precedence:
 * <ol>
 *   <li>Java system properties ({@code -Dbattlebots.ticks-per-second=30})</li>
 *   <li>Environment variables</li>
 *   <li>One user configuration file, found by {@link #resolve(File, ConfigMessageHandler)}</li>
 *   <li>{@code reference.conf} on the classpath</li>
 * </ol>
 * Substitutions are resolved only after all layers are merged, so a user override also
 * reaches every value in {@code reference.conf} that refers to it.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    private static final String CONFIG_DIR = "config";
    private static final String CONFIG_FILE_NAME = "battlebots.conf";

    private ConfigLoader() {
    }

    public enum MessageLevel {
        INFO,
        WARN
    }

    /**
     * Receives progress messages while the configuration file is being looked up.
     * The CLI forwards them to SLF4J; logging may not be configured yet when they arrive.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {

        /**
         * @param level   the severity of the message.
         * @param message the human-readable description.
         */
        void log(MessageLevel level, String message);
    }

    /**
     * Finds the user configuration file and loads it on top of the classpath defaults.
     * The first existing candidate wins:
     * <ol>
     *   <li>the file passed with {@code --config}</li>
     *   <li>the file named by {@code -Dconfig.file}</li>
     *   <li>{@code config/battlebots.conf} in the working directory</li>
     *   <li>{@code APP_HOME/config/battlebots.conf}, where {@code APP_HOME} is the parent of
     *       the directory holding the running jar</li>
     *   <li>none, classpath defaults only</li>
     * </ol>
     *
     * @param explicitConfigFile the {@code --config} file, or {@code null}.
     * @param handler            receives progress messages.
     * @return the resolved configuration.
     * @throws IllegalArgumentException                if a file given with {@code --config} or
     *                                                 {@code -Dconfig.file} does not exist.
     * @throws com.typesafe.config.ConfigException     if a file cannot be parsed or resolved.
     */
    public static Config resolve(final File explicitConfigFile, final ConfigMessageHandler handler) {
        if (explicitConfigFile != null) {
            if (!explicitConfigFile.exists()) {
                throw new IllegalArgumentException(
                        "Configuration file not found: " + explicitConfigFile.getAbsolutePath());
            }
            handler.log(MessageLevel.INFO, "Using configuration file from --config: "
                    + explicitConfigFile.getAbsolutePath());
            return loadFromFile(explicitConfigFile);
        }

        final String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            final File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
            if (!systemConfigFile.exists()) {
                throw new IllegalArgumentException(
                        "Configuration file from -Dconfig.file not found: " + systemConfigFile.getAbsolutePath());
            }
            handler.log(MessageLevel.INFO, "Using configuration file from -Dconfig.file: "
                    + systemConfigFile.getAbsolutePath());
            return loadFromFile(systemConfigFile);
        }

        final File cwdConfigFile = new File(CONFIG_DIR, CONFIG_FILE_NAME);
        if (cwdConfigFile.exists()) {
            handler.log(MessageLevel.INFO, "Using configuration file in working directory: "
                    + cwdConfigFile.getAbsolutePath());
            return loadFromFile(cwdConfigFile);
        }

        final File installationConfigFile = detectInstallationConfigFile();
        if (installationConfigFile != null) {
            handler.log(MessageLevel.INFO, "Using configuration file from installation directory: "
                    + installationConfigFile.getAbsolutePath());
            return loadFromFile(installationConfigFile);
        }

        handler.log(MessageLevel.WARN, "No " + CONFIG_DIR + "/" + CONFIG_FILE_NAME
                + " found, using classpath defaults");
        return loadDefaults();
    }

    /**
     * Loads a configuration file merged with system properties, environment and classpath defaults.
     *
     * @param configFile the file to load.
     * @return the resolved configuration.
     */
    static Config loadFromFile(final File configFile) {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.parseFile(configFile))
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    static Config loadDefaults() {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    private static File detectInstallationConfigFile() {
        final ProtectionDomain protectionDomain = ConfigLoader.class.getProtectionDomain();
        final CodeSource codeSource = protectionDomain == null ? null : protectionDomain.getCodeSource();
        if (codeSource == null || codeSource.getLocation() == null) {
            return null;
        }

        final File jarOrClasses;
        try {
            final URL location = codeSource.getLocation();
            jarOrClasses = new File(location.toURI());
        } catch (URISyntaxException | IllegalArgumentException e) {
            LOG.debug("Cannot locate installation directory: {}", e.getMessage());
            return null;
        }

        // APP_HOME/lib/battlebots.jar; a classes directory (target/classes) has no installation
        final File libDir = jarOrClasses.isFile() ? jarOrClasses.getParentFile() : null;
        final File appHome = libDir == null ? null : libDir.getParentFile();
        if (appHome == null) {
            return null;
        }

        final File configFile = new File(new File(appHome, CONFIG_DIR), CONFIG_FILE_NAME);
        return configFile.exists() ? configFile : null;
    }
}
