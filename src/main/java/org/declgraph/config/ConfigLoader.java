package org.declgraph.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.io.File;

/**
 * Finds the HOCON file holding the analyzer settings and layers it over the defaults in
 * {@code reference.conf}. System properties override environment variables, which override
 * the settings file.
 * <p>
 * The reference configuration is merged unresolved, so substitutions in its defaults see the
 * values of the settings file.
 */
public final class ConfigLoader {

    private static final String SETTINGS_DIR = "config";
    private static final String SETTINGS_FILE_NAME = "declgraph.conf";

    private ConfigLoader() {
    }

    /**
     * Severity of a message reported while choosing the settings file.
     */
    public enum MessageLevel {
        INFO,
        /** The analyzer falls back to its built-in defaults. */
        WARN
    }

    /**
     * Receives a message telling which settings source was chosen.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {

        void log(MessageLevel level, String message);
    }

    /**
     * Loads the analyzer settings from the first source that applies: the given file, the file
     * named by {@code -Dconfig.file}, {@code config/declgraph.conf} under the working directory,
     * or nothing beyond {@code reference.conf}.
     *
     * @param explicitConfigFile settings file chosen by the caller, or {@code null} to search for one.
     * @param handler            told which source was chosen.
     * @return the resolved settings.
     * @throws IllegalArgumentException            if the given file or the one named by
     *                                             {@code -Dconfig.file} does not exist.
     * @throws com.typesafe.config.ConfigException if the settings cannot be parsed or resolved.
     */
    public static Config resolve(final File explicitConfigFile, final ConfigMessageHandler handler) {
        if (explicitConfigFile != null) {
            requireExisting(explicitConfigFile, "Analyzer settings file does not exist: ");
            handler.log(MessageLevel.INFO, "Reading analyzer settings from " + explicitConfigFile.getAbsolutePath());
            return loadFromFile(explicitConfigFile);
        }

        final String propertyPath = System.getProperty("config.file");
        if (propertyPath != null && !propertyPath.isBlank()) {
            final File propertyFile = new File(propertyPath).getAbsoluteFile();
            requireExisting(propertyFile, "Analyzer settings file named by -Dconfig.file does not exist: ");
            handler.log(MessageLevel.INFO,
                    "Reading analyzer settings named by -Dconfig.file from " + propertyFile.getAbsolutePath());
            return loadFromFile(propertyFile);
        }

        final File workingDirFile = new File(SETTINGS_DIR, SETTINGS_FILE_NAME);
        if (workingDirFile.exists()) {
            handler.log(MessageLevel.INFO, "Reading analyzer settings from " + workingDirFile.getAbsolutePath());
            return loadFromFile(workingDirFile);
        }

        handler.log(MessageLevel.WARN, "No " + SETTINGS_DIR + "/" + SETTINGS_FILE_NAME
                + " under the working directory, analyzing with the built-in defaults");
        return loadDefaults();
    }

    private static void requireExisting(final File settingsFile, final String messagePrefix) {
        if (!settingsFile.exists()) {
            throw new IllegalArgumentException(messagePrefix + settingsFile.getAbsolutePath());
        }
    }

    /**
     * @return the settings of the given file over {@code reference.conf}, with system
     * properties and environment variables on top.
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
}
