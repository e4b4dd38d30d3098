package org.declgraph.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Settings of one declaration graph run, read from the {@code declgraph} configuration block.
 *
 * @param packageJsonField       The {@code package.json} field naming a package's documentation metadata file.
 * @param metadataFileName       The metadata file name looked up when that field is absent.
 * @param reportForgottenExports Whether forgotten exports are logged at WARN after a build.
 */
public record AnalyzerSettings(String packageJsonField, String metadataFileName, boolean reportForgottenExports) {

    private static final Logger LOG = LoggerFactory.getLogger(AnalyzerSettings.class);

    private static final String ROOT = "declgraph";

    /**
     * Resolves the settings through the {@link ConfigLoader} cascade, logging which source was used.
     *
     * @param explicitConfigFile config file chosen by the caller, or {@code null} for discovery.
     * @return the settings.
     * @throws IllegalArgumentException if {@code explicitConfigFile} does not exist.
     */
    public static AnalyzerSettings load(File explicitConfigFile) {
        Config config = ConfigLoader.resolve(explicitConfigFile, (level, message) -> {
            if (level == ConfigLoader.MessageLevel.WARN) {
                LOG.warn(message);
            } else {
                LOG.info(message);
            }
        });
        return fromConfig(config);
    }

    /**
     * Reads the settings from a resolved configuration. Keys missing from {@code config} fall
     * back to {@code reference.conf}.
     *
     * @param config the application configuration (containing a {@code declgraph} block).
     * @return the settings.
     * @throws com.typesafe.config.ConfigException if a value has the wrong type.
     */
    public static AnalyzerSettings fromConfig(Config config) {
        Config block = config.withFallback(ConfigFactory.defaultReference()).getConfig(ROOT);
        return new AnalyzerSettings(
                block.getString("package-metadata.package-json-field"),
                block.getString("package-metadata.file-name"),
                block.getBoolean("analysis.report-forgotten-exports"));
    }

    /**
     * @return the settings of {@code reference.conf} alone.
     */
    public static AnalyzerSettings defaults() {
        return fromConfig(ConfigFactory.defaultReference());
    }
}
