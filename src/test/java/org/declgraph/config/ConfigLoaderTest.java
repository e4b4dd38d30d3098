package org.declgraph.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.File;
import java.net.URISyntaxException;
import java.net.URL;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link ConfigLoader} to verify the configuration priority hierarchy:
 * <ol>
 *   <li>System Properties (highest priority)</li>
 *   <li>Environment Variables</li>
 *   <li>Configuration File</li>
 *   <li>Default reference configuration (lowest priority)</li>
 * </ol>
 */
@Tag("unit")
class ConfigLoaderTest {

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("test.value");
        System.clearProperty("test.priority");
        System.clearProperty("test.nested.setting");
        System.clearProperty("declgraph.analysis.report-forgotten-exports");
        System.clearProperty("config.file");
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("loadFromFile should load configuration file with defaults when no overrides present")
    void loadFromFile_shouldLoadConfigFileWithDefaults() {
        Config config = ConfigLoader.loadFromFile(testResource("test-config.conf"));

        assertEquals("file-value", config.getString("test.value"));
        assertEquals("file-priority", config.getString("test.priority"));
        assertEquals("file-nested", config.getString("test.nested.setting"));
        assertEquals("api-metadata.json", config.getString("declgraph.package-metadata.file-name"));
        // Not overridden by the file
        assertEquals("tsdocMetadata", config.getString("declgraph.package-metadata.package-json-field"));
    }

    @Test
    @DisplayName("System property should override file configuration")
    void loadFromFile_systemPropertyShouldOverrideFileConfig() {
        System.setProperty("test.value", "system-value");
        System.setProperty("declgraph.analysis.report-forgotten-exports", "true");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.loadFromFile(testResource("test-config.conf"));

        assertEquals("system-value", config.getString("test.value"));
        assertEquals("file-priority", config.getString("test.priority"));
        assertTrue(config.getBoolean("declgraph.analysis.report-forgotten-exports"));
    }

    @Test
    @DisplayName("System property should override nested configuration values")
    void loadFromFile_systemPropertyShouldOverrideNestedConfig() {
        System.setProperty("test.nested.setting", "system-nested");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.loadFromFile(testResource("test-config.conf"));

        assertEquals("system-nested", config.getString("test.nested.setting"));
        assertEquals("file-value", config.getString("test.value"));
    }

    @Test
    @DisplayName("loadDefaults should expose the reference configuration")
    void loadDefaults_shouldExposeReferenceConfiguration() {
        Config config = ConfigLoader.loadDefaults();

        assertEquals("tsdoc-metadata.json", config.getString("declgraph.package-metadata.file-name"));
        assertTrue(config.getBoolean("declgraph.analysis.report-forgotten-exports"));
    }

    @Test
    @DisplayName("Should resolve configuration references correctly")
    void loadFromFile_shouldResolveConfigurationReferences() {
        System.setProperty("test.priority", "system-override");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.loadFromFile(testResource("references-config.conf"));

        assertEquals("base-suffix", config.getString("test.referenced-value"));
        assertEquals("baseMetadata", config.getString("declgraph.package-metadata.package-json-field"));
        assertEquals("system-override", config.getString("test.priority"));
    }

    @Test
    @DisplayName("resolve should prefer the explicit file and report it")
    void resolve_shouldUseExplicitFile() {
        List<String> messages = new ArrayList<>();
        File file = testResource("test-config.conf");

        Config config = ConfigLoader.resolve(file, (level, message) -> messages.add(level + " " + message));

        assertEquals("file-value", config.getString("test.value"));
        assertEquals(1, messages.size());
        assertTrue(messages.get(0).startsWith("INFO Reading analyzer settings from "));
    }

    @Test
    @DisplayName("resolve should reject a missing explicit file")
    void resolve_shouldRejectMissingExplicitFile() {
        File missing = new File("does-not-exist/declgraph.conf");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ConfigLoader.resolve(missing, (level, message) -> { }));
        assertTrue(e.getMessage().contains("Analyzer settings file does not exist"));
    }

    @Test
    @DisplayName("resolve should honor -Dconfig.file")
    void resolve_shouldUseConfigFileSystemProperty() {
        System.setProperty("config.file", testResource("test-config.conf").getAbsolutePath());
        ConfigFactory.invalidateCaches();
        List<ConfigLoader.MessageLevel> levels = new ArrayList<>();

        Config config = ConfigLoader.resolve(null, (level, message) -> levels.add(level));

        assertEquals("file-nested", config.getString("test.nested.setting"));
        assertEquals(List.of(ConfigLoader.MessageLevel.INFO), levels);
    }

    @Test
    @DisplayName("resolve should reject a missing file named by -Dconfig.file")
    void resolve_shouldRejectMissingConfigFileSystemProperty() {
        System.setProperty("config.file", "does-not-exist/declgraph.conf");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ConfigLoader.resolve(null, (level, message) -> { }));
        assertTrue(e.getMessage().startsWith("Analyzer settings file named by -Dconfig.file does not exist: "));
    }

    /**
     * Locates a test resource file on the classpath.
     *
     * @param name the resource file name (relative to this test class's package).
     * @return the {@link File} pointing to the test resource.
     */
    private File testResource(final String name) {
        final URL url = getClass().getResource(name);
        assertNotNull(url, "Test resource not found: " + name);
        try {
            return new File(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid test resource URI: " + url, e);
        }
    }
}
