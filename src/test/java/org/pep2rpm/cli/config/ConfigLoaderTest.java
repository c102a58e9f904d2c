package org.pep2rpm.cli.config;

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
        System.clearProperty("pep2rpm.flavour");
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("loadFromFile should load configuration file with defaults when no overrides present")
    void loadFromFile_shouldLoadConfigFileWithDefaults() {
        Config config = ConfigLoader.loadFromFile(testResource("test-config.conf"));

        assertEquals("file-value", config.getString("test.value"));
        assertEquals("file-priority", config.getString("test.priority"));
        assertEquals("file-nested", config.getString("test.nested.setting"));
        assertEquals("opensuse", config.getString("pep2rpm.flavour"));
        assertTrue(config.getBoolean("pep2rpm.normalize-names"));
        // Untouched keys come from reference.conf
        assertEquals("posix", config.getString("pep2rpm.environment.os_name"));
    }

    @Test
    @DisplayName("System property should override file configuration")
    void loadFromFile_systemPropertyShouldOverrideFileConfig() {
        System.setProperty("test.value", "system-value");
        System.setProperty("pep2rpm.flavour", "fedora");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.loadFromFile(testResource("test-config.conf"));

        assertEquals("system-value", config.getString("test.value"));
        assertEquals("file-priority", config.getString("test.priority"));
        assertEquals("fedora", config.getString("pep2rpm.flavour"));
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
    @DisplayName("loadDefaults should return the reference configuration")
    void loadDefaults_shouldReturnReferenceConfig() {
        Config config = ConfigLoader.loadDefaults();

        assertEquals("base", config.getString("pep2rpm.flavour"));
        assertEquals("literal", config.getString("pep2rpm.version-rendering"));
        assertFalse(config.hasPath("test.value"));
    }

    @Test
    @DisplayName("Should resolve configuration references correctly")
    void loadFromFile_shouldResolveConfigurationReferences() {
        System.setProperty("test.priority", "system-override");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.loadFromFile(testResource("references-config.conf"));

        assertEquals("base-suffix", config.getString("test.referenced-value"));
        assertEquals("system-override", config.getString("test.priority"));
        assertEquals(">=3.9", config.getString("pep2rpm.dependencies.python-version"));
    }

    @Test
    @DisplayName("resolve should prefer the explicit file and report it")
    void resolve_shouldUseExplicitFile() {
        List<String> messages = new ArrayList<>();

        Config config = ConfigLoader.resolve(testResource("test-config.conf"),
                (level, message) -> messages.add(level + " " + message));

        assertEquals("opensuse", config.getString("pep2rpm.flavour"));
        assertEquals(1, messages.size());
        assertTrue(messages.get(0).startsWith("INFO Using configuration file specified via --config"));
    }

    @Test
    @DisplayName("resolve should fail for a missing explicit file")
    void resolve_shouldRejectMissingExplicitFile() {
        File missing = new File("does-not-exist/pep2rpm.conf");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ConfigLoader.resolve(missing, (level, message) -> { }));

        assertTrue(e.getMessage().startsWith("Configuration file not found"));
    }

    @Test
    @DisplayName("resolve should fall back to classpath defaults")
    void resolve_shouldFallBackToDefaults() {
        List<String> messages = new ArrayList<>();

        Config config = ConfigLoader.resolve(null, (level, message) -> messages.add(message));

        assertEquals("base", config.getString("pep2rpm.flavour"));
        assertTrue(messages.get(0).contains("using default configuration from classpath"));
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
