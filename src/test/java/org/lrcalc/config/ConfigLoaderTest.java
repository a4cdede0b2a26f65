package org.lrcalc.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.lrcalc.junit.extensions.logging.AllowLog;
import org.lrcalc.junit.extensions.logging.LogLevel;
import org.lrcalc.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ConfigLoader}, verifying the precedence of the configuration sources:
 * system properties over the configuration file over {@code reference.conf}.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ConfigLoaderTest {

    private static final String TEST_CONFIG = "org/lrcalc/config/test-config.conf";

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("test.value");
        System.clearProperty("lrcalc.engine.number-type");
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("Should load the configuration resource on top of the reference defaults")
    void load_shouldLoadResourceWithDefaults() {
        // Act
        Config config = ConfigLoader.load(TEST_CONFIG);

        // Assert
        assertThat(config.getString("test.value")).isEqualTo("file-value");
        assertThat(config.getString("test.nested.setting")).isEqualTo("file-nested");
        assertThat(config.getString("lrcalc.engine.number-type")).isEqualTo("long");
        assertThat(config.getString("logging.default-level")).isEqualTo("INFO");
    }

    @Test
    @DisplayName("System property should override the file configuration")
    void load_systemPropertyShouldOverrideFileConfig() {
        // Arrange
        System.setProperty("lrcalc.engine.number-type", "int");
        System.setProperty("test.value", "system-value");
        ConfigFactory.invalidateCaches();

        // Act
        Config config = ConfigLoader.load(TEST_CONFIG);

        // Assert
        assertThat(config.getString("lrcalc.engine.number-type")).isEqualTo("int");
        assertThat(config.getString("test.value")).isEqualTo("system-value");
        assertThat(config.getString("lrcalc.engine.ambiguity-policy")).isEqualTo("ERROR");
    }

    @Test
    @AllowLog(level = LogLevel.WARN, messagePattern = "Configuration file 'non-existent-config.conf' not found or is empty. Using defaults.")
    @DisplayName("Should fall back to the defaults for a missing configuration file")
    void load_shouldHandleMissingConfigFile() {
        // Act
        Config config = ConfigLoader.load("non-existent-config.conf");

        // Assert
        assertThat(config.getString("lrcalc.engine.number-type")).isEqualTo("double");
        assertThat(config.getString("lrcalc.engine.ambiguity-policy")).isEqualTo("WARN");
        assertThat(config.hasPath("lrcalc.engine.random-seed")).isFalse();
    }

    @Test
    @AllowLog(level = LogLevel.WARN, messagePattern = "Configuration file.*not found or is empty. Using defaults.")
    @DisplayName("Should fall back to the defaults for an empty configuration file")
    void load_shouldHandleEmptyConfigFile() {
        // Act
        Config config = ConfigLoader.load("org/lrcalc/config/empty-config.conf");

        // Assert
        assertThat(config.getString("lrcalc.engine.number-type")).isEqualTo("double");
    }

    @Test
    @DisplayName("Default load should contain the reference configuration")
    void load_withoutArgumentShouldContainReference() {
        // Act
        Config config = ConfigLoader.load();

        // Assert
        assertThat(config.hasPath("lrcalc.engine")).isTrue();
        assertThat(config.getConfig("lrcalc.engine.variables").isEmpty()).isTrue();
    }
}
