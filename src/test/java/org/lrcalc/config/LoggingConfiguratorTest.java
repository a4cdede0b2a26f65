package org.lrcalc.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for the {@link LoggingConfigurator} class.
 */
@Tag("unit")
class LoggingConfiguratorTest {

    private static final String LEXER_LOGGER = "org.lrcalc.frontend.lexer";

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
    private Level savedRootLevel;
    private Level savedLexerLevel;

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
        savedRootLevel = context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
        savedLexerLevel = context.getLogger(LEXER_LOGGER).getLevel();
    }

    @AfterEach
    void tearDown() {
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(savedRootLevel);
        context.getLogger(LEXER_LOGGER).setLevel(savedLexerLevel);
        LoggingConfigurator.reset();
    }

    @Test
    void configure_shouldApplyDefaultAndSpecificLevels() {
        // Given
        final Config config = ConfigFactory.parseString("""
            logging {
              default-level = "ERROR"
              levels {
                "org.lrcalc.frontend.lexer" = "DEBUG"
              }
            }
            """);

        // When
        LoggingConfigurator.configure(config);

        // Then
        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.ERROR);
        assertThat(context.getLogger(LEXER_LOGGER).getLevel()).isEqualTo(Level.DEBUG);
        assertThat(LoggingConfigurator.isConfigured()).isTrue();
    }

    @Test
    void configure_shouldBeIdempotentUntilReset() {
        // Given
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.default-level = WARN"));

        // When
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.default-level = ERROR"));

        // Then
        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.WARN);

        // When
        LoggingConfigurator.reset();
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.default-level = ERROR"));

        // Then
        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.ERROR);
    }

    @Test
    void configure_withoutLoggingBlockShouldLeaveLevelsUntouched() {
        // Given
        final Level before = context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();

        // When
        LoggingConfigurator.configure(ConfigFactory.empty());

        // Then
        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(before);
        assertThat(LoggingConfigurator.isConfigured()).isTrue();
    }
}
