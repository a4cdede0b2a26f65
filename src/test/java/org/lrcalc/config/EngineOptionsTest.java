package org.lrcalc.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.lrcalc.frontend.lexer.AmbiguityPolicy;
import org.lrcalc.numeric.NumberTypes;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link EngineOptions}.
 */
@Tag("unit")
class EngineOptionsTest {

    @Test
    void fromConfig_shouldReadAllKeys() {
        // Given
        final Config config = ConfigFactory.parseString("""
            lrcalc.engine {
              number-type = "LONG"
              ambiguity-policy = "error"
              random-seed = 7
              variables { e = 2.5, n = 3 }
            }
            """);

        // When
        final EngineOptions options = EngineOptions.fromConfig(config);

        // Then
        assertThat(options.numberType()).isSameAs(NumberTypes.LONG);
        assertThat(options.ambiguityPolicy()).isEqualTo(AmbiguityPolicy.ERROR);
        assertThat(options.randomSeed()).hasValue(7L);
        assertThat(options.variables()).containsEntry("e", 2.5).containsEntry("n", 3.0);
    }

    @Test
    void fromConfig_withoutEngineBlockShouldUseDefaults() {
        // When
        final EngineOptions options = EngineOptions.fromConfig(ConfigFactory.empty());

        // Then
        assertThat(options).isEqualTo(EngineOptions.defaults());
        assertThat(options.randomSeed()).isEmpty();
    }

    @Test
    void fromConfig_shouldRejectUnknownNumberType() {
        final Config config = ConfigFactory.parseString("lrcalc.engine.number-type = float");

        assertThatThrownBy(() -> EngineOptions.fromConfig(config))
                .isInstanceOf(ConfigException.BadValue.class)
                .hasMessageContaining("float");
    }

    @Test
    void fromConfig_shouldRejectUnknownAmbiguityPolicy() {
        final Config config = ConfigFactory.parseString("lrcalc.engine.ambiguity-policy = ignore");

        assertThatThrownBy(() -> EngineOptions.fromConfig(config))
                .isInstanceOf(ConfigException.BadValue.class)
                .hasMessageContaining("ambiguity-policy");
    }

    @Test
    void fromConfig_shouldRejectNonNumericVariable() {
        final Config config = ConfigFactory.parseString("lrcalc.engine.variables.name = \"text\"");

        assertThatThrownBy(() -> EngineOptions.fromConfig(config))
                .isInstanceOf(ConfigException.BadValue.class)
                .hasMessageContaining("variables.name");
    }
}
