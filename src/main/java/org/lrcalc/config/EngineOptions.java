package org.lrcalc.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigValue;
import org.lrcalc.frontend.lexer.AmbiguityPolicy;
import org.lrcalc.numeric.NumberType;
import org.lrcalc.numeric.NumberTypes;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalLong;

/**
 * The validated settings under {@code lrcalc.engine}.
 *
 * <pre>
 * lrcalc.engine {
 *   number-type = "double"     # double | int | long
 *   ambiguity-policy = "WARN"  # WARN | ERROR
 *   random-seed = 42           # optional
 *   variables { e = 2.718281828459045 }
 * }
 * </pre>
 *
 * @param numberType The value type of the engine.
 * @param ambiguityPolicy The lexer ambiguity policy.
 * @param randomSeed The seed of a private random provider, or empty to use the shared provider.
 * @param variables Predefined variables as doubles, converted into the value type by the factory.
 */
public record EngineOptions(
        NumberType<? extends Number> numberType,
        AmbiguityPolicy ambiguityPolicy,
        OptionalLong randomSeed,
        Map<String, Double> variables
) {
    /** Path of the engine block in the configuration. */
    public static final String PATH = "lrcalc.engine";

    private static final String NUMBER_TYPE = "number-type";
    private static final String AMBIGUITY_POLICY = "ambiguity-policy";
    private static final String RANDOM_SEED = "random-seed";
    private static final String VARIABLES = "variables";

    /**
     * @return The options used when no configuration is given: doubles, WARN, shared provider, no variables.
     */
    public static EngineOptions defaults() {
        return new EngineOptions(NumberTypes.DOUBLE, AmbiguityPolicy.WARN, OptionalLong.empty(), Map.of());
    }

    /**
     * Reads and validates the engine options. Missing keys keep their defaults.
     *
     * @param config The full configuration.
     * @return The options.
     * @throws ConfigException.BadValue if a value is not one of the allowed ones.
     */
    public static EngineOptions fromConfig(final Config config) {
        if (!config.hasPath(PATH)) {
            return defaults();
        }
        final Config engine = config.getConfig(PATH);

        NumberType<? extends Number> numberType = NumberTypes.DOUBLE;
        if (engine.hasPath(NUMBER_TYPE)) {
            final String name = engine.getString(NUMBER_TYPE);
            numberType = NumberTypes.byName(name).orElseThrow(() -> new ConfigException.BadValue(
                    engine.origin(), PATH + "." + NUMBER_TYPE,
                    "Unknown number type '" + name + "', expected one of double, int, long"));
        }

        AmbiguityPolicy policy = AmbiguityPolicy.WARN;
        if (engine.hasPath(AMBIGUITY_POLICY)) {
            final String name = engine.getString(AMBIGUITY_POLICY);
            try {
                policy = AmbiguityPolicy.valueOf(name.toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new ConfigException.BadValue(engine.origin(), PATH + "." + AMBIGUITY_POLICY,
                        "Unknown ambiguity policy '" + name + "', expected WARN or ERROR", e);
            }
        }

        final OptionalLong seed = engine.hasPath(RANDOM_SEED)
                ? OptionalLong.of(engine.getLong(RANDOM_SEED))
                : OptionalLong.empty();

        final Map<String, Double> variables = new LinkedHashMap<>();
        if (engine.hasPath(VARIABLES)) {
            final Config variablesConfig = engine.getConfig(VARIABLES);
            for (final Map.Entry<String, ConfigValue> entry : variablesConfig.root().entrySet()) {
                final Object raw = entry.getValue().unwrapped();
                if (!(raw instanceof Number number)) {
                    throw new ConfigException.BadValue(entry.getValue().origin(),
                            PATH + "." + VARIABLES + "." + entry.getKey(), "Variable value must be a number");
                }
                variables.put(entry.getKey(), number.doubleValue());
            }
        }

        return new EngineOptions(numberType, policy, seed, Collections.unmodifiableMap(variables));
    }
}
