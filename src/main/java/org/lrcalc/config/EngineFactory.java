package org.lrcalc.config;

import com.typesafe.config.Config;
import org.lrcalc.ExprParser;
import org.lrcalc.internal.SeededRandomProvider;
import org.lrcalc.numeric.NumberType;
import org.lrcalc.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds engines from configuration.
 */
public final class EngineFactory {

    private static final Logger LOG = LoggerFactory.getLogger(EngineFactory.class);

    private EngineFactory() {
    }

    private static final String LOGBACK_CONTEXT = "ch.qos.logback.classic.LoggerContext";

    /**
     * Loads the configuration with {@link ConfigLoader#load()}, applies its logging settings
     * when Logback is the SLF4J backend, and builds an engine from it.
     *
     * @return The engine.
     */
    public static ExprParser<? extends Number> create() {
        final Config config = ConfigLoader.load();
        if (isLogbackBound()) {
            LoggingConfigurator.configure(config);
        } else {
            LOG.debug("SLF4J is not bound to Logback, leaving log levels to the application.");
        }
        return create(config);
    }

    /**
     * Builds an engine from the {@code lrcalc.engine} block of a configuration.
     *
     * @param config The configuration.
     * @return The engine.
     * @throws com.typesafe.config.ConfigException.BadValue if the engine block is invalid.
     */
    public static ExprParser<? extends Number> create(final Config config) {
        return create(EngineOptions.fromConfig(config));
    }

    /**
     * Builds an engine from validated options.
     *
     * @param options The options.
     * @return The engine.
     */
    public static ExprParser<? extends Number> create(final EngineOptions options) {
        LOG.debug("Creating {} engine (ambiguity policy {}, {} predefined variables).",
                options.numberType().name(), options.ambiguityPolicy(), options.variables().size());
        return build(options.numberType(), options);
    }

    /**
     * @return {@code true} if SLF4J is bound to Logback, the only backend {@link LoggingConfigurator} configures.
     */
    static boolean isLogbackBound() {
        return LOGBACK_CONTEXT.equals(LoggerFactory.getILoggerFactory().getClass().getName());
    }

    private static <T extends Number> ExprParser<T> build(final NumberType<T> type, final EngineOptions options) {
        final IRandomProvider random = options.randomSeed().isPresent()
                ? new SeededRandomProvider(options.randomSeed().getAsLong())
                : SeededRandomProvider.shared();
        final Map<String, T> variables = new LinkedHashMap<>();
        options.variables().forEach((name, value) -> variables.put(name, type.fromDouble(value)));
        return new ExprParser<>(type, random, options.ambiguityPolicy(), variables);
    }
}
