package org.lrcalc.functions;

import org.apache.commons.math3.special.Erf;
import org.apache.commons.math3.util.FastMath;
import org.apache.commons.math3.util.Precision;
import org.lrcalc.numeric.NumberType;
import org.lrcalc.spi.IRandomProvider;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.BinaryOperator;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * A registry for the built-in functions, one table per arity. A name may appear in several
 * tables; a call site picks the table by the number of arguments it supplies.
 * The registry is filled once by {@link #initialize(NumberType, IRandomProvider)} and read-only afterwards.
 *
 * @param <T> The numeric value type.
 */
public final class FunctionRegistry<T extends Number> {

    private final Map<String, Supplier<T>> nullary = new HashMap<>();
    private final Map<String, UnaryOperator<T>> unary = new HashMap<>();
    private final Map<String, BinaryOperator<T>> binary = new HashMap<>();

    private FunctionRegistry() {
    }

    private void registerNullary(String name, Supplier<T> function) {
        nullary.put(name, function);
    }

    private void registerUnary(String name, UnaryOperator<T> function) {
        unary.put(name, function);
    }

    private void registerBinary(String name, BinaryOperator<T> function) {
        binary.put(name, function);
    }

    /**
     * Gets a function taking no arguments.
     * @param name The function name.
     * @return An {@link Optional} containing the function if it exists, otherwise empty.
     */
    public Optional<Supplier<T>> nullary(String name) {
        return Optional.ofNullable(nullary.get(name));
    }

    /**
     * Gets a function taking one argument.
     * @param name The function name.
     * @return An {@link Optional} containing the function if it exists, otherwise empty.
     */
    public Optional<UnaryOperator<T>> unary(String name) {
        return Optional.ofNullable(unary.get(name));
    }

    /**
     * Gets a function taking two arguments.
     * @param name The function name.
     * @return An {@link Optional} containing the function if it exists, otherwise empty.
     */
    public Optional<BinaryOperator<T>> binary(String name) {
        return Optional.ofNullable(binary.get(name));
    }

    /**
     * Lists the names registered for an arity.
     * @param arity 0, 1 or 2.
     * @return The sorted names, empty for any other arity.
     */
    public Set<String> names(int arity) {
        Set<String> keys = switch (arity) {
            case 0 -> nullary.keySet();
            case 1 -> unary.keySet();
            case 2 -> binary.keySet();
            default -> Set.of();
        };
        return Collections.unmodifiableSet(new TreeSet<>(keys));
    }

    /**
     * Creates a registry holding all built-in functions for the given value type.
     * @param type The value type the functions compute with.
     * @param random The source drawn from by {@code rand}.
     * @param <T> The numeric value type.
     * @return A new, fully populated registry.
     */
    public static <T extends Number> FunctionRegistry<T> initialize(NumberType<T> type, IRandomProvider random) {
        FunctionRegistry<T> registry = new FunctionRegistry<>();

        registry.registerNullary("rand", () -> type.random(random));

        registry.registerUnary("sin", x -> type.apply(Math::sin, x));
        registry.registerUnary("cos", x -> type.apply(Math::cos, x));
        registry.registerUnary("tan", x -> type.apply(Math::tan, x));
        registry.registerUnary("asin", x -> type.apply(Math::asin, x));
        registry.registerUnary("acos", x -> type.apply(Math::acos, x));
        registry.registerUnary("atan", x -> type.apply(Math::atan, x));

        registry.registerUnary("sinh", x -> type.apply(Math::sinh, x));
        registry.registerUnary("cosh", x -> type.apply(Math::cosh, x));
        registry.registerUnary("tanh", x -> type.apply(Math::tanh, x));
        registry.registerUnary("asinh", x -> type.apply(FastMath::asinh, x));
        registry.registerUnary("acosh", x -> type.apply(FastMath::acosh, x));
        registry.registerUnary("atanh", x -> type.apply(FastMath::atanh, x));

        registry.registerUnary("sqrt", x -> type.apply(Math::sqrt, x));
        registry.registerUnary("cbrt", x -> type.apply(Math::cbrt, x));

        registry.registerUnary("exp", x -> type.apply(Math::exp, x));
        registry.registerUnary("log", x -> type.apply(Math::log, x));
        registry.registerUnary("log10", x -> type.apply(Math::log10, x));
        registry.registerUnary("log2", x -> type.apply(v -> Math.log(v) / Math.log(2.0), x));

        // half away from zero
        registry.registerUnary("round", x -> type.apply(v -> Precision.round(v, 0), x));
        registry.registerUnary("ceil", x -> type.apply(Math::ceil, x));
        registry.registerUnary("floor", x -> type.apply(Math::floor, x));
        registry.registerUnary("abs", type::abs);

        registry.registerUnary("erf", x -> type.apply(Erf::erf, x));
        registry.registerUnary("erfc", x -> type.apply(Erf::erfc, x));

        registry.registerBinary("pow", type::power);
        registry.registerBinary("atan2", (y, x) -> type.apply(Math::atan2, y, x));
        registry.registerBinary("rand", (min, max) -> type.random(random, min, max));
        registry.registerBinary("mod", type::remainder);

        return registry;
    }
}
