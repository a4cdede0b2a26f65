package org.lrcalc.numeric;

import org.lrcalc.spi.IRandomProvider;

import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;
import java.util.regex.Pattern;

/**
 * The numeric value type an engine computes with. It decides how literals look and parse,
 * and what the arithmetic operators and the random built-ins mean for its values.
 *
 * @param <T> The boxed Java type of the values.
 */
public interface NumberType<T extends Number> {

    /**
     * @return The configuration name of this type, e.g. {@code "double"}.
     */
    String name();

    /**
     * Returns the pattern a numeric literal must match. The pattern has to be prefix-closed
     * (every prefix of a literal on its way to a longer literal matches as well), because the
     * lexer stops growing a token at the first character that breaks all patterns.
     *
     * @return The literal pattern.
     */
    Pattern literalPattern();

    /**
     * Converts the text of a literal matched by {@link #literalPattern()} into a value.
     *
     * @param text The literal text.
     * @return The value.
     * @throws NumberFormatException if the literal does not fit into the type.
     */
    T parseLiteral(String text);

    /**
     * Converts a double into this type (truncating for integer types).
     * @param value The double value.
     * @return The converted value.
     */
    T fromDouble(double value);

    /**
     * Widens a value of this type to double.
     * @param value The value.
     * @return The double value.
     */
    double toDouble(T value);

    /** @return {@code a + b} */
    T add(T a, T b);

    /** @return {@code a - b} */
    T subtract(T a, T b);

    /** @return {@code a * b} */
    T multiply(T a, T b);

    /**
     * @return {@code a / b}
     * @throws ArithmeticException if the type does not define division by zero.
     */
    T divide(T a, T b);

    /**
     * @return The remainder of {@code a / b}, with the sign of {@code a}.
     * @throws ArithmeticException if the type does not define division by zero.
     */
    T remainder(T a, T b);

    /** @return {@code a} raised to the power {@code b} */
    T power(T a, T b);

    /** @return {@code -a} */
    T negate(T a);

    /** @return The absolute value of {@code a}, computed in this type. */
    T abs(T a);

    /**
     * Draws a value for the zero-argument {@code rand()} built-in.
     * @param random The random source.
     * @return The random value.
     */
    T random(IRandomProvider random);

    /**
     * Draws a value for the two-argument {@code rand(min, max)} built-in.
     * @param random The random source.
     * @param min The lower bound.
     * @param max The upper bound.
     * @return The random value.
     * @throws IllegalArgumentException if {@code min > max}.
     */
    T random(IRandomProvider random, T min, T max);

    /**
     * Applies a double function to a value of this type.
     * @param function The function.
     * @param value The argument.
     * @return The result converted back into this type.
     */
    default T apply(DoubleUnaryOperator function, T value) {
        return fromDouble(function.applyAsDouble(toDouble(value)));
    }

    /**
     * Applies a two-argument double function to values of this type.
     * @param function The function.
     * @param a The first argument.
     * @param b The second argument.
     * @return The result converted back into this type.
     */
    default T apply(DoubleBinaryOperator function, T a, T b) {
        return fromDouble(function.applyAsDouble(toDouble(a), toDouble(b)));
    }
}
