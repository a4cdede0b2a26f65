package org.lrcalc.numeric;

import org.lrcalc.spi.IRandomProvider;

import java.util.regex.Pattern;

/**
 * Double precision floating point values. Literals may carry a fractional part and an exponent.
 */
public final class DoubleType implements NumberType<Double> {

    private static final Pattern LITERAL = Pattern.compile("[0-9]+(\\.[0-9]*)?([Ee][+-]?[0-9]*)?");
    private static final Pattern INCOMPLETE_EXPONENT = Pattern.compile("[Ee][+-]?$");

    DoubleType() {
    }

    @Override
    public String name() {
        return "double";
    }

    @Override
    public Pattern literalPattern() {
        return LITERAL;
    }

    /**
     * {@inheritDoc}
     * <p>
     * An exponent marker without digits ({@code 2e}, {@code 2e+}) is ignored.
     */
    @Override
    public Double parseLiteral(String text) {
        return Double.parseDouble(INCOMPLETE_EXPONENT.matcher(text).replaceFirst(""));
    }

    @Override
    public Double fromDouble(double value) {
        return value;
    }

    @Override
    public double toDouble(Double value) {
        return value;
    }

    @Override
    public Double add(Double a, Double b) {
        return a + b;
    }

    @Override
    public Double subtract(Double a, Double b) {
        return a - b;
    }

    @Override
    public Double multiply(Double a, Double b) {
        return a * b;
    }

    @Override
    public Double divide(Double a, Double b) {
        return a / b;
    }

    @Override
    public Double remainder(Double a, Double b) {
        return a % b;
    }

    @Override
    public Double power(Double a, Double b) {
        return Math.pow(a, b);
    }

    @Override
    public Double negate(Double a) {
        return -a;
    }

    @Override
    public Double abs(Double a) {
        return Math.abs(a);
    }

    @Override
    public Double random(IRandomProvider random) {
        return random.nextDouble();
    }

    @Override
    public Double random(IRandomProvider random, Double min, Double max) {
        return random.nextDouble(min, max);
    }

    @Override
    public String toString() {
        return name();
    }
}
