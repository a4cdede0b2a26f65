package org.lrcalc.numeric;

import org.lrcalc.spi.IRandomProvider;

import java.util.regex.Pattern;

/**
 * 32-bit signed integer values. Literals are plain decimal digits; division and remainder truncate.
 */
public final class IntegerType implements NumberType<Integer> {

    private static final Pattern LITERAL = Pattern.compile("[0-9]+");

    IntegerType() {
    }

    @Override
    public String name() {
        return "int";
    }

    @Override
    public Pattern literalPattern() {
        return LITERAL;
    }

    @Override
    public Integer parseLiteral(String text) {
        return Integer.parseInt(text);
    }

    @Override
    public Integer fromDouble(double value) {
        return (int) value;
    }

    @Override
    public double toDouble(Integer value) {
        return value;
    }

    @Override
    public Integer add(Integer a, Integer b) {
        return a + b;
    }

    @Override
    public Integer subtract(Integer a, Integer b) {
        return a - b;
    }

    @Override
    public Integer multiply(Integer a, Integer b) {
        return a * b;
    }

    @Override
    public Integer divide(Integer a, Integer b) {
        return a / b;
    }

    @Override
    public Integer remainder(Integer a, Integer b) {
        return a % b;
    }

    @Override
    public Integer power(Integer a, Integer b) {
        return (int) Math.pow(a, b);
    }

    @Override
    public Integer negate(Integer a) {
        return -a;
    }

    @Override
    public Integer abs(Integer a) {
        return Math.abs(a);
    }

    @Override
    public Integer random(IRandomProvider random) {
        return random.nextInt();
    }

    @Override
    public Integer random(IRandomProvider random, Integer min, Integer max) {
        return random.nextInt(min, max);
    }

    @Override
    public String toString() {
        return name();
    }
}
