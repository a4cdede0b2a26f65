package org.lrcalc.numeric;

import org.lrcalc.spi.IRandomProvider;

import java.util.regex.Pattern;

/**
 * 64-bit signed integer values. Same literal and operator rules as {@link IntegerType}.
 */
public final class LongType implements NumberType<Long> {

    private static final Pattern LITERAL = Pattern.compile("[0-9]+");

    LongType() {
    }

    @Override
    public String name() {
        return "long";
    }

    @Override
    public Pattern literalPattern() {
        return LITERAL;
    }

    @Override
    public Long parseLiteral(String text) {
        return Long.parseLong(text);
    }

    @Override
    public Long fromDouble(double value) {
        return (long) value;
    }

    @Override
    public double toDouble(Long value) {
        return value;
    }

    @Override
    public Long add(Long a, Long b) {
        return a + b;
    }

    @Override
    public Long subtract(Long a, Long b) {
        return a - b;
    }

    @Override
    public Long multiply(Long a, Long b) {
        return a * b;
    }

    @Override
    public Long divide(Long a, Long b) {
        return a / b;
    }

    @Override
    public Long remainder(Long a, Long b) {
        return a % b;
    }

    @Override
    public Long power(Long a, Long b) {
        return (long) Math.pow(a, b);
    }

    @Override
    public Long negate(Long a) {
        return -a;
    }

    @Override
    public Long abs(Long a) {
        return Math.abs(a);
    }

    @Override
    public Long random(IRandomProvider random) {
        return random.nextLong();
    }

    @Override
    public Long random(IRandomProvider random, Long min, Long max) {
        return random.nextLong(min, max);
    }

    @Override
    public String toString() {
        return name();
    }
}
