package org.lrcalc.numeric;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * The built-in numeric value types.
 */
public final class NumberTypes {

    /** Double precision floating point. */
    public static final NumberType<Double> DOUBLE = new DoubleType();
    /** 32-bit signed integer. */
    public static final NumberType<Integer> INTEGER = new IntegerType();
    /** 64-bit signed integer. */
    public static final NumberType<Long> LONG = new LongType();

    private static final List<NumberType<? extends Number>> ALL = List.of(DOUBLE, INTEGER, LONG);

    private NumberTypes() {
    }

    /**
     * Looks up a built-in type by its configuration name ({@code double}, {@code int} or {@code long}).
     * @param name The type name, case-insensitive.
     * @return The type, or empty if no type has that name.
     */
    public static Optional<NumberType<? extends Number>> byName(String name) {
        String key = name.toLowerCase(Locale.ROOT);
        return ALL.stream().filter(type -> type.name().equals(key)).findFirst();
    }
}
