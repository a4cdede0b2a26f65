package org.lrcalc.frontend.semantics;

/**
 * An element of the parser's operand stack: either a value computed so far, or an identifier
 * whose meaning (variable read, assignment target, callee) is decided only when a reduction needs it.
 *
 * @param <T> The numeric value type.
 */
public sealed interface Symbol<T extends Number> permits Symbol.Value, Symbol.Name {

    /**
     * A resolved numeric value.
     * @param value The value.
     * @param <T> The numeric value type.
     */
    record Value<T extends Number>(T value) implements Symbol<T> {}

    /**
     * An identifier that has not been resolved yet.
     * @param name The identifier text.
     * @param <T> The numeric value type.
     */
    record Name<T extends Number>(String name) implements Symbol<T> {}

    /**
     * @param value The value.
     * @param <T> The numeric value type.
     * @return A resolved symbol.
     */
    static <T extends Number> Symbol<T> value(T value) {
        return new Value<>(value);
    }

    /**
     * @param name The identifier text.
     * @param <T> The numeric value type.
     * @return An unresolved symbol.
     */
    static <T extends Number> Symbol<T> name(String name) {
        return new Name<>(name);
    }
}
