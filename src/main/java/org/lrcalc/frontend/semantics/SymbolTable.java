package org.lrcalc.frontend.semantics;

import org.lrcalc.api.ExpressionErrorCode;
import org.lrcalc.frontend.ExpressionError;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The variables of one engine, keyed by their case-sensitive names.
 * Only the assignment action and the engine's own setters mutate it.
 *
 * @param <T> The numeric value type.
 */
public class SymbolTable<T extends Number> {

    private final Map<String, T> variables = new HashMap<>();

    /**
     * Creates an empty symbol table.
     */
    public SymbolTable() {
    }

    /**
     * Creates a copy of another symbol table.
     * @param other The table to copy.
     */
    public SymbolTable(SymbolTable<T> other) {
        variables.putAll(other.variables);
    }

    /**
     * Reads a variable.
     * @param name The variable name.
     * @return The value.
     * @throws ExpressionError with {@link ExpressionErrorCode#UNKNOWN_VARIABLE} if the variable was never assigned.
     */
    public T lookup(String name) {
        T value = variables.get(name);
        if (value == null) {
            throw new ExpressionError(ExpressionErrorCode.UNKNOWN_VARIABLE, "Unknown variable \"" + name + "\".");
        }
        return value;
    }

    /**
     * @param name The variable name.
     * @return The value, or empty if the variable was never assigned.
     */
    public Optional<T> get(String name) {
        return Optional.ofNullable(variables.get(name));
    }

    /**
     * Sets a variable, inserting it if it does not exist yet.
     * @param name The variable name.
     * @param value The new value.
     * @return The assigned value.
     */
    public T assign(String name, T value) {
        variables.put(name, value);
        return value;
    }

    /**
     * Replaces the whole content of this table with the content of another.
     * @param other The table to copy from.
     */
    public void replaceWith(SymbolTable<T> other) {
        variables.clear();
        variables.putAll(other.variables);
    }

    /**
     * @return An unmodifiable snapshot of all variables.
     */
    public Map<String, T> snapshot() {
        return Collections.unmodifiableMap(new HashMap<>(variables));
    }
}
