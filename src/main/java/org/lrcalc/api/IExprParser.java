package org.lrcalc.api;

import org.lrcalc.diagnostics.Diagnostic;
import org.lrcalc.numeric.NumberType;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Defines the public interface of the expression engine.
 * <p>
 * An engine owns a symbol table that survives between calls, so {@code x = 5} in one call
 * makes {@code x} visible in the next call on the same instance. Engines are not thread-safe.
 *
 * @param <T> The numeric value type the engine computes with.
 */
public interface IExprParser<T extends Number> {

    /**
     * Parses and evaluates a single expression.
     *
     * @param expression The expression text, e.g. {@code "x = 2 * sin(pi / 4)"}.
     * @return The value of the expression.
     * @throws ExpressionException if lexing, parsing or evaluation fails. Assignments reduced before
     *                             the failure stay in the symbol table.
     */
    T parse(String expression) throws ExpressionException;

    /**
     * Looks up a variable.
     * @param name The case-sensitive variable name.
     * @return The value, or empty if the variable is unknown.
     */
    Optional<T> getVariable(String name);

    /**
     * Creates or overwrites a variable.
     * @param name The case-sensitive variable name.
     * @param value The new value.
     */
    void setVariable(String name, T value);

    /**
     * @return An unmodifiable snapshot of all variables.
     */
    Map<String, T> getVariables();

    /**
     * Restores the symbol table to the state it had right after construction.
     */
    void resetVariables();

    /**
     * Returns the warnings collected while lexing the most recent expression.
     * @return An unmodifiable list of diagnostics.
     */
    List<Diagnostic> getDiagnostics();

    /**
     * @return The numeric value type of this engine.
     */
    NumberType<T> numberType();
}
