package org.lrcalc.diagnostics;

/**
 * Represents a single diagnostic message (error, warning) raised while
 * tokenizing or parsing an expression.
 *
 * @param type The type of the diagnostic (e.g., ERROR, WARNING).
 * @param message The diagnostic message.
 * @param column The 1-based column in the expression where the issue starts.
 */
public record Diagnostic(
        Type type,
        String message,
        int column
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error that aborts the evaluation. */
        ERROR,
        /** A warning that does not abort the evaluation. */
        WARNING
    }

    @Override
    public String toString() {
        return String.format("[%s] column %d: %s", type, column, message);
    }
}
