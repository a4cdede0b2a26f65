package org.lrcalc.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects the diagnostic messages raised while evaluating one expression.
 * <p>
 * This decouples reporting from the lexer, so a warning can be surfaced to the
 * caller without failing the parse.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param message The error message.
     * @param column  The column at which the error occurred.
     */
    public void reportError(String message, int column) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, message, column));
    }

    /**
     * Reports a warning.
     *
     * @param message The warning message.
     * @param column  The column at which the warning occurred.
     */
    public void reportWarning(String message, int column) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, message, column));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * Checks if warnings have been reported.
     *
     * @return {@code true} if at least one warning exists, otherwise {@code false}.
     */
    public boolean hasWarnings() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.WARNING);
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
