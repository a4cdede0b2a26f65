package org.lrcalc.frontend.lexer;

/**
 * Represents a single token extracted from the expression by the {@link Lexer}.
 *
 * @param type The type of the token (e.g., NUMBER, IDENTIFIER, PLUS).
 * @param text The exact text of the token from the expression.
 * @param value The processed value of the token (the numeric value of a NUMBER), otherwise {@code null}.
 * @param column The 1-based column where the token begins.
 */
public record Token(
        TokenType type,
        String text,
        Object value,
        int column
) {
}
