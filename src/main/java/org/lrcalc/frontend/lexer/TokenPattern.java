package org.lrcalc.frontend.lexer;

/**
 * One family of tokens the {@link Lexer} tests a candidate string against.
 * The lexer tries the families in order and keeps the first one on ambiguity.
 */
public interface TokenPattern {

    /**
     * @return A short name of the family for diagnostics, e.g. {@code "number"}.
     */
    String name();

    /**
     * Tests whether the whole candidate belongs to this family.
     * @param candidate The characters collected so far.
     * @return {@code true} if the candidate matches.
     */
    boolean matches(String candidate);

    /**
     * Builds the token for a matched candidate.
     * @param text The matched text.
     * @param column The 1-based column where the text starts.
     * @return The token.
     * @throws NumberFormatException if the text matches but has no representable value.
     */
    Token toToken(String text, int column);
}
