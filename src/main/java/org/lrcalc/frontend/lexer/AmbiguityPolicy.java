package org.lrcalc.frontend.lexer;

/**
 * What the {@link Lexer} does when the longest candidate matches more than one token family.
 */
public enum AmbiguityPolicy {
    /** Use the first matching family and report a warning. */
    WARN,
    /** Fail the evaluation with {@link org.lrcalc.api.ExpressionErrorCode#AMBIGUOUS_TOKEN}. */
    ERROR
}
