package org.lrcalc.api;

/**
 * Defines unique, testable error codes for all errors that can occur while evaluating an expression.
 * This decouples the test logic from the exact wording of the error messages.
 */
public enum ExpressionErrorCode {
    // region Lexical Errors
    /** No token pattern matches the input at the current position. */
    INVALID_TOKEN(ErrorKind.LEXICAL),
    /** More than one token pattern matched the longest input and the lexer runs with the ERROR policy. */
    AMBIGUOUS_TOKEN(ErrorKind.LEXICAL),
    // endregion

    // region Grammar Errors
    /** The parser state has no transition for the current look-ahead token. */
    NO_TRANSITION(ErrorKind.GRAMMAR),
    /** The automaton stopped without accepting exactly one value. */
    NOT_ACCEPTED(ErrorKind.GRAMMAR),
    // endregion

    // region Semantic Errors
    /** A variable was read before it was assigned. */
    UNKNOWN_VARIABLE(ErrorKind.SEMANTIC),
    /** No built-in function with the given name takes the given number of arguments. */
    UNKNOWN_FUNCTION(ErrorKind.SEMANTIC),
    /** The left side of an assignment is not a bare identifier. */
    ASSIGNMENT_NEEDS_IDENTIFIER(ErrorKind.SEMANTIC),
    /**
     * The callee of a function call is not a bare identifier. The grammar only shifts '(' after an
     * identifier, so expressions evaluated through the engine never raise it; it guards direct calls
     * of the semantic actions.
     */
    CALL_NEEDS_IDENTIFIER(ErrorKind.SEMANTIC),
    /** The value type rejected an operation, e.g. integer division by zero. */
    ARITHMETIC_ERROR(ErrorKind.SEMANTIC);
    // endregion

    private final ErrorKind kind;

    ExpressionErrorCode(ErrorKind kind) {
        this.kind = kind;
    }

    /**
     * Returns the family this error belongs to.
     * @return The error kind.
     */
    public ErrorKind kind() {
        return kind;
    }

    /**
     * The broad families of evaluation errors.
     */
    public enum ErrorKind {
        /** The input could not be split into tokens. */
        LEXICAL,
        /** The tokens do not form a sentence of the expression grammar. */
        GRAMMAR,
        /** The sentence is well-formed but cannot be evaluated. */
        SEMANTIC
    }
}
