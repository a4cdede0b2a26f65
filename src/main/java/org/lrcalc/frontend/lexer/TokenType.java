package org.lrcalc.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Single-character tokens.
    /** The '+' character, binary addition or unary plus. */
    PLUS('+'),
    /** The '-' character, binary subtraction or unary minus. */
    MINUS('-'),
    /** The '*' character. */
    STAR('*'),
    /** The '/' character. */
    SLASH('/'),
    /** The '%' character, remainder. */
    PERCENT('%'),
    /** The '^' character, right-associative power. */
    CARET('^'),
    /** The '(' character. */
    LEFT_PAREN('('),
    /** The ')' character. */
    RIGHT_PAREN(')'),
    /** The ',' character separating function arguments. */
    COMMA(','),
    /** The '=' character, assignment. */
    EQUALS('='),

    // Literals.
    /** A numeric literal. */
    NUMBER("number"),
    /** An identifier naming a variable or a function. */
    IDENTIFIER("identifier"),

    // Miscellaneous.
    /** Represents the end of the expression (end of input or a newline). */
    END("end"),
    /** Represents input that no token pattern matches. */
    INVALID("invalid");

    private final char symbol;
    private final String description;

    TokenType(char symbol) {
        this.symbol = symbol;
        this.description = "'" + symbol + "'";
    }

    TokenType(String description) {
        this.symbol = '\0';
        this.description = description;
    }

    /**
     * Returns how the token type is named in error messages: its character in quotes for
     * punctuation, otherwise its kind ("number", "identifier", "end", "invalid").
     *
     * @return The description.
     */
    public String describe() {
        return description;
    }

    /**
     * Finds the punctuation token type for a single character.
     * @param c The character.
     * @return The token type, or {@code null} if the character is not punctuation.
     */
    public static TokenType forSymbol(char c) {
        for (TokenType type : values()) {
            if (type.symbol != '\0' && type.symbol == c) {
                return type;
            }
        }
        return null;
    }
}
