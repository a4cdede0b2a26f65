package org.lrcalc.frontend.lexer;

import java.util.regex.Pattern;

/**
 * Identifiers: a letter followed by letters and digits.
 */
public final class IdentifierPattern implements TokenPattern {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z][A-Za-z0-9]*");

    @Override
    public String name() {
        return "identifier";
    }

    @Override
    public boolean matches(String candidate) {
        return IDENTIFIER.matcher(candidate).matches();
    }

    @Override
    public Token toToken(String text, int column) {
        return new Token(TokenType.IDENTIFIER, text, null, column);
    }
}
