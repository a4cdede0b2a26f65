package org.lrcalc.frontend.lexer;

/**
 * Operators and punctuation that stand for themselves: {@code + - * / % ^ ( ) , =}.
 */
public final class PunctuationPattern implements TokenPattern {

    @Override
    public String name() {
        return "punctuation";
    }

    @Override
    public boolean matches(String candidate) {
        return candidate.length() == 1 && TokenType.forSymbol(candidate.charAt(0)) != null;
    }

    @Override
    public Token toToken(String text, int column) {
        return new Token(TokenType.forSymbol(text.charAt(0)), text, null, column);
    }
}
