package org.lrcalc.frontend.lexer;

import org.lrcalc.numeric.NumberType;

/**
 * Numeric literals, as defined by the engine's {@link NumberType}.
 */
public final class NumberPattern implements TokenPattern {

    private final NumberType<?> numberType;

    /**
     * @param numberType The value type whose literal syntax and parsing are used.
     */
    public NumberPattern(NumberType<?> numberType) {
        this.numberType = numberType;
    }

    @Override
    public String name() {
        return "number";
    }

    @Override
    public boolean matches(String candidate) {
        return numberType.literalPattern().matcher(candidate).matches();
    }

    @Override
    public Token toToken(String text, int column) {
        return new Token(TokenType.NUMBER, text, numberType.parseLiteral(text), column);
    }
}
