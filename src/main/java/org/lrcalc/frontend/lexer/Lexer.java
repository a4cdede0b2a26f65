package org.lrcalc.frontend.lexer;

import org.lrcalc.api.ExpressionErrorCode;
import org.lrcalc.diagnostics.DiagnosticsEngine;
import org.lrcalc.frontend.ExpressionError;
import org.lrcalc.numeric.NumberType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The Lexer converts an expression into tokens, one token per call to {@link #nextToken()}.
 * <p>
 * Tokens are found by longest match: characters are appended to a candidate for as long as at
 * least one {@link TokenPattern} still matches it. The first character that breaks every pattern
 * is pushed back and the longest matching candidate becomes the token.
 */
public class Lexer {

    private static final Logger LOG = LoggerFactory.getLogger(Lexer.class);

    private final String source;
    private final List<TokenPattern> patterns;
    private final DiagnosticsEngine diagnostics;
    private final AmbiguityPolicy ambiguityPolicy;
    private int current = 0;

    /**
     * Creates a new Lexer with the built-in token families and the WARN ambiguity policy.
     * @param source The expression text.
     * @param numberType The value type deciding the numeric literal syntax.
     * @param diagnostics The engine for reporting errors and warnings.
     */
    public Lexer(String source, NumberType<?> numberType, DiagnosticsEngine diagnostics) {
        this(source, defaultPatterns(numberType), diagnostics, AmbiguityPolicy.WARN);
    }

    /**
     * Creates a new Lexer with explicit token families.
     * @param source The expression text.
     * @param patterns The token families in order of preference.
     * @param diagnostics The engine for reporting errors and warnings.
     * @param ambiguityPolicy What to do when several families match the same longest candidate.
     */
    public Lexer(String source, List<TokenPattern> patterns, DiagnosticsEngine diagnostics, AmbiguityPolicy ambiguityPolicy) {
        this.source = source;
        this.patterns = List.copyOf(patterns);
        this.diagnostics = diagnostics;
        this.ambiguityPolicy = ambiguityPolicy;
    }

    /**
     * Returns the built-in token families: numbers, identifiers, punctuation.
     * @param numberType The value type deciding the numeric literal syntax.
     * @return The families in order of preference.
     */
    public static List<TokenPattern> defaultPatterns(NumberType<?> numberType) {
        return List.of(new NumberPattern(numberType), new IdentifierPattern(), new PunctuationPattern());
    }

    /**
     * Scans the next token. Blanks before a token are skipped; a newline before any token
     * or the end of the input yields {@link TokenType#END}.
     *
     * @return The next token.
     * @throws ExpressionError if the candidate is ambiguous and the policy is {@link AmbiguityPolicy#ERROR}.
     */
    public Token nextToken() {
        StringBuilder input = new StringBuilder();
        String longestInput = "";
        List<TokenPattern> longestMatching = List.of();
        int start = current;

        while (!isAtEnd()) {
            char c = advance();
            if (longestMatching.isEmpty()) {
                if (c == ' ' || c == '\t' || c == '\r') {
                    start = current;
                    continue;
                }
                if (c == '\n') {
                    return new Token(TokenType.END, "", null, current);
                }
            }

            input.append(c);
            List<TokenPattern> matching = matchingPatterns(input.toString());
            if (matching.isEmpty()) {
                // The offending character stays consumed if nothing matched at all.
                if (!longestMatching.isEmpty()) {
                    pushBack();
                }
                break;
            }
            longestInput = input.toString();
            longestMatching = matching;
        }

        int column = start + 1;
        if (input.length() == 0) {
            return new Token(TokenType.END, "", null, column);
        }
        if (longestMatching.isEmpty()) {
            return invalid(input.toString(), "Invalid input in lexer: \"" + input + "\".", column);
        }
        if (longestMatching.size() > 1) {
            reportAmbiguity(longestInput, longestMatching, column);
        }

        try {
            return longestMatching.get(0).toToken(longestInput, column);
        } catch (NumberFormatException e) {
            return invalid(longestInput, "Numeric literal out of range: \"" + longestInput + "\".", column);
        }
    }

    /**
     * Scans tokens until the end of the expression or the first invalid token, both included.
     * @return The list of tokens.
     */
    public List<Token> scanTokens() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (token.type() != TokenType.END && token.type() != TokenType.INVALID);
        return tokens;
    }

    private List<TokenPattern> matchingPatterns(String candidate) {
        return patterns.stream().filter(p -> p.matches(candidate)).toList();
    }

    private Token invalid(String text, String message, int column) {
        diagnostics.reportError(message, column);
        LOG.debug("{} Column {} of \"{}\".", message, column, source);
        return new Token(TokenType.INVALID, text, null, column);
    }

    private void reportAmbiguity(String text, List<TokenPattern> matching, int column) {
        String families = matching.stream().map(TokenPattern::name).collect(Collectors.joining(", "));
        String message = "Ambiguous match in lexer for token \"" + text + "\" (" + families + ").";
        if (ambiguityPolicy == AmbiguityPolicy.ERROR) {
            diagnostics.reportError(message, column);
            throw new ExpressionError(ExpressionErrorCode.AMBIGUOUS_TOKEN, message + " Input expression: \"" + source + "\".");
        }
        diagnostics.reportWarning(message + " Using " + matching.get(0).name() + ".", column);
        LOG.warn("Ambiguous match in lexer for token \"{}\" ({}), using {}.", text, families, matching.get(0).name());
    }

    private char advance() {
        return source.charAt(current++);
    }

    private void pushBack() {
        current--;
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }
}
