package org.lrcalc;

import org.lrcalc.api.ExpressionErrorCode;
import org.lrcalc.api.ExpressionException;
import org.lrcalc.frontend.lexer.AmbiguityPolicy;
import org.lrcalc.internal.SeededRandomProvider;
import org.lrcalc.numeric.NumberTypes;
import org.lrcalc.spi.IRandomProvider;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Contains end-to-end tests for the {@link ExprParser} engine: lexing, parsing and evaluation
 * through the public API, including the variables that persist between calls.
 */
public class ExprParserTest {

    private static ExpressionErrorCode codeOf(Throwable e) {
        return ((ExpressionException) e).getCode();
    }

    /**
     * Verifies the basic arithmetic results of the engine.
     */
    @Test
    @Tag("unit")
    void testArithmetic() throws ExpressionException {
        ExprParser<Double> parser = ExprParser.forDouble();

        assertThat(parser.parse("2+3*4")).isEqualTo(14.0);
        assertThat(parser.parse("(2+3)*4")).isEqualTo(20.0);
        assertThat(parser.parse("2^3^2")).isEqualTo(512.0);
        assertThat(parser.parse("-3+4")).isEqualTo(1.0);
        assertThat(parser.parse("-(3+4)")).isEqualTo(-7.0);
        assertThat(parser.parse("12.5e3 / 2")).isEqualTo(6250.0);
    }

    /**
     * Verifies calls to built-in functions of each arity.
     */
    @Test
    @Tag("unit")
    void testFunctionCalls() throws ExpressionException {
        ExprParser<Double> parser = ExprParser.forDouble();

        assertThat(parser.parse("pow(2,10)")).isEqualTo(1024.0);
        assertThat(parser.parse("sin(0)")).isEqualTo(0.0);
        assertThat(parser.parse("2 * sin(pi / 2)")).isCloseTo(2.0, within(1e-12));
        for (int i = 0; i < 100; i++) {
            assertThat(parser.parse("rand()")).isGreaterThanOrEqualTo(0.0).isLessThan(1.0);
            assertThat(parser.parse("rand(5, 6)")).isGreaterThanOrEqualTo(5.0).isLessThan(6.0);
        }
    }

    /**
     * Verifies that an assigned variable persists on the same engine and is unknown to a fresh one.
     */
    @Test
    @Tag("unit")
    void testAssignmentPersistsPerInstance() throws ExpressionException {
        // Arrange
        ExprParser<Double> parser = ExprParser.forDouble();

        // Act
        Double assigned = parser.parse("x=5");
        Double next = parser.parse("x+1");

        // Assert
        assertThat(assigned).isEqualTo(5.0);
        assertThat(next).isEqualTo(6.0);
        assertThat(parser.getVariable("x")).contains(5.0);
        assertThatThrownBy(() -> ExprParser.forDouble().parse("x+1"))
                .isInstanceOf(ExpressionException.class)
                .satisfies(e -> assertThat(codeOf(e)).isEqualTo(ExpressionErrorCode.UNKNOWN_VARIABLE));
    }

    /**
     * Verifies that a non-assigning expression gives the same result every time and leaves the variables unchanged.
     */
    @Test
    @Tag("unit")
    void testNonAssigningExpressionIsIdempotent() throws ExpressionException {
        // Arrange
        ExprParser<Double> parser = ExprParser.forDouble();
        Map<String, Double> before = parser.getVariables();

        // Act & Assert
        for (int i = 0; i < 5; i++) {
            assertThat(parser.parse("2+2")).isEqualTo(4.0);
        }
        assertThat(parser.getVariables()).isEqualTo(before);
    }

    /**
     * Verifies that bracketing a valid expression does not change its value.
     */
    @ParameterizedTest
    @ValueSource(strings = {"1+2*3", "2^3^2", "-4", "pow(2, 3) - 1", "10 % 4", "cos(pi) * 2", "1.5e2"})
    @Tag("unit")
    void testBracketsPreserveValue(String expression) throws ExpressionException {
        ExprParser<Double> parser = ExprParser.forDouble();

        assertThat(parser.parse("(" + expression + ")")).isEqualTo(parser.parse(expression));
    }

    /**
     * Verifies the error codes of the documented failure cases.
     */
    @Test
    @Tag("unit")
    void testFailureCases() {
        ExprParser<Double> parser = ExprParser.forDouble();

        assertThatThrownBy(() -> parser.parse("1+"))
                .isInstanceOf(ExpressionException.class)
                .satisfies(e -> assertThat(codeOf(e).kind()).isEqualTo(ExpressionErrorCode.ErrorKind.GRAMMAR));
        assertThatThrownBy(() -> parser.parse("y+1"))
                .satisfies(e -> assertThat(codeOf(e)).isEqualTo(ExpressionErrorCode.UNKNOWN_VARIABLE))
                .hasMessage("Unknown variable \"y\".");
        assertThatThrownBy(() -> parser.parse("foo(1,2,3)"))
                .satisfies(e -> assertThat(codeOf(e)).isEqualTo(ExpressionErrorCode.NO_TRANSITION));
        assertThatThrownBy(() -> parser.parse("foo(1,2)"))
                .satisfies(e -> assertThat(codeOf(e)).isEqualTo(ExpressionErrorCode.UNKNOWN_FUNCTION));
        assertThatThrownBy(() -> parser.parse("5=3"))
                .satisfies(e -> assertThat(codeOf(e)).isEqualTo(ExpressionErrorCode.ASSIGNMENT_NEEDS_IDENTIFIER));
        assertThatThrownBy(() -> parser.parse("3 @ 4"))
                .satisfies(e -> assertThat(codeOf(e)).isEqualTo(ExpressionErrorCode.INVALID_TOKEN));
        assertThatThrownBy(() -> parser.parse("rand(2, 1)"))
                .satisfies(e -> assertThat(codeOf(e)).isEqualTo(ExpressionErrorCode.ARITHMETIC_ERROR));
    }

    /**
     * Verifies that the exception carries the offending expression.
     */
    @Test
    @Tag("unit")
    void testExceptionCarriesExpression() {
        assertThatThrownBy(() -> ExprParser.forDouble().parse("(1"))
                .isInstanceOf(ExpressionException.class)
                .satisfies(e -> assertThat(((ExpressionException) e).getExpression()).isEqualTo("(1"))
                .hasMessageContaining("Input expression: \"(1\"");
    }

    /**
     * Verifies that an assignment reduced before a later failure stays in effect.
     */
    @Test
    @Tag("unit")
    void testAssignmentSurvivesLaterFailure() {
        // Arrange
        ExprParser<Double> parser = ExprParser.forDouble();

        // Act
        assertThatThrownBy(() -> parser.parse("pow(a = 4, unknown)"))
                .satisfies(e -> assertThat(codeOf(e)).isEqualTo(ExpressionErrorCode.UNKNOWN_VARIABLE));

        // Assert
        assertThat(parser.getVariable("a")).contains(4.0);
    }

    /**
     * Verifies that an expression ends at the first newline.
     */
    @Test
    @Tag("unit")
    void testNewlineEndsExpression() throws ExpressionException {
        assertThat(ExprParser.forDouble().parse("1+1\n this is ignored")).isEqualTo(2.0);
    }

    /**
     * Verifies integer and long engines, including truncation and integer division by zero.
     */
    @Test
    @Tag("unit")
    void testIntegerEngines() throws ExpressionException {
        ExprParser<Integer> ints = ExprParser.forInteger();
        ExprParser<Long> longs = ExprParser.forLong();

        assertThat(ints.parse("7/2")).isEqualTo(3);
        assertThat(ints.parse("pi")).isEqualTo(3);
        assertThat(ints.parse("sqrt(17)")).isEqualTo(4);
        assertThat(longs.parse("3000000000 * 2")).isEqualTo(6_000_000_000L);
        assertThat(longs.parse("abs(0-9007199254740993)")).isEqualTo(9_007_199_254_740_993L);
        assertThat(ints.parse("abs(-2147483647)")).isEqualTo(2_147_483_647);
        assertThatThrownBy(() -> ints.parse("1/0"))
                .satisfies(e -> assertThat(codeOf(e)).isEqualTo(ExpressionErrorCode.ARITHMETIC_ERROR));
        assertThatThrownBy(() -> ints.parse("3000000000"))
                .satisfies(e -> assertThat(codeOf(e)).isEqualTo(ExpressionErrorCode.INVALID_TOKEN));
        assertThatThrownBy(() -> ints.parse("1.5"))
                .satisfies(e -> assertThat(codeOf(e)).isEqualTo(ExpressionErrorCode.INVALID_TOKEN));
    }

    /**
     * Verifies the variable accessors, the reset to the construction-time table and the copy constructor.
     */
    @Test
    @Tag("unit")
    void testVariablesResetAndCopy() throws ExpressionException {
        // Arrange
        ExprParser<Double> parser = new ExprParser<>(NumberTypes.DOUBLE, new SeededRandomProvider(3L),
                AmbiguityPolicy.WARN, Map.of("e", Math.E));
        parser.setVariable("w", 2.0);
        parser.parse("pi = 3");

        // Act
        ExprParser<Double> copy = new ExprParser<>(parser);
        copy.parse("w = w * 10");
        parser.resetVariables();

        // Assert
        assertThat(copy.getVariable("w")).contains(20.0);
        assertThat(copy.getVariable("pi")).contains(3.0);
        assertThat(parser.getVariables()).containsOnlyKeys("pi", "e");
        assertThat(parser.getVariable("pi")).contains(Math.PI);
        assertThat(parser.parse("e")).isEqualTo(Math.E);
        assertThat(parser.getDiagnostics()).isEmpty();
    }

    /**
     * Verifies that the engine draws from an injected random provider.
     */
    @Test
    @Tag("unit")
    void testInjectedRandomProvider() throws ExpressionException {
        // Arrange
        IRandomProvider random = mock(IRandomProvider.class);
        when(random.nextInt(1, 6)).thenReturn(4);
        ExprParser<Integer> parser = new ExprParser<>(NumberTypes.INTEGER, random, AmbiguityPolicy.ERROR, Map.of());

        // Act & Assert
        assertThat(parser.parse("rand(1, 6) * 10")).isEqualTo(40);
        assertThat(parser.numberType()).isSameAs(NumberTypes.INTEGER);
    }

    /**
     * Verifies that a null expression is rejected as a programming error.
     */
    @Test
    @Tag("unit")
    void testNullExpressionIsRejected() {
        assertThatThrownBy(() -> ExprParser.forDouble().parse(null)).isInstanceOf(NullPointerException.class);
    }
}
