package org.lrcalc.frontend.semantics;

import org.lrcalc.api.ExpressionErrorCode;
import org.lrcalc.frontend.ExpressionError;
import org.lrcalc.frontend.lexer.TokenType;
import org.lrcalc.functions.FunctionRegistry;
import org.lrcalc.numeric.NumberType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Supplier;

/**
 * The computations the parser performs when it reduces a production. Each method pops nothing
 * itself; it receives the right-hand-side symbols and returns the symbol that replaces them.
 *
 * @param <T> The numeric value type.
 */
public class SemanticActions<T extends Number> {

    private static final Logger LOG = LoggerFactory.getLogger(SemanticActions.class);

    private final NumberType<T> type;
    private final SymbolTable<T> symbols;
    private final FunctionRegistry<T> functions;

    /**
     * @param type The value type the operators compute with.
     * @param symbols The variables read and written by the actions.
     * @param functions The built-in functions available to calls.
     */
    public SemanticActions(NumberType<T> type, SymbolTable<T> symbols, FunctionRegistry<T> functions) {
        this.type = type;
        this.symbols = symbols;
        this.functions = functions;
    }

    /**
     * Returns the value of a symbol, reading the symbol table for an identifier.
     * @param symbol The symbol.
     * @return Its value.
     * @throws ExpressionError with {@link ExpressionErrorCode#UNKNOWN_VARIABLE} for an unassigned identifier.
     */
    public T resolve(Symbol<T> symbol) {
        if (symbol instanceof Symbol.Value<T> value) {
            return value.value();
        }
        return symbols.lookup(((Symbol.Name<T>) symbol).name());
    }

    /**
     * {@code expr -> expr op expr}
     * @param operator One of PLUS, MINUS, STAR, SLASH, PERCENT, CARET.
     * @param left The left operand.
     * @param right The right operand.
     * @return The result.
     */
    public Symbol<T> binary(TokenType operator, Symbol<T> left, Symbol<T> right) {
        T a = resolve(left);
        T b = resolve(right);
        return Symbol.value(evaluate(a + " " + operator.describe() + " " + b, () -> switch (operator) {
            case PLUS -> type.add(a, b);
            case MINUS -> type.subtract(a, b);
            case STAR -> type.multiply(a, b);
            case SLASH -> type.divide(a, b);
            case PERCENT -> type.remainder(a, b);
            case CARET -> type.power(a, b);
            default -> throw new IllegalStateException("Not a binary operator: " + operator);
        }));
    }

    /**
     * {@code expr -> + expr} and {@code expr -> - expr}
     * @param operator PLUS or MINUS.
     * @param operand The operand.
     * @return The result.
     */
    public Symbol<T> unary(TokenType operator, Symbol<T> operand) {
        T value = resolve(operand);
        return Symbol.value(operator == TokenType.MINUS ? type.negate(value) : value);
    }

    /**
     * {@code expr -> ( expr )}
     * @param operand The enclosed expression.
     * @return Its value.
     */
    public Symbol<T> group(Symbol<T> operand) {
        return Symbol.value(resolve(operand));
    }

    /**
     * {@code expr -> ident = expr}. The variable is written immediately, so it keeps its new
     * value even if the rest of the expression fails later.
     *
     * @param target The assigned identifier.
     * @param value The right-hand side.
     * @return The assigned value.
     * @throws ExpressionError with {@link ExpressionErrorCode#ASSIGNMENT_NEEDS_IDENTIFIER} if the target is a value.
     */
    public Symbol<T> assign(Symbol<T> target, Symbol<T> value) {
        if (!(target instanceof Symbol.Name<T> name)) {
            throw new ExpressionError(ExpressionErrorCode.ASSIGNMENT_NEEDS_IDENTIFIER, "Assignment needs a variable identifier.");
        }
        T assigned = symbols.assign(name.name(), resolve(value));
        LOG.debug("Assigned variable {} = {}.", name.name(), assigned);
        return Symbol.value(assigned);
    }

    /**
     * {@code expr -> ident ( )}, {@code ident ( expr )} and {@code ident ( expr , expr )}.
     * The function is looked up in the table matching the number of arguments only.
     *
     * @param callee The function identifier.
     * @param arguments Zero, one or two arguments.
     * @return The function result.
     * @throws ExpressionError with {@link ExpressionErrorCode#UNKNOWN_FUNCTION} if no function of that arity has the name.
     */
    public Symbol<T> call(Symbol<T> callee, List<Symbol<T>> arguments) {
        if (!(callee instanceof Symbol.Name<T> name)) {
            throw new ExpressionError(ExpressionErrorCode.CALL_NEEDS_IDENTIFIER, "Function call needs an identifier.");
        }
        String function = name.name();
        T result = switch (arguments.size()) {
            case 0 -> {
                Supplier<T> f = functions.nullary(function).orElseThrow(() -> unknownFunction(function, 0));
                yield evaluate(function + "()", f);
            }
            case 1 -> {
                var f = functions.unary(function).orElseThrow(() -> unknownFunction(function, 1));
                T x = resolve(arguments.get(0));
                yield evaluate(function + "(" + x + ")", () -> f.apply(x));
            }
            case 2 -> {
                var f = functions.binary(function).orElseThrow(() -> unknownFunction(function, 2));
                T x = resolve(arguments.get(0));
                T y = resolve(arguments.get(1));
                yield evaluate(function + "(" + x + ", " + y + ")", () -> f.apply(x, y));
            }
            default -> throw unknownFunction(function, arguments.size());
        };
        return Symbol.value(result);
    }

    private T evaluate(String what, Supplier<T> computation) {
        try {
            return computation.get();
        } catch (ArithmeticException | IllegalArgumentException e) {
            throw new ExpressionError(ExpressionErrorCode.ARITHMETIC_ERROR,
                    "Cannot evaluate " + what + ": " + e.getMessage(), e);
        }
    }

    private static ExpressionError unknownFunction(String name, int arity) {
        return new ExpressionError(ExpressionErrorCode.UNKNOWN_FUNCTION,
                "Unknown function \"" + name + "\" taking " + arity + (arity == 1 ? " argument." : " arguments."));
    }
}
