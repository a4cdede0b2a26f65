package org.lrcalc;

import org.lrcalc.api.ExpressionErrorCode;
import org.lrcalc.api.ExpressionException;
import org.lrcalc.api.IExprParser;
import org.lrcalc.diagnostics.Diagnostic;
import org.lrcalc.diagnostics.DiagnosticsEngine;
import org.lrcalc.frontend.ExpressionError;
import org.lrcalc.frontend.lexer.AmbiguityPolicy;
import org.lrcalc.frontend.lexer.Lexer;
import org.lrcalc.frontend.lexer.TokenPattern;
import org.lrcalc.frontend.parser.Parser;
import org.lrcalc.frontend.semantics.SemanticActions;
import org.lrcalc.frontend.semantics.Symbol;
import org.lrcalc.frontend.semantics.SymbolTable;
import org.lrcalc.functions.FunctionRegistry;
import org.lrcalc.internal.SeededRandomProvider;
import org.lrcalc.numeric.NumberType;
import org.lrcalc.numeric.NumberTypes;
import org.lrcalc.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The expression engine. It evaluates one expression per call to {@link #parse(String)} and keeps
 * its variables between calls.
 * <p>
 * The evaluation runs in three phases, all in a single pass over the input:
 * <ol>
 *     <li><b>Lexing:</b> the {@link Lexer} hands out one token at a time.</li>
 *     <li><b>Parsing:</b> the recursive-ascent {@link Parser} consumes the tokens.</li>
 *     <li><b>Evaluation:</b> {@link SemanticActions} compute values while the parser reduces.</li>
 * </ol>
 * An instance is not thread-safe; give each thread its own engine, e.g. with the copy constructor.
 *
 * @param <T> The numeric value type.
 */
public class ExprParser<T extends Number> implements IExprParser<T> {

    private static final Logger LOG = LoggerFactory.getLogger(ExprParser.class);

    private final NumberType<T> numberType;
    private final FunctionRegistry<T> functions;
    private final IRandomProvider random;
    private final AmbiguityPolicy ambiguityPolicy;
    private final List<TokenPattern> patterns;
    private final SymbolTable<T> initialSymbols;
    private final SymbolTable<T> symbols;
    private List<Diagnostic> lastDiagnostics = List.of();

    /**
     * Creates an engine that draws from the shared random provider and warns on lexer ambiguity.
     * @param numberType The value type to compute with.
     */
    public ExprParser(NumberType<T> numberType) {
        this(numberType, SeededRandomProvider.shared(), AmbiguityPolicy.WARN, Map.of());
    }

    /**
     * Creates an engine.
     * @param numberType The value type to compute with.
     * @param random The source for the {@code rand} built-ins.
     * @param ambiguityPolicy What the lexer does when several token families match.
     * @param predefined Variables defined in addition to {@code pi}; they survive {@link #resetVariables()}.
     */
    public ExprParser(NumberType<T> numberType, IRandomProvider random, AmbiguityPolicy ambiguityPolicy,
                      Map<String, T> predefined) {
        this.numberType = Objects.requireNonNull(numberType, "numberType");
        this.random = Objects.requireNonNull(random, "random");
        this.ambiguityPolicy = Objects.requireNonNull(ambiguityPolicy, "ambiguityPolicy");
        this.functions = FunctionRegistry.initialize(numberType, random);
        this.patterns = Lexer.defaultPatterns(numberType);

        this.initialSymbols = new SymbolTable<>();
        initialSymbols.assign("pi", numberType.fromDouble(Math.PI));
        predefined.forEach(initialSymbols::assign);
        this.symbols = new SymbolTable<>(initialSymbols);
    }

    /**
     * Creates an independent engine with a copy of another engine's variables.
     * The function registry and the random provider are shared.
     * @param other The engine to copy.
     */
    public ExprParser(ExprParser<T> other) {
        this.numberType = other.numberType;
        this.random = other.random;
        this.ambiguityPolicy = other.ambiguityPolicy;
        this.functions = other.functions;
        this.patterns = other.patterns;
        this.initialSymbols = new SymbolTable<>(other.initialSymbols);
        this.symbols = new SymbolTable<>(other.symbols);
    }

    /** @return A new engine computing with doubles. */
    public static ExprParser<Double> forDouble() {
        return new ExprParser<>(NumberTypes.DOUBLE);
    }

    /** @return A new engine computing with 32-bit integers. */
    public static ExprParser<Integer> forInteger() {
        return new ExprParser<>(NumberTypes.INTEGER);
    }

    /** @return A new engine computing with 64-bit integers. */
    public static ExprParser<Long> forLong() {
        return new ExprParser<>(NumberTypes.LONG);
    }

    @Override
    public T parse(String expression) throws ExpressionException {
        Objects.requireNonNull(expression, "expression");
        LOG.debug("Evaluating \"{}\".", expression);

        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        Lexer lexer = new Lexer(expression, patterns, diagnostics, ambiguityPolicy);
        SemanticActions<T> actions = new SemanticActions<>(numberType, symbols, functions);
        Parser<T> parser = new Parser<>(lexer, actions, expression);

        try {
            Optional<Symbol<T>> result = parser.parse();
            if (result.isEmpty()) {
                throw new ExpressionError(ExpressionErrorCode.NOT_ACCEPTED,
                        "Expression was not accepted: \"" + expression + "\".");
            }
            T value = actions.resolve(result.get());
            LOG.debug("\"{}\" = {}", expression, value);
            return value;
        } catch (ExpressionError e) {
            LOG.debug("Failed to evaluate \"{}\": {}", expression, e.getMessage());
            throw new ExpressionException(e.getCode(), e.getMessage(), expression, e);
        } finally {
            lastDiagnostics = diagnostics.getDiagnostics().stream()
                    .filter(d -> d.type() == Diagnostic.Type.WARNING)
                    .toList();
        }
    }

    @Override
    public Optional<T> getVariable(String name) {
        return symbols.get(name);
    }

    @Override
    public void setVariable(String name, T value) {
        symbols.assign(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
    }

    @Override
    public Map<String, T> getVariables() {
        return symbols.snapshot();
    }

    @Override
    public void resetVariables() {
        symbols.replaceWith(initialSymbols);
    }

    @Override
    public List<Diagnostic> getDiagnostics() {
        return lastDiagnostics;
    }

    @Override
    public NumberType<T> numberType() {
        return numberType;
    }
}
