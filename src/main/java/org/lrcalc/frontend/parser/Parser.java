package org.lrcalc.frontend.parser;

import org.lrcalc.api.ExpressionErrorCode;
import org.lrcalc.frontend.ExpressionError;
import org.lrcalc.frontend.lexer.Lexer;
import org.lrcalc.frontend.lexer.Token;
import org.lrcalc.frontend.lexer.TokenType;
import org.lrcalc.frontend.semantics.SemanticActions;
import org.lrcalc.frontend.semantics.Symbol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * LR(1) parser for arithmetic expressions, implemented by recursive ascent.
 * <p>
 * Every LR item ({@link ParserState}) is one method. Shifting a token pushes its symbol, reads the
 * next look-ahead and calls the method of the successor item, so the Java call stack plays the role
 * of the automaton's state stack. Reducing a production with <i>n</i> symbols on its right-hand
 * side therefore has to pop <i>n</i> states: the reducing method sets {@code unwind} to <i>n</i>,
 * and every method decrements it once on return. Methods that wait for a complete {@code expr}
 * (the "goto" on the nonterminal) loop while {@code unwind} is zero, i.e. while control has come
 * back to them after a reduction.
 * <p>
 * Semantic actions run during the reductions, so the value of the expression is known as soon as
 * it is accepted. A parser instance evaluates one expression and is not reused.
 *
 * @param <T> The numeric value type.
 */
public class Parser<T extends Number> {

    private static final Logger LOG = LoggerFactory.getLogger(Parser.class);

    /** Look-ahead terminals on which a complete {@code expr} is reduced. */
    private static final Set<TokenType> EXPR_FOLLOW = EnumSet.of(
            TokenType.PLUS, TokenType.MINUS, TokenType.STAR, TokenType.SLASH, TokenType.PERCENT,
            TokenType.CARET, TokenType.COMMA, TokenType.RIGHT_PAREN, TokenType.END);

    private final Lexer lexer;
    private final SemanticActions<T> actions;
    private final String expression;

    private final Deque<Symbol<T>> symbols = new ArrayDeque<>();
    private Token lookahead;
    private int unwind = 0;
    private boolean accepted = false;

    /**
     * Constructs a new Parser.
     * @param lexer The lexer delivering the tokens of the expression.
     * @param actions The semantic actions run on reductions.
     * @param expression The full expression text, quoted in error messages.
     */
    public Parser(Lexer lexer, SemanticActions<T> actions, String expression) {
        this.lexer = lexer;
        this.actions = actions;
        this.expression = expression;
    }

    /**
     * Runs the automaton over the whole expression.
     *
     * @return The single symbol left on the stack if the expression was accepted, otherwise empty.
     * @throws ExpressionError if a token has no transition, or a semantic action fails.
     */
    public Optional<Symbol<T>> parse() {
        symbols.clear();
        lookahead = null;
        unwind = 0;
        accepted = false;

        nextLookahead();
        start();

        if (accepted && symbols.size() == 1) {
            return Optional.of(symbols.peek());
        }
        return Optional.empty();
    }

    /**
     * @return {@code true} if the last run reached the accepting state.
     */
    public boolean isAccepted() {
        return accepted;
    }

    // region Shift helpers

    /**
     * Shifts a token that can begin an {@code expr}: a sign, an opening bracket, a number or an identifier.
     * @return {@code false} if the look-ahead cannot begin an {@code expr}.
     */
    private boolean shiftOperand() {
        Token token = lookahead;
        switch (token.type()) {
            case PLUS, MINUS -> {
                nextLookahead();
                unaryAfterOp(token.type());
            }
            case LEFT_PAREN -> {
                nextLookahead();
                afterBracket();
            }
            case NUMBER -> {
                symbols.push(Symbol.value(numberValue(token)));
                nextLookahead();
                afterNumber();
            }
            case IDENTIFIER -> {
                symbols.push(Symbol.name(token.text()));
                nextLookahead();
                afterIdent();
            }
            default -> {
                return false;
            }
        }
        return true;
    }

    /**
     * Shifts a binary operator following a complete {@code expr}.
     * @return {@code false} if the look-ahead is not a binary operator.
     */
    private boolean shiftBinaryOperator() {
        TokenType operator = lookahead.type();
        switch (operator) {
            case PLUS, MINUS -> {
                nextLookahead();
                addAfterOp(operator);
            }
            case STAR, SLASH, PERCENT -> {
                nextLookahead();
                mulAfterOp(operator);
            }
            case CARET -> {
                nextLookahead();
                powAfterOp();
            }
            default -> {
                return false;
            }
        }
        return true;
    }

    // endregion

    // region States

    /** start -> •expr */
    private void start() {
        if (!shiftOperand()) {
            transitionError(ParserState.START);
        }
        while (unwind == 0 && !accepted) {
            afterExpr();
        }
        unwindFrame();
    }

    /** start -> expr• */
    private void afterExpr() {
        if (!shiftBinaryOperator()) {
            if (lookahead.type() == TokenType.END) {
                accepted = true;
            } else {
                transitionError(ParserState.AFTER_EXPR);
            }
        }
        unwindFrame();
    }

    /** expr -> + •expr, expr -> - •expr */
    private void unaryAfterOp(TokenType operator) {
        if (!shiftOperand()) {
            transitionError(ParserState.UNARY_AFTER_OP);
        }
        while (unwind == 0 && !accepted) {
            afterUnary(operator);
        }
        unwindFrame();
    }

    /** expr -> + expr•, expr -> - expr• */
    private void afterUnary(TokenType operator) {
        // shifts * / % ^ before reducing, so a sign binds looser than them: -2^2 = -(2^2)
        TokenType type = lookahead.type();
        switch (type) {
            case STAR, SLASH, PERCENT -> {
                nextLookahead();
                mulAfterOp(type);
            }
            case CARET -> {
                nextLookahead();
                powAfterOp();
            }
            case PLUS, MINUS, COMMA, RIGHT_PAREN, END -> {
                Symbol<T> operand = symbols.pop();
                reduce(2, actions.unary(operator, operand));
            }
            default -> transitionError(ParserState.AFTER_UNARY);
        }
        unwindFrame();
    }

    /** expr -> expr + •expr, expr -> expr - •expr */
    private void addAfterOp(TokenType operator) {
        if (!shiftOperand()) {
            transitionError(ParserState.ADD_AFTER_OP);
        }
        while (unwind == 0 && !accepted) {
            afterAdd(operator);
        }
        unwindFrame();
    }

    /** expr -> expr + expr•, expr -> expr - expr• */
    private void afterAdd(TokenType operator) {
        TokenType type = lookahead.type();
        switch (type) {
            case STAR, SLASH, PERCENT -> {
                nextLookahead();
                mulAfterOp(type);
            }
            case CARET -> {
                nextLookahead();
                powAfterOp();
            }
            case PLUS, MINUS, COMMA, RIGHT_PAREN, END -> reduceBinary(operator);
            default -> transitionError(ParserState.AFTER_ADD);
        }
        unwindFrame();
    }

    /** expr -> expr * •expr, expr -> expr / •expr, expr -> expr % •expr */
    private void mulAfterOp(TokenType operator) {
        if (!shiftOperand()) {
            transitionError(ParserState.MUL_AFTER_OP);
        }
        while (unwind == 0 && !accepted) {
            afterMul(operator);
        }
        unwindFrame();
    }

    /** expr -> expr * expr•, expr -> expr / expr•, expr -> expr % expr• */
    private void afterMul(TokenType operator) {
        switch (lookahead.type()) {
            case CARET -> {
                nextLookahead();
                powAfterOp();
            }
            case PLUS, MINUS, STAR, SLASH, PERCENT, COMMA, RIGHT_PAREN, END -> reduceBinary(operator);
            default -> transitionError(ParserState.AFTER_MUL);
        }
        unwindFrame();
    }

    /** expr -> expr ^ •expr */
    private void powAfterOp() {
        if (!shiftOperand()) {
            transitionError(ParserState.POW_AFTER_OP);
        }
        while (unwind == 0 && !accepted) {
            afterPow();
        }
        unwindFrame();
    }

    /** expr -> expr ^ expr• */
    private void afterPow() {
        switch (lookahead.type()) {
            // shifting another '^' makes the operator right-associative
            case CARET -> {
                nextLookahead();
                powAfterOp();
            }
            case PLUS, MINUS, STAR, SLASH, PERCENT, COMMA, RIGHT_PAREN, END -> reduceBinary(TokenType.CARET);
            default -> transitionError(ParserState.AFTER_POW);
        }
        unwindFrame();
    }

    /** expr -> ( •expr ) */
    private void afterBracket() {
        if (!shiftOperand()) {
            transitionError(ParserState.AFTER_BRACKET);
        }
        while (unwind == 0 && !accepted) {
            bracketAfterExpr();
        }
        unwindFrame();
    }

    /** expr -> ( expr •) */
    private void bracketAfterExpr() {
        if (!shiftBinaryOperator()) {
            if (lookahead.type() == TokenType.RIGHT_PAREN) {
                nextLookahead();
                afterBracketExpr();
            } else {
                transitionError(ParserState.BRACKET_AFTER_EXPR);
            }
        }
        unwindFrame();
    }

    /** expr -> ( expr )• */
    private void afterBracketExpr() {
        if (EXPR_FOLLOW.contains(lookahead.type())) {
            Symbol<T> operand = symbols.pop();
            reduce(3, actions.group(operand));
        } else {
            transitionError(ParserState.AFTER_BRACKET_EXPR);
        }
        unwindFrame();
    }

    /** expr -> number• */
    private void afterNumber() {
        if (EXPR_FOLLOW.contains(lookahead.type())) {
            reduce(1, symbols.pop());
        } else {
            transitionError(ParserState.AFTER_NUMBER);
        }
        unwindFrame();
    }

    /** expr -> ident•, expr -> ident •= expr, expr -> ident •( ... ) */
    private void afterIdent() {
        TokenType type = lookahead.type();
        if (type == TokenType.EQUALS) {
            nextLookahead();
            assignAfterIdent();
        } else if (type == TokenType.LEFT_PAREN) {
            nextLookahead();
            callAfterIdent();
        } else if (EXPR_FOLLOW.contains(type)) {
            // the name stays unresolved until an action needs its value
            reduce(1, symbols.pop());
        } else {
            transitionError(ParserState.AFTER_IDENT);
        }
        unwindFrame();
    }

    /** expr -> ident = •expr */
    private void assignAfterIdent() {
        if (!shiftOperand()) {
            transitionError(ParserState.ASSIGN_AFTER_IDENT);
        }
        while (unwind == 0 && !accepted) {
            afterAssign();
        }
        unwindFrame();
    }

    /** expr -> ident = expr• */
    private void afterAssign() {
        if (!shiftBinaryOperator()) {
            TokenType type = lookahead.type();
            if (type == TokenType.COMMA || type == TokenType.RIGHT_PAREN || type == TokenType.END) {
                Symbol<T> value = symbols.pop();
                Symbol<T> target = symbols.pop();
                reduce(3, actions.assign(target, value));
            } else {
                transitionError(ParserState.AFTER_ASSIGN);
            }
        }
        unwindFrame();
    }

    /** expr -> ident ( •), expr -> ident ( •expr ), expr -> ident ( •expr , expr ) */
    private void callAfterIdent() {
        if (lookahead.type() == TokenType.RIGHT_PAREN) {
            nextLookahead();
            afterCall0Args();
        } else if (!shiftOperand()) {
            transitionError(ParserState.CALL_AFTER_IDENT);
        }
        while (unwind == 0 && !accepted) {
            callAfterArg();
        }
        unwindFrame();
    }

    /** expr -> ident ( )• */
    private void afterCall0Args() {
        if (EXPR_FOLLOW.contains(lookahead.type())) {
            Symbol<T> callee = symbols.pop();
            reduce(3, actions.call(callee, List.of()));
        } else {
            transitionError(ParserState.AFTER_CALL_0ARGS);
        }
        unwindFrame();
    }

    /** expr -> ident ( expr •), expr -> ident ( expr •, expr ) */
    private void callAfterArg() {
        if (!shiftBinaryOperator()) {
            TokenType type = lookahead.type();
            if (type == TokenType.COMMA) {
                nextLookahead();
                callAfterComma();
            } else if (type == TokenType.RIGHT_PAREN) {
                nextLookahead();
                afterCall1Arg();
            } else {
                transitionError(ParserState.CALL_AFTER_ARG);
            }
        }
        unwindFrame();
    }

    /** expr -> ident ( expr )• */
    private void afterCall1Arg() {
        if (EXPR_FOLLOW.contains(lookahead.type())) {
            Symbol<T> argument = symbols.pop();
            Symbol<T> callee = symbols.pop();
            reduce(4, actions.call(callee, List.of(argument)));
        } else {
            transitionError(ParserState.AFTER_CALL_1ARG);
        }
        unwindFrame();
    }

    /** expr -> ident ( expr , •expr ) */
    private void callAfterComma() {
        if (!shiftOperand()) {
            transitionError(ParserState.CALL_AFTER_COMMA);
        }
        while (unwind == 0 && !accepted) {
            callAfterArg2();
        }
        unwindFrame();
    }

    /** expr -> ident ( expr , expr •) */
    private void callAfterArg2() {
        if (!shiftBinaryOperator()) {
            if (lookahead.type() == TokenType.RIGHT_PAREN) {
                nextLookahead();
                afterCall2Args();
            } else {
                transitionError(ParserState.CALL_AFTER_ARG2);
            }
        }
        unwindFrame();
    }

    /** expr -> ident ( expr , expr )• */
    private void afterCall2Args() {
        if (EXPR_FOLLOW.contains(lookahead.type())) {
            Symbol<T> second = symbols.pop();
            Symbol<T> first = symbols.pop();
            Symbol<T> callee = symbols.pop();
            reduce(6, actions.call(callee, List.of(first, second)));
        } else {
            transitionError(ParserState.AFTER_CALL_2ARGS);
        }
        unwindFrame();
    }

    // endregion

    private void reduceBinary(TokenType operator) {
        Symbol<T> right = symbols.pop();
        Symbol<T> left = symbols.pop();
        reduce(3, actions.binary(operator, left, right));
    }

    /**
     * Pushes the left-hand side of a reduced production and requests that the given number of
     * states (the length of the right-hand side) be popped.
     */
    private void reduce(int rhsLength, Symbol<T> result) {
        symbols.push(result);
        unwind = rhsLength;
        LOG.trace("Reduced to {}, unwinding {} states.", result, rhsLength);
    }

    private void unwindFrame() {
        if (unwind > 0) {
            --unwind;
        }
    }

    private void nextLookahead() {
        lookahead = lexer.nextToken();
    }

    @SuppressWarnings("unchecked")
    private T numberValue(Token token) {
        return (T) token.value();
    }

    private void transitionError(ParserState state) {
        if (lookahead.type() == TokenType.INVALID) {
            throw new ExpressionError(ExpressionErrorCode.INVALID_TOKEN,
                    "Invalid input \"" + lookahead.text() + "\" at column " + lookahead.column()
                            + ". Input expression: \"" + expression + "\".");
        }
        if (lookahead.type() == TokenType.EQUALS && state.isComplete()) {
            // only an identifier shifts '='
            throw new ExpressionError(ExpressionErrorCode.ASSIGNMENT_NEEDS_IDENTIFIER,
                    "Assignment needs a variable identifier, found '=' at column " + lookahead.column()
                            + " in state " + state + ". Input expression: \"" + expression + "\".");
        }
        throw new ExpressionError(ExpressionErrorCode.NO_TRANSITION,
                "No transition from " + state + " [" + state.item() + "] and look-ahead terminal "
                        + lookahead.type().describe() + " at column " + lookahead.column()
                        + ". Input expression: \"" + expression + "\".");
    }
}
