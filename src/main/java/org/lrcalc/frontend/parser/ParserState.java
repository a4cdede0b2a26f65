package org.lrcalc.frontend.parser;

/**
 * The LR items of the expression automaton. Each item is implemented by one procedure of
 * {@link Parser}; the constant names the procedure in transition errors.
 */
public enum ParserState {
    START("start -> •expr"),
    AFTER_EXPR("start -> expr•"),

    UNARY_AFTER_OP("expr -> ± •expr"),
    AFTER_UNARY("expr -> ± expr•"),

    ADD_AFTER_OP("expr -> expr ± •expr"),
    AFTER_ADD("expr -> expr ± expr•"),

    MUL_AFTER_OP("expr -> expr * •expr"),
    AFTER_MUL("expr -> expr * expr•"),

    POW_AFTER_OP("expr -> expr ^ •expr"),
    AFTER_POW("expr -> expr ^ expr•"),

    AFTER_BRACKET("expr -> ( •expr )"),
    BRACKET_AFTER_EXPR("expr -> ( expr •)"),
    AFTER_BRACKET_EXPR("expr -> ( expr )•"),

    AFTER_NUMBER("expr -> number•"),
    AFTER_IDENT("expr -> ident•"),

    ASSIGN_AFTER_IDENT("expr -> ident = •expr"),
    AFTER_ASSIGN("expr -> ident = expr•"),

    CALL_AFTER_IDENT("expr -> ident ( •)"),
    AFTER_CALL_0ARGS("expr -> ident ( )•"),
    CALL_AFTER_ARG("expr -> ident ( expr •)"),
    AFTER_CALL_1ARG("expr -> ident ( expr )•"),
    CALL_AFTER_COMMA("expr -> ident ( expr , •expr )"),
    CALL_AFTER_ARG2("expr -> ident ( expr , expr •)"),
    AFTER_CALL_2ARGS("expr -> ident ( expr , expr )•");

    private final String item;

    ParserState(String item) {
        this.item = item;
    }

    /**
     * @return The grammar item with its cursor, e.g. {@code "expr -> expr ^ •expr"}.
     */
    public String item() {
        return item;
    }

    /**
     * @return {@code true} if the cursor is at the end of the item, i.e. a complete operand precedes the look-ahead.
     */
    public boolean isComplete() {
        return item.endsWith("•");
    }
}
