package com.phillippitts.retroauto.dsl.ast;

/**
 * Binary operators with their source symbol and binding strength (higher binds tighter).
 */
public enum BinaryOperator {
    OR("||", 1),
    AND("&&", 2),
    EQ("==", 3), NEQ("!=", 3),
    LT("<", 4), LE("<=", 4), GT(">", 4), GE(">=", 4),
    ADD("+", 5), SUB("-", 5),
    MUL("*", 6), DIV("/", 6), MOD("%", 6);

    private final String symbol;
    private final int precedence;

    BinaryOperator(String symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
    }

    public String symbol() {
        return symbol;
    }

    public int precedence() {
        return precedence;
    }
}
