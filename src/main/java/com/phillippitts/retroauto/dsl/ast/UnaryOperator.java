package com.phillippitts.retroauto.dsl.ast;

public enum UnaryOperator {
    NOT("!"), NEGATE("-");

    private final String symbol;

    UnaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
