package com.phillippitts.retroauto.dsl;

public record Token(TokenType type, String lexeme, int line, int col) {

    @Override
    public String toString() {
        return type + "('" + lexeme + "') @" + line + ":" + col;
    }
}
