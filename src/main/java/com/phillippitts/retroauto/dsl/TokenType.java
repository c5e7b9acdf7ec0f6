package com.phillippitts.retroauto.dsl;

public enum TokenType {
    // literals
    INTEGER, FLOAT, STRING, DURATION, TRUE, FALSE,

    // names
    IDENTIFIER,
    VARIABLE,   // $name
    SECTION,    // @name

    // keywords
    IF, ELIF, ELSE, END, LOOP, WHILE, LABEL, GOTO, RUN, BREAK, CONTINUE,

    // operators
    PLUS, MINUS, STAR, SLASH, PERCENT,
    EQ, NEQ, LT, GT, LE, GE,
    AND, OR, NOT,
    ASSIGN, ARROW,

    // delimiters
    LPAREN, RPAREN, COMMA, COLON,

    NEWLINE, EOF
}
