package com.phillippitts.retroauto.dsl.ast;

public record UnaryExpr(UnaryOperator op, Expression operand) implements Expression {
}
