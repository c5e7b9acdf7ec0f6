package com.phillippitts.retroauto.dsl.ast;

public record BinaryExpr(BinaryOperator op, Expression left, Expression right) implements Expression {
}
