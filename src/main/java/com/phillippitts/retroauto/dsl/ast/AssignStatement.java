package com.phillippitts.retroauto.dsl.ast;

public record AssignStatement(String variable, Expression value) implements Statement {
}
