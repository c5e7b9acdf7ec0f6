package com.phillippitts.retroauto.dsl.ast;

public record LabelStatement(String name) implements Statement {
}
