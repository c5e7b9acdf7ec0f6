package com.phillippitts.retroauto.dsl.ast;

public record BreakStatement() implements Statement {
}
