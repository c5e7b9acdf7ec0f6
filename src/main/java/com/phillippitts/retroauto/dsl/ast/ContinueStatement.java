package com.phillippitts.retroauto.dsl.ast;

public record ContinueStatement() implements Statement {
}
