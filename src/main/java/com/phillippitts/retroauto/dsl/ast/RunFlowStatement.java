package com.phillippitts.retroauto.dsl.ast;

public record RunFlowStatement(String flowName) implements Statement {
}
