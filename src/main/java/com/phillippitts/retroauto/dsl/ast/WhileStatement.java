package com.phillippitts.retroauto.dsl.ast;

import java.util.List;

public record WhileStatement(Expression condition, List<Statement> body) implements Statement {
    public WhileStatement {
        body = List.copyOf(body);
    }
}
