package com.phillippitts.retroauto.dsl.ast;

import java.util.List;

public record ConditionalBranch(Expression condition, List<Statement> body) {
    public ConditionalBranch {
        body = List.copyOf(body);
    }
}
