package com.phillippitts.retroauto.dsl.ast;

import java.util.List;

public record TupleExpr(List<Expression> items) implements Expression {
    public TupleExpr {
        items = List.copyOf(items);
    }
}
