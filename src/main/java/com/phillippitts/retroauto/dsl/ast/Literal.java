package com.phillippitts.retroauto.dsl.ast;

import com.phillippitts.retroauto.domain.Value;

import java.util.Objects;

public record Literal(Value value) implements Expression {
    public Literal {
        Objects.requireNonNull(value, "value");
    }
}
