package com.phillippitts.retroauto.dsl.ast;

import java.util.List;

/** Named, reusable sequence of statements. */
public record Flow(String name, List<Statement> body) {
    public Flow {
        body = List.copyOf(body);
    }
}
