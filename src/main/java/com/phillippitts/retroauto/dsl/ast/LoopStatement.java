package com.phillippitts.retroauto.dsl.ast;

import java.util.List;

/**
 * Counted loop. A {@code null} count (or a count evaluating to 0) loops until stopped.
 */
public record LoopStatement(Expression count, List<Statement> body) implements Statement {
    public LoopStatement {
        body = List.copyOf(body);
    }
}
