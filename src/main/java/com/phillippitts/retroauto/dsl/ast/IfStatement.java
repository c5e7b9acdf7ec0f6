package com.phillippitts.retroauto.dsl.ast;

import java.util.List;

/**
 * {@code if} with any number of {@code elif} branches and an optional {@code else} body.
 * The first branch is the {@code if} itself; an empty else body means no else.
 */
public record IfStatement(List<ConditionalBranch> branches, List<Statement> elseBody) implements Statement {
    public IfStatement {
        if (branches.isEmpty()) {
            throw new IllegalArgumentException("if needs at least one branch");
        }
        branches = List.copyOf(branches);
        elseBody = List.copyOf(elseBody);
    }
}
