package com.phillippitts.retroauto.dsl.ast;

/** Jump to a label of the same flow. */
public record GotoStatement(String label) implements Statement {
}
