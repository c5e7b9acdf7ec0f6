package com.phillippitts.retroauto.dsl.ast;

/** Marker for expression nodes. */
public interface Expression {
}
