package com.phillippitts.retroauto.dsl.ast;

/** Marker for statement nodes. */
public interface Statement {
}
