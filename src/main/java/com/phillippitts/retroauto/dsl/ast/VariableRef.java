package com.phillippitts.retroauto.dsl.ast;

/** Read of a global variable, written {@code $name} in source. */
public record VariableRef(String name) implements Expression {
}
