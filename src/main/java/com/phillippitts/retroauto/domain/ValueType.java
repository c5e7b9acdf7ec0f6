package com.phillippitts.retroauto.domain;

/** Runtime type of a script {@link Value}. */
public enum ValueType {
    INT, FLOAT, STRING, BOOL, DURATION, LIST
}
