package com.phillippitts.retroauto.dsl.ast;

import com.phillippitts.retroauto.domain.ActionKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Call of a primitive action, e.g. {@code click(100, 200, button="right")}.
 * The kind is resolved by the parser; arguments stay unevaluated until execution.
 */
public record ActionCall(ActionKind kind, List<Expression> args, Map<String, Expression> options)
        implements Statement {

    public ActionCall {
        args = List.copyOf(args);
        options = Collections.unmodifiableMap(new LinkedHashMap<>(options));
    }
}
