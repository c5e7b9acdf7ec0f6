package com.phillippitts.retroauto.dsl.ast;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Vision query {@code image(asset, region=(x, y, w, h), threshold=0.9)}; evaluates to a bool.
 */
public record ImageQuery(Expression asset, Map<String, Expression> options) implements Expression {

    public static final Set<String> OPTIONS = Set.of("region", "threshold");

    public ImageQuery {
        options = Collections.unmodifiableMap(new LinkedHashMap<>(options));
    }
}
