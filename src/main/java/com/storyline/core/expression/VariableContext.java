package com.storyline.core.expression;

import java.util.Map;
import java.util.Optional;

/**
 * Host-supplied variables visible to guard expressions.
 */
@FunctionalInterface
public interface VariableContext {

    Optional<Object> lookup(String name);

    static VariableContext empty() {
        return name -> Optional.empty();
    }

    static VariableContext of(Map<String, ?> variables) {
        var copy = Map.copyOf(variables);
        return name -> Optional.ofNullable(copy.get(name));
    }
}
