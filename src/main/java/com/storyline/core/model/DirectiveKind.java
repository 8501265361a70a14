package com.storyline.core.model;

/**
 * How a directive chooses its output branch.
 */
public enum DirectiveKind {
    CONDITIONAL,
    STOPPING,   // repeats the last branch once the sequence runs out
    CYCLE,
    SHUFFLE,
    ONCE_ONLY;

    public boolean isList() {
        return this != CONDITIONAL;
    }
}
