package com.storyline.core.state;

/**
 * Lifecycle of a list directive instance.
 */
public enum DirectivePhase {
    UNVISITED,
    ACTIVE,
    EXHAUSTED   // terminal, only reachable by ONCE_ONLY
}
