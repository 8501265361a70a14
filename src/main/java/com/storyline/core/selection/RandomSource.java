package com.storyline.core.selection;

/**
 * Source of randomness for shuffle directives. Injected so that tests and replays are deterministic.
 */
@FunctionalInterface
public interface RandomSource {

    /**
     * @return a value in {@code [0, bound)}
     */
    int nextInt(int bound);
}
