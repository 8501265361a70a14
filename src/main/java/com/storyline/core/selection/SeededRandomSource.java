package com.storyline.core.selection;

import java.util.Random;

/**
 * {@link RandomSource} backed by a seeded {@link Random}; the same seed yields the same draws.
 */
public class SeededRandomSource implements RandomSource {

    private final long seed;
    private final Random random;

    public SeededRandomSource(long seed) {
        this.seed = seed;
        this.random = new Random(seed);
    }

    @Override
    public int nextInt(int bound) {
        return random.nextInt(bound);
    }

    public long seed() {
        return seed;
    }
}
