package org.bankreserves.runtime.internal.services;

import org.apache.commons.math3.random.RandomAdaptor;
import org.apache.commons.math3.random.Well19937c;
import org.bankreserves.runtime.spi.IRandomProvider;

import java.util.Random;

/**
 * Default implementation of {@link IRandomProvider} backed by Apache Commons Math {@link Well19937c}.
 * <p>
 * Every draw of a simulation (scheduling order, movement and trade decisions) goes through a
 * single instance, so the consumption order is fixed per step and runs are reproducible.
 * </p>
 */
public final class SeededRandomProvider implements IRandomProvider {

    private final long seed;
    private final Well19937c rng;
    private final Random javaRandom;

    /**
     * Creates a new seeded random provider.
     * @param seed The initial seed for the random number generator.
     */
    public SeededRandomProvider(long seed) {
        this.seed = seed;
        this.rng = new Well19937c(seed);
        // Wrap once so shuffles and direct draws share the same underlying stream
        this.javaRandom = new RandomAdaptor(rng);
    }

    @Override
    public int nextInt(int bound) {
        return rng.nextInt(bound);
    }

    @Override
    public boolean nextBoolean() {
        return rng.nextInt(2) == 0;
    }

    @Override
    public Random asJavaRandom() {
        return javaRandom;
    }

    @Override
    public long getSeed() {
        return seed;
    }
}
