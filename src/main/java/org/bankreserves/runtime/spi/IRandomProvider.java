package org.bankreserves.runtime.spi;

import java.util.Random;

/**
 * Provides deterministic randomness scoped to a single Simulation.
 * Implementations must be pure with respect to the provided seed so that two
 * simulations built from the same seed consume identical sequences.
 */
public interface IRandomProvider {

    /**
     * Returns a random integer in the range [0, bound).
     *
     * @param bound exclusive upper bound, must be > 0
     * @return the random int
     */
    int nextInt(int bound);

    /**
     * Returns the outcome of a fair coin flip.
     *
     * @return true with probability 0.5
     */
    boolean nextBoolean();

    /**
     * Provides access to an underlying {@link Random} instance for APIs that require it
     * (e.g., {@code Collections.shuffle}). The returned instance draws from the same stream.
     *
     * @return the Random instance
     */
    Random asJavaRandom();

    /**
     * @return the seed this provider was created with
     */
    long getSeed();
}
