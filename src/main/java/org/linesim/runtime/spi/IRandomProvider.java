package org.linesim.runtime.spi;

import java.util.Random;

/**
 * Provides deterministic randomness scoped to a Simulation.
 * Implementations should be pure with respect to the provided seed and
 * support derivation of child providers for independent sub-streams.
 * <p>
 * The engine never owns a global random state. Everything that needs random numbers,
 * including the event tie-breaks of the clock, receives a provider explicitly.
 * </p>
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
     * Returns a random double in the range [0.0, 1.0).
     *
     * @return the random double
     */
    double nextDouble();

    /**
     * Provides access to an underlying {@link Random} instance for APIs that require it
     * (e.g., {@code Collections.shuffle}).
     *
     * @return the Random instance
     */
    Random asJavaRandom();

    /**
     * Creates a derived provider that is deterministically based on this provider and the given scope/key.
     * Use this to create independent sub-streams (e.g., one for the clock, one per failure model).
     *
     * @param scope a stable, descriptive scope name (e.g., "clock", "failures")
     * @param key a stable numeric key (e.g., device id)
     * @return a derived random provider
     */
    IRandomProvider deriveFor(String scope, long key);
}
