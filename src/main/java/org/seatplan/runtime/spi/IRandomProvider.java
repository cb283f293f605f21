package org.seatplan.runtime.spi;

import java.util.Random;

/**
 * Provides deterministic randomness scoped to one annealing run.
 * Implementations should be pure with respect to the provided seed and
 * support derivation of child providers for independent sub-streams.
 * <p>
 * A provider is not thread-safe. Each chain of the replica ladder owns its own
 * derived provider, so no two tasks ever draw from the same stream.
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
     * Use this to create independent sub-streams (e.g., per ladder level).
     *
     * @param scope a stable, descriptive scope name (e.g., "chain", "initialisation")
     * @param key a stable numeric key (e.g., ladder level index)
     * @return a derived random provider
     */
    IRandomProvider deriveFor(String scope, long key);
}
