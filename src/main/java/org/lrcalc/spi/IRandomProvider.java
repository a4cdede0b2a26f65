package org.lrcalc.spi;

/**
 * Provides the randomness behind the {@code rand} built-ins.
 * <p>
 * Engines share one process-wide provider unless they are given their own, so implementations
 * used as the shared provider must be safe for concurrent use.
 */
public interface IRandomProvider {

    /**
     * Returns a random double in the range [0.0, 1.0).
     *
     * @return the random double
     */
    double nextDouble();

    /**
     * Returns a random double in the range [min, max). Returns {@code min} if both bounds are equal.
     *
     * @param min inclusive lower bound
     * @param max exclusive upper bound
     * @return the random double
     * @throws IllegalArgumentException if {@code min > max}
     */
    double nextDouble(double min, double max);

    /**
     * Returns a random int drawn uniformly from the whole int range.
     *
     * @return the random int
     */
    int nextInt();

    /**
     * Returns a random int in the range [min, max].
     *
     * @param min inclusive lower bound
     * @param max inclusive upper bound
     * @return the random int
     * @throws IllegalArgumentException if {@code min > max}
     */
    int nextInt(int min, int max);

    /**
     * Returns a random long drawn uniformly from the whole long range.
     *
     * @return the random long
     */
    long nextLong();

    /**
     * Returns a random long in the range [min, max].
     *
     * @param min inclusive lower bound
     * @param max inclusive upper bound
     * @return the random long
     * @throws IllegalArgumentException if {@code min > max}
     */
    long nextLong(long min, long max);

    /**
     * Creates a derived provider that is deterministically based on this provider and the given scope/key.
     * Use this to give each thread or engine its own independent stream.
     *
     * @param scope a stable, descriptive scope name (e.g., "worker")
     * @param key a stable numeric key (e.g., a worker index)
     * @return a derived random provider
     */
    IRandomProvider deriveFor(String scope, long key);
}
