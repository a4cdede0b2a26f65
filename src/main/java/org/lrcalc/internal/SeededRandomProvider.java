package org.lrcalc.internal;

import org.apache.commons.math3.random.RandomDataGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.lrcalc.spi.IRandomProvider;

import java.nio.charset.StandardCharsets;

/**
 * Default implementation of {@link IRandomProvider} backed by Apache Commons Math {@link Well19937c}.
 * <p>
 * Every draw is synchronized on the provider, which makes the process-wide instance returned by
 * {@link #shared()} usable from engines evaluating on different threads.
 * </p>
 * <p>
 * Supports deterministic derivation of child providers using a stable hashing scheme.
 * </p>
 */
public final class SeededRandomProvider implements IRandomProvider {

    private final long seed;
    private final Well19937c rng;
    private final RandomDataGenerator data;

    /**
     * Creates a new seeded random provider.
     * @param seed The initial seed for the random number generator.
     */
    public SeededRandomProvider(long seed) {
        this.seed = seed;
        this.rng = new Well19937c(seed);
        this.data = new RandomDataGenerator(rng);
    }

    /**
     * Returns the provider shared by every engine that was not given its own.
     * It is seeded once per process from the system clock.
     *
     * @return the process-wide provider
     */
    public static SeededRandomProvider shared() {
        return SharedHolder.INSTANCE;
    }

    /**
     * @return the seed this provider was created with
     */
    public long getSeed() {
        return seed;
    }

    @Override
    public synchronized double nextDouble() {
        return rng.nextDouble();
    }

    @Override
    public synchronized double nextDouble(double min, double max) {
        checkRange(min <= max, min, max);
        if (min == max) {
            return min;
        }
        return data.nextUniform(min, max);
    }

    @Override
    public synchronized int nextInt() {
        return rng.nextInt();
    }

    @Override
    public synchronized int nextInt(int min, int max) {
        checkRange(min <= max, min, max);
        if (min == max) {
            return min;
        }
        return data.nextInt(min, max);
    }

    @Override
    public synchronized long nextLong() {
        return rng.nextLong();
    }

    @Override
    public synchronized long nextLong(long min, long max) {
        checkRange(min <= max, min, max);
        if (min == max) {
            return min;
        }
        return data.nextLong(min, max);
    }

    @Override
    public IRandomProvider deriveFor(String scope, long key) {
        long h = mix64(seed);
        h = mix64(h ^ mix64(hashString(scope)));
        h = mix64(h ^ mix64(key));
        return new SeededRandomProvider(h);
    }

    private static void checkRange(boolean ordered, Number min, Number max) {
        if (!ordered) {
            throw new IllegalArgumentException("Lower bound " + min + " is greater than upper bound " + max + ".");
        }
    }

    /**
     * Hashes a string using the FNV-1a 64-bit algorithm.
     * @param s The string to hash.
     * @return The hashed value.
     */
    private static long hashString(String s) {
        if (s == null) return 0L;
        byte[] b = s.getBytes(StandardCharsets.UTF_8);
        long h = 1469598103934665603L; // FNV-1a 64-bit offset basis
        for (byte value : b) {
            h ^= (value & 0xFF);
            h *= 1099511628211L; // FNV-1a prime
        }
        return h;
    }

    /**
     * A SplitMix64 mix function for good bit diffusion.
     * @param z The value to mix.
     * @return The mixed value.
     */
    private static long mix64(long z) {
        z = (z ^ (z >>> 33)) * 0xff51afd7ed558ccdL;
        z = (z ^ (z >>> 33)) * 0xc4ceb9fe1a85ec53L;
        return z ^ (z >>> 33);
    }

    private static final class SharedHolder {
        private static final SeededRandomProvider INSTANCE =
                new SeededRandomProvider(mix64(System.nanoTime() ^ System.currentTimeMillis()));
    }
}
