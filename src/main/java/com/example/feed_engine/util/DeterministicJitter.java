package com.example.feed_engine.util;

/**
 * Stable pseudo-random offset derived from an identifier.
 * <p>
 * Uses the 31-multiplier rolling hash over UTF-16 code units (the same value as
 * {@link String#hashCode()}), read as unsigned, reduced modulo 1000 and rescaled
 * to {@code [-amplitude, amplitude)}.
 */
public final class DeterministicJitter {
    public static final double DEFAULT_AMPLITUDE = 0.05;

    private DeterministicJitter() {
    }

    public static double of(String seed) {
        return of(seed, DEFAULT_AMPLITUDE);
    }

    public static double of(String seed, double amplitude) {
        String s = seed == null ? "" : seed;
        long unsigned = Integer.toUnsignedLong(s.hashCode());
        double normalized = (unsigned % 1000) / 1000.0;
        return (normalized - 0.5) * 2 * amplitude;
    }
}
