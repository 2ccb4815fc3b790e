package edu.brandeis.cosi103a.rankings.util;

import java.util.List;

/**
 * Small mulberry32 generator. Same seed, same sequence, on every platform.
 */
public final class SeededRandom {

    private int state;

    public SeededRandom(long seed) {
        this.state = (int) seed;
    }

    /**
     * Creates a generator seeded from the FNV-1a hash of a string.
     */
    public static SeededRandom fromString(String seed) {
        return new SeededRandom(DeterministicHash.fnv1a(seed));
    }

    /**
     * Returns the next value in [0, 1).
     */
    public double nextDouble() {
        state += 0x6D2B79F5;
        int t = state;
        int r = (t ^ (t >>> 15)) * (1 | t);
        r ^= r + (r ^ (r >>> 7)) * (61 | r);
        return Integer.toUnsignedLong(r ^ (r >>> 14)) / 4294967296.0;
    }

    /**
     * Fisher-Yates shuffle in place.
     */
    public <T> void shuffle(List<T> items) {
        for (int i = items.size() - 1; i > 0; i--) {
            int j = (int) Math.floor(nextDouble() * (i + 1));
            T tmp = items.get(i);
            items.set(i, items.get(j));
            items.set(j, tmp);
        }
    }
}
