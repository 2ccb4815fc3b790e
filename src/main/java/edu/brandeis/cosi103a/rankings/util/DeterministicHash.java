package edu.brandeis.cosi103a.rankings.util;

/**
 * 32-bit FNV-1a string hash used to break otherwise unordered ties reproducibly.
 * Not a security primitive.
 */
public final class DeterministicHash {

    private static final int OFFSET_BASIS = 0x811c9dc5;
    private static final int PRIME = 16777619;

    private DeterministicHash() {}

    /**
     * Hashes the UTF-16 code units of {@code value}.
     *
     * @return the hash as an unsigned 32-bit value
     */
    public static long fnv1a(String value) {
        int h = OFFSET_BASIS;
        for (int i = 0; i < value.length(); i++) {
            h ^= value.charAt(i);
            h *= PRIME;
        }
        return Integer.toUnsignedLong(h);
    }

    /**
     * Hash of {@code eventId::role::id}, the key used by every seeded fallback ordering.
     */
    public static long tieBreakKey(String eventId, String role, String id) {
        return fnv1a(eventId + "::" + role + "::" + id);
    }
}
