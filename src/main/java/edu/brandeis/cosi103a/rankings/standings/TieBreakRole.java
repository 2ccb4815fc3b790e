package edu.brandeis.cosi103a.rankings.standings;

import edu.brandeis.cosi103a.rankings.util.DeterministicHash;

/**
 * Namespaces for the seeded hash fallback, so standings and pairing orderings
 * of the same event do not coincide.
 */
public enum TieBreakRole {
    SWISS_FALLBACK("fallback"),
    ROUND_ROBIN_FALLBACK("rr-fallback"),
    SINGLE_ELIMINATION("single-elim"),
    PAIRING_FALLBACK("pairing-fallback");

    private final String key;

    TieBreakRole(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public long hash(String eventId, String competitorId) {
        return DeterministicHash.tieBreakKey(eventId, key, competitorId);
    }
}
