package edu.brandeis.cosi103a.rankings.pairing;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Two competitors meeting in a round. For Swiss pairings {@code a} is the better-ranked one;
 * for round robin {@code a} is the first seat.
 */
public record Pairing(
    @JsonProperty("a") String a,
    @JsonProperty("b") String b
) {

    public Pairing {
        if (a == null || b == null) {
            throw new IllegalArgumentException("Pairing needs two competitors");
        }
        if (a.equals(b)) {
            throw new IllegalArgumentException("Competitor " + a + " cannot be paired with themselves");
        }
    }

    public boolean involves(String competitorId) {
        return a.equals(competitorId) || b.equals(competitorId);
    }

    public Pairing swapped() {
        return new Pairing(b, a);
    }
}
