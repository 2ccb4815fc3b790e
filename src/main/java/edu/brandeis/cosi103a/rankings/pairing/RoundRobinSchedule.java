package edu.brandeis.cosi103a.rankings.pairing;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

/**
 * A full round-robin schedule, rounds in order.
 */
public record RoundRobinSchedule(
    @JsonProperty("rounds") ImmutableList<RoundDefinition> rounds
) {

    public int roundCount() {
        return rounds.size();
    }
}
