package edu.brandeis.cosi103a.rankings.pairing;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.Optional;

/**
 * Pairings for one round.
 *
 * @param round          round number, when known (round robin)
 * @param pairings       matchups, best-ranked first
 * @param bye            competitor sitting out, if the field was odd
 * @param byes           every competitor sitting out (round robin may report one)
 * @param downfloats     prior downfloat counts plus this round's increments
 * @param rematchesUsed  pairings that repeat an earlier matchup
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
public record PairingResult(
    @JsonProperty("round") Integer round,
    @JsonProperty("pairings") ImmutableList<Pairing> pairings,
    @JsonProperty("bye") Optional<String> bye,
    @JsonProperty("byes") ImmutableList<String> byes,
    @JsonProperty("downfloats") ImmutableMap<String, Integer> downfloats,
    @JsonProperty("rematchesUsed") ImmutableList<Pairing> rematchesUsed
) {

    public static PairingResult swiss(ImmutableList<Pairing> pairings, Optional<String> bye,
                                      ImmutableMap<String, Integer> downfloats,
                                      ImmutableList<Pairing> rematchesUsed) {
        return new PairingResult(null, pairings, bye, bye.map(ImmutableList::of).orElse(ImmutableList.of()),
            downfloats, rematchesUsed);
    }

    public static PairingResult roundRobin(RoundDefinition round) {
        Optional<String> bye = round.byes().isEmpty() ? Optional.empty() : Optional.of(round.byes().get(0));
        return new PairingResult(round.round(), round.pairings(), bye, round.byes(),
            ImmutableMap.of(), ImmutableList.of());
    }

    /**
     * Downfloat count for a competitor, 0 if they never floated.
     */
    public int downfloatsOf(String competitorId) {
        return downfloats.getOrDefault(competitorId, 0);
    }
}
