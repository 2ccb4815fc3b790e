package edu.brandeis.cosi103a.rankings.pairing;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

/**
 * One scheduled round.
 *
 * @param round    1-based round number
 * @param pairings matchups in seat order
 * @param byes     competitors sitting out; empty for an even field
 */
public record RoundDefinition(
    @JsonProperty("round") int round,
    @JsonProperty("pairings") ImmutableList<Pairing> pairings,
    @JsonProperty("byes") ImmutableList<String> byes
) {}
