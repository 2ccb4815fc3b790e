package edu.brandeis.cosi103a.rankings.cli;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import edu.brandeis.cosi103a.rankings.rating.EloUpdateResult;

/**
 * Contents of {@code ratings.json}.
 */
public record RatingsReport(
    @JsonProperty("matches") int matches,
    @JsonProperty("elo") EloUpdateResult elo,
    @JsonProperty("trueSkill") ImmutableList<TrueSkillEntry> trueSkill
) {

    /**
     * One competitor's TrueSkill line, best conservative rating first.
     */
    public record TrueSkillEntry(
        @JsonProperty("playerId") String playerId,
        @JsonProperty("mu") double mu,
        @JsonProperty("sigma") double sigma,
        @JsonProperty("conservative") double conservative,
        @JsonProperty("matchPoints") double matchPoints
    ) {}
}
