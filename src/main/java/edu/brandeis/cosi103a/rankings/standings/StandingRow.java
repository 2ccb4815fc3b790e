package edu.brandeis.cosi103a.rankings.standings;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

/**
 * One competitor's line in the standings.
 *
 * @param rank             1-based final rank, 0 until the row has been ranked
 * @param gameWins         includes two synthetic game wins per bye
 * @param opponents        real opponents in chronological order
 * @param eliminationRound round a competitor went out in; set only for single elimination
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StandingRow(
    @JsonProperty("rank") int rank,
    @JsonProperty("playerId") String playerId,
    @JsonProperty("matchPoints") double matchPoints,
    @JsonProperty("mwp") double mwp,
    @JsonProperty("gwp") double gwp,
    @JsonProperty("omwp") double omwp,
    @JsonProperty("ogwp") double ogwp,
    @JsonProperty("sb") double sb,
    @JsonProperty("wins") int wins,
    @JsonProperty("losses") int losses,
    @JsonProperty("draws") int draws,
    @JsonProperty("byes") int byes,
    @JsonProperty("roundsPlayed") int roundsPlayed,
    @JsonProperty("gameWins") int gameWins,
    @JsonProperty("gameLosses") int gameLosses,
    @JsonProperty("gameDraws") int gameDraws,
    @JsonProperty("penalties") int penalties,
    @JsonProperty("opponents") ImmutableList<String> opponents,
    @JsonProperty("eliminationRound") Integer eliminationRound
) {

    public StandingRow {
        if (opponents == null) {
            opponents = ImmutableList.of();
        }
    }

    /**
     * Builds an unranked row from a tally and its derived percentages.
     */
    static StandingRow unranked(String playerId, Tally t, double mwp, double gwp,
                                double omwp, double ogwp, double sb) {
        return new StandingRow(0, playerId, t.matchPoints(), mwp, gwp, omwp, ogwp, sb,
            t.wins(), t.losses(), t.draws(), t.byes(), t.roundsPlayed(),
            t.visibleGameWins(), t.gameLosses(), t.gameDraws(), t.penalties(), t.opponents(), null);
    }

    public StandingRow withRank(int newRank) {
        return new StandingRow(newRank, playerId, matchPoints, mwp, gwp, omwp, ogwp, sb,
            wins, losses, draws, byes, roundsPlayed, gameWins, gameLosses, gameDraws, penalties,
            opponents, eliminationRound);
    }

    public TieSignature signature() {
        return new TieSignature(matchPoints, omwp, gwp, ogwp, sb);
    }
}
