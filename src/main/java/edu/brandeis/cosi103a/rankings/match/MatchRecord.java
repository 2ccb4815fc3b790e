package edu.brandeis.cosi103a.rankings.match;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One directed match entry: the owning competitor's view of a single round.
 * A bye has no opponent.
 *
 * @param id         optional stable identifier, used only to order entries within a round
 * @param round      1-based round number
 * @param playerId   owning competitor
 * @param opponentId opponent, or {@code null} for a bye
 * @param outcome    result from the owner's point of view
 * @param gameWins   games won by the owner
 * @param gameLosses games lost by the owner
 * @param gameDraws  drawn games
 * @param penalties  penalties assessed to the owner in this match
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MatchRecord(
    @JsonProperty("id") String id,
    @JsonProperty("round") int round,
    @JsonProperty("playerId") String playerId,
    @JsonProperty("opponentId") String opponentId,
    @JsonProperty("outcome") MatchOutcome outcome,
    @JsonProperty("gameWins") int gameWins,
    @JsonProperty("gameLosses") int gameLosses,
    @JsonProperty("gameDraws") int gameDraws,
    @JsonProperty("penalties") int penalties
) {

    public MatchRecord {
        Objects.requireNonNull(playerId, "playerId");
        Objects.requireNonNull(outcome, "outcome");
        if (round < 1) {
            throw new IllegalArgumentException("Round must be positive, got " + round + " for " + playerId);
        }
        if (playerId.equals(opponentId)) {
            throw new IllegalArgumentException("Competitor " + playerId + " cannot be their own opponent");
        }
        if (outcome == MatchOutcome.BYE && opponentId != null) {
            throw new IllegalArgumentException("Bye for " + playerId + " must not name an opponent");
        }
        if (gameWins < 0 || gameLosses < 0 || gameDraws < 0 || penalties < 0) {
            throw new IllegalArgumentException("Game counts and penalties must be non-negative for " + playerId);
        }
        if (id == null) {
            id = "";
        }
    }

    /**
     * Convenience constructor without id and penalties.
     */
    public MatchRecord(int round, String playerId, String opponentId, MatchOutcome outcome,
                       int gameWins, int gameLosses, int gameDraws) {
        this("", round, playerId, opponentId, outcome, gameWins, gameLosses, gameDraws, 0);
    }

    /**
     * A bye for {@code playerId} in the given round.
     */
    public static MatchRecord bye(int round, String playerId) {
        return new MatchRecord("", round, playerId, null, MatchOutcome.BYE, 0, 0, 0, 0);
    }

    /**
     * Whether this entry names a real opponent.
     */
    public boolean hasOpponent() {
        return opponentId != null;
    }

    /**
     * The opponent's entry for the same match: outcome flipped, game wins and losses swapped.
     * Penalties are not carried over.
     */
    public MatchRecord mirror() {
        if (!hasOpponent()) {
            throw new IllegalStateException("Entry without an opponent has no mirror: " + playerId);
        }
        return new MatchRecord(id + "#mirror", round, opponentId, playerId, outcome.flip(),
            gameLosses, gameWins, gameDraws, 0);
    }
}
