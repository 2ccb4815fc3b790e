package edu.brandeis.cosi103a.rankings.match;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of one directed match entry, seen from the owning competitor.
 */
public enum MatchOutcome {
    @JsonProperty("win") WIN,
    @JsonProperty("loss") LOSS,
    @JsonProperty("draw") DRAW,
    @JsonProperty("bye") BYE,
    @JsonProperty("forfeit-win") FORFEIT_WIN,
    @JsonProperty("forfeit-loss") FORFEIT_LOSS;

    public boolean isWin() {
        return this == WIN || this == FORFEIT_WIN;
    }

    public boolean isLoss() {
        return this == LOSS || this == FORFEIT_LOSS;
    }

    /**
     * The outcome as the opponent saw it. Draws and byes map to themselves.
     */
    public MatchOutcome flip() {
        return switch (this) {
            case WIN -> LOSS;
            case LOSS -> WIN;
            case FORFEIT_WIN -> FORFEIT_LOSS;
            case FORFEIT_LOSS -> FORFEIT_WIN;
            case DRAW, BYE -> this;
        };
    }
}
