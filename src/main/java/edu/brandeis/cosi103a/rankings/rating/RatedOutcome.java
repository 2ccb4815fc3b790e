package edu.brandeis.cosi103a.rankings.rating;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of a rated match between sides A and B.
 */
public enum RatedOutcome {
    @JsonProperty("A") A,
    @JsonProperty("B") B,
    @JsonProperty("draw") DRAW;

    /**
     * A's actual score: 1 for a win, 0 for a loss, {@code drawScore} for a draw.
     */
    double scoreOfA(double drawScore) {
        return switch (this) {
            case A -> 1.0;
            case B -> 0.0;
            case DRAW -> drawScore;
        };
    }
}
