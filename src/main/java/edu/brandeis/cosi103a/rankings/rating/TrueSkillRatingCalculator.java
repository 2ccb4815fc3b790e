package edu.brandeis.cosi103a.rankings.rating;

import de.gesundkrank.jskills.GameInfo;
import de.gesundkrank.jskills.IPlayer;
import de.gesundkrank.jskills.ITeam;
import de.gesundkrank.jskills.Player;
import de.gesundkrank.jskills.Rating;
import de.gesundkrank.jskills.Team;
import de.gesundkrank.jskills.TrueSkillCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Head-to-head TrueSkill updates using JSkills. Each competitor is a one-person team.
 * The displayed rating is the conservative estimate: mu - 3*sigma.
 *
 * <p>Match weights are not used; every game counts fully.
 */
public class TrueSkillRatingCalculator {

    private static final Logger log = LoggerFactory.getLogger(TrueSkillRatingCalculator.class);

    private static final int MAX_LOGGED_FAILURES = 5;

    private int convergenceFailures;

    /**
     * Update ratings after a single match.
     *
     * @param ratings  current (mu, sigma) per competitor; missing competitors start at the default rating
     * @param match    the match result
     * @param gameInfo TrueSkill parameters
     * @return updated ratings for all competitors (non-participants unchanged)
     */
    public Map<String, Rating> update(Map<String, Rating> ratings, RatedMatch match, GameInfo gameInfo) {
        Map<String, Rating> result = new HashMap<>(ratings);

        Player<String> playerA = new Player<>(match.a());
        Player<String> playerB = new Player<>(match.b());
        Rating ratingA = ratings.getOrDefault(match.a(), gameInfo.getDefaultRating());
        Rating ratingB = ratings.getOrDefault(match.b(), gameInfo.getDefaultRating());
        List<ITeam> teams = List.of(new Team(playerA, ratingA), new Team(playerB, ratingB));

        try {
            Map<IPlayer, Rating> newRatings =
                TrueSkillCalculator.calculateNewRatings(gameInfo, teams, ranks(match.result()));
            result.put(match.a(), newRatings.get(playerA));
            result.put(match.b(), newRatings.get(playerB));
        } catch (RuntimeException e) {
            // keep existing ratings for this match
            convergenceFailures++;
            if (convergenceFailures <= MAX_LOGGED_FAILURES) {
                log.warn("TrueSkill failed to converge for {} vs {}, keeping existing ratings", match.a(), match.b());
            } else if (convergenceFailures == MAX_LOGGED_FAILURES + 1) {
                log.warn("Suppressing further TrueSkill convergence warnings...");
            }
        }

        return result;
    }

    /**
     * 1-based ranks for sides A and B. A draw ranks both first.
     */
    static int[] ranks(RatedOutcome result) {
        return switch (result) {
            case A -> new int[] {1, 2};
            case B -> new int[] {2, 1};
            case DRAW -> new int[] {1, 1};
        };
    }

    public int getConvergenceFailures() {
        return convergenceFailures;
    }

    public void resetConvergenceFailures() {
        convergenceFailures = 0;
    }

    /**
     * Conservative display rating: mu - 3*sigma.
     */
    public static double conservativeRating(Rating rating) {
        return rating.getMean() - 3.0 * rating.getStandardDeviation();
    }
}
