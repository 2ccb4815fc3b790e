package edu.brandeis.cosi103a.rankings.rating;

import de.gesundkrank.jskills.GameInfo;
import de.gesundkrank.jskills.Rating;
import edu.brandeis.cosi103a.rankings.standings.PointsMap;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Tracks TrueSkill ratings and match points across a sequence of matches.
 * Not thread-safe; one tracker belongs to one caller.
 */
public class TrueSkillTracker {
    private final Map<String, Rating> ratings;
    private final Map<String, Double> points;
    private final GameInfo gameInfo;
    private final PointsMap pointsMap;
    private final TrueSkillRatingCalculator calculator = new TrueSkillRatingCalculator();

    /**
     * Create a tracker with all competitors at the default rating.
     *
     * @param playerIds competitors known up front; others are added on their first match
     * @param gameInfo  TrueSkill parameters
     * @param pointsMap match points per outcome
     */
    public TrueSkillTracker(List<String> playerIds, GameInfo gameInfo, PointsMap pointsMap) {
        this.gameInfo = gameInfo;
        this.pointsMap = pointsMap;
        this.ratings = new HashMap<>();
        this.points = new HashMap<>();
        for (String id : playerIds) {
            ratings.put(id, gameInfo.getDefaultRating());
            points.put(id, 0.0);
        }
    }

    public TrueSkillTracker(List<String> playerIds, GameInfo gameInfo) {
        this(playerIds, gameInfo, PointsMap.defaults());
    }

    /**
     * Process a single match, updating ratings and match points.
     */
    public void processMatch(RatedMatch match) {
        ratings.putAll(calculator.update(ratings, match, gameInfo));

        double forA = switch (match.result()) {
            case A -> pointsMap.win();
            case B -> pointsMap.loss();
            case DRAW -> pointsMap.draw();
        };
        double forB = switch (match.result()) {
            case A -> pointsMap.loss();
            case B -> pointsMap.win();
            case DRAW -> pointsMap.draw();
        };
        points.merge(match.a(), forA, Double::sum);
        points.merge(match.b(), forB, Double::sum);
    }

    public void processAll(List<RatedMatch> matches) {
        for (RatedMatch m : matches) {
            processMatch(m);
        }
    }

    /**
     * @return a copy of the current ratings
     */
    public Map<String, Rating> getCurrentRatings() {
        return new HashMap<>(ratings);
    }

    /**
     * @return a copy of the current match points
     */
    public Map<String, Double> getCurrentPoints() {
        return new HashMap<>(points);
    }

    /**
     * Conservative rating (mu - 3*sigma) for one competitor.
     *
     * @throws IllegalArgumentException if the competitor is unknown
     */
    public double getConservativeRating(String playerId) {
        Rating rating = ratings.get(playerId);
        if (rating == null) {
            throw new IllegalArgumentException("Unknown competitor: " + playerId);
        }
        return TrueSkillRatingCalculator.conservativeRating(rating);
    }

    /**
     * Competitor ids, best conservative rating first; ties by id.
     */
    public List<String> leaderboard() {
        List<String> ids = new ArrayList<>(ratings.keySet());
        ids.sort(Comparator.comparingDouble((String id) -> getConservativeRating(id)).reversed()
            .thenComparing(Comparator.naturalOrder()));
        return ids;
    }

    public int getConvergenceFailures() {
        return calculator.getConvergenceFailures();
    }
}
