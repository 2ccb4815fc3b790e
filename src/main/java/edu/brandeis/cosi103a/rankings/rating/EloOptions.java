package edu.brandeis.cosi103a.rankings.rating;

import com.google.common.collect.ImmutableMap;

import java.util.Map;
import java.util.Optional;

/**
 * Elo update parameters.
 *
 * @param k             K-factor for decisive games
 * @param kDraw         K-factor for draws
 * @param perPlayerK    per-competitor K overriding both of the above
 * @param initialRating rating of a competitor missing from the base map
 * @param floor         lower clamp for ratings, if any
 * @param cap           upper clamp for ratings, if any
 * @param mode          whether later games see earlier updates
 * @param drawScore     actual score credited to A for a draw
 */
public record EloOptions(
    double k,
    double kDraw,
    Map<String, Double> perPlayerK,
    double initialRating,
    Optional<Double> floor,
    Optional<Double> cap,
    Mode mode,
    double drawScore
) {

    public static final double DEFAULT_K = 32;
    public static final double DEFAULT_RATING = 1500;

    public enum Mode {
        /** Each game is rated against the ratings left by the previous one. */
        SEQUENTIAL,
        /** Every game in the batch is rated against the same snapshot. */
        SIMULTANEOUS
    }

    public EloOptions {
        perPlayerK = perPlayerK == null ? ImmutableMap.of() : ImmutableMap.copyOf(perPlayerK);
        floor = floor == null ? Optional.empty() : floor;
        cap = cap == null ? Optional.empty() : cap;
        if (mode == null) {
            mode = Mode.SEQUENTIAL;
        }
    }

    public static EloOptions defaults() {
        return new EloOptions(DEFAULT_K, DEFAULT_K, ImmutableMap.of(), DEFAULT_RATING,
            Optional.empty(), Optional.empty(), Mode.SEQUENTIAL, 0.5);
    }

    /**
     * Sets K for decisive games and draws alike.
     */
    public EloOptions withK(double value) {
        return new EloOptions(value, value, perPlayerK, initialRating, floor, cap, mode, drawScore);
    }

    public EloOptions withKDraw(double value) {
        return new EloOptions(k, value, perPlayerK, initialRating, floor, cap, mode, drawScore);
    }

    public EloOptions withPerPlayerK(Map<String, Double> overrides) {
        return new EloOptions(k, kDraw, overrides, initialRating, floor, cap, mode, drawScore);
    }

    public EloOptions withInitialRating(double value) {
        return new EloOptions(k, kDraw, perPlayerK, value, floor, cap, mode, drawScore);
    }

    public EloOptions withFloor(double value) {
        return new EloOptions(k, kDraw, perPlayerK, initialRating, Optional.of(value), cap, mode, drawScore);
    }

    public EloOptions withCap(double value) {
        return new EloOptions(k, kDraw, perPlayerK, initialRating, floor, Optional.of(value), mode, drawScore);
    }

    public EloOptions withMode(Mode value) {
        return new EloOptions(k, kDraw, perPlayerK, initialRating, floor, cap, value, drawScore);
    }

    public EloOptions withDrawScore(double value) {
        return new EloOptions(k, kDraw, perPlayerK, initialRating, floor, cap, mode, value);
    }

    /**
     * K used for {@code competitorId} in a game with the given result.
     */
    double kFor(String competitorId, RatedOutcome result) {
        Double override = perPlayerK.get(competitorId);
        if (override != null) {
            return override;
        }
        return result == RatedOutcome.DRAW ? kDraw : k;
    }

    double clamp(double rating) {
        double r = rating;
        if (floor.isPresent()) {
            r = Math.max(floor.get(), r);
        }
        if (cap.isPresent()) {
            r = Math.min(cap.get(), r);
        }
        return r;
    }
}
