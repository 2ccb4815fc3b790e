package edu.brandeis.cosi103a.rankings.rating;

import com.google.common.collect.ImmutableMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Elo rating updates over a batch of games.
 *
 * <p>The expected score comes from an optional {@link ExpectedScoreBackend}. If the backend
 * throws or returns something that is not a finite number, the logistic formula
 * {@code 1 / (1 + 10^((Rb - Ra) / 400))} is used for that game instead and the failure is counted.
 */
public class EloRatingCalculator {

    private static final Logger log = LoggerFactory.getLogger(EloRatingCalculator.class);

    private static final int MAX_LOGGED_FAILURES = 5;

    private final ExpectedScoreBackend backend;
    private final AtomicInteger backendFailures = new AtomicInteger();

    /**
     * Calculator using the logistic formula only.
     */
    public EloRatingCalculator() {
        this(null);
    }

    /**
     * @param backend expected-score backend, or {@code null} for the logistic formula
     */
    public EloRatingCalculator(ExpectedScoreBackend backend) {
        this.backend = backend;
    }

    public static double logisticExpectedScore(double ratingA, double ratingB) {
        return 1.0 / (1.0 + Math.pow(10, (ratingB - ratingA) / 400.0));
    }

    /**
     * Rates a batch of games.
     *
     * @param base    current ratings; competitors not listed start at {@link EloOptions#initialRating()}
     * @param matches games in the order they were played
     * @param options update parameters, {@code null} for defaults
     */
    public EloUpdateResult update(Map<String, Double> base, List<RatedMatch> matches, EloOptions options) {
        EloOptions opts = options == null ? EloOptions.defaults() : options;
        Map<String, Double> ratings = new TreeMap<>(base);
        Map<String, Double> deltas = new TreeMap<>();
        Map<String, Double> snapshot = opts.mode() == EloOptions.Mode.SIMULTANEOUS ? new HashMap<>(ratings) : null;

        for (RatedMatch m : matches) {
            Map<String, Double> source = snapshot != null ? snapshot : ratings;
            double ra = source.getOrDefault(m.a(), opts.initialRating());
            double rb = source.getOrDefault(m.b(), opts.initialRating());

            double ea = expectedScore(ra, rb);
            double eb = 1 - ea;
            double sa = m.result().scoreOfA(opts.drawScore());
            double sb = 1 - sa;

            apply(ratings, deltas, m.a(), m.weight() * opts.kFor(m.a(), m.result()) * (sa - ea), opts);
            apply(ratings, deltas, m.b(), m.weight() * opts.kFor(m.b(), m.result()) * (sb - eb), opts);
        }

        return new EloUpdateResult(ImmutableMap.copyOf(ratings), ImmutableMap.copyOf(deltas));
    }

    private static void apply(Map<String, Double> ratings, Map<String, Double> deltas, String id,
                              double delta, EloOptions opts) {
        double before = ratings.getOrDefault(id, opts.initialRating());
        ratings.put(id, opts.clamp(before + delta));
        deltas.merge(id, delta, Double::sum);
    }

    /**
     * Expected score from the backend, falling back to the logistic formula.
     */
    double expectedScore(double ra, double rb) {
        if (backend == null) {
            return logisticExpectedScore(ra, rb);
        }
        try {
            double e = backend.expectedScore(ra, rb);
            if (Double.isFinite(e)) {
                return e;
            }
            recordFailure("returned " + e);
        } catch (RuntimeException e) {
            recordFailure(e.toString());
        }
        return logisticExpectedScore(ra, rb);
    }

    private void recordFailure(String reason) {
        int failures = backendFailures.incrementAndGet();
        if (failures <= MAX_LOGGED_FAILURES) {
            log.warn("Expected-score backend failed ({}), using logistic formula", reason);
        } else if (failures == MAX_LOGGED_FAILURES + 1) {
            log.warn("Suppressing further expected-score backend warnings...");
        }
    }

    /**
     * Number of games where the backend failed and the logistic formula was used.
     */
    public int getBackendFailures() {
        return backendFailures.get();
    }

    public void resetBackendFailures() {
        backendFailures.set(0);
    }
}
