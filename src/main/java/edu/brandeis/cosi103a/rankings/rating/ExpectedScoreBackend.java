package edu.brandeis.cosi103a.rankings.rating;

/**
 * Computes A's expected score against B. Implementations may trade exactness for speed;
 * a backend that throws or returns a non-finite value is replaced by the logistic formula
 * for that game.
 *
 * <p>Implementations found by {@link ExpectedScoreBackendDiscovery} need a public zero-argument constructor.
 */
@FunctionalInterface
public interface ExpectedScoreBackend {

    double expectedScore(double ratingA, double ratingB);
}
