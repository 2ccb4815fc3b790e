package edu.brandeis.cosi103a.rankings.rating;

/**
 * Expected score from a precomputed table over integer rating differences, linearly
 * interpolated. Differences beyond the table use the logistic formula directly.
 */
@BackendDescription("Precomputed logistic table over rating differences up to 800 points")
public class TableExpectedScoreBackend implements ExpectedScoreBackend {

    private static final int RANGE = 800;

    private final double[] table = new double[2 * RANGE + 1];

    public TableExpectedScoreBackend() {
        for (int d = -RANGE; d <= RANGE; d++) {
            // d is Ra - Rb
            table[d + RANGE] = EloRatingCalculator.logisticExpectedScore(d, 0);
        }
    }

    @Override
    public double expectedScore(double ratingA, double ratingB) {
        double diff = ratingA - ratingB;
        if (Double.isNaN(diff) || Math.abs(diff) >= RANGE) {
            return EloRatingCalculator.logisticExpectedScore(ratingA, ratingB);
        }
        double pos = diff + RANGE;
        int lo = (int) Math.floor(pos);
        double frac = pos - lo;
        if (frac == 0) {
            return table[lo];
        }
        return table[lo] + frac * (table[lo + 1] - table[lo]);
    }
}
