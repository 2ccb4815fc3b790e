package edu.brandeis.cosi103a.rankings.standings;

import java.util.Comparator;

/**
 * The five primary ranking keys, compared in order with a small tolerance.
 */
public record TieSignature(double matchPoints, double omwp, double gwp, double ogwp, double sb) {

    static final double EPSILON = 1e-12;

    /**
     * Best signature first.
     */
    public static final Comparator<TieSignature> DESCENDING = (a, b) -> {
        int c = compareDesc(a.matchPoints, b.matchPoints);
        if (c != 0) {
            return c;
        }
        c = compareDesc(a.omwp, b.omwp);
        if (c != 0) {
            return c;
        }
        c = compareDesc(a.gwp, b.gwp);
        if (c != 0) {
            return c;
        }
        c = compareDesc(a.ogwp, b.ogwp);
        if (c != 0) {
            return c;
        }
        return compareDesc(a.sb, b.sb);
    };

    /**
     * Whether both signatures agree on all five keys within tolerance.
     */
    public boolean sameAs(TieSignature other) {
        return DESCENDING.compare(this, other) == 0;
    }

    private static int compareDesc(double a, double b) {
        if (Math.abs(a - b) <= EPSILON) {
            return 0;
        }
        return a > b ? -1 : 1;
    }
}
