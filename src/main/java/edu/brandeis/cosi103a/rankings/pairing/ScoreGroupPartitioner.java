package edu.brandeis.cosi103a.rankings.pairing;

import com.google.common.collect.ImmutableList;
import edu.brandeis.cosi103a.rankings.standings.StandingRow;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits ranked rows into score groups.
 */
public final class ScoreGroupPartitioner {

    /**
     * What adjacent rows must share to land in the same group.
     */
    public enum GroupingKey {
        /** All five primary ranking keys. */
        TIE_SIGNATURE,
        /** Match points only, as in classic Swiss score groups. */
        MATCH_POINTS
    }

    private static final double EPSILON = 1e-12;

    private ScoreGroupPartitioner() {}

    /**
     * @param ranked rows already in rank order
     */
    public static ImmutableList<ScoreGroup> partition(List<StandingRow> ranked, GroupingKey key) {
        ImmutableList.Builder<ScoreGroup> groups = ImmutableList.builder();
        List<StandingRow> current = new ArrayList<>();
        int index = 0;
        for (StandingRow row : ranked) {
            if (!current.isEmpty() && !sameGroup(current.get(0), row, key)) {
                groups.add(new ScoreGroup(index++, ImmutableList.copyOf(current)));
                current.clear();
            }
            current.add(row);
        }
        if (!current.isEmpty()) {
            groups.add(new ScoreGroup(index, ImmutableList.copyOf(current)));
        }
        return groups.build();
    }

    private static boolean sameGroup(StandingRow a, StandingRow b, GroupingKey key) {
        return switch (key) {
            case TIE_SIGNATURE -> a.signature().sameAs(b.signature());
            case MATCH_POINTS -> Math.abs(a.matchPoints() - b.matchPoints()) <= EPSILON;
        };
    }
}
