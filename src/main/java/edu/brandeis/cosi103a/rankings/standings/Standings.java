package edu.brandeis.cosi103a.rankings.standings;

import com.google.common.collect.ImmutableList;
import edu.brandeis.cosi103a.rankings.match.MatchRecord;

import java.util.List;

/**
 * Entry point for computing standings in any supported mode.
 * A {@code null} options argument means {@link StandingsOptions#defaults()}.
 */
public final class Standings {

    private Standings() {}

    public static ImmutableList<StandingRow> compute(StandingsMode mode, List<MatchRecord> matches,
                                                     StandingsOptions options) {
        StandingsOptions opts = options == null ? StandingsOptions.defaults() : options;
        return switch (mode) {
            case SWISS -> StandingsEngine.swiss(matches, opts);
            case ROUND_ROBIN -> StandingsEngine.roundRobin(matches, opts);
            case SINGLE_ELIMINATION -> SingleEliminationStandings.compute(matches, opts);
        };
    }

    public static ImmutableList<StandingRow> swiss(List<MatchRecord> matches, StandingsOptions options) {
        return compute(StandingsMode.SWISS, matches, options);
    }

    public static ImmutableList<StandingRow> roundRobin(List<MatchRecord> matches, StandingsOptions options) {
        return compute(StandingsMode.ROUND_ROBIN, matches, options);
    }

    public static ImmutableList<StandingRow> singleElimination(List<MatchRecord> matches,
                                                               StandingsOptions options) {
        return compute(StandingsMode.SINGLE_ELIMINATION, matches, options);
    }
}
