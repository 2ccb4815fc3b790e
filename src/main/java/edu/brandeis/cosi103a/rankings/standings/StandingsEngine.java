package edu.brandeis.cosi103a.rankings.standings;

import com.google.common.collect.ImmutableList;
import edu.brandeis.cosi103a.rankings.match.MatchIndex;
import edu.brandeis.cosi103a.rankings.match.MatchMirror;
import edu.brandeis.cosi103a.rankings.match.MatchRecord;
import edu.brandeis.cosi103a.rankings.match.MissingMirrorEntryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Swiss and round-robin standings. Both share the same tally, percentage and
 * ranking pipeline; they differ in mirror handling, virtual byes and the hash namespace.
 */
public final class StandingsEngine {

    private static final Logger log = LoggerFactory.getLogger(StandingsEngine.class);

    private StandingsEngine() {}

    /**
     * Swiss standings. One-sided entries are mirrored only when the options ask for it.
     */
    public static ImmutableList<StandingRow> swiss(List<MatchRecord> matches, StandingsOptions options) {
        List<MatchRecord> input = options.acceptSingleEntryMatches() ? MatchMirror.withMirrors(matches) : matches;
        return compute(input, options, options.virtualBye(), TieBreakRole.SWISS_FALLBACK);
    }

    /**
     * Round-robin standings. Without single-entry acceptance every real match must
     * be present from both sides.
     *
     * @throws MissingMirrorEntryException if an entry has no reverse and reconstruction is off
     */
    public static ImmutableList<StandingRow> roundRobin(List<MatchRecord> matches, StandingsOptions options) {
        List<MatchRecord> input;
        if (options.acceptSingleEntryMatches()) {
            input = MatchMirror.withMirrors(matches);
        } else {
            MatchMirror.requireMirrored(matches);
            input = matches;
        }
        return compute(input, options, VirtualByeOptions.disabled(), TieBreakRole.ROUND_ROBIN_FALLBACK);
    }

    private static ImmutableList<StandingRow> compute(List<MatchRecord> matches, StandingsOptions options,
                                                      VirtualByeOptions virtualBye, TieBreakRole role) {
        MatchIndex index = MatchIndex.of(matches);
        double floor = options.opponentPctFloor();

        Map<String, Tally> tallies = new LinkedHashMap<>();
        for (String id : index.competitors()) {
            tallies.put(id, TallyCalculator.tally(index.matchesOf(id), options.points()));
        }

        // Sonneborn-Berger needs every competitor's final match points first
        Map<String, Double> finalPoints = new HashMap<>();
        tallies.forEach((id, t) -> finalPoints.put(id, t.matchPoints()));

        List<StandingRow> rows = new ArrayList<>(tallies.size());
        for (var entry : tallies.entrySet()) {
            String id = entry.getKey();
            Tally t = entry.getValue();
            OpponentStatistics.OpponentPercentages pct =
                OpponentStatistics.opponentPercentages(id, t, index, floor, virtualBye);
            rows.add(StandingRow.unranked(id, t,
                OpponentStatistics.matchWinPercentage(t),
                OpponentStatistics.gameWinPercentage(t, floor),
                pct.omwp(), pct.ogwp(),
                OpponentStatistics.sonnebornBerger(index.matchesOf(id), finalPoints)));
        }

        log.debug("Ranking {} competitors from {} match entries ({})", rows.size(), matches.size(), role.key());
        return RankingSorter.rank(rows, index, options.eventId(), options.applyHeadToHead(), role);
    }
}
