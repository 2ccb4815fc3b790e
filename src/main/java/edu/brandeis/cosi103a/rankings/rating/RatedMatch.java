package edu.brandeis.cosi103a.rankings.rating;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import edu.brandeis.cosi103a.rankings.match.MatchOutcome;
import edu.brandeis.cosi103a.rankings.match.MatchRecord;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * One rated game between two competitors.
 *
 * @param weight scales the rating change; 1 is a normal game, 0 changes nothing
 */
public record RatedMatch(
    @JsonProperty("a") String a,
    @JsonProperty("b") String b,
    @JsonProperty("result") RatedOutcome result,
    @JsonProperty("weight") double weight
) {

    public RatedMatch {
        if (a == null || b == null || result == null) {
            throw new IllegalArgumentException("Rated match needs both sides and a result");
        }
        if (a.equals(b)) {
            throw new IllegalArgumentException("Competitor " + a + " cannot be rated against themselves");
        }
    }

    public RatedMatch(String a, String b, RatedOutcome result) {
        this(a, b, result, 1.0);
    }

    /**
     * Converts directed match entries into rated matches, one per real match.
     * Byes are skipped; when both sides of a match are present only the first one seen is used.
     * The result is ordered by round, then by the entry's position in the history.
     */
    public static ImmutableList<RatedMatch> fromHistory(List<MatchRecord> history) {
        List<MatchRecord> sorted = new ArrayList<>(history);
        sorted.sort(Comparator.comparingInt(MatchRecord::round));

        Set<MatchKey> seen = new HashSet<>();
        ImmutableList.Builder<RatedMatch> out = ImmutableList.builder();
        for (MatchRecord m : sorted) {
            if (!m.hasOpponent()) {
                continue;
            }
            MatchKey key = MatchKey.of(m);
            if (!seen.add(key)) {
                continue;
            }
            out.add(new RatedMatch(m.playerId(), m.opponentId(), toRated(m.outcome())));
        }
        return out.build();
    }

    private static RatedOutcome toRated(MatchOutcome outcome) {
        if (outcome.isWin()) {
            return RatedOutcome.A;
        }
        if (outcome.isLoss()) {
            return RatedOutcome.B;
        }
        return RatedOutcome.DRAW;
    }

    private record MatchKey(int round, String low, String high) {
        static MatchKey of(MatchRecord m) {
            String p = m.playerId();
            String o = m.opponentId();
            return p.compareTo(o) < 0 ? new MatchKey(m.round(), p, o) : new MatchKey(m.round(), o, p);
        }
    }
}
