package edu.brandeis.cosi103a.rankings.pairing;

import edu.brandeis.cosi103a.rankings.match.MatchRecord;
import edu.brandeis.cosi103a.rankings.standings.StandingRow;

import java.util.List;

/**
 * Entry point for next-round pairings.
 */
public final class Pairings {

    private Pairings() {}

    /**
     * Swiss pairings from the current standings and the full history.
     */
    public static PairingResult swiss(List<StandingRow> standings, List<MatchRecord> history,
                                      PairingOptions options) {
        return SwissPairingMatcher.pair(standings, history, options);
    }

    /**
     * One round of a round-robin schedule, as a pairing result.
     *
     * @param roundNumber 1-based round
     */
    public static PairingResult roundRobin(List<String> players, int roundNumber, RoundRobinOptions options) {
        return PairingResult.roundRobin(RoundRobinScheduler.getRound(players, roundNumber, options));
    }
}
