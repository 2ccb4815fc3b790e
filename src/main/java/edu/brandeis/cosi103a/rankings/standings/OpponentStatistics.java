package edu.brandeis.cosi103a.rankings.standings;

import edu.brandeis.cosi103a.rankings.match.MatchIndex;
import edu.brandeis.cosi103a.rankings.match.MatchOutcome;
import edu.brandeis.cosi103a.rankings.match.MatchRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Percentage tie-breakers: MWP, GWP, OMW%, OGW% and Sonneborn-Berger.
 *
 * <p>Opponent percentages are computed from the opponent's own entries, leaving out
 * games against the subject and the opponent's byes. Each opponent value is floored
 * individually before averaging.
 */
public final class OpponentStatistics {

    /** Default lower bound for GWP and the opponent percentages. */
    public static final double DEFAULT_FLOOR = 0.33;

    private OpponentStatistics() {}

    /**
     * (W + D/2) / (W + L + D), or 0 when the competitor played no decisive or drawn match.
     */
    public static double matchWinPercentage(Tally t) {
        return ratio(t.wins() + 0.5 * t.draws(), t.wins() + t.losses() + t.draws());
    }

    /**
     * Game-win percentage counting each bye as a 2-0, never below {@code floor}.
     */
    public static double gameWinPercentage(Tally t, double floor) {
        int byeGameWins = 2 * t.byes();
        double num = t.gameWins() + byeGameWins + 0.5 * t.gameDraws();
        int den = t.gameWins() + t.gameLosses() + t.gameDraws() + byeGameWins;
        return Math.max(floor, ratio(num, den));
    }

    /**
     * The opponent's MWP over their matches not played against {@code subjectId}. Byes excluded.
     */
    static double opponentMatchWinExcluding(String subjectId, List<MatchRecord> opponentMatches) {
        int w = 0;
        int l = 0;
        int d = 0;
        for (MatchRecord m : opponentMatches) {
            if (!countsAgainstOthers(m, subjectId)) {
                continue;
            }
            if (m.outcome().isWin()) {
                w++;
            } else if (m.outcome().isLoss()) {
                l++;
            } else if (m.outcome() == MatchOutcome.DRAW) {
                d++;
            }
        }
        return ratio(w + 0.5 * d, w + l + d);
    }

    /**
     * The opponent's GWP over their games not played against {@code subjectId}. Byes excluded, unfloored.
     */
    static double opponentGameWinExcluding(String subjectId, List<MatchRecord> opponentMatches) {
        int gw = 0;
        int gl = 0;
        int gd = 0;
        for (MatchRecord m : opponentMatches) {
            if (!countsAgainstOthers(m, subjectId)) {
                continue;
            }
            gw += m.gameWins();
            gl += m.gameLosses();
            gd += m.gameDraws();
        }
        return ratio(gw + 0.5 * gd, gw + gl + gd);
    }

    /**
     * OMW% and OGW% for one subject.
     *
     * @param subjectId   competitor being scored
     * @param subject     the subject's tally, for its opponent list and bye count
     * @param index       full match index
     * @param floor       per-entry floor
     * @param virtualBye  synthetic opponent contribution per bye, or disabled
     */
    public static OpponentPercentages opponentPercentages(String subjectId, Tally subject, MatchIndex index,
                                                          double floor, VirtualByeOptions virtualBye) {
        List<Double> omw = new ArrayList<>();
        List<Double> ogw = new ArrayList<>();

        for (String opponentId : subject.opponents()) {
            List<MatchRecord> oppMatches = index.matchesOf(opponentId);
            omw.add(opponentMatchWinExcluding(subjectId, oppMatches));
            ogw.add(opponentGameWinExcluding(subjectId, oppMatches));
        }

        if (virtualBye.enabled()) {
            double vmw = clamp01(virtualBye.mwp());
            double vgw = clamp01(virtualBye.gwp());
            for (int i = 0; i < subject.byes(); i++) {
                omw.add(vmw);
                ogw.add(vgw);
            }
        }

        return new OpponentPercentages(averageWithFloor(omw, floor), averageWithFloor(ogw, floor));
    }

    /**
     * Sum of opponents' final match points: full credit for a win, half for a draw.
     */
    public static double sonnebornBerger(List<MatchRecord> matches, Map<String, Double> finalMatchPoints) {
        double sb = 0;
        for (MatchRecord m : matches) {
            if (!m.hasOpponent()) {
                continue;
            }
            double oppPoints = finalMatchPoints.getOrDefault(m.opponentId(), 0.0);
            if (m.outcome().isWin()) {
                sb += oppPoints;
            } else if (m.outcome() == MatchOutcome.DRAW) {
                sb += 0.5 * oppPoints;
            }
        }
        return sb;
    }

    /**
     * Mean of the values after flooring each one. 0 for an empty list.
     */
    static double averageWithFloor(List<Double> values, double floor) {
        if (values.isEmpty()) {
            return 0;
        }
        double total = 0;
        for (double v : values) {
            total += Math.max(floor, v);
        }
        return total / values.size();
    }

    private static boolean countsAgainstOthers(MatchRecord m, String subjectId) {
        return m.hasOpponent() && !m.opponentId().equals(subjectId) && m.outcome() != MatchOutcome.BYE;
    }

    private static double clamp01(double x) {
        return Math.max(0, Math.min(1, x));
    }

    private static double ratio(double num, double den) {
        return den > 0 ? num / den : 0;
    }

    /**
     * OMW% and OGW% of one competitor.
     */
    public record OpponentPercentages(double omwp, double ogwp) {}
}
