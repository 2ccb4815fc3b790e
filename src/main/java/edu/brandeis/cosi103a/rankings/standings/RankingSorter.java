package edu.brandeis.cosi103a.rankings.standings;

import com.google.common.collect.ImmutableList;
import edu.brandeis.cosi103a.rankings.match.MatchIndex;
import edu.brandeis.cosi103a.rankings.match.MatchOutcome;
import edu.brandeis.cosi103a.rankings.match.MatchRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Orders standing rows by the five-key cascade and resolves each tie block by
 * head-to-head, then penalties, then the seeded hash.
 */
public final class RankingSorter {

    private static final Logger log = LoggerFactory.getLogger(RankingSorter.class);

    static final double HEAD_TO_HEAD_EPSILON = 1e-9;

    private RankingSorter() {}

    /**
     * Sorts and ranks {@code rows}.
     *
     * @param rows        unranked rows, one per competitor
     * @param index       match history, for head-to-head
     * @param eventId     hash seed
     * @param headToHead  whether to try head-to-head before penalties
     * @param role        hash namespace
     * @return the rows with ranks 1..N applied
     */
    public static ImmutableList<StandingRow> rank(List<StandingRow> rows, MatchIndex index, String eventId,
                                                  boolean headToHead, TieBreakRole role) {
        List<StandingRow> sorted = new ArrayList<>(rows);
        sorted.sort(Comparator.comparing(StandingRow::signature, TieSignature.DESCENDING)
            .thenComparing(StandingRow::playerId));

        List<StandingRow> resolved = new ArrayList<>(sorted.size());
        int i = 0;
        while (i < sorted.size()) {
            TieSignature first = sorted.get(i).signature();
            int j = i + 1;
            while (j < sorted.size() && first.sameAs(sorted.get(j).signature())) {
                j++;
            }
            List<StandingRow> block = new ArrayList<>(sorted.subList(i, j));
            if (block.size() > 1) {
                resolveBlock(block, index, eventId, headToHead, role);
            }
            resolved.addAll(block);
            i = j;
        }

        ImmutableList.Builder<StandingRow> ranked = ImmutableList.builderWithExpectedSize(resolved.size());
        for (int r = 0; r < resolved.size(); r++) {
            ranked.add(resolved.get(r).withRank(r + 1));
        }
        return ranked.build();
    }

    private static void resolveBlock(List<StandingRow> block, MatchIndex index, String eventId,
                                     boolean headToHead, TieBreakRole role) {
        if (headToHead) {
            Map<String, Double> scores = headToHeadScores(block, index);
            if (isStrict(scores)) {
                block.sort(Comparator.comparingDouble((StandingRow r) -> scores.get(r.playerId())).reversed());
                log.debug("Tie block of {} resolved by head-to-head", block.size());
                return;
            }
        }
        block.sort(Comparator.comparingInt(StandingRow::penalties)
            .thenComparingLong(r -> role.hash(eventId, r.playerId())));
        log.debug("Tie block of {} resolved by penalties and {} hash", block.size(), role.key());
    }

    /**
     * Points each block member earned against other block members: 1 per win, 0.5 per draw.
     */
    static Map<String, Double> headToHeadScores(List<StandingRow> block, MatchIndex index) {
        Set<String> members = new HashSet<>();
        for (StandingRow r : block) {
            members.add(r.playerId());
        }
        Map<String, Double> scores = new HashMap<>();
        for (StandingRow r : block) {
            double score = 0;
            for (MatchRecord m : index.matchesOf(r.playerId())) {
                if (!m.hasOpponent() || !members.contains(m.opponentId())) {
                    continue;
                }
                if (m.outcome().isWin()) {
                    score += 1;
                } else if (m.outcome() == MatchOutcome.DRAW) {
                    score += 0.5;
                }
            }
            scores.put(r.playerId(), score);
        }
        return scores;
    }

    private static boolean isStrict(Map<String, Double> scores) {
        List<Double> values = new ArrayList<>(scores.values());
        values.sort(Comparator.reverseOrder());
        for (int k = 1; k < values.size(); k++) {
            if (Math.abs(values.get(k) - values.get(k - 1)) < HEAD_TO_HEAD_EPSILON) {
                return false;
            }
        }
        return true;
    }
}
