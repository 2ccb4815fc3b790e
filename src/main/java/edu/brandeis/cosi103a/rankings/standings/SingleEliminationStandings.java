package edu.brandeis.cosi103a.rankings.standings;

import com.google.common.collect.ImmutableList;
import edu.brandeis.cosi103a.rankings.match.MatchIndex;
import edu.brandeis.cosi103a.rankings.match.MatchRecord;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Standings for a knockout bracket: the deeper a competitor went, the better.
 * The champion's elimination round is one past the final.
 */
public final class SingleEliminationStandings {

    private SingleEliminationStandings() {}

    public static ImmutableList<StandingRow> compute(List<MatchRecord> matches, StandingsOptions options) {
        MatchIndex index = MatchIndex.of(matches);
        int maxRound = matches.stream().mapToInt(MatchRecord::round).max().orElse(0);

        List<StandingRow> rows = new ArrayList<>(index.size());
        for (String id : index.competitors()) {
            List<MatchRecord> ms = index.matchesOf(id);
            rows.add(row(id, ms, maxRound));
        }

        Map<String, Integer> seeding = options.seeding();
        String eventId = options.eventId();
        rows.sort(Comparator.comparingInt((StandingRow r) -> r.eliminationRound()).reversed()
            .thenComparingInt(r -> seeding.getOrDefault(r.playerId(), Integer.MAX_VALUE))
            .thenComparingInt(StandingRow::penalties)
            .thenComparingLong(r -> TieBreakRole.SINGLE_ELIMINATION.hash(eventId, r.playerId())));

        ImmutableList.Builder<StandingRow> ranked = ImmutableList.builderWithExpectedSize(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            ranked.add(rows.get(i).withRank(i + 1));
        }
        return ranked.build();
    }

    private static StandingRow row(String id, List<MatchRecord> ms, int maxRound) {
        int wins = 0;
        int losses = 0;
        int gameWins = 0;
        int gameLosses = 0;
        int gameDraws = 0;
        int penalties = 0;
        ImmutableList.Builder<String> opponents = ImmutableList.builder();
        for (MatchRecord m : ms) {
            if (m.outcome().isWin()) {
                wins++;
            } else if (m.outcome().isLoss()) {
                losses++;
            }
            gameWins += m.gameWins();
            gameLosses += m.gameLosses();
            gameDraws += m.gameDraws();
            penalties += m.penalties();
            if (m.hasOpponent()) {
                opponents.add(m.opponentId());
            }
        }

        MatchRecord last = ms.get(ms.size() - 1);
        int eliminationRound = last.round() == maxRound && last.outcome().isWin() ? maxRound + 1 : last.round();

        return new StandingRow(0, id, wins, 0, 0, 0, 0, 0, wins, losses, 0, 0, ms.size(),
            gameWins, gameLosses, gameDraws, penalties, opponents.build(), eliminationRound);
    }
}
