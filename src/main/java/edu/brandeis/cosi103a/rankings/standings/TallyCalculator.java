package edu.brandeis.cosi103a.rankings.standings;

import com.google.common.collect.ImmutableList;
import edu.brandeis.cosi103a.rankings.match.MatchRecord;

import java.util.List;

/**
 * Folds one competitor's chronological match list into a {@link Tally}.
 */
public final class TallyCalculator {

    private TallyCalculator() {}

    public static Tally tally(List<MatchRecord> matches, PointsMap points) {
        if (matches.isEmpty()) {
            return Tally.EMPTY;
        }
        int wins = 0;
        int losses = 0;
        int draws = 0;
        int byes = 0;
        double matchPoints = 0;
        int gameWins = 0;
        int gameLosses = 0;
        int gameDraws = 0;
        int penalties = 0;
        ImmutableList.Builder<String> opponents = ImmutableList.builder();

        for (MatchRecord m : matches) {
            matchPoints += points.pointsFor(m.outcome());
            switch (m.outcome()) {
                case WIN, FORFEIT_WIN -> wins++;
                case LOSS, FORFEIT_LOSS -> losses++;
                case DRAW -> draws++;
                case BYE -> byes++;
            }
            gameWins += m.gameWins();
            gameLosses += m.gameLosses();
            gameDraws += m.gameDraws();
            penalties += m.penalties();
            if (m.hasOpponent()) {
                opponents.add(m.opponentId());
            }
        }

        return new Tally(wins, losses, draws, byes, matchPoints, gameWins, gameLosses, gameDraws,
            penalties, opponents.build(), matches.size());
    }
}
