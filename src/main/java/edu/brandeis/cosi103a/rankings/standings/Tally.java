package edu.brandeis.cosi103a.rankings.standings;

import com.google.common.collect.ImmutableList;

/**
 * Raw per-competitor totals accumulated from their own match entries.
 *
 * @param gameWins real game wins only; the two synthetic wins per bye are added by {@link #visibleGameWins()}
 */
public record Tally(
    int wins,
    int losses,
    int draws,
    int byes,
    double matchPoints,
    int gameWins,
    int gameLosses,
    int gameDraws,
    int penalties,
    ImmutableList<String> opponents,
    int roundsPlayed
) {

    static final Tally EMPTY = new Tally(0, 0, 0, 0, 0, 0, 0, 0, 0, ImmutableList.of(), 0);

    /**
     * Game wins as reported on a standings row: each bye counts as a 2-0.
     */
    public int visibleGameWins() {
        return gameWins + 2 * byes;
    }
}
