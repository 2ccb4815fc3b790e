package edu.brandeis.cosi103a.rankings.standings;

import edu.brandeis.cosi103a.rankings.match.MatchOutcome;

/**
 * Match points awarded per outcome. Forfeits score as a win or a loss.
 */
public record PointsMap(
    double win,
    double draw,
    double loss,
    double bye
) {

    private static final PointsMap DEFAULT = new PointsMap(3, 1, 0, 3);

    /**
     * The usual 3/1/0 system with a bye worth a win.
     */
    public static PointsMap defaults() {
        return DEFAULT;
    }

    public double pointsFor(MatchOutcome outcome) {
        return switch (outcome) {
            case WIN, FORFEIT_WIN -> win;
            case DRAW -> draw;
            case LOSS, FORFEIT_LOSS -> loss;
            case BYE -> bye;
        };
    }
}
