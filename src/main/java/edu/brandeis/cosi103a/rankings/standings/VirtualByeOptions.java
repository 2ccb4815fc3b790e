package edu.brandeis.cosi103a.rankings.standings;

/**
 * Synthetic opponent contribution for each bye a competitor received.
 * Affects OMW% and OGW% only.
 *
 * @param enabled whether byes contribute a virtual opponent
 * @param mwp     match-win percentage credited per bye (clamped to [0, 1], then floored)
 * @param gwp     game-win percentage credited per bye (clamped to [0, 1], then floored)
 */
public record VirtualByeOptions(
    boolean enabled,
    double mwp,
    double gwp
) {

    private static final VirtualByeOptions DISABLED = new VirtualByeOptions(false, 0.5, 0.5);

    public static VirtualByeOptions disabled() {
        return DISABLED;
    }

    /**
     * Enabled with the default 0.5 contribution.
     */
    public static VirtualByeOptions enabledDefault() {
        return new VirtualByeOptions(true, 0.5, 0.5);
    }
}
