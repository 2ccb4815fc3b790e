package edu.brandeis.cosi103a.rankings.standings;

import java.util.Locale;

/**
 * Which standings engine to run.
 */
public enum StandingsMode {
    SWISS("swiss"),
    ROUND_ROBIN("roundrobin"),
    SINGLE_ELIMINATION("singleelimination");

    private final String key;

    StandingsMode(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    /**
     * Parses a mode name such as {@code swiss} or {@code roundrobin}.
     *
     * @throws IllegalArgumentException if the mode is not supported
     */
    public static StandingsMode fromKey(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        for (StandingsMode mode : values()) {
            if (mode.key.equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported standings mode: " + value);
    }
}
