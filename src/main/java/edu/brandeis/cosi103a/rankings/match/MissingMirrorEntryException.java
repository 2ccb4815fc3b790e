package edu.brandeis.cosi103a.rankings.match;

/**
 * Thrown when a match between two competitors was entered from one side only
 * and the caller did not ask for single-sided entries to be reconstructed.
 */
public class MissingMirrorEntryException extends IllegalArgumentException {

    private final MatchRecord entry;

    public MissingMirrorEntryException(MatchRecord entry) {
        super(String.format(
            "Missing mirrored entry for %s vs %s in round %d. Enable single-entry matches to reconstruct it.",
            entry.playerId(), entry.opponentId(), entry.round()));
        this.entry = entry;
    }

    /**
     * The one-sided entry that has no counterpart.
     */
    public MatchRecord entry() {
        return entry;
    }
}
