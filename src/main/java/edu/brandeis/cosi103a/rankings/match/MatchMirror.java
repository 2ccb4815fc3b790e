package edu.brandeis.cosi103a.rankings.match;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Detects and repairs matches that were entered from one side only.
 * Byes are never mirrored.
 */
public final class MatchMirror {

    private MatchMirror() {}

    /**
     * Returns the input plus a mirrored entry for every real match whose reverse
     * (same round, owner and opponent swapped) is missing. Existing pairs are not duplicated.
     */
    public static List<MatchRecord> withMirrors(List<MatchRecord> matches) {
        List<MatchRecord> out = new ArrayList<>(matches);
        Set<DirectedKey> seen = directedKeys(matches);

        for (MatchRecord m : matches) {
            if (!m.hasOpponent()) {
                continue;
            }
            DirectedKey reverse = new DirectedKey(m.round(), m.opponentId(), m.playerId());
            if (seen.add(reverse)) {
                out.add(m.mirror());
            }
        }
        return out;
    }

    /**
     * Entries with a real opponent whose reverse entry is missing, in input order.
     */
    public static List<MatchRecord> findUnmirrored(List<MatchRecord> matches) {
        Set<DirectedKey> seen = directedKeys(matches);
        List<MatchRecord> missing = new ArrayList<>();
        for (MatchRecord m : matches) {
            if (m.hasOpponent() && !seen.contains(new DirectedKey(m.round(), m.opponentId(), m.playerId()))) {
                missing.add(m);
            }
        }
        return missing;
    }

    /**
     * Fails with {@link MissingMirrorEntryException} on the first one-sided entry.
     */
    public static void requireMirrored(List<MatchRecord> matches) {
        List<MatchRecord> missing = findUnmirrored(matches);
        if (!missing.isEmpty()) {
            throw new MissingMirrorEntryException(missing.get(0));
        }
    }

    private static Set<DirectedKey> directedKeys(List<MatchRecord> matches) {
        Set<DirectedKey> seen = new HashSet<>();
        for (MatchRecord m : matches) {
            if (m.hasOpponent()) {
                seen.add(new DirectedKey(m.round(), m.playerId(), m.opponentId()));
            }
        }
        return seen;
    }

    private record DirectedKey(int round, String owner, String opponent) {}
}
