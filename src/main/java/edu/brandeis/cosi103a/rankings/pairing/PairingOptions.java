package edu.brandeis.cosi103a.rankings.pairing;

import com.google.common.collect.ImmutableMap;
import edu.brandeis.cosi103a.rankings.standings.StandingsOptions;

import java.util.Map;

/**
 * Swiss pairing options.
 *
 * @param eventId         seeds the pairing hash fallback
 * @param avoidRematches  treat previous opponents as illegal until relaxation
 * @param protectTopN     top-ranked competitors that may not be floated out of their group
 * @param maxBacktrack    undo budget per relaxation level
 * @param allowBye        whether an odd field may give a bye
 * @param groupingKey     how score groups are formed
 * @param priorDownfloats downfloats carried over from earlier rounds
 */
public record PairingOptions(
    String eventId,
    boolean avoidRematches,
    int protectTopN,
    int maxBacktrack,
    boolean allowBye,
    ScoreGroupPartitioner.GroupingKey groupingKey,
    Map<String, Integer> priorDownfloats
) {

    public static final int DEFAULT_MAX_BACKTRACK = 10_000;

    public PairingOptions {
        if (eventId == null || eventId.isBlank()) {
            eventId = StandingsOptions.DEFAULT_EVENT_ID;
        }
        if (protectTopN < 0) {
            throw new IllegalArgumentException("protectTopN must be non-negative, got " + protectTopN);
        }
        if (maxBacktrack < 0) {
            throw new IllegalArgumentException("maxBacktrack must be non-negative, got " + maxBacktrack);
        }
        if (groupingKey == null) {
            groupingKey = ScoreGroupPartitioner.GroupingKey.TIE_SIGNATURE;
        }
        priorDownfloats = priorDownfloats == null ? ImmutableMap.of() : ImmutableMap.copyOf(priorDownfloats);
    }

    public static PairingOptions defaults() {
        return new PairingOptions(StandingsOptions.DEFAULT_EVENT_ID, true, 0, DEFAULT_MAX_BACKTRACK, true,
            ScoreGroupPartitioner.GroupingKey.TIE_SIGNATURE, ImmutableMap.of());
    }

    public PairingOptions withEventId(String id) {
        return new PairingOptions(id, avoidRematches, protectTopN, maxBacktrack, allowBye, groupingKey,
            priorDownfloats);
    }

    public PairingOptions withAvoidRematches(boolean avoid) {
        return new PairingOptions(eventId, avoid, protectTopN, maxBacktrack, allowBye, groupingKey,
            priorDownfloats);
    }

    public PairingOptions withProtectTopN(int n) {
        return new PairingOptions(eventId, avoidRematches, n, maxBacktrack, allowBye, groupingKey,
            priorDownfloats);
    }

    public PairingOptions withMaxBacktrack(int bound) {
        return new PairingOptions(eventId, avoidRematches, protectTopN, bound, allowBye, groupingKey,
            priorDownfloats);
    }

    public PairingOptions withAllowBye(boolean allow) {
        return new PairingOptions(eventId, avoidRematches, protectTopN, maxBacktrack, allow, groupingKey,
            priorDownfloats);
    }

    public PairingOptions withGroupingKey(ScoreGroupPartitioner.GroupingKey key) {
        return new PairingOptions(eventId, avoidRematches, protectTopN, maxBacktrack, allowBye, key,
            priorDownfloats);
    }

    public PairingOptions withPriorDownfloats(Map<String, Integer> counts) {
        return new PairingOptions(eventId, avoidRematches, protectTopN, maxBacktrack, allowBye, groupingKey,
            counts);
    }
}
