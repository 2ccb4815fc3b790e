package edu.brandeis.cosi103a.rankings.match;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Match history grouped by owning competitor, each list in chronological order.
 * Competitors iterate in id order so results never depend on the order records were supplied in.
 */
public final class MatchIndex {

    static final Comparator<MatchRecord> CHRONOLOGICAL = Comparator
        .comparingInt(MatchRecord::round)
        .thenComparing(MatchRecord::id)
        .thenComparing(MatchRecord::opponentId, Comparator.nullsFirst(Comparator.naturalOrder()))
        .thenComparing(MatchRecord::outcome);

    private final ImmutableSortedMap<String, ImmutableList<MatchRecord>> byCompetitor;

    private MatchIndex(ImmutableSortedMap<String, ImmutableList<MatchRecord>> byCompetitor) {
        this.byCompetitor = byCompetitor;
    }

    /**
     * Builds the index from raw records.
     */
    public static MatchIndex of(List<MatchRecord> matches) {
        Map<String, List<MatchRecord>> grouped = new TreeMap<>();
        for (MatchRecord m : matches) {
            grouped.computeIfAbsent(m.playerId(), k -> new ArrayList<>()).add(m);
        }

        ImmutableSortedMap.Builder<String, ImmutableList<MatchRecord>> builder = ImmutableSortedMap.naturalOrder();
        for (var entry : grouped.entrySet()) {
            List<MatchRecord> list = entry.getValue();
            list.sort(CHRONOLOGICAL);
            builder.put(entry.getKey(), ImmutableList.copyOf(list));
        }
        return new MatchIndex(builder.build());
    }

    /**
     * Competitors that own at least one record, in id order.
     */
    public Set<String> competitors() {
        return byCompetitor.keySet();
    }

    /**
     * Chronological records owned by {@code competitorId}; empty if none.
     */
    public List<MatchRecord> matchesOf(String competitorId) {
        return byCompetitor.getOrDefault(competitorId, ImmutableList.of());
    }

    public int size() {
        return byCompetitor.size();
    }
}
