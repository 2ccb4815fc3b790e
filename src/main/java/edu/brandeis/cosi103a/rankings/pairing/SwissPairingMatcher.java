package edu.brandeis.cosi103a.rankings.pairing;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import edu.brandeis.cosi103a.rankings.match.MatchOutcome;
import edu.brandeis.cosi103a.rankings.match.MatchRecord;
import edu.brandeis.cosi103a.rankings.standings.StandingRow;
import edu.brandeis.cosi103a.rankings.standings.TieBreakRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Swiss pairings for the next round.
 *
 * <p>The bye goes to the lowest-ranked competitor who has not had one. The rest are paired
 * best-ranked first by a depth-first search over an explicit frame stack. When the search
 * runs out of candidates or exceeds its undo budget it restarts with looser rules:
 * <ol>
 *   <li>level 0: no rematches, top-N protection in force</li>
 *   <li>level 1: top-N protection lifted, still no rematches</li>
 *   <li>level 2: rematches allowed and reported</li>
 * </ol>
 * At level 2 the search keeps going after the first complete matching and returns the one
 * with the fewest rematches found within the budget, then the fewest protected competitors moved.
 */
public final class SwissPairingMatcher {

    private static final Logger log = LoggerFactory.getLogger(SwissPairingMatcher.class);

    private static final int STRICT = 0;
    private static final int LIFT_PROTECTION = 1;
    private static final int ALLOW_REMATCHES = 2;

    private final ImmutableList<StandingRow> field;
    private final PairingOptions options;
    private final Map<String, Set<String>> played;
    private final int[] naturalGroup;
    private final boolean[] protectedRank;
    private final int[] priorDownfloats;
    private final long[] hash;

    private final int[] partner;
    private int backtracks;
    private int rematchCount;
    private int protectedMoves;

    private SwissPairingMatcher(ImmutableList<StandingRow> field, Map<String, Set<String>> played,
                                PairingOptions options) {
        this.field = field;
        this.options = options;
        this.played = played;

        int n = field.size();
        this.naturalGroup = new int[n];
        this.protectedRank = new boolean[n];
        this.priorDownfloats = new int[n];
        this.hash = new long[n];
        this.partner = new int[n];

        int pos = 0;
        for (ScoreGroup group : ScoreGroupPartitioner.partition(field, options.groupingKey())) {
            for (int k = 0; k < group.size(); k++) {
                naturalGroup[pos++] = group.index();
            }
        }
        for (int i = 0; i < n; i++) {
            String id = field.get(i).playerId();
            protectedRank[i] = i < options.protectTopN();
            priorDownfloats[i] = options.priorDownfloats().getOrDefault(id, 0);
            hash[i] = TieBreakRole.PAIRING_FALLBACK.hash(options.eventId(), id);
        }
    }

    /**
     * Pairs the next round.
     *
     * @param standings current standings, one row per competitor; ranks order the field
     * @param history   every match entry so far, for rematches and previous byes
     * @param options   pairing options, {@code null} for defaults
     * @throws IllegalArgumentException     if a competitor appears twice in the standings
     * @throws PairingImpossibleException   if the field is empty, odd without byes, or cannot be paired
     */
    public static PairingResult pair(List<StandingRow> standings, List<MatchRecord> history,
                                     PairingOptions options) {
        PairingOptions opts = options == null ? PairingOptions.defaults() : options;
        List<StandingRow> ranked = rankOrder(standings, opts.eventId());

        if (ranked.isEmpty()) {
            throw new PairingImpossibleException("No competitors to pair");
        }

        Optional<String> bye = Optional.empty();
        List<StandingRow> remaining = new ArrayList<>(ranked);
        if (ranked.size() % 2 == 1) {
            if (!opts.allowBye()) {
                throw new PairingImpossibleException(
                    "Odd number of competitors (" + ranked.size() + ") and byes are not allowed");
            }
            StandingRow byeRow = chooseBye(ranked, history);
            remaining.remove(byeRow);
            bye = Optional.of(byeRow.playerId());
        }

        SwissPairingMatcher matcher =
            new SwissPairingMatcher(ImmutableList.copyOf(remaining), previousOpponents(history), opts);
        return matcher.run(ranked, bye);
    }

    private PairingResult run(List<StandingRow> ranked, Optional<String> bye) {
        int level = STRICT;
        int totalBacktracks = 0;
        while (true) {
            if (search(level)) {
                totalBacktracks += backtracks;
                log.debug("Paired {} competitors at relaxation level {} after {} backtracks",
                    field.size(), level, totalBacktracks);
                return buildResult(ranked, bye);
            }
            totalBacktracks += backtracks;
            int next = nextLevel(level);
            if (next < 0) {
                throw new PairingImpossibleException("No legal pairing for " + field.size()
                    + " competitors after " + totalBacktracks + " backtracks with all constraints relaxed");
            }
            log.warn("No pairing at relaxation level {} ({} backtracks); relaxing to {}",
                level, backtracks, next == ALLOW_REMATCHES ? "allow rematches" : "lift top-N protection");
            level = next;
        }
    }

    private int nextLevel(int level) {
        if (level == STRICT && options.protectTopN() > 0) {
            return LIFT_PROTECTION;
        }
        if (level < ALLOW_REMATCHES && options.avoidRematches()) {
            return ALLOW_REMATCHES;
        }
        return -1;
    }

    /**
     * One bounded depth-first pass. Leaves the matching in {@link #partner} on success.
     * Once rematches are allowed the pass is a branch and bound over (rematches, protected moves).
     */
    private boolean search(int level) {
        Arrays.fill(partner, -1);
        backtracks = 0;
        rematchCount = 0;
        protectedMoves = 0;
        boolean minimise = level == ALLOW_REMATCHES;
        int[] best = null;
        int bestRematches = Integer.MAX_VALUE;
        int bestMoves = Integer.MAX_VALUE;
        int[] effectiveGroup = effectiveGroups(level);

        Deque<Frame> stack = new ArrayDeque<>();
        Frame first = open(level, effectiveGroup);
        if (first == null) {
            return true;
        }
        stack.push(first);

        while (!stack.isEmpty()) {
            Frame top = stack.peek();
            if (!top.hasNext()) {
                stack.pop();
                if (stack.isEmpty()) {
                    break;
                }
                unpair(stack.peek().competitor);
                if (++backtracks > options.maxBacktrack()) {
                    break;
                }
                continue;
            }

            pair(top.competitor, top.next());
            if (minimise && !(rematchCount < bestRematches
                || (rematchCount == bestRematches && protectedMoves < bestMoves))) {
                unpair(top.competitor);
                continue;
            }
            Frame child = open(level, effectiveGroup);
            if (child != null) {
                stack.push(child);
                continue;
            }
            if (!minimise) {
                return true;
            }
            best = partner.clone();
            bestRematches = rematchCount;
            bestMoves = protectedMoves;
            if (bestRematches == 0 && bestMoves == 0) {
                break;
            }
            unpair(top.competitor);
        }

        if (best == null) {
            return false;
        }
        System.arraycopy(best, 0, partner, 0, partner.length);
        return true;
    }

    private void pair(int i, int j) {
        partner[i] = j;
        partner[j] = i;
        if (isRematch(i, j)) {
            rematchCount++;
        }
        if (movesProtected(i, j)) {
            protectedMoves++;
        }
    }

    private void unpair(int i) {
        int j = partner[i];
        if (isRematch(i, j)) {
            rematchCount--;
        }
        if (movesProtected(i, j)) {
            protectedMoves--;
        }
        partner[i] = -1;
        partner[j] = -1;
    }

    /**
     * Frame for the best-ranked unpaired competitor, or {@code null} when everyone is paired.
     */
    private Frame open(int level, int[] effectiveGroup) {
        int i = -1;
        for (int k = 0; k < partner.length; k++) {
            if (partner[k] < 0) {
                i = k;
                break;
            }
        }
        if (i < 0) {
            return null;
        }

        List<Integer> candidates = new ArrayList<>();
        for (int j = i + 1; j < partner.length; j++) {
            if (partner[j] < 0 && isLegal(i, j, level)) {
                candidates.add(j);
            }
        }
        int self = i;
        candidates.sort(Comparator
            .comparingInt((Integer j) -> isRematch(self, j) ? 1 : 0)
            .thenComparingInt(j -> movesProtected(self, j) ? 1 : 0)
            .thenComparingInt(j -> effectiveGroup[j] == effectiveGroup[self] ? 0 : 1)
            .thenComparingInt(j -> Math.abs(naturalGroup[j] - naturalGroup[self]))
            .thenComparingInt(j -> j - self)
            .thenComparingLong(j -> hash[j]));
        return new Frame(i, candidates.stream().mapToInt(Integer::intValue).toArray());
    }

    private boolean isLegal(int i, int j, int level) {
        if (level < ALLOW_REMATCHES && options.avoidRematches() && isRematch(i, j)) {
            return false;
        }
        return level >= LIFT_PROTECTION || !movesProtected(i, j);
    }

    private boolean isRematch(int i, int j) {
        return played.getOrDefault(field.get(i).playerId(), Set.of()).contains(field.get(j).playerId());
    }

    private boolean movesProtected(int i, int j) {
        return naturalGroup[i] != naturalGroup[j] && (protectedRank[i] || protectedRank[j]);
    }

    /**
     * Walks the groups top-down and floats one natural member out of every odd group.
     * Floaters are chosen by fewest prior downfloats, then lowest rank.
     */
    private int[] effectiveGroups(int level) {
        int[] effective = naturalGroup.clone();
        int n = field.size();
        List<Integer> incoming = new ArrayList<>();
        int start = 0;
        while (start < n) {
            int group = naturalGroup[start];
            int end = start;
            while (end < n && naturalGroup[end] == group) {
                end++;
            }
            int count = (end - start) + incoming.size();
            List<Integer> outgoing = new ArrayList<>();
            if (count % 2 == 1 && end < n) {
                int floater = pickFloater(start, end, incoming, level);
                if (floater >= 0) {
                    outgoing.add(floater);
                }
            }
            int nextGroup = end < n ? naturalGroup[end] : group;
            for (int f : outgoing) {
                effective[f] = nextGroup;
            }
            incoming = outgoing;
            start = end;
        }
        return effective;
    }

    private int pickFloater(int start, int end, List<Integer> incoming, int level) {
        int best = -1;
        for (int k = start; k < end; k++) {
            if (protectedRank[k] && level < LIFT_PROTECTION) {
                continue;
            }
            if (best < 0 || priorDownfloats[k] < priorDownfloats[best]
                || (priorDownfloats[k] == priorDownfloats[best] && k > best)) {
                best = k;
            }
        }
        if (best < 0 && !incoming.isEmpty()) {
            best = incoming.get(incoming.size() - 1);
        }
        return best;
    }

    private PairingResult buildResult(List<StandingRow> ranked, Optional<String> bye) {
        ImmutableList.Builder<Pairing> pairings = ImmutableList.builder();
        ImmutableList.Builder<Pairing> rematches = ImmutableList.builder();
        int[] floats = priorDownfloats.clone();

        for (int i = 0; i < partner.length; i++) {
            int j = partner[i];
            if (j < i) {
                continue;
            }
            Pairing pairing = new Pairing(field.get(i).playerId(), field.get(j).playerId());
            pairings.add(pairing);
            if (options.avoidRematches() && isRematch(i, j)) {
                rematches.add(pairing);
            }
            if (naturalGroup[i] != naturalGroup[j]) {
                floats[naturalGroup[i] < naturalGroup[j] ? i : j]++;
            }
        }

        Map<String, Integer> byId = new HashMap<>();
        for (int i = 0; i < field.size(); i++) {
            byId.put(field.get(i).playerId(), floats[i]);
        }
        ImmutableMap.Builder<String, Integer> downfloats = ImmutableMap.builder();
        for (StandingRow row : ranked) {
            String id = row.playerId();
            downfloats.put(id, byId.getOrDefault(id, options.priorDownfloats().getOrDefault(id, 0)));
        }

        return PairingResult.swiss(pairings.build(), bye, downfloats.build(), rematches.build());
    }

    static List<StandingRow> rankOrder(List<StandingRow> standings, String eventId) {
        Set<String> seen = new HashSet<>();
        for (StandingRow row : standings) {
            if (!seen.add(row.playerId())) {
                throw new IllegalArgumentException("Competitor " + row.playerId() + " appears twice in the standings");
            }
        }
        List<StandingRow> ranked = new ArrayList<>(standings);
        ranked.sort(Comparator.comparingInt(StandingRow::rank)
            .thenComparingLong(r -> TieBreakRole.PAIRING_FALLBACK.hash(eventId, r.playerId()))
            .thenComparing(StandingRow::playerId));
        return ranked;
    }

    /**
     * Lowest-ranked competitor without a previous bye; the lowest-ranked overall if everyone had one.
     */
    static StandingRow chooseBye(List<StandingRow> ranked, List<MatchRecord> history) {
        Set<String> hadBye = new HashSet<>();
        for (MatchRecord m : history) {
            if (m.outcome() == MatchOutcome.BYE) {
                hadBye.add(m.playerId());
            }
        }
        for (int i = ranked.size() - 1; i >= 0; i--) {
            if (!hadBye.contains(ranked.get(i).playerId())) {
                return ranked.get(i);
            }
        }
        return ranked.get(ranked.size() - 1);
    }

    static Map<String, Set<String>> previousOpponents(List<MatchRecord> history) {
        Map<String, Set<String>> played = new HashMap<>();
        for (MatchRecord m : history) {
            if (m.hasOpponent()) {
                played.computeIfAbsent(m.playerId(), k -> new HashSet<>()).add(m.opponentId());
                played.computeIfAbsent(m.opponentId(), k -> new HashSet<>()).add(m.playerId());
            }
        }
        return played;
    }

    private static final class Frame {
        private final int competitor;
        private final int[] candidates;
        private int next;

        private Frame(int competitor, int[] candidates) {
            this.competitor = competitor;
            this.candidates = candidates;
        }

        boolean hasNext() {
            return next < candidates.length;
        }

        int next() {
            return candidates[next++];
        }
    }
}
