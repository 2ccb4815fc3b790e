package edu.brandeis.cosi103a.rankings.pairing;

import com.google.common.collect.ImmutableList;
import edu.brandeis.cosi103a.rankings.match.MatchMirror;
import edu.brandeis.cosi103a.rankings.match.MatchOutcome;
import edu.brandeis.cosi103a.rankings.match.MatchRecord;
import edu.brandeis.cosi103a.rankings.standings.StandingRow;
import edu.brandeis.cosi103a.rankings.standings.StandingsEngine;
import edu.brandeis.cosi103a.rankings.standings.StandingsOptions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SwissPairingMatcherTest {

    @Test
    void oddField_byeToLowestAndTopPaired() {
        PairingResult result = SwissPairingMatcher.pair(standings(6, 6, 3, 3, 0), List.of(), PairingOptions.defaults());

        assertEquals(Optional.of("E"), result.bye());
        assertEquals(List.of("E"), result.byes());
        assertEquals(List.of(new Pairing("A", "B"), new Pairing("C", "D")), result.pairings());
        assertTrue(result.rematchesUsed().isEmpty());
    }

    @Test
    void evenField_noBye() {
        PairingResult result = SwissPairingMatcher.pair(standings(6, 6, 6, 3), List.of(), PairingOptions.defaults());

        assertTrue(result.bye().isEmpty());
        assertEquals(2, result.pairings().size());
        assertEquals(List.of(new Pairing("A", "B"), new Pairing("C", "D")), result.pairings());
    }

    @Test
    void bye_skipsCompetitorWhoAlreadyHadOne() {
        List<MatchRecord> history = List.of(MatchRecord.bye(1, "E"));
        PairingResult result = SwissPairingMatcher.pair(standings(6, 6, 3, 3, 0), history, PairingOptions.defaults());

        assertEquals(Optional.of("D"), result.bye());
        assertAllPairedOnce(result, 5);
    }

    @Test
    void bye_fallsBackToLowestWhenEveryoneHadOne() {
        List<MatchRecord> history = List.of(MatchRecord.bye(1, "A"), MatchRecord.bye(2, "B"), MatchRecord.bye(3, "C"));
        PairingResult result = SwissPairingMatcher.pair(standings(3, 3, 3), history, PairingOptions.defaults());

        assertEquals(Optional.of("C"), result.bye());
    }

    @Test
    void rematchesAreAvoided() {
        List<MatchRecord> history = played(1, "A", "B", "C", "D");
        PairingResult result = SwissPairingMatcher.pair(standings(6, 6, 3, 3), history, PairingOptions.defaults());

        assertEquals(List.of(new Pairing("A", "C"), new Pairing("B", "D")), result.pairings());
        assertTrue(result.rematchesUsed().isEmpty());
    }

    @Test
    void backtracksOutOfDeadEnd() {
        List<MatchRecord> history = new ArrayList<>();
        history.addAll(played(1, "A", "B"));
        history.addAll(played(2, "B", "D"));
        history.addAll(played(3, "D", "F"));

        PairingResult result = SwissPairingMatcher.pair(standings(3, 3, 3, 3, 3, 3), history, PairingOptions.defaults());

        assertEquals(List.of(new Pairing("A", "C"), new Pairing("B", "F"), new Pairing("D", "E")), result.pairings());
        assertTrue(result.rematchesUsed().isEmpty());
    }

    @Test
    void rematchesAllowedWhenUnavoidable() {
        List<MatchRecord> history = new ArrayList<>();
        history.addAll(played(1, "A", "B", "C", "D"));
        history.addAll(played(2, "A", "C", "B", "D"));
        history.addAll(played(3, "A", "D", "B", "C"));

        PairingResult result = SwissPairingMatcher.pair(standings(6, 6, 3, 3), history, PairingOptions.defaults());

        assertEquals(2, result.pairings().size());
        assertEquals(2, result.rematchesUsed().size(), "every pairing is a rematch");
        assertAllPairedOnce(result, 4);
    }

    @Test
    void rematchesNotReportedWhenAvoidanceIsOff() {
        List<MatchRecord> history = played(1, "A", "B", "C", "D");
        PairingOptions opts = PairingOptions.defaults().withAvoidRematches(false);

        PairingResult result = SwissPairingMatcher.pair(standings(6, 6, 3, 3), history, opts);

        assertEquals(List.of(new Pairing("A", "B"), new Pairing("C", "D")), result.pairings());
        assertTrue(result.rematchesUsed().isEmpty());
    }

    @Test
    void protectedTopCompetitorsStayInGroup() {
        PairingOptions opts = PairingOptions.defaults().withProtectTopN(2);
        PairingResult result = SwissPairingMatcher.pair(standings(9, 9, 9, 6), List.of(), opts);

        assertEquals(List.of(new Pairing("A", "B"), new Pairing("C", "D")), result.pairings());
        assertEquals(1, result.downfloatsOf("C"));
        assertEquals(0, result.downfloatsOf("A"));
    }

    @Test
    void protectionIsLiftedBeforeRematchesAreAllowed() {
        // A and B already met; pairing across groups costs protection but no rematch
        List<MatchRecord> history = played(1, "A", "B", "C", "D");
        PairingOptions opts = PairingOptions.defaults().withProtectTopN(2);

        PairingResult result = SwissPairingMatcher.pair(standings(6, 6, 3, 3), history, opts);

        assertEquals(List.of(new Pairing("A", "C"), new Pairing("B", "D")), result.pairings());
        assertTrue(result.rematchesUsed().isEmpty());
        assertEquals(1, result.downfloatsOf("A"));
        assertEquals(1, result.downfloatsOf("B"));
    }

    @Test
    void protectedSoleLeaderStillAvoidsRematches() {
        List<MatchRecord> history = played(1, "C", "D");
        PairingOptions opts = PairingOptions.defaults().withProtectTopN(1);

        PairingResult result = SwissPairingMatcher.pair(standings(9, 6, 6, 3), history, opts);

        assertEquals(List.of(new Pairing("A", "C"), new Pairing("B", "D")), result.pairings());
        assertTrue(result.rematchesUsed().isEmpty(), "a rematch-free pairing exists");
        assertEquals(1, result.downfloatsOf("A"), "the leader has nobody left in their group");
        assertEquals(SwissPairingMatcher.pair(standings(9, 6, 6, 3), history, PairingOptions.defaults()).pairings(),
            result.pairings());
    }

    @Test
    void relaxedSearchKeepsFewestRematches() {
        // Only A-B, A-C and B-D are fresh. Taking A-B first leaves two rematches; A-C, B-D leaves one.
        Set<String> fresh = Set.of("A-B", "A-C", "B-D");
        List<String> ids = List.of("A", "B", "C", "D", "E", "F");
        List<MatchRecord> history = new ArrayList<>();
        int round = 1;
        for (int i = 0; i < ids.size(); i++) {
            for (int j = i + 1; j < ids.size(); j++) {
                if (!fresh.contains(ids.get(i) + "-" + ids.get(j))) {
                    history.addAll(played(round++, ids.get(i), ids.get(j)));
                }
            }
        }

        PairingResult result = SwissPairingMatcher.pair(standings(3, 3, 3, 3, 3, 3), history, PairingOptions.defaults());

        assertEquals(List.of(new Pairing("A", "C"), new Pairing("B", "D"), new Pairing("E", "F")), result.pairings());
        assertEquals(List.of(new Pairing("E", "F")), result.rematchesUsed());
    }

    @Test
    void downfloatGoesToLowestInOddGroupAndIsCounted() {
        PairingResult result = SwissPairingMatcher.pair(standings(9, 9, 9, 6, 6), List.of(), PairingOptions.defaults());

        assertEquals(Optional.of("E"), result.bye());
        assertEquals(List.of(new Pairing("A", "B"), new Pairing("C", "D")), result.pairings());
        assertEquals(1, result.downfloatsOf("C"));
        assertEquals(0, result.downfloatsOf("D"));
        assertEquals(5, result.downfloats().size(), "every competitor is listed");
    }

    @Test
    void priorDownfloatsSpreadTheFloat() {
        PairingOptions opts = PairingOptions.defaults().withPriorDownfloats(Map.of("C", 1));
        PairingResult result = SwissPairingMatcher.pair(standings(9, 9, 9, 6), List.of(), opts);

        assertEquals(List.of(new Pairing("A", "C"), new Pairing("B", "D")), result.pairings());
        assertEquals(1, result.downfloatsOf("B"));
        assertEquals(1, result.downfloatsOf("C"), "carried over unchanged");
    }

    @Test
    void fiveCompetitors_byeGoesToLowestWithoutPriorBye() {
        List<MatchRecord> history = List.of(MatchRecord.bye(1, "E"));

        PairingResult result = SwissPairingMatcher.pair(standings(9, 9, 9, 6, 3), history, PairingOptions.defaults());

        assertEquals(Optional.of("D"), result.bye());
        assertEquals(List.of(new Pairing("A", "B"), new Pairing("C", "E")), result.pairings());
        assertAllPairedOnce(result, 5);
    }

    @Test
    void fourTiedCompetitors_avoidBothPreviousPairings() {
        List<MatchRecord> history = played(1, "A", "B", "C", "D");

        PairingResult result = SwissPairingMatcher.pair(standings(6, 6, 6, 6), history, PairingOptions.defaults());

        assertFalse(result.pairings().contains(new Pairing("A", "B")));
        assertFalse(result.pairings().contains(new Pairing("C", "D")));
        assertEquals(List.of(new Pairing("A", "C"), new Pairing("B", "D")), result.pairings());
        assertTrue(result.rematchesUsed().isEmpty());
    }

    @Test
    void resultIgnoresInputOrder() {
        List<StandingRow> rows = standings(9, 6, 6, 6, 3, 3, 0);
        List<MatchRecord> history = new ArrayList<>();
        history.addAll(played(1, "A", "B", "C", "D", "E", "F"));
        history.add(MatchRecord.bye(1, "G"));
        history.addAll(played(2, "A", "C", "B", "E", "D", "G"));
        history.add(MatchRecord.bye(2, "F"));
        PairingOptions opts = PairingOptions.defaults().withEventId("spring-open").withProtectTopN(1);

        PairingResult expected = SwissPairingMatcher.pair(rows, history, opts);
        assertEquals(expected, SwissPairingMatcher.pair(rows, history, opts), "repeated call");

        for (long seed = 1; seed <= 5; seed++) {
            List<StandingRow> shuffledRows = new ArrayList<>(rows);
            List<MatchRecord> shuffledHistory = new ArrayList<>(history);
            Collections.shuffle(shuffledRows, new Random(seed));
            Collections.shuffle(shuffledHistory, new Random(seed));

            assertEquals(expected, SwissPairingMatcher.pair(shuffledRows, shuffledHistory, opts),
                "shuffle seed " + seed);
        }
    }

    @Test
    void matchPointsGroupingIgnoresLowerTieKeys() {
        List<StandingRow> rows = List.of(row(1, "A", 0.6), row(2, "B", 0.5), row(3, "C", 0.4), row(4, "D", 0.3));

        PairingResult bySignature = SwissPairingMatcher.pair(rows, List.of(), PairingOptions.defaults());
        PairingResult byPoints = SwissPairingMatcher.pair(rows, List.of(),
            PairingOptions.defaults().withGroupingKey(ScoreGroupPartitioner.GroupingKey.MATCH_POINTS));

        assertEquals(List.of(new Pairing("A", "B"), new Pairing("C", "D")), byPoints.pairings());
        assertEquals(bySignature.pairings(), byPoints.pairings());
        assertEquals(1, bySignature.downfloatsOf("A"), "every row is its own group by signature");
        assertEquals(1, bySignature.downfloatsOf("C"));
        for (String id : List.of("A", "B", "C", "D")) {
            assertEquals(0, byPoints.downfloatsOf(id), id + " shares one points group");
        }
    }

    @Test
    void emptyFieldIsImpossible() {
        assertThrows(PairingImpossibleException.class,
            () -> SwissPairingMatcher.pair(List.of(), List.of(), PairingOptions.defaults()));
    }

    @Test
    void oddFieldWithoutByeIsImpossible() {
        PairingOptions opts = PairingOptions.defaults().withAllowBye(false);
        assertThrows(PairingImpossibleException.class,
            () -> SwissPairingMatcher.pair(standings(3, 3, 0), List.of(), opts));
    }

    @Test
    void duplicateCompetitorRejected() {
        List<StandingRow> rows = new ArrayList<>(standings(3, 0));
        rows.add(rows.get(0));
        assertThrows(IllegalArgumentException.class,
            () -> SwissPairingMatcher.pair(rows, List.of(), PairingOptions.defaults()));
    }

    @Test
    void nullOptionsMeansDefaults() {
        assertEquals(SwissPairingMatcher.pair(standings(3, 3, 0, 0), List.of(), PairingOptions.defaults()),
            SwissPairingMatcher.pair(standings(3, 3, 0, 0), List.of(), null));
    }

    @Test
    void optionsRejectNegativeBounds() {
        assertThrows(IllegalArgumentException.class, () -> PairingOptions.defaults().withProtectTopN(-1));
        assertThrows(IllegalArgumentException.class, () -> PairingOptions.defaults().withMaxBacktrack(-1));
    }

    @Test
    void optionsFillMissingValuesWithDefaults() {
        PairingOptions opts = new PairingOptions(null, true, 0, 10, true, null, null);

        assertEquals(StandingsOptions.DEFAULT_EVENT_ID, opts.eventId());
        assertEquals(ScoreGroupPartitioner.GroupingKey.TIE_SIGNATURE, opts.groupingKey());
        assertTrue(opts.priorDownfloats().isEmpty());
        assertTrue(PairingOptions.defaults().avoidRematches());
        assertEquals(PairingOptions.DEFAULT_MAX_BACKTRACK, PairingOptions.defaults().maxBacktrack());
    }

    @Test
    void eightPlayersThreeRoundsWithoutRematches() {
        List<MatchRecord> history = new ArrayList<>();
        List<StandingRow> current = standings(0, 0, 0, 0, 0, 0, 0, 0);
        Set<String> met = new HashSet<>();

        for (int round = 1; round <= 3; round++) {
            PairingResult result = SwissPairingMatcher.pair(current, history, PairingOptions.defaults());
            assertTrue(result.rematchesUsed().isEmpty(), "rematch in round " + round);
            assertAllPairedOnce(result, 8);

            for (Pairing p : result.pairings()) {
                assertTrue(met.add(key(p)), "repeat pairing " + p + " in round " + round);
                history.addAll(MatchMirror.withMirrors(List.of(
                    new MatchRecord(round, p.a(), p.b(), MatchOutcome.WIN, 2, 0, 0))));
            }
            current = StandingsEngine.swiss(history, StandingsOptions.defaults());
        }
    }

    private static void assertAllPairedOnce(PairingResult result, int fieldSize) {
        Set<String> seen = new HashSet<>();
        for (Pairing p : result.pairings()) {
            assertTrue(seen.add(p.a()), p.a() + " paired twice");
            assertTrue(seen.add(p.b()), p.b() + " paired twice");
        }
        result.bye().ifPresent(b -> assertTrue(seen.add(b), b + " both paired and given the bye"));
        assertEquals(fieldSize, seen.size());
    }

    private static String key(Pairing p) {
        return p.a().compareTo(p.b()) < 0 ? p.a() + "-" + p.b() : p.b() + "-" + p.a();
    }

    /**
     * Mirrored wins for each consecutive pair of ids: the first of each pair wins.
     */
    private static List<MatchRecord> played(int round, String... ids) {
        List<MatchRecord> out = new ArrayList<>();
        for (int i = 0; i < ids.length; i += 2) {
            out.add(new MatchRecord(round, ids[i], ids[i + 1], MatchOutcome.WIN, 2, 0, 0));
        }
        return MatchMirror.withMirrors(out);
    }

    private static StandingRow row(int rank, String id, double omwp) {
        return new StandingRow(rank, id, 6, 0.5, 0.5, omwp, 0.5, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0,
            ImmutableList.of(), null);
    }

    /**
     * Ranked rows named A, B, C... with the given match points. Rows with equal points
     * share the remaining tie keys.
     */
    static List<StandingRow> standings(double... points) {
        List<StandingRow> rows = new ArrayList<>();
        for (int i = 0; i < points.length; i++) {
            String id = String.valueOf((char) ('A' + i));
            rows.add(new StandingRow(i + 1, id, points[i], 0.5, 0.5, 0.5, 0.5, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0,
                ImmutableList.of(), null));
        }
        return rows;
    }
}
