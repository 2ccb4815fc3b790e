package edu.brandeis.cosi103a.rankings.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.brandeis.cosi103a.rankings.match.MatchRecord;
import edu.brandeis.cosi103a.rankings.match.MissingMirrorEntryException;
import edu.brandeis.cosi103a.rankings.standings.StandingsMode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RankingsRunnerTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void parseArgs_standingsDefaults() {
        RunnerConfig config = RankingsRunner.parseArgs(new String[] {"standings", "--matches", "m.json"});

        assertEquals(RunnerConfig.Command.STANDINGS, config.command());
        assertEquals(Path.of("m.json"), config.matchesFile());
        assertEquals(StandingsMode.SWISS, config.mode());
        assertTrue(config.headToHead());
        assertFalse(config.acceptSingleEntry());
        assertEquals(Path.of("./data"), config.outputDir());
    }

    @Test
    void parseArgs_allFlags() {
        RunnerConfig config = RankingsRunner.parseArgs(new String[] {
            "pair", "--matches", "m.json", "--round", "4", "--mode", "roundrobin", "--event-id", "spring",
            "--accept-single-entry", "--no-head-to-head", "--virtual-bye", "--protect-top", "2",
            "--allow-rematches", "--max-backtrack", "50", "--output", "out"});

        assertEquals(4, config.round());
        assertEquals(StandingsMode.ROUND_ROBIN, config.mode());
        assertEquals("spring", config.standingsOptions().eventId());
        assertTrue(config.standingsOptions().acceptSingleEntryMatches());
        assertFalse(config.standingsOptions().applyHeadToHead());
        assertTrue(config.standingsOptions().virtualBye().enabled());
        assertEquals(2, config.pairingOptions().protectTopN());
        assertFalse(config.pairingOptions().avoidRematches());
        assertEquals(50, config.pairingOptions().maxBacktrack());
        assertEquals("spring", config.pairingOptions().eventId());
        assertEquals(Path.of("out"), config.outputDir());
    }

    @Test
    void parseArgs_scheduleAndRatingsFlags() {
        RunnerConfig schedule = RankingsRunner.parseArgs(new String[] {
            "schedule", "--players", "a, b ,c", "--double", "--seed", "x", "--no-bye"});
        assertEquals(List.of("a", "b", "c"), schedule.players());
        assertTrue(schedule.roundRobinOptions().doubleRoundRobin());
        assertEquals("x", schedule.roundRobinOptions().shuffleSeed());
        assertFalse(schedule.roundRobinOptions().includeBye());

        RunnerConfig ratings = RankingsRunner.parseArgs(new String[] {
            "ratings", "--matches", "m.json", "--k", "24", "--backend", "com.example.Fast"});
        assertEquals(24.0, ratings.eloOptions().k());
        assertEquals(24.0, ratings.eloOptions().kDraw());
        assertEquals("com.example.Fast", ratings.backendClass());
    }

    @Test
    void parseArgs_rejectsBadInput() {
        assertThrows(IllegalArgumentException.class, () -> RankingsRunner.parseArgs(new String[] {"rank"}));
        assertThrows(IllegalArgumentException.class, () -> RankingsRunner.parseArgs(new String[] {"standings"}));
        assertThrows(IllegalArgumentException.class,
            () -> RankingsRunner.parseArgs(new String[] {"pair", "--matches", "m.json"}));
        assertThrows(IllegalArgumentException.class,
            () -> RankingsRunner.parseArgs(new String[] {"pair", "--matches", "m.json", "--round", "0"}));
        assertThrows(IllegalArgumentException.class,
            () -> RankingsRunner.parseArgs(new String[] {"standings", "--matches", "m.json", "--frobnicate"}));
        assertThrows(IllegalArgumentException.class,
            () -> RankingsRunner.parseArgs(new String[] {"standings", "--matches"}));
        assertThrows(IllegalArgumentException.class,
            () -> RankingsRunner.parseArgs(new String[] {"ratings", "--matches", "m.json", "--k", "big"}));
        assertThrows(IllegalArgumentException.class,
            () -> RankingsRunner.parseArgs(new String[] {"schedule", "--players", "a,b,a"}));
        assertThrows(IllegalArgumentException.class,
            () -> RankingsRunner.parseArgs(new String[] {"standings", "--matches", "m.json", "--mode", "ladder"}));
    }

    @Test
    void readMatches_parsesSampleEvent(@TempDir Path tempDir) throws Exception {
        Path file = copyResource("sample-event/matches.json", tempDir.resolve("matches.json"));

        List<MatchRecord> matches = RankingsRunner.readMatches(file);

        assertEquals(10, matches.size());
        assertFalse(matches.get(4).hasOpponent(), "r1-bye has no opponent");
        assertEquals(1, matches.get(8).penalties());
    }

    @Test
    void readMatches_missingFile(@TempDir Path tempDir) {
        assertThrows(IllegalArgumentException.class,
            () -> RankingsRunner.readMatches(tempDir.resolve("nope.json")));
    }

    @Test
    void run_standingsWritesRankedFile(@TempDir Path tempDir) throws Exception {
        Path matches = copyResource("sample-event/matches.json", tempDir.resolve("matches.json"));
        Path out = tempDir.resolve("out");

        List<Path> written = RankingsRunner.run(RankingsRunner.parseArgs(new String[] {
            "standings", "--matches", matches.toString(), "--output", out.toString()}));

        assertEquals(List.of(out.resolve("standings.json")), written);
        JsonNode standings = mapper.readTree(written.get(0).toFile());
        assertEquals(5, standings.size());
        assertEquals("alice", standings.get(0).get("playerId").asText());
        assertEquals(1, standings.get(0).get("rank").asInt());
        assertEquals("erin", standings.get(1).get("playerId").asText());
        assertEquals("bob", standings.get(4).get("playerId").asText());
        assertFalse(standings.get(0).has("eliminationRound"), "only set for single elimination");
    }

    @Test
    void run_pairWritesStandingsAndPairings(@TempDir Path tempDir) throws Exception {
        Path matches = copyResource("sample-event/matches.json", tempDir.resolve("matches.json"));

        List<Path> written = RankingsRunner.run(RankingsRunner.parseArgs(new String[] {
            "pair", "--matches", matches.toString(), "--round", "3", "--output", tempDir.toString()}));

        assertEquals(2, written.size());
        Path pairingsFile = tempDir.resolve("pairings-round-03.json");
        assertTrue(Files.exists(pairingsFile), "pairings-round-03.json should be created");

        JsonNode result = mapper.readTree(pairingsFile.toFile());
        assertEquals("bob", result.get("bye").asText());
        JsonNode pairings = result.get("pairings");
        assertEquals(2, pairings.size());
        assertEquals("alice", pairings.get(0).get("a").asText());
        assertEquals("dave", pairings.get(0).get("b").asText());
        assertEquals("erin", pairings.get(1).get("a").asText());
        assertEquals("carol", pairings.get(1).get("b").asText());
        assertEquals(0, result.get("rematchesUsed").size());
        assertFalse(result.has("round"), "Swiss results carry no round number");
    }

    @Test
    void run_scheduleWritesAllRounds(@TempDir Path tempDir) throws Exception {
        List<Path> written = RankingsRunner.run(RankingsRunner.parseArgs(new String[] {
            "schedule", "--players", "a,b,c", "--output", tempDir.toString()}));

        JsonNode schedule = mapper.readTree(written.get(0).toFile());
        assertEquals(3, schedule.get("rounds").size());
        for (JsonNode round : schedule.get("rounds")) {
            assertEquals(1, round.get("pairings").size());
            assertEquals(1, round.get("byes").size());
        }
    }

    @Test
    void run_roundRobinRequiresMirroredEntries(@TempDir Path tempDir) throws Exception {
        Path matches = copyResource("sample-event/roundrobin-single-entry.json", tempDir.resolve("rr.json"));

        RunnerConfig strict = RankingsRunner.parseArgs(new String[] {
            "standings", "--matches", matches.toString(), "--mode", "roundrobin", "--output", tempDir.toString()});
        assertThrows(MissingMirrorEntryException.class, () -> RankingsRunner.run(strict));
        assertFalse(Files.exists(tempDir.resolve("standings.json")), "nothing written on failure");

        RunnerConfig lenient = RankingsRunner.parseArgs(new String[] {
            "standings", "--matches", matches.toString(), "--mode", "roundrobin", "--accept-single-entry",
            "--output", tempDir.toString()});
        JsonNode standings = mapper.readTree(RankingsRunner.run(lenient).get(0).toFile());
        assertEquals("p2", standings.get(0).get("playerId").asText());
        assertEquals("p4", standings.get(3).get("playerId").asText());
    }

    @Test
    void run_singleEliminationBracket(@TempDir Path tempDir) throws Exception {
        Path matches = copyResource("sample-event/bracket.json", tempDir.resolve("bracket.json"));

        JsonNode standings = mapper.readTree(RankingsRunner.run(RankingsRunner.parseArgs(new String[] {
            "standings", "--matches", matches.toString(), "--mode", "singleelimination",
            "--output", tempDir.toString()})).get(0).toFile());

        assertEquals("a", standings.get(0).get("playerId").asText());
        assertEquals(3, standings.get(0).get("eliminationRound").asInt());
        assertEquals("b", standings.get(1).get("playerId").asText());
    }

    @Test
    void run_ratingsWritesEloAndTrueSkill(@TempDir Path tempDir) throws Exception {
        Path matches = copyResource("sample-event/matches.json", tempDir.resolve("matches.json"));

        List<Path> written = RankingsRunner.run(RankingsRunner.parseArgs(new String[] {
            "ratings", "--matches", matches.toString(), "--backend",
            "edu.brandeis.cosi103a.rankings.rating.TableExpectedScoreBackend", "--output", tempDir.toString()}));

        JsonNode report = mapper.readTree(written.get(0).toFile());
        assertEquals(4, report.get("matches").asInt(), "byes are not rated");
        assertTrue(report.get("elo").get("ratings").get("alice").asDouble() > 1500);
        assertTrue(report.get("elo").get("ratings").get("bob").asDouble() < 1500);
        assertEquals(5, report.get("trueSkill").size());
        assertEquals("alice", report.get("trueSkill").get(0).get("playerId").asText());
    }

    @Test
    void rate_unknownBackendRejected(@TempDir Path tempDir) throws Exception {
        Path matches = copyResource("sample-event/matches.json", tempDir.resolve("matches.json"));
        RunnerConfig config = RankingsRunner.parseArgs(new String[] {
            "ratings", "--matches", matches.toString(), "--backend", "com.example.NoSuchBackend"});

        assertThrows(IllegalArgumentException.class,
            () -> RankingsRunner.rate(RankingsRunner.readMatches(matches), config));
    }

    private Path copyResource(String resourceName, Path target) throws Exception {
        try (var in = getClass().getClassLoader().getResourceAsStream(resourceName)) {
            if (in == null) {
                throw new IllegalStateException("Resource not found: " + resourceName);
            }
            Files.copy(in, target);
        }
        return target;
    }
}
