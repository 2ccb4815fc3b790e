package edu.brandeis.cosi103a.rankings.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import de.gesundkrank.jskills.GameInfo;
import de.gesundkrank.jskills.Rating;
import edu.brandeis.cosi103a.rankings.match.MatchRecord;
import edu.brandeis.cosi103a.rankings.pairing.Pairing;
import edu.brandeis.cosi103a.rankings.pairing.PairingOptions;
import edu.brandeis.cosi103a.rankings.pairing.PairingResult;
import edu.brandeis.cosi103a.rankings.pairing.Pairings;
import edu.brandeis.cosi103a.rankings.pairing.RoundRobinSchedule;
import edu.brandeis.cosi103a.rankings.pairing.RoundRobinScheduler;
import edu.brandeis.cosi103a.rankings.rating.DiscoveredBackend;
import edu.brandeis.cosi103a.rankings.rating.EloRatingCalculator;
import edu.brandeis.cosi103a.rankings.rating.EloUpdateResult;
import edu.brandeis.cosi103a.rankings.rating.ExpectedScoreBackend;
import edu.brandeis.cosi103a.rankings.rating.ExpectedScoreBackendDiscovery;
import edu.brandeis.cosi103a.rankings.rating.RatedMatch;
import edu.brandeis.cosi103a.rankings.rating.TrueSkillRatingCalculator;
import edu.brandeis.cosi103a.rankings.rating.TrueSkillTracker;
import edu.brandeis.cosi103a.rankings.standings.StandingRow;
import edu.brandeis.cosi103a.rankings.standings.Standings;
import edu.brandeis.cosi103a.rankings.standings.StandingsMode;
import edu.brandeis.cosi103a.rankings.standings.StandingsOptions;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Main entry point for the rankings CLI.
 *
 * <p>Invocation:
 * <pre>
 * java -jar rankings-core.jar standings --matches matches.json --mode swiss --output ./out
 * java -jar rankings-core.jar pair --matches matches.json --round 4 --protect-top 2 --output ./out
 * java -jar rankings-core.jar schedule --players alice,bob,carol,dave --double --seed spring
 * java -jar rankings-core.jar ratings --matches matches.json --k 24
 * java -jar rankings-core.jar --list-backends
 * </pre>
 */
public class RankingsRunner {

    private static final Path DEFAULT_OUTPUT = Path.of("./data");

    public static void main(String[] args) {
        if (args.length >= 1 && "--list-backends".equals(args[0])) {
            listBackends();
            System.exit(0);
        }

        if (args.length < 1) {
            printUsage();
            System.exit(1);
        }

        RunnerConfig config;
        try {
            config = parseArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            System.err.println();
            printUsage();
            System.exit(1);
            return;
        }

        try {
            run(config);
        } catch (Exception e) {
            System.err.println("Command failed: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    /**
     * Lists expected-score backends found on the classpath.
     */
    private static void listBackends() {
        ExpectedScoreBackendDiscovery discovery = new ExpectedScoreBackendDiscovery();
        discovery.scanClasspath();

        List<DiscoveredBackend> backends = discovery.getDiscoveredBackends();
        if (backends.isEmpty()) {
            System.out.println("No expected-score backends discovered on classpath.");
            return;
        }

        System.out.println("Discovered expected-score backends:");
        System.out.println();
        for (DiscoveredBackend b : backends) {
            String desc = b.description().isEmpty() ? "" : " - " + b.description();
            System.out.printf("  %-30s %s%s%n", b.displayName(), b.className(), desc);
        }
        System.out.println();
        System.out.println("Use '--backend <class-name>' with the ratings command.");
    }

    /**
     * Runs one command and returns the files it wrote.
     */
    static List<Path> run(RunnerConfig config) throws IOException, ReflectiveOperationException {
        ResultFileWriter writer = new ResultFileWriter(config.outputDir());
        List<Path> written = new ArrayList<>();

        switch (config.command()) {
            case STANDINGS -> {
                List<MatchRecord> matches = readMatches(config.matchesFile());
                List<StandingRow> standings = Standings.compute(config.mode(), matches, config.standingsOptions());
                written.add(writer.writeStandings(standings));
                printStandings(standings);
            }
            case PAIR -> {
                List<MatchRecord> matches = readMatches(config.matchesFile());
                StandingsOptions standingsOptions = config.standingsOptions();
                List<StandingRow> standings = Standings.swiss(matches, standingsOptions);
                PairingOptions pairingOptions = config.pairingOptions();
                PairingResult result = Pairings.swiss(standings, matches, pairingOptions);
                written.add(writer.writeStandings(standings));
                written.add(writer.writePairings(config.round(), result));
                printPairings(config.round(), result);
            }
            case SCHEDULE -> {
                RoundRobinSchedule schedule =
                    RoundRobinScheduler.buildSchedule(config.players(), config.roundRobinOptions());
                written.add(writer.writeSchedule(schedule));
                System.out.printf("Scheduled %d rounds for %d players%n",
                    schedule.roundCount(), config.players().size());
            }
            case RATINGS -> {
                List<MatchRecord> matches = readMatches(config.matchesFile());
                RatingsReport report = rate(matches, config);
                written.add(writer.writeRatings(report));
                System.out.printf("Rated %d matches for %d players%n",
                    report.matches(), report.trueSkill().size());
            }
        }

        for (Path p : written) {
            System.out.printf("Wrote %s%n", p);
        }
        return written;
    }

    static List<MatchRecord> readMatches(Path file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("Missing required argument: --matches");
        }
        if (!Files.exists(file)) {
            throw new IllegalArgumentException("Matches file not found: " + file);
        }
        ObjectMapper mapper = ObjectMapperFactory.create();
        return mapper.readValue(file.toFile(), new TypeReference<List<MatchRecord>>() {});
    }

    static RatingsReport rate(List<MatchRecord> history, RunnerConfig config) throws ReflectiveOperationException {
        List<RatedMatch> matches = RatedMatch.fromHistory(history);

        EloRatingCalculator elo = new EloRatingCalculator(loadBackend(config.backendClass()));
        EloUpdateResult eloResult = elo.update(Map.of(), matches, config.eloOptions());

        Set<String> ids = new LinkedHashSet<>();
        for (RatedMatch m : matches) {
            ids.add(m.a());
            ids.add(m.b());
        }
        TrueSkillTracker tracker = new TrueSkillTracker(new ArrayList<>(ids), GameInfo.getDefaultGameInfo());
        tracker.processAll(matches);

        Map<String, Rating> ratings = tracker.getCurrentRatings();
        Map<String, Double> points = tracker.getCurrentPoints();
        ImmutableList.Builder<RatingsReport.TrueSkillEntry> entries = ImmutableList.builder();
        for (String id : tracker.leaderboard()) {
            Rating r = ratings.get(id);
            entries.add(new RatingsReport.TrueSkillEntry(id, r.getMean(), r.getStandardDeviation(),
                TrueSkillRatingCalculator.conservativeRating(r), points.getOrDefault(id, 0.0)));
        }
        return new RatingsReport(matches.size(), eloResult, entries.build());
    }

    private static ExpectedScoreBackend loadBackend(String className) throws ReflectiveOperationException {
        if (className == null) {
            return null;
        }
        ExpectedScoreBackendDiscovery discovery = new ExpectedScoreBackendDiscovery();
        discovery.scanClasspath();
        DiscoveredBackend discovered = discovery.findByClassName(className)
            .orElseThrow(() -> new IllegalArgumentException("Unknown expected-score backend: " + className));
        return discovery.createBackend(discovered);
    }

    private static void printStandings(List<StandingRow> standings) {
        for (StandingRow row : standings) {
            System.out.printf("%3d  %-20s %6.1f  OMW %.4f  GW %.4f  OGW %.4f%n",
                row.rank(), row.playerId(), row.matchPoints(), row.omwp(), row.gwp(), row.ogwp());
        }
    }

    private static void printPairings(int round, PairingResult result) {
        System.out.printf("Round %d pairings:%n", round);
        int table = 1;
        for (Pairing p : result.pairings()) {
            String marker = result.rematchesUsed().contains(p) ? "  (rematch)" : "";
            System.out.printf("  Table %d: %s vs %s%s%n", table++, p.a(), p.b(), marker);
        }
        result.bye().ifPresent(id -> System.out.printf("  Bye: %s%n", id));
    }

    /**
     * Parses CLI arguments into a RunnerConfig.
     *
     * @throws IllegalArgumentException if arguments are missing or malformed
     */
    static RunnerConfig parseArgs(String[] args) {
        RunnerConfig.Command command = RunnerConfig.Command.fromKey(args[0]);
        Path matchesFile = null;
        StandingsMode mode = StandingsMode.SWISS;
        String eventId = StandingsOptions.DEFAULT_EVENT_ID;
        boolean acceptSingleEntry = false;
        boolean headToHead = true;
        boolean virtualBye = false;
        Integer round = null;
        int protectTopN = 0;
        boolean allowRematches = false;
        int maxBacktrack = PairingOptions.DEFAULT_MAX_BACKTRACK;
        List<String> players = List.of();
        boolean doubleRoundRobin = false;
        String seed = null;
        boolean includeBye = true;
        double kFactor = 32;
        String backendClass = null;
        Path outputDir = DEFAULT_OUTPUT;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--matches" -> matchesFile = Path.of(value(args, ++i));
                case "--mode" -> mode = StandingsMode.fromKey(value(args, ++i));
                case "--event-id" -> eventId = value(args, ++i);
                case "--accept-single-entry" -> acceptSingleEntry = true;
                case "--no-head-to-head" -> headToHead = false;
                case "--virtual-bye" -> virtualBye = true;
                case "--round" -> round = parseInt(args[i], value(args, ++i));
                case "--protect-top" -> protectTopN = parseInt(args[i], value(args, ++i));
                case "--allow-rematches" -> allowRematches = true;
                case "--max-backtrack" -> maxBacktrack = parseInt(args[i], value(args, ++i));
                case "--players" -> players = parsePlayers(value(args, ++i));
                case "--double" -> doubleRoundRobin = true;
                case "--seed" -> seed = value(args, ++i);
                case "--no-bye" -> includeBye = false;
                case "--k" -> kFactor = parseDouble(args[i], value(args, ++i));
                case "--backend" -> backendClass = value(args, ++i);
                case "--output" -> outputDir = Path.of(value(args, ++i));
                default -> throw new IllegalArgumentException("Unknown argument: " + args[i]);
            }
        }

        switch (command) {
            case STANDINGS, RATINGS -> {
                if (matchesFile == null) {
                    throw new IllegalArgumentException("Missing required argument: --matches");
                }
            }
            case PAIR -> {
                if (matchesFile == null || round == null) {
                    throw new IllegalArgumentException("Missing required arguments: --matches, --round");
                }
                if (round < 1) {
                    throw new IllegalArgumentException("--round must be at least 1, got " + round);
                }
            }
            case SCHEDULE -> {
                if (players.isEmpty()) {
                    throw new IllegalArgumentException("Missing required argument: --players");
                }
            }
        }

        return new RunnerConfig(command, matchesFile, mode, eventId, acceptSingleEntry, headToHead, virtualBye,
            round == null ? 0 : round, protectTopN, allowRematches, maxBacktrack, players, doubleRoundRobin,
            seed, includeBye, kFactor, backendClass, outputDir);
    }

    private static String value(String[] args, int i) {
        if (i >= args.length) {
            throw new IllegalArgumentException("Missing value for " + args[i - 1]);
        }
        return args[i];
    }

    private static int parseInt(String flag, String raw) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Expected an integer for " + flag + ", got " + raw, e);
        }
    }

    private static double parseDouble(String flag, String raw) {
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Expected a number for " + flag + ", got " + raw, e);
        }
    }

    private static List<String> parsePlayers(String raw) {
        List<String> players = Arrays.stream(raw.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .toList();
        if (new LinkedHashSet<>(players).size() != players.size()) {
            throw new IllegalArgumentException("Duplicate player in --players: " + raw);
        }
        return players;
    }

    private static void printUsage() {
        System.err.println("Usage: java -jar rankings-core.jar <command> [options]");
        System.err.println("       java -jar rankings-core.jar --list-backends");
        System.err.println();
        System.err.println("Commands:");
        System.err.println("  standings    Compute standings from a match file");
        System.err.println("  pair         Compute Swiss standings and pair the next round");
        System.err.println("  schedule     Build a round-robin schedule");
        System.err.println("  ratings      Compute Elo and TrueSkill ratings from a match file");
        System.err.println();
        System.err.println("Options:");
        System.err.println("  --matches <file>           JSON array of match entries (standings, pair, ratings)");
        System.err.println("  --mode <mode>              swiss | roundrobin | singleelimination (default: swiss)");
        System.err.println("  --event-id <id>            Seed for tie-break hashes (default: rankings-core)");
        System.err.println("  --accept-single-entry      Reconstruct matches entered from one side only");
        System.err.println("  --no-head-to-head          Skip head-to-head when resolving ties");
        System.err.println("  --virtual-bye              Count each bye as a 0.5 opponent in OMW%/OGW%");
        System.err.println("  --round <n>                Round being paired (pair, required)");
        System.err.println("  --protect-top <n>          Keep the top n out of downfloats (default: 0)");
        System.err.println("  --allow-rematches          Do not avoid previous opponents");
        System.err.println("  --max-backtrack <n>        Search budget per relaxation level (default: 10000)");
        System.err.println("  --players <a,b,c>          Competitors in seat order (schedule, required)");
        System.err.println("  --double                   Double round robin");
        System.err.println("  --seed <seed>              Deterministic shuffle of the player order");
        System.err.println("  --no-bye                   Reject an odd number of players");
        System.err.println("  --k <k>                    Elo K-factor (default: 32)");
        System.err.println("  --backend <class-name>     Expected-score backend for Elo");
        System.err.println("  --output <dir>             Output directory (default: ./data)");
    }
}
