package edu.brandeis.cosi103a.rankings.cli;

import edu.brandeis.cosi103a.rankings.pairing.PairingOptions;
import edu.brandeis.cosi103a.rankings.pairing.RoundRobinOptions;
import edu.brandeis.cosi103a.rankings.rating.EloOptions;
import edu.brandeis.cosi103a.rankings.standings.StandingsMode;
import edu.brandeis.cosi103a.rankings.standings.StandingsOptions;
import edu.brandeis.cosi103a.rankings.standings.VirtualByeOptions;

import java.nio.file.Path;
import java.util.List;

/**
 * Command line configuration parsed from CLI args.
 *
 * @param command       what to run
 * @param matchesFile   JSON array of match entries (standings, pair, ratings)
 * @param mode          standings mode
 * @param eventId       seed for every hash fallback
 * @param round         round being paired (pair)
 * @param players       competitors in seat order (schedule)
 * @param backendClass  expected-score backend class for Elo, or {@code null} for the logistic formula
 * @param outputDir     where result files go
 */
public record RunnerConfig(
    Command command,
    Path matchesFile,
    StandingsMode mode,
    String eventId,
    boolean acceptSingleEntry,
    boolean headToHead,
    boolean virtualBye,
    int round,
    int protectTopN,
    boolean allowRematches,
    int maxBacktrack,
    List<String> players,
    boolean doubleRoundRobin,
    String seed,
    boolean includeBye,
    double kFactor,
    String backendClass,
    Path outputDir
) {

    public enum Command {
        STANDINGS("standings"),
        PAIR("pair"),
        SCHEDULE("schedule"),
        RATINGS("ratings");

        private final String key;

        Command(String key) {
            this.key = key;
        }

        public String key() {
            return key;
        }

        static Command fromKey(String value) {
            for (Command c : values()) {
                if (c.key.equals(value)) {
                    return c;
                }
            }
            throw new IllegalArgumentException("Unknown command: " + value);
        }
    }

    public StandingsOptions standingsOptions() {
        return StandingsOptions.defaults()
            .withEventId(eventId)
            .withAcceptSingleEntryMatches(acceptSingleEntry)
            .withHeadToHead(headToHead)
            .withVirtualBye(virtualBye ? VirtualByeOptions.enabledDefault() : VirtualByeOptions.disabled());
    }

    public PairingOptions pairingOptions() {
        return PairingOptions.defaults()
            .withEventId(eventId)
            .withAvoidRematches(!allowRematches)
            .withProtectTopN(protectTopN)
            .withMaxBacktrack(maxBacktrack);
    }

    public RoundRobinOptions roundRobinOptions() {
        return new RoundRobinOptions(doubleRoundRobin, seed, includeBye);
    }

    public EloOptions eloOptions() {
        return EloOptions.defaults().withK(kFactor);
    }
}
