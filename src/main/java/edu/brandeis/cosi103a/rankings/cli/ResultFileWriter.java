package edu.brandeis.cosi103a.rankings.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import edu.brandeis.cosi103a.rankings.pairing.PairingResult;
import edu.brandeis.cosi103a.rankings.pairing.RoundRobinSchedule;
import edu.brandeis.cosi103a.rankings.standings.StandingRow;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Writes result files. Every file is written to a temp file first and then moved
 * into place atomically, so readers never see a partial file.
 */
public class ResultFileWriter {

    static final String STANDINGS_FILE = "standings.json";
    static final String SCHEDULE_FILE = "schedule.json";
    static final String RATINGS_FILE = "ratings.json";

    private final Path outputDir;
    private final ObjectMapper objectMapper;

    public ResultFileWriter(Path outputDir) {
        this.outputDir = outputDir;
        this.objectMapper = ObjectMapperFactory.create();
    }

    public Path writeStandings(List<StandingRow> standings) throws IOException {
        return write(STANDINGS_FILE, standings);
    }

    /**
     * Writes a pairings-round-NN.json file.
     */
    public Path writePairings(int round, PairingResult pairings) throws IOException {
        return write(pairingsFileName(round), pairings);
    }

    public Path writeSchedule(RoundRobinSchedule schedule) throws IOException {
        return write(SCHEDULE_FILE, schedule);
    }

    public Path writeRatings(RatingsReport report) throws IOException {
        return write(RATINGS_FILE, report);
    }

    static String pairingsFileName(int round) {
        return String.format("pairings-round-%02d.json", round);
    }

    private Path write(String filename, Object value) throws IOException {
        Files.createDirectories(outputDir);
        Path target = outputDir.resolve(filename);
        Path temp = outputDir.resolve(filename + ".tmp");
        objectMapper.writeValue(temp.toFile(), value);
        Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        return target;
    }
}
