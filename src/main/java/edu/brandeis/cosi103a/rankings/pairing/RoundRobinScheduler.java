package edu.brandeis.cosi103a.rankings.pairing;

import com.google.common.collect.ImmutableList;
import edu.brandeis.cosi103a.rankings.util.SeededRandom;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Generates round-robin schedules with the circle method.
 *
 * <p>Seat 0 stays fixed and the remaining seats rotate one step each round, so every
 * pair of competitors meets exactly once per leg. An odd field gets an empty seat;
 * whoever faces it has the bye.
 */
public final class RoundRobinScheduler {

    private static final String SHUFFLE_PREFIX = "rr::";

    private RoundRobinScheduler() {}

    /**
     * Builds the full schedule.
     *
     * @param players competitors in seat order (before any shuffle)
     * @param options schedule options, {@code null} for defaults
     * @throws IllegalArgumentException if the field is odd and byes are disabled
     */
    public static RoundRobinSchedule buildSchedule(List<String> players, RoundRobinOptions options) {
        RoundRobinOptions opts = options == null ? RoundRobinOptions.defaults() : options;

        if (players.size() < 2) {
            ImmutableList<String> byes = ImmutableList.copyOf(players);
            return new RoundRobinSchedule(ImmutableList.of(new RoundDefinition(1, ImmutableList.of(), byes)));
        }

        // null marks the empty seat
        List<String> seats = new ArrayList<>(players);
        if (opts.shuffleSeed() != null && !opts.shuffleSeed().isEmpty()) {
            SeededRandom.fromString(SHUFFLE_PREFIX + opts.shuffleSeed()).shuffle(seats);
        }
        if (seats.size() % 2 == 1) {
            if (!opts.includeBye()) {
                throw new IllegalArgumentException(
                    "Odd number of players (" + seats.size() + ") and byes are disabled");
            }
            seats.add(null);
        }

        int n = seats.size();
        int roundsCount = n - 1;
        List<RoundDefinition> rounds = new ArrayList<>(opts.doubleRoundRobin() ? 2 * roundsCount : roundsCount);

        for (int r = 1; r <= roundsCount; r++) {
            ImmutableList.Builder<Pairing> pairings = ImmutableList.builder();
            ImmutableList.Builder<String> byes = ImmutableList.builder();
            for (int i = 0; i < n / 2; i++) {
                String a = seats.get(i);
                String b = seats.get(n - 1 - i);
                if (a == null || b == null) {
                    byes.add(a == null ? b : a);
                } else {
                    pairings.add(new Pairing(a, b));
                }
            }
            rounds.add(new RoundDefinition(r, pairings.build(), byes.build()));

            Collections.rotate(seats.subList(1, n), 1);
        }

        if (opts.doubleRoundRobin()) {
            for (int r = 0; r < roundsCount; r++) {
                RoundDefinition first = rounds.get(r);
                ImmutableList<Pairing> swapped = first.pairings().stream()
                    .map(Pairing::swapped)
                    .collect(ImmutableList.toImmutableList());
                rounds.add(new RoundDefinition(roundsCount + first.round(), swapped, first.byes()));
            }
        }

        return new RoundRobinSchedule(ImmutableList.copyOf(rounds));
    }

    /**
     * One round of the schedule.
     *
     * @param roundNumber 1-based round number
     * @throws IllegalArgumentException if the round is outside the schedule
     */
    public static RoundDefinition getRound(List<String> players, int roundNumber, RoundRobinOptions options) {
        RoundRobinSchedule schedule = buildSchedule(players, options);
        if (roundNumber < 1 || roundNumber > schedule.roundCount()) {
            throw new IllegalArgumentException(
                "Round " + roundNumber + " out of range (1.." + schedule.roundCount() + ")");
        }
        return schedule.rounds().get(roundNumber - 1);
    }
}
