package edu.brandeis.cosi103a.rankings.pairing;

/**
 * @param doubleRoundRobin append a second leg with seats swapped
 * @param shuffleSeed      deterministic shuffle of the input order, or {@code null} to keep it
 * @param includeBye       pad an odd field with a bye slot; when false an odd field is rejected
 */
public record RoundRobinOptions(
    boolean doubleRoundRobin,
    String shuffleSeed,
    boolean includeBye
) {

    public static RoundRobinOptions defaults() {
        return new RoundRobinOptions(false, null, true);
    }

    public RoundRobinOptions withDoubleRoundRobin(boolean value) {
        return new RoundRobinOptions(value, shuffleSeed, includeBye);
    }

    public RoundRobinOptions withShuffleSeed(String seed) {
        return new RoundRobinOptions(doubleRoundRobin, seed, includeBye);
    }

    public RoundRobinOptions withIncludeBye(boolean value) {
        return new RoundRobinOptions(doubleRoundRobin, shuffleSeed, value);
    }
}
