package edu.brandeis.cosi103a.rankings.standings;

import com.google.common.collect.ImmutableMap;

import java.util.Map;

/**
 * Options shared by all standings modes. Fields a mode does not use are ignored:
 * seeding and the bronze-match flag only apply to single elimination, the virtual bye only to Swiss.
 *
 * @param eventId                  seeds the hash fallback
 * @param applyHeadToHead          resolve tie blocks by results among block members first
 * @param opponentPctFloor         lower bound for GWP, OMW% and OGW%
 * @param points                   match points per outcome
 * @param acceptSingleEntryMatches reconstruct missing mirrored entries instead of failing
 * @param virtualBye               synthetic opponent per bye in the opponent percentages
 * @param seeding                  competitor to seed number, lower is better
 * @param useBronzeMatch           accepted for compatibility; has no effect on ranking
 */
public record StandingsOptions(
    String eventId,
    boolean applyHeadToHead,
    double opponentPctFloor,
    PointsMap points,
    boolean acceptSingleEntryMatches,
    VirtualByeOptions virtualBye,
    Map<String, Integer> seeding,
    boolean useBronzeMatch
) {

    public static final String DEFAULT_EVENT_ID = "rankings-core";

    public StandingsOptions {
        if (eventId == null || eventId.isBlank()) {
            eventId = DEFAULT_EVENT_ID;
        }
        if (Double.isNaN(opponentPctFloor)) {
            opponentPctFloor = OpponentStatistics.DEFAULT_FLOOR;
        }
        if (points == null) {
            points = PointsMap.defaults();
        }
        if (virtualBye == null) {
            virtualBye = VirtualByeOptions.disabled();
        }
        seeding = seeding == null ? ImmutableMap.of() : ImmutableMap.copyOf(seeding);
    }

    public static StandingsOptions defaults() {
        return new StandingsOptions(DEFAULT_EVENT_ID, true, OpponentStatistics.DEFAULT_FLOOR,
            PointsMap.defaults(), false, VirtualByeOptions.disabled(), ImmutableMap.of(), true);
    }

    public StandingsOptions withEventId(String id) {
        return new StandingsOptions(id, applyHeadToHead, opponentPctFloor, points,
            acceptSingleEntryMatches, virtualBye, seeding, useBronzeMatch);
    }

    public StandingsOptions withHeadToHead(boolean enabled) {
        return new StandingsOptions(eventId, enabled, opponentPctFloor, points,
            acceptSingleEntryMatches, virtualBye, seeding, useBronzeMatch);
    }

    public StandingsOptions withOpponentPctFloor(double floor) {
        return new StandingsOptions(eventId, applyHeadToHead, floor, points,
            acceptSingleEntryMatches, virtualBye, seeding, useBronzeMatch);
    }

    public StandingsOptions withPoints(PointsMap map) {
        return new StandingsOptions(eventId, applyHeadToHead, opponentPctFloor, map,
            acceptSingleEntryMatches, virtualBye, seeding, useBronzeMatch);
    }

    public StandingsOptions withAcceptSingleEntryMatches(boolean accept) {
        return new StandingsOptions(eventId, applyHeadToHead, opponentPctFloor, points,
            accept, virtualBye, seeding, useBronzeMatch);
    }

    public StandingsOptions withVirtualBye(VirtualByeOptions vb) {
        return new StandingsOptions(eventId, applyHeadToHead, opponentPctFloor, points,
            acceptSingleEntryMatches, vb, seeding, useBronzeMatch);
    }

    public StandingsOptions withSeeding(Map<String, Integer> seeds) {
        return new StandingsOptions(eventId, applyHeadToHead, opponentPctFloor, points,
            acceptSingleEntryMatches, virtualBye, seeds, useBronzeMatch);
    }
}
