package edu.brandeis.cosi103a.rankings.pairing;

import com.google.common.collect.ImmutableList;
import edu.brandeis.cosi103a.rankings.standings.StandingRow;

/**
 * Adjacent ranked competitors that share a grouping key.
 *
 * @param index   0 for the top group, increasing downwards
 * @param members rows in rank order
 */
public record ScoreGroup(int index, ImmutableList<StandingRow> members) {

    public int size() {
        return members.size();
    }

    public double matchPoints() {
        return members.get(0).matchPoints();
    }
}
