package edu.brandeis.cosi103a.rankings.rating;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableMap;

/**
 * @param ratings ratings after the batch, including untouched competitors from the base map
 * @param deltas  summed unclamped changes for every competitor who played
 */
public record EloUpdateResult(
    @JsonProperty("ratings") ImmutableMap<String, Double> ratings,
    @JsonProperty("deltas") ImmutableMap<String, Double> deltas
) {

    public double ratingOf(String competitorId) {
        Double r = ratings.get(competitorId);
        if (r == null) {
            throw new IllegalArgumentException("No rating for " + competitorId);
        }
        return r;
    }
}
