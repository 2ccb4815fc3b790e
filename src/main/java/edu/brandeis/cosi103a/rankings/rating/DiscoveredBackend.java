package edu.brandeis.cosi103a.rankings.rating;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An {@link ExpectedScoreBackend} implementation found on the classpath.
 *
 * @param simpleName  simple class name
 * @param className   fully-qualified class name
 * @param displayName simple name if unique, otherwise the full name
 * @param description text from {@link BackendDescription}, or empty
 */
public record DiscoveredBackend(
    @JsonProperty("simpleName") String simpleName,
    @JsonProperty("className") String className,
    @JsonProperty("displayName") String displayName,
    @JsonProperty("description") String description
) {}
