package edu.brandeis.cosi103a.rankings.rating;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Optional human-readable description for an {@link ExpectedScoreBackend} implementation,
 * read by {@link ExpectedScoreBackendDiscovery}.
 *
 * <pre>
 * {@literal @}BackendDescription("Lookup table over integer rating differences")
 * public class TableBackend implements ExpectedScoreBackend {
 *     // ...
 * }
 * </pre>
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
@Documented
public @interface BackendDescription {
    String value();
}
