package com.vigil.database;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Externalized configuration of the timeline database.
 *
 * <h2>Configuration Example</h2>
 *
 * <pre>{@code
 * vigil:
 *   timeline:
 *     enabled: true
 *     url: jdbc:h2:file:/var/lib/vigil/timeline
 *     username: vigil
 *     password: ""
 *     locations: classpath:db/migration/timeline
 *     retention: 7d
 *     eviction-interval: 10m
 * }</pre>
 *
 * @param enabled          whether events are stored at all
 * @param url              JDBC connection URL
 * @param username         database username
 * @param password         database password
 * @param locations        Flyway migration locations
 * @param retention        how long stored events are kept
 * @param evictionInterval how often expired events are deleted
 */
@Validated
@ConfigurationProperties(prefix = "vigil.timeline")
public record TimelineStorageProperties(
        boolean enabled,
        @NotBlank String url,
        @NotBlank String username,
        String password,
        String locations,
        Duration retention,
        Duration evictionInterval) {

    /** Default Flyway location of the timeline schema. */
    public static final String DEFAULT_LOCATIONS = "classpath:db/migration/timeline";

    /** Default event retention. */
    public static final Duration DEFAULT_RETENTION = Duration.ofDays(7);

    /** Default interval between evictions. */
    public static final Duration DEFAULT_EVICTION_INTERVAL = Duration.ofMinutes(10);

    public TimelineStorageProperties {
        if (locations == null || locations.isBlank()) {
            locations = DEFAULT_LOCATIONS;
        }
        if (retention == null) {
            retention = DEFAULT_RETENTION;
        }
        if (evictionInterval == null) {
            evictionInterval = DEFAULT_EVICTION_INTERVAL;
        }
        if (retention.isZero() || retention.isNegative()) {
            throw new IllegalArgumentException("retention must be positive");
        }
        if (evictionInterval.isZero() || evictionInterval.isNegative()) {
            throw new IllegalArgumentException("evictionInterval must be positive");
        }
    }
}
