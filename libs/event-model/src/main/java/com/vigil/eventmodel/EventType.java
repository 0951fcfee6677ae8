package com.vigil.eventmodel;

import java.util.Optional;

/**
 * All kinds of timeline events.
 * <p>
 * The {@code value} field holds the canonical name stored in the {@code type} column and used as
 * the JSON type discriminator.
 */
public enum EventType {

    // ---- Cluster ----
    CLUSTER_DEGRADED("ClusterDegraded"),
    CLUSTER_RECOVERED("ClusterRecovered"),

    // ---- Nodes ----
    NODE_ADDED("NodeAdded"),
    NODE_REMOVED("NodeRemoved"),
    NODE_DEGRADED("NodeDegraded"),
    NODE_RECOVERED("NodeRecovered"),

    // ---- Probes ----
    PROBE_FAILED("ProbeFailed"),
    PROBE_SUCCEEDED("ProbeSucceeded"),

    // ---- Leadership ----
    LEADER_ELECTED("LeaderElected");

    private final String value;

    EventType(String value) {
        this.value = value;
    }

    /** The canonical name (e.g. "NodeDegraded"). */
    public String value() {
        return value;
    }

    /**
     * Looks up an EventType by its canonical name.
     *
     * @param value the string to match (e.g. "ProbeFailed")
     * @return the matching EventType, or empty if not found
     */
    public static Optional<EventType> fromString(String value) {
        for (EventType type : values()) {
            if (type.value.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    /** Checks whether a string names a known event type. */
    public static boolean isKnown(String value) {
        return fromString(value).isPresent();
    }
}
