package com.vigil.membership;

import java.util.Locale;

/**
 * Gossip status of a cluster member as reported by the membership substrate.
 */
public enum MemberStatus {

    /** The member is part of the cluster and responding to gossip. */
    ALIVE("alive"),

    /** The member announced it is leaving the cluster. */
    LEAVING("leaving"),

    /** The member left the cluster gracefully. */
    LEFT("left"),

    /** The member stopped responding and was declared failed. */
    FAILED("failed"),

    /** The substrate reported a status this agent does not recognize. */
    NONE("none");

    private final String value;

    MemberStatus(String value) {
        this.value = value;
    }

    /** The canonical lower-case name used by the gossip substrate (e.g. "alive"). */
    public String value() {
        return value;
    }

    /**
     * Parses a substrate status string. Unknown or missing values map to {@link #NONE}.
     *
     * @param value status string such as "alive" or "failed"
     * @return the matching status
     */
    public static MemberStatus fromString(String value) {
        if (value == null) {
            return NONE;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (MemberStatus status : values()) {
            if (status.value.equals(normalized)) {
                return status;
            }
        }
        return NONE;
    }
}
