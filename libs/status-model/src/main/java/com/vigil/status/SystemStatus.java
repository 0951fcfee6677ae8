package com.vigil.status;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Reduced health of the whole cluster at one point in time.
 *
 * @param statusType overall health
 * @param summary    explanation of the worst condition found (empty when running)
 * @param nodes      one status per known active member, order not significant
 * @param timestamp  when the status was aggregated ({@code null} for the empty status)
 */
public record SystemStatus(
        StatusType statusType,
        String summary,
        List<NodeStatus> nodes,
        Instant timestamp
) {

    public SystemStatus {
        if (statusType == null) {
            throw new IllegalArgumentException("statusType must not be null");
        }
        if (summary == null) {
            summary = "";
        }
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
    }

    /** The status before anything has been collected: unknown, no nodes. */
    public static SystemStatus empty() {
        return new SystemStatus(StatusType.UNKNOWN, "", List.of(), null);
    }

    /** Returns true if nothing is known about any node. */
    @JsonIgnore
    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    /** Looks up a node status by name. */
    public Optional<NodeStatus> node(String name) {
        return nodes.stream().filter(n -> n.name().equals(name)).findFirst();
    }

    /** Name of the node whose member snapshot carries {@code leader=true}, if any. */
    public Optional<String> leader() {
        return nodes.stream()
                .filter(n -> n.member().isLeader())
                .map(NodeStatus::name)
                .findFirst();
    }
}
