package com.vigil.status;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.vigil.membership.ClusterMember;
import com.vigil.membership.MemberStatus;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Health of one node at collection time.
 * <p>
 * {@code statusType} is {@link StatusType#DEGRADED} iff at least one probe failed, and
 * {@link StatusType#UNKNOWN} only for a node whose status could not be collected in time.
 *
 * @param name       node name
 * @param member     membership snapshot taken when the status was collected
 * @param statusType health of the node
 * @param probes     probe results in checker order
 */
public record NodeStatus(
        String name,
        ClusterMember member,
        StatusType statusType,
        List<ProbeResult> probes
) {

    public NodeStatus {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (member == null) {
            member = new ClusterMember(name, "", 0, Map.of(), MemberStatus.NONE);
        }
        if (statusType == null) {
            throw new IllegalArgumentException("statusType must not be null");
        }
        probes = probes == null ? List.of() : List.copyOf(probes);
    }

    /**
     * Builds a node status from probe results: degraded iff any probe failed.
     */
    public static NodeStatus fromProbes(ClusterMember member, List<ProbeResult> probes) {
        boolean anyFailed = probes.stream().anyMatch(probe -> !probe.succeeded());
        return new NodeStatus(member.name(), member,
                anyFailed ? StatusType.DEGRADED : StatusType.RUNNING, probes);
    }

    /** Status recorded for a member whose status could not be obtained. */
    public static NodeStatus unknown(ClusterMember member) {
        return new NodeStatus(member.name(), member, StatusType.UNKNOWN, List.of());
    }

    /** Status of a node that has not been collected yet. */
    public static NodeStatus empty(String name) {
        return new NodeStatus(name, null, StatusType.UNKNOWN, List.of());
    }

    /** Looks up a probe by checker name. */
    public Optional<ProbeResult> probe(String probeName) {
        return probes.stream().filter(p -> p.probe().equals(probeName)).findFirst();
    }

    /** Returns the failed probes. */
    @JsonIgnore
    public List<ProbeResult> failedProbes() {
        return probes.stream().filter(p -> !p.succeeded()).toList();
    }
}
