package com.vigil.status;

import com.vigil.membership.ClusterMember;
import com.vigil.membership.MemberStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Reduces the local node status, the remote node statuses and the active member list into one
 * {@link SystemStatus}.
 * <p>
 * Rules:
 * <ol>
 *   <li>No statuses at all: {@link StatusType#UNKNOWN} with no nodes.
 *   <li>Any node that is not running ({@link StatusType#DEGRADED} or {@link StatusType#UNKNOWN})
 *       degrades the cluster. Unknown nodes count as failures; they never make the whole cluster
 *       unknown.
 *   <li>Any node whose member snapshot is {@link MemberStatus#FAILED} degrades the cluster.
 *   <li>No node tagged {@code role=master} degrades the cluster.
 *   <li>Any active member without a collected status degrades the cluster.
 * </ol>
 * When several conditions hold, the summary reports the one that comes first in
 * {@link Condition} declaration order.
 * <p>
 * Aggregation is a pure function of its inputs: no I/O, no clock, no hidden state.
 */
public final class ClusterStatusAggregator {

    /**
     * Conditions that degrade the cluster, in summary priority order (highest first).
     */
    public enum Condition {

        /** No node carries {@code role=master}. */
        MASTER_UNAVAILABLE("master node unavailable"),

        /** Active members did not report a status. */
        MISSING_NODES("no status received from nodes"),

        /** Nodes reported a degraded or unknown status. */
        DEGRADED_NODES("degraded nodes"),

        /** Member snapshots report a failed gossip status. */
        FAILED_MEMBERS("failed members");

        private final String message;

        Condition(String message) {
            this.message = message;
        }

        /** Base message of this condition. */
        public String message() {
            return message;
        }

        /**
         * Formats the summary for this condition. Names are listed in order, each followed by a
         * comma, e.g. {@code "no status received from nodes (node-2,)"}.
         */
        public String summary(List<String> names) {
            if (this == MASTER_UNAVAILABLE) {
                return message;
            }
            StringBuilder sb = new StringBuilder(message).append(" (");
            for (String name : names) {
                sb.append(name).append(',');
            }
            return sb.append(')').toString();
        }
    }

    /**
     * Aggregates without a timestamp.
     *
     * @see #aggregate(NodeStatus, List, List, Instant)
     */
    public SystemStatus aggregate(NodeStatus local, List<NodeStatus> remotes, List<ClusterMember> members) {
        return aggregate(local, remotes, members, null);
    }

    /**
     * Aggregates node statuses into a system status.
     *
     * @param local     status of the local node (may be null if it was not collected)
     * @param remotes   statuses received from remote nodes
     * @param members   active members at the start of the collection
     * @param timestamp aggregation time stamped on the result
     * @return the cluster status
     */
    public SystemStatus aggregate(
            NodeStatus local,
            List<NodeStatus> remotes,
            List<ClusterMember> members,
            Instant timestamp) {
        Map<String, NodeStatus> byName = new LinkedHashMap<>();
        if (local != null) {
            byName.put(local.name(), local);
        }
        if (remotes != null) {
            for (NodeStatus remote : remotes) {
                if (remote != null) {
                    byName.putIfAbsent(remote.name(), remote);
                }
            }
        }
        List<ClusterMember> activeMembers = members == null ? List.of() : members;

        TreeSet<String> missing = new TreeSet<>();
        for (ClusterMember member : activeMembers) {
            if (!byName.containsKey(member.name())) {
                missing.add(member.name());
            }
        }

        if (byName.isEmpty()) {
            String summary = missing.isEmpty() ? "" : Condition.MISSING_NODES.summary(List.copyOf(missing));
            return new SystemStatus(StatusType.UNKNOWN, summary, List.of(), timestamp);
        }

        Map<Condition, List<String>> conditions = new EnumMap<>(Condition.class);
        TreeSet<String> degraded = new TreeSet<>();
        TreeSet<String> failed = new TreeSet<>();
        boolean masterPresent = false;

        for (NodeStatus node : byName.values()) {
            if (node.member().status() == MemberStatus.FAILED) {
                failed.add(node.name());
            }
            if (!node.statusType().isRunning()) {
                degraded.add(node.name());
            }
            if (node.member().isMaster()) {
                masterPresent = true;
            }
        }

        if (!masterPresent) {
            conditions.put(Condition.MASTER_UNAVAILABLE, List.of());
        }
        if (!missing.isEmpty()) {
            conditions.put(Condition.MISSING_NODES, List.copyOf(missing));
        }
        if (!degraded.isEmpty()) {
            conditions.put(Condition.DEGRADED_NODES, List.copyOf(degraded));
        }
        if (!failed.isEmpty()) {
            conditions.put(Condition.FAILED_MEMBERS, List.copyOf(failed));
        }

        List<NodeStatus> nodes = new ArrayList<>(byName.values());
        if (conditions.isEmpty()) {
            return new SystemStatus(StatusType.RUNNING, "", nodes, timestamp);
        }
        Map.Entry<Condition, List<String>> worst = conditions.entrySet().iterator().next();
        return new SystemStatus(
                StatusType.DEGRADED, worst.getKey().summary(worst.getValue()), nodes, timestamp);
    }
}
