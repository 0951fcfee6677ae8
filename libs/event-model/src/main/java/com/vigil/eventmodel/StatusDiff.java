package com.vigil.eventmodel;

import com.vigil.status.NodeStatus;
import com.vigil.status.ProbeResult;
import com.vigil.status.SystemStatus;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Detects the transitions between two consecutive cluster statuses.
 * <p>
 * Rules:
 * <ul>
 *   <li>cluster running to not running: {@link TimelineEvent.ClusterDegraded}; the reverse:
 *       {@link TimelineEvent.ClusterRecovered}
 *   <li>node status present now but not before: {@link TimelineEvent.NodeAdded}; the reverse:
 *       {@link TimelineEvent.NodeRemoved}
 *   <li>node running to not running: {@link TimelineEvent.NodeDegraded}; the reverse:
 *       {@link TimelineEvent.NodeRecovered}
 *   <li>probe passed to failed: {@link TimelineEvent.ProbeFailed}; the reverse:
 *       {@link TimelineEvent.ProbeSucceeded}
 *   <li>a different node carries {@code leader=true}: {@link TimelineEvent.LeaderElected}
 * </ul>
 * Without a previous status there is nothing to compare with: the new status becomes the baseline
 * and no event is emitted. Events are returned grouped in the order listed above.
 */
public final class StatusDiff {

    private StatusDiff() {
        // utility class
    }

    /**
     * Diffs two statuses.
     *
     * @param previous the previously recorded status, or {@code null} if there is none
     * @param next     the newly aggregated status
     * @param clock    source of event timestamps
     * @return the detected events, empty if nothing changed
     */
    public static List<TimelineEvent> diff(SystemStatus previous, SystemStatus next, TimelineClock clock) {
        if (next == null) {
            throw new IllegalArgumentException("next must not be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        if (previous == null) {
            return List.of();
        }

        List<TimelineEvent> cluster = new ArrayList<>();
        boolean wasRunning = previous.statusType().isRunning();
        boolean isRunning = next.statusType().isRunning();
        if (wasRunning && !isRunning) {
            cluster.add(new TimelineEvent.ClusterDegraded(clock.now(), next.statusType(), next.summary()));
        } else if (!wasRunning && isRunning) {
            cluster.add(new TimelineEvent.ClusterRecovered(clock.now(), previous.statusType()));
        }

        Map<String, NodeStatus> before = byName(previous.nodes());
        Map<String, NodeStatus> after = byName(next.nodes());

        List<TimelineEvent> membership = new ArrayList<>();
        for (String name : after.keySet()) {
            if (!before.containsKey(name)) {
                membership.add(new TimelineEvent.NodeAdded(clock.now(), name));
            }
        }
        for (String name : before.keySet()) {
            if (!after.containsKey(name)) {
                membership.add(new TimelineEvent.NodeRemoved(clock.now(), name));
            }
        }

        List<TimelineEvent> nodes = new ArrayList<>();
        List<TimelineEvent> probes = new ArrayList<>();
        for (NodeStatus now : after.values()) {
            NodeStatus then = before.get(now.name());
            if (then == null) {
                continue;
            }
            boolean nodeWasRunning = then.statusType().isRunning();
            boolean nodeIsRunning = now.statusType().isRunning();
            if (nodeWasRunning && !nodeIsRunning) {
                nodes.add(new TimelineEvent.NodeDegraded(clock.now(), now.name(), now.statusType()));
            } else if (!nodeWasRunning && nodeIsRunning) {
                nodes.add(new TimelineEvent.NodeRecovered(clock.now(), now.name(), then.statusType()));
            }
            diffProbes(then, now, clock, probes);
        }

        List<TimelineEvent> events = new ArrayList<>(cluster);
        events.addAll(membership);
        events.addAll(nodes);
        events.addAll(probes);
        leaderChange(previous, next, clock).ifPresent(events::add);
        return List.copyOf(events);
    }

    private static void diffProbes(NodeStatus then, NodeStatus now, TimelineClock clock, List<TimelineEvent> out) {
        for (ProbeResult probe : now.probes()) {
            Optional<ProbeResult> before = then.probe(probe.probe());
            if (before.isEmpty() || before.get().succeeded() == probe.succeeded()) {
                continue;
            }
            if (probe.succeeded()) {
                out.add(new TimelineEvent.ProbeSucceeded(clock.now(), now.name(), probe.probe()));
            } else {
                out.add(new TimelineEvent.ProbeFailed(clock.now(), now.name(), probe.probe(), probe.detail()));
            }
        }
    }

    private static Optional<TimelineEvent> leaderChange(SystemStatus previous, SystemStatus next, TimelineClock clock) {
        Optional<String> newLeader = next.leader();
        if (newLeader.isEmpty()) {
            return Optional.empty();
        }
        String oldLeader = previous.leader().orElse(null);
        if (Objects.equals(oldLeader, newLeader.get())) {
            return Optional.empty();
        }
        return Optional.of(new TimelineEvent.LeaderElected(clock.now(), oldLeader, newLeader.get()));
    }

    private static Map<String, NodeStatus> byName(List<NodeStatus> nodes) {
        Map<String, NodeStatus> map = new LinkedHashMap<>();
        for (NodeStatus node : nodes) {
            map.putIfAbsent(node.name(), node);
        }
        return map;
    }
}
