package com.vigil.eventmodel;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.vigil.status.StatusType;

import java.time.Instant;

/**
 * A significant cluster transition, appended to the timeline exactly once.
 * <p>
 * Events are immutable. Each kind is its own record; use a {@link Visitor} to handle every kind
 * with a compile-time check that none is forgotten.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = TimelineEvent.ClusterDegraded.class, name = "ClusterDegraded"),
        @JsonSubTypes.Type(value = TimelineEvent.ClusterRecovered.class, name = "ClusterRecovered"),
        @JsonSubTypes.Type(value = TimelineEvent.NodeAdded.class, name = "NodeAdded"),
        @JsonSubTypes.Type(value = TimelineEvent.NodeRemoved.class, name = "NodeRemoved"),
        @JsonSubTypes.Type(value = TimelineEvent.NodeDegraded.class, name = "NodeDegraded"),
        @JsonSubTypes.Type(value = TimelineEvent.NodeRecovered.class, name = "NodeRecovered"),
        @JsonSubTypes.Type(value = TimelineEvent.ProbeFailed.class, name = "ProbeFailed"),
        @JsonSubTypes.Type(value = TimelineEvent.ProbeSucceeded.class, name = "ProbeSucceeded"),
        @JsonSubTypes.Type(value = TimelineEvent.LeaderElected.class, name = "LeaderElected")
})
public sealed interface TimelineEvent {

    /** When the transition was detected. */
    Instant timestamp();

    /** The kind of this event. */
    EventType type();

    /** Dispatches to the visitor method for this kind. */
    <R> R accept(Visitor<R> visitor);

    /**
     * Exhaustive handler over all event kinds.
     *
     * @param <R> result type
     */
    interface Visitor<R> {
        R visitClusterDegraded(ClusterDegraded event);

        R visitClusterRecovered(ClusterRecovered event);

        R visitNodeAdded(NodeAdded event);

        R visitNodeRemoved(NodeRemoved event);

        R visitNodeDegraded(NodeDegraded event);

        R visitNodeRecovered(NodeRecovered event);

        R visitProbeFailed(ProbeFailed event);

        R visitProbeSucceeded(ProbeSucceeded event);

        R visitLeaderElected(LeaderElected event);
    }

    /**
     * The cluster left the running state.
     *
     * @param status  the new cluster status (degraded or unknown)
     * @param summary explanation of the worst condition
     */
    record ClusterDegraded(Instant timestamp, StatusType status, String summary) implements TimelineEvent {
        @Override
        public EventType type() {
            return EventType.CLUSTER_DEGRADED;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitClusterDegraded(this);
        }
    }

    /**
     * The cluster returned to the running state.
     *
     * @param previous the status it recovered from
     */
    record ClusterRecovered(Instant timestamp, StatusType previous) implements TimelineEvent {
        @Override
        public EventType type() {
            return EventType.CLUSTER_RECOVERED;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitClusterRecovered(this);
        }
    }

    /** A node status appeared that was not part of the previous cluster status. */
    record NodeAdded(Instant timestamp, String node) implements TimelineEvent {
        @Override
        public EventType type() {
            return EventType.NODE_ADDED;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNodeAdded(this);
        }
    }

    /** A node status that was part of the previous cluster status is gone. */
    record NodeRemoved(Instant timestamp, String node) implements TimelineEvent {
        @Override
        public EventType type() {
            return EventType.NODE_REMOVED;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNodeRemoved(this);
        }
    }

    /** A node left the running state. */
    record NodeDegraded(Instant timestamp, String node, StatusType status) implements TimelineEvent {
        @Override
        public EventType type() {
            return EventType.NODE_DEGRADED;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNodeDegraded(this);
        }
    }

    /** A node returned to the running state. */
    record NodeRecovered(Instant timestamp, String node, StatusType previous) implements TimelineEvent {
        @Override
        public EventType type() {
            return EventType.NODE_RECOVERED;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNodeRecovered(this);
        }
    }

    /** A probe that passed in the previous status now fails. */
    record ProbeFailed(Instant timestamp, String node, String probe, String detail) implements TimelineEvent {
        @Override
        public EventType type() {
            return EventType.PROBE_FAILED;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitProbeFailed(this);
        }
    }

    /** A probe that failed in the previous status now passes. */
    record ProbeSucceeded(Instant timestamp, String node, String probe) implements TimelineEvent {
        @Override
        public EventType type() {
            return EventType.PROBE_SUCCEEDED;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitProbeSucceeded(this);
        }
    }

    /**
     * A different node now carries the leader tag.
     *
     * @param previous the former leader, {@code null} if there was none
     * @param node     the new leader
     */
    record LeaderElected(Instant timestamp, String previous, String node) implements TimelineEvent {
        @Override
        public EventType type() {
            return EventType.LEADER_ELECTED;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLeaderElected(this);
        }
    }
}
