package com.vigil.eventmodel;

import com.vigil.status.StatusType;

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Maps timeline events to the insert statement of the {@code events} table.
 * <p>
 * Columns: {@code timestamp}, {@code type} (the canonical {@link EventType} name), {@code node},
 * {@code probe}, {@code old_state}, {@code new_state} and {@code payload} (the event as JSON).
 * Columns that do not apply to an event kind are null. Timestamps are bound as UTC
 * {@link OffsetDateTime}s so the stored instant never depends on the JVM time zone.
 */
public final class EventInserter implements TimelineEvent.Visitor<EventInserter.Insert> {

    /** The insert statement shared by all event kinds. */
    public static final String INSERT_EVENT =
            "INSERT INTO events (timestamp, type, node, probe, old_state, new_state, payload) "
                    + "VALUES (?, ?, ?, ?, ?, ?, ?)";

    static final String SUCCEEDED = "succeeded";
    static final String FAILED = "failed";

    /**
     * A statement ready for an {@link Execer}.
     *
     * @param statement the SQL statement
     * @param args      its positional arguments
     */
    public record Insert(String statement, List<Object> args) {

        /** Runs this insert on the given execer, bounded by {@code timeout}. */
        public void execute(Execer execer, Duration timeout) {
            execer.exec(timeout, statement, args.toArray());
        }
    }

    /**
     * Builds the insert statement for an event.
     */
    public Insert insert(TimelineEvent event) {
        return event.accept(this);
    }

    @Override
    public Insert visitClusterDegraded(TimelineEvent.ClusterDegraded event) {
        return row(event, null, null, state(StatusType.RUNNING), state(event.status()));
    }

    @Override
    public Insert visitClusterRecovered(TimelineEvent.ClusterRecovered event) {
        return row(event, null, null, state(event.previous()), state(StatusType.RUNNING));
    }

    @Override
    public Insert visitNodeAdded(TimelineEvent.NodeAdded event) {
        return row(event, event.node(), null, null, null);
    }

    @Override
    public Insert visitNodeRemoved(TimelineEvent.NodeRemoved event) {
        return row(event, event.node(), null, null, null);
    }

    @Override
    public Insert visitNodeDegraded(TimelineEvent.NodeDegraded event) {
        return row(event, event.node(), null, state(StatusType.RUNNING), state(event.status()));
    }

    @Override
    public Insert visitNodeRecovered(TimelineEvent.NodeRecovered event) {
        return row(event, event.node(), null, state(event.previous()), state(StatusType.RUNNING));
    }

    @Override
    public Insert visitProbeFailed(TimelineEvent.ProbeFailed event) {
        return row(event, event.node(), event.probe(), SUCCEEDED, FAILED);
    }

    @Override
    public Insert visitProbeSucceeded(TimelineEvent.ProbeSucceeded event) {
        return row(event, event.node(), event.probe(), FAILED, SUCCEEDED);
    }

    @Override
    public Insert visitLeaderElected(TimelineEvent.LeaderElected event) {
        return row(event, event.node(), null, event.previous(), event.node());
    }

    private static Insert row(TimelineEvent event, String node, String probe, String oldState, String newState) {
        return new Insert(INSERT_EVENT, Arrays.asList(
                utc(event.timestamp()),
                event.type().value(),
                node,
                probe,
                oldState,
                newState,
                EventSerializer.serialize(event)));
    }

    /** Converts an instant to the UTC offset date-time bound to the {@code timestamp} column. */
    public static OffsetDateTime utc(Instant instant) {
        return OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    private static String state(StatusType status) {
        return status == null ? null : status.name().toLowerCase(Locale.ROOT);
    }
}
