package com.vigil.eventmodel;

import com.vigil.status.SystemStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Records cluster transitions into an append-only event log.
 * <p>
 * {@link #recordStatus(SystemStatus, Execer, Duration)} diffs each new status against the last one
 * it saw and stores the resulting events. Only one diff and record step runs at a time, so events
 * of consecutive statuses never interleave. The first status seen is a baseline: nothing is
 * emitted for it.
 * <p>
 * Every write is bounded: an event whose turn comes after the deadline is reported as not stored
 * without reaching the execer.
 */
public final class Timeline {

    private static final Logger log = LoggerFactory.getLogger(Timeline.class);

    private final TimelineClock clock;
    private final EventInserter inserter = new EventInserter();
    private final ReentrantLock lock = new ReentrantLock();
    private SystemStatus baseline;

    public Timeline(TimelineClock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.clock = clock;
    }

    /**
     * Validates and stores one event.
     *
     * @param timeout how long the write may take
     * @throws IllegalArgumentException if the event is invalid or the timeout is not positive
     * @throws TimelineStorageException if the execer fails or times out
     */
    public void record(TimelineEvent event, Execer execer, Duration timeout) {
        if (execer == null) {
            throw new IllegalArgumentException("execer must not be null");
        }
        requirePositive(timeout);
        ValidationResult validation = EventValidator.validate(event);
        if (!validation.valid()) {
            throw new IllegalArgumentException("invalid timeline event: " + String.join(", ", validation.errors()));
        }
        EventInserter.Insert insert = inserter.insert(event);
        try {
            insert.execute(execer, timeout);
        } catch (RuntimeException e) {
            throw new TimelineStorageException("failed to store " + event.type().value() + " event", event, e);
        }
        log.debug("Recorded {} event", event.type().value());
    }

    /**
     * Diffs {@code status} against the previously recorded status and stores the detected events.
     * <p>
     * The baseline advances to {@code status} even if storing fails. Every event is attempted
     * until {@code timeout} has elapsed; the first storage failure is then rethrown with the
     * others attached as suppressed.
     *
     * @param status  the newly aggregated cluster status
     * @param execer  the storage collaborator
     * @param timeout how long storing all detected events may take
     * @return the detected events, in emission order
     * @throws TimelineStorageException if any event could not be stored
     */
    public List<TimelineEvent> recordStatus(SystemStatus status, Execer execer, Duration timeout) {
        if (status == null) {
            throw new IllegalArgumentException("status must not be null");
        }
        if (execer == null) {
            throw new IllegalArgumentException("execer must not be null");
        }
        requirePositive(timeout);
        long deadline = System.nanoTime() + timeout.toNanos();
        lock.lock();
        try {
            List<TimelineEvent> events = StatusDiff.diff(baseline, status, clock);
            baseline = status;
            TimelineStorageException failure = null;
            for (TimelineEvent event : events) {
                try {
                    Duration remaining = Duration.ofNanos(deadline - System.nanoTime());
                    if (remaining.isNegative() || remaining.isZero()) {
                        throw new TimelineStorageException("no time left to store " + event.type().value()
                                + " event within " + timeout, event, null);
                    }
                    record(event, execer, remaining);
                } catch (TimelineStorageException e) {
                    log.warn("Failed to store timeline event {}", event.type().value(), e);
                    if (failure == null) {
                        failure = e;
                    } else {
                        failure.addSuppressed(e);
                    }
                }
            }
            if (!events.isEmpty()) {
                log.info("Detected {} timeline events", events.size());
            }
            if (failure != null) {
                throw failure;
            }
            return events;
        } finally {
            lock.unlock();
        }
    }

    private static void requirePositive(Duration timeout) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
    }

    /** The status the next diff compares against, empty before the first status is recorded. */
    public Optional<SystemStatus> baseline() {
        lock.lock();
        try {
            return Optional.ofNullable(baseline);
        } finally {
            lock.unlock();
        }
    }
}
