package com.vigil.eventmodel;

import java.time.Clock;
import java.time.Instant;

/**
 * Source of timeline timestamps.
 * <p>
 * Reads a wall clock but never returns an instant earlier than or equal to the previous one: if
 * the wall clock stalls or steps back, the previous instant plus one nanosecond is returned.
 */
public final class TimelineClock {

    private final Clock clock;
    private Instant last;

    public TimelineClock(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.clock = clock;
    }

    /** A timeline clock over the UTC system clock. */
    public static TimelineClock system() {
        return new TimelineClock(Clock.systemUTC());
    }

    /** Returns the next timestamp, strictly after every timestamp returned before. */
    public synchronized Instant now() {
        Instant now = clock.instant();
        if (last != null && !now.isAfter(last)) {
            now = last.plusNanos(1);
        }
        last = now;
        return now;
    }
}
