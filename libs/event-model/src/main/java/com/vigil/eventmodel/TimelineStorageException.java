package com.vigil.eventmodel;

/**
 * Thrown when a timeline event could not be stored.
 */
public class TimelineStorageException extends RuntimeException {

    private final transient TimelineEvent event;

    public TimelineStorageException(String message, TimelineEvent event, Throwable cause) {
        super(message, cause);
        this.event = event;
    }

    /** The event that was not stored. */
    public TimelineEvent event() {
        return event;
    }
}
