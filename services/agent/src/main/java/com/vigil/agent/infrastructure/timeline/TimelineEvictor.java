package com.vigil.agent.infrastructure.timeline;

import com.vigil.database.TimelineStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically deletes timeline events older than the store's retention.
 */
public final class TimelineEvictor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TimelineEvictor.class);

    private final TimelineStore store;
    private final Duration interval;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;

    public TimelineEvictor(TimelineStore store, Duration interval, Clock clock) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive");
        }
        this.store = store;
        this.interval = interval;
        this.clock = clock;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "vigil-timeline-evictor");
            thread.setDaemon(true);
            return thread;
        });
    }

    public void start() {
        scheduler.scheduleWithFixedDelay(this::runScheduled, interval.toMillis(), interval.toMillis(),
                TimeUnit.MILLISECONDS);
        log.info("Evicting timeline events older than {} every {}", store.retention(), interval);
    }

    /**
     * Deletes the events past retention.
     *
     * @return the number of deleted events
     */
    public int evictOnce() {
        return store.evictBefore(store.retentionCutoff(clock.instant()));
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }

    private void runScheduled() {
        try {
            evictOnce();
        } catch (DataAccessException e) {
            log.warn("Timeline eviction failed", e);
        }
    }
}
