package com.vigil.database;

import com.vigil.eventmodel.EventInserter;
import com.vigil.eventmodel.EventSerializer;
import com.vigil.eventmodel.TimelineEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Read and retention side of the {@code events} table.
 */
public class TimelineStore {

    private static final Logger log = LoggerFactory.getLogger(TimelineStore.class);

    private final JdbcTemplate jdbcTemplate;
    private final Duration retention;

    public TimelineStore(JdbcTemplate jdbcTemplate, Duration retention) {
        if (jdbcTemplate == null) {
            throw new IllegalArgumentException("jdbcTemplate must not be null");
        }
        if (retention == null || retention.isZero() || retention.isNegative()) {
            throw new IllegalArgumentException("retention must be positive");
        }
        this.jdbcTemplate = jdbcTemplate;
        this.retention = retention;
    }

    /**
     * Returns the most recent stored events matching the query, oldest first.
     */
    public List<TimelineEvent> events(EventQuery query) {
        StringBuilder sql = new StringBuilder("SELECT payload FROM events WHERE 1 = 1");
        List<Object> args = new ArrayList<>();
        if (query.type() != null) {
            sql.append(" AND type = ?");
            args.add(query.type().value());
        }
        if (query.node() != null) {
            sql.append(" AND node = ?");
            args.add(query.node());
        }
        if (query.probe() != null) {
            sql.append(" AND probe = ?");
            args.add(query.probe());
        }
        sql.append(" ORDER BY timestamp DESC, id DESC LIMIT ?");
        args.add(query.limit());

        List<TimelineEvent> events = new ArrayList<>(jdbcTemplate.query(sql.toString(),
                (rs, rowNum) -> EventSerializer.deserialize(rs.getString("payload")), args.toArray()));
        Collections.reverse(events);
        return events;
    }

    /** Returns the number of stored events. */
    public long count() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM events", Long.class);
        return count == null ? 0 : count;
    }

    /**
     * Deletes every event older than {@code cutoff}.
     *
     * @return the number of deleted events
     */
    public int evictBefore(Instant cutoff) {
        int deleted = jdbcTemplate.update("DELETE FROM events WHERE timestamp < ?", EventInserter.utc(cutoff));
        if (deleted > 0) {
            log.info("Evicted {} timeline events older than {}", deleted, cutoff);
        }
        return deleted;
    }

    /** The instant before which events are expired, relative to {@code now}. */
    public Instant retentionCutoff(Instant now) {
        return now.minus(retention);
    }

    /** The configured retention. */
    public Duration retention() {
        return retention;
    }
}
