package com.vigil.database;

import com.vigil.eventmodel.EventType;
import com.vigil.eventmodel.Timeline;
import com.vigil.eventmodel.TimelineClock;
import com.vigil.eventmodel.TimelineEvent;
import com.vigil.status.StatusType;
import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.TimeZone;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TimelineStore")
class TimelineStoreTest {

    private static final Instant T0 = Instant.parse("2026-05-01T10:00:00Z");
    private static final Duration WRITE_TIMEOUT = Duration.ofSeconds(5);

    private JdbcTemplate jdbcTemplate;
    private JdbcExecer execer;
    private TimelineStore store;
    private Timeline timeline;

    @BeforeEach
    void setUp() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(
                "jdbc:h2:mem:timeline-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1", "sa", "");
        Flyway.configure()
                .dataSource(dataSource)
                .locations(TimelineStorageProperties.DEFAULT_LOCATIONS)
                .load()
                .migrate();
        jdbcTemplate = new JdbcTemplate(dataSource);
        execer = new JdbcExecer(jdbcTemplate);
        store = new TimelineStore(jdbcTemplate, Duration.ofDays(7));
        timeline = new Timeline(TimelineClock.system());
    }

    @Nested
    @DisplayName("Storing")
    class Storing {

        @Test
        @DisplayName("should store and read back events oldest first")
        void shouldRoundTripEvents() {
            TimelineEvent degraded = new TimelineEvent.ClusterDegraded(T0, StatusType.DEGRADED,
                    "no status received from nodes (node-2,)");
            TimelineEvent removed = new TimelineEvent.NodeRemoved(T0.plusNanos(1), "node-2");

            timeline.record(removed, execer, WRITE_TIMEOUT);
            timeline.record(degraded, execer, WRITE_TIMEOUT);

            assertThat(store.events(EventQuery.all())).containsExactly(degraded, removed);
        }

        @Test
        @DisplayName("should ignore a duplicate row")
        void shouldIgnoreDuplicates() {
            TimelineEvent event = new TimelineEvent.NodeAdded(T0, "node-1");

            timeline.record(event, execer, WRITE_TIMEOUT);
            timeline.record(event, execer, WRITE_TIMEOUT);

            assertThat(store.count()).isEqualTo(1);
        }

        @Test
        @DisplayName("should keep events an hour apart distinct across a daylight saving fall-back")
        void shouldKeepInstantsAcrossFallBack() {
            TimeZone defaultZone = TimeZone.getDefault();
            TimeZone.setDefault(TimeZone.getTimeZone("America/New_York"));
            try {
                // 01:30 EDT and 01:30 EST share the same local wall time
                Instant firstPass = Instant.parse("2026-11-01T05:30:00Z");
                Instant secondPass = Instant.parse("2026-11-01T06:30:00Z");
                timeline.record(new TimelineEvent.NodeAdded(firstPass, "node-1"), execer, WRITE_TIMEOUT);
                timeline.record(new TimelineEvent.NodeAdded(secondPass, "node-2"), execer, WRITE_TIMEOUT);

                assertThat(store.count()).isEqualTo(2);
                assertThat(store.evictBefore(secondPass)).isEqualTo(1);
                assertThat(store.events(EventQuery.all())).extracting(TimelineEvent::timestamp)
                        .containsExactly(secondPass);
            } finally {
                TimeZone.setDefault(defaultZone);
            }
        }

        @Test
        @DisplayName("should fill the state columns")
        void shouldFillStateColumns() {
            timeline.record(new TimelineEvent.ProbeFailed(T0, "node-1", "disk", "full"), execer, WRITE_TIMEOUT);

            Map<String, Object> row = jdbcTemplate.queryForMap(
                    "SELECT type, node, probe, old_state, new_state FROM events");
            assertThat(row).containsEntry("TYPE", "ProbeFailed")
                    .containsEntry("NODE", "node-1")
                    .containsEntry("PROBE", "disk")
                    .containsEntry("OLD_STATE", "succeeded")
                    .containsEntry("NEW_STATE", "failed");
        }
    }

    @Nested
    @DisplayName("Querying")
    class Querying {

        @BeforeEach
        void seed() {
            timeline.record(new TimelineEvent.ProbeFailed(T0, "node-1", "disk", "full"), execer, WRITE_TIMEOUT);
            timeline.record(new TimelineEvent.ProbeFailed(T0.plusSeconds(1), "node-2", "disk", "full"), execer, WRITE_TIMEOUT);
            timeline.record(new TimelineEvent.ProbeSucceeded(T0.plusSeconds(2), "node-1", "disk"), execer, WRITE_TIMEOUT);
            timeline.record(new TimelineEvent.NodeDegraded(T0.plusSeconds(3), "node-1", StatusType.DEGRADED), execer, WRITE_TIMEOUT);
        }

        @Test
        @DisplayName("should filter by node")
        void shouldFilterByNode() {
            List<TimelineEvent> events = store.events(EventQuery.fromFilters(Map.of("node", "node-1")));

            assertThat(events).extracting(TimelineEvent::type).containsExactly(
                    EventType.PROBE_FAILED, EventType.PROBE_SUCCEEDED, EventType.NODE_DEGRADED);
        }

        @Test
        @DisplayName("should combine filters with AND")
        void shouldCombineFilters() {
            List<TimelineEvent> events = store.events(
                    EventQuery.fromFilters(Map.of("type", "ProbeFailed", "probe", "disk", "node", "node-2")));

            assertThat(events).hasSize(1);
            assertThat(events.get(0)).isInstanceOfSatisfying(TimelineEvent.ProbeFailed.class,
                    e -> assertThat(e.node()).isEqualTo("node-2"));
        }

        @Test
        @DisplayName("should return the most recent events up to the limit")
        void shouldLimit() {
            List<TimelineEvent> events = store.events(new EventQuery(null, null, null, 2));

            assertThat(events).extracting(TimelineEvent::type)
                    .containsExactly(EventType.PROBE_SUCCEEDED, EventType.NODE_DEGRADED);
        }
    }

    @Nested
    @DisplayName("Retention")
    class Retention {

        @Test
        @DisplayName("should evict events older than the cutoff")
        void shouldEvict() {
            timeline.record(new TimelineEvent.NodeAdded(T0, "old"), execer, WRITE_TIMEOUT);
            timeline.record(new TimelineEvent.NodeAdded(T0.plus(Duration.ofDays(8)), "new"), execer, WRITE_TIMEOUT);

            int deleted = store.evictBefore(store.retentionCutoff(T0.plus(Duration.ofDays(8))));

            assertThat(deleted).isEqualTo(1);
            assertThat(store.events(EventQuery.all())).extracting(e -> ((TimelineEvent.NodeAdded) e).node())
                    .containsExactly("new");
        }

        @Test
        @DisplayName("should compute the cutoff from the retention")
        void shouldComputeCutoff() {
            assertThat(store.retentionCutoff(T0)).isEqualTo(T0.minus(Duration.ofDays(7)));
        }

        @Test
        @DisplayName("should reject non-positive retention")
        void shouldRejectNonPositiveRetention() {
            assertThatThrownBy(() -> new TimelineStore(jdbcTemplate, Duration.ZERO))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
