package com.vigil.database;

import com.zaxxer.hikari.HikariDataSource;
import org.flywaydb.core.Flyway;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.DependsOn;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

/**
 * Wires the timeline database: a dedicated DataSource migrated by its own Flyway instance, the
 * {@link JdbcExecer} that stores events and the {@link TimelineStore} that reads and evicts them.
 * <p>
 * Active only when {@code vigil.timeline.enabled=true}. Services using this module should disable
 * Spring Boot's Flyway auto-configuration ({@code spring.flyway.enabled: false}).
 *
 * @see TimelineStorageProperties
 */
@Configuration
@EnableConfigurationProperties(TimelineStorageProperties.class)
@ConditionalOnProperty(prefix = "vigil.timeline", name = "enabled", havingValue = "true")
public class TimelineStorageConfig {

    /** Bean name of the timeline Flyway instance. */
    public static final String TIMELINE_FLYWAY_BEAN = "timelineFlyway";

    /** Bean name of the timeline DataSource. */
    public static final String TIMELINE_DATA_SOURCE_BEAN = "timelineDataSource";

    @Bean(name = TIMELINE_DATA_SOURCE_BEAN)
    public DataSource timelineDataSource(TimelineStorageProperties properties) {
        HikariDataSource dataSource = DataSourceBuilder.create()
                .type(HikariDataSource.class)
                .url(properties.url())
                .username(properties.username())
                .password(properties.password())
                .build();
        dataSource.setPoolName("vigil-timeline");
        return dataSource;
    }

    /**
     * Flyway instance for the timeline schema; migrates when the context starts.
     */
    @Bean(name = TIMELINE_FLYWAY_BEAN, initMethod = "migrate")
    public Flyway timelineFlyway(DataSource timelineDataSource, TimelineStorageProperties properties) {
        return Flyway.configure()
                .dataSource(timelineDataSource)
                .locations(properties.locations())
                .baselineOnMigrate(true)
                .cleanDisabled(true)
                .load();
    }

    @Bean
    @DependsOn(TIMELINE_FLYWAY_BEAN)
    public JdbcTemplate timelineJdbcTemplate(DataSource timelineDataSource) {
        return new JdbcTemplate(timelineDataSource);
    }

    @Bean
    public JdbcExecer timelineExecer(JdbcTemplate timelineJdbcTemplate) {
        return new JdbcExecer(timelineJdbcTemplate);
    }

    @Bean
    public TimelineStore timelineStore(JdbcTemplate timelineJdbcTemplate, TimelineStorageProperties properties) {
        return new TimelineStore(timelineJdbcTemplate, properties.retention());
    }
}
