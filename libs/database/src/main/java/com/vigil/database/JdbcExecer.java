package com.vigil.database;

import com.vigil.eventmodel.Execer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.core.ArgumentPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.PreparedStatement;
import java.time.Duration;

/**
 * {@link Execer} over a {@link JdbcTemplate}.
 * <p>
 * Each statement carries its own JDBC query timeout, rounded up to whole seconds. A statement
 * rejected by a unique constraint is ignored: the row is already stored. Every other
 * {@link org.springframework.dao.DataAccessException} propagates.
 */
public final class JdbcExecer implements Execer {

    private static final Logger log = LoggerFactory.getLogger(JdbcExecer.class);

    private final JdbcTemplate jdbcTemplate;

    public JdbcExecer(JdbcTemplate jdbcTemplate) {
        if (jdbcTemplate == null) {
            throw new IllegalArgumentException("jdbcTemplate must not be null");
        }
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void exec(Duration timeout, String statement, Object... args) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new QueryTimeoutException("no time left to execute: " + statement);
        }
        int timeoutSeconds = queryTimeoutSeconds(timeout);
        try {
            jdbcTemplate.update(connection -> {
                PreparedStatement prepared = connection.prepareStatement(statement);
                prepared.setQueryTimeout(timeoutSeconds);
                new ArgumentPreparedStatementSetter(args).setValues(prepared);
                return prepared;
            });
        } catch (DuplicateKeyException e) {
            log.debug("Ignoring duplicate row: {}", e.getMostSpecificCause().getMessage());
        }
    }

    static int queryTimeoutSeconds(Duration timeout) {
        long seconds = timeout.getSeconds() + (timeout.getNano() > 0 ? 1 : 0);
        return (int) Math.min(Math.max(seconds, 1), Integer.MAX_VALUE);
    }
}
