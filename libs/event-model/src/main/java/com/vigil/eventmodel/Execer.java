package com.vigil.eventmodel;

import java.time.Duration;

/**
 * Storage collaborator that executes one write statement.
 * <p>
 * Implementations throw an unchecked exception when the statement fails or does not complete
 * within its timeout.
 */
@FunctionalInterface
public interface Execer {

    /**
     * Executes a statement with positional arguments.
     *
     * @param timeout   how long the statement may run, always positive
     * @param statement the statement, with {@code ?} placeholders
     * @param args      the placeholder values in order
     */
    void exec(Duration timeout, String statement, Object... args);
}
