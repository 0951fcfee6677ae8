package com.vigil.status;

/**
 * Health of a single node or of the whole cluster.
 * <p>
 * This is deliberately not a total order: {@link #DEGRADED} and {@link #UNKNOWN} are both
 * "not running" and aggregation treats them alike.
 */
public enum StatusType {

    /** Every probe passed (node) or every aggregation rule holds (cluster). */
    RUNNING,

    /** At least one probe failed (node) or at least one aggregation rule is violated (cluster). */
    DEGRADED,

    /** The status could not be collected, or nothing is known yet. */
    UNKNOWN;

    /** Returns true only for {@link #RUNNING}. */
    public boolean isRunning() {
        return this == RUNNING;
    }
}
