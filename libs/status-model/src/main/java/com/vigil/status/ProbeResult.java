package com.vigil.status;

/**
 * Outcome of a single checker run on a node.
 *
 * @param node      name of the node the probe ran on
 * @param probe     checker name, unique per node
 * @param succeeded whether the probe passed
 * @param detail    free-text detail (error message on failure, may be empty)
 */
public record ProbeResult(String node, String probe, boolean succeeded, String detail) {

    /** Detail recorded for a checker that did not finish within its deadline. */
    public static final String TIMED_OUT = "timed out";

    public ProbeResult {
        if (probe == null || probe.isBlank()) {
            throw new IllegalArgumentException("probe must not be null or blank");
        }
        if (detail == null) {
            detail = "";
        }
    }

    /** Creates a passing probe. */
    public static ProbeResult passed(String node, String probe) {
        return new ProbeResult(node, probe, true, "");
    }

    /** Creates a passing probe with detail. */
    public static ProbeResult passed(String node, String probe, String detail) {
        return new ProbeResult(node, probe, true, detail);
    }

    /** Creates a failed probe. */
    public static ProbeResult failed(String node, String probe, String detail) {
        return new ProbeResult(node, probe, false, detail);
    }

    /** Creates the failed probe recorded for a checker that missed its deadline. */
    public static ProbeResult timedOut(String node, String probe) {
        return new ProbeResult(node, probe, false, TIMED_OUT);
    }

    /** Creates the failed probe recorded for a checker that threw. */
    public static ProbeResult panicked(String node, String probe, Throwable cause) {
        return new ProbeResult(node, probe, false, "checker panicked: " + cause);
    }
}
