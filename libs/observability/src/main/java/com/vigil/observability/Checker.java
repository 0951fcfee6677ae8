package com.vigil.observability;

import com.vigil.status.ProbeResult;

import java.time.Duration;

/**
 * A single health probe of one aspect of the local node (disk, process, API reachability).
 * <p>
 * Implementations should return within {@code budget}; the collector records a checker that
 * does not as timed out and interrupts it. A thrown exception is recorded as a failed probe.
 * <p>
 * Example usage:
 * <pre>{@code
 * Checker docker = new Checker() {
 *     public String name() { return "docker"; }
 *     public ProbeResult run(String node, Duration budget) {
 *         return dockerClient.ping(budget)
 *                 ? ProbeResult.passed(node, name())
 *                 : ProbeResult.failed(node, name(), "docker daemon not responding");
 *     }
 * };
 * }</pre>
 */
public interface Checker {

    /** Name of the probe, unique within a {@link CheckerRegistry}. */
    String name();

    /**
     * Runs the probe.
     *
     * @param node   name of the local node
     * @param budget time the checker may take before it is considered timed out
     * @return the probe result
     * @throws Exception if the probe cannot be performed
     */
    ProbeResult run(String node, Duration budget) throws Exception;
}
