package com.vigil.observability;

import java.util.UUID;

/**
 * Identifies one collection cycle in logs and traces.
 * <p>
 * Every cycle (and every status request served to a peer) runs with a {@code CycleContext}
 * installed through {@link CycleContextHolder}, which copies it into SLF4J MDC so that every log
 * line of the cycle carries the same identifiers.
 *
 * @param cycleId  unique ID of the collection cycle
 * @param nodeName name of the local node running the cycle
 */
public record CycleContext(String cycleId, String nodeName) {

    /** MDC key for the cycle ID. */
    public static final String MDC_CYCLE_ID = "cycleId";

    /** MDC key for the local node name. */
    public static final String MDC_NODE = "node";

    public CycleContext {
        if (cycleId == null || cycleId.isBlank()) {
            throw new IllegalArgumentException("cycleId must not be null or blank");
        }
    }

    /**
     * Creates a context with a random cycle ID.
     */
    public static CycleContext newCycle(String nodeName) {
        return new CycleContext(UUID.randomUUID().toString(), nodeName);
    }
}
