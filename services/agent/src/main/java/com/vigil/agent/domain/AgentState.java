package com.vigil.agent.domain;

/**
 * Lifecycle of a {@link ClusterAgent}.
 * <p>
 * {@code INITIALIZING -> COLLECTING <-> IDLE -> STOPPED}. Reading the cached status is allowed in
 * every state and never changes it.
 */
public enum AgentState {

    /** Waiting for the membership client to become ready. */
    INITIALIZING,

    /** A collection cycle is in flight. */
    COLLECTING,

    /** Between two cycles. */
    IDLE,

    /** Closed; no further cycles run. */
    STOPPED
}
