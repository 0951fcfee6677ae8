package com.vigil.agent.domain;

/**
 * Thrown when the cluster status is read before the first collection cycle completed.
 */
public class AgentNotReadyException extends RuntimeException {

    public AgentNotReadyException(String message) {
        super(message);
    }
}
