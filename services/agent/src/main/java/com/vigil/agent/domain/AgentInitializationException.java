package com.vigil.agent.domain;

/**
 * Thrown when the membership client does not become ready within the initialization timeout.
 * Fatal to the agent.
 */
public class AgentInitializationException extends RuntimeException {

    public AgentInitializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
