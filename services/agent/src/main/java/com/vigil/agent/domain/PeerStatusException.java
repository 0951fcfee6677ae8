package com.vigil.agent.domain;

/**
 * Thrown when the status of a peer cannot be obtained.
 */
public class PeerStatusException extends RuntimeException {

    private final String peer;

    public PeerStatusException(String peer, String message, Throwable cause) {
        super(message, cause);
        this.peer = peer;
    }

    /** Name of the peer that could not be queried. */
    public String peer() {
        return peer;
    }
}
