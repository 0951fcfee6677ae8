package com.vigil.membership;

/**
 * Thrown when the gossip substrate cannot serve a membership request.
 */
public class MembershipException extends RuntimeException {

    public MembershipException(String message) {
        super(message);
    }

    public MembershipException(String message, Throwable cause) {
        super(message, cause);
    }
}
