package com.vigil.membership;

/**
 * Thrown when a named member is not an active member of the cluster.
 */
public class MemberNotFoundException extends RuntimeException {

    private final String memberName;

    public MemberNotFoundException(String memberName) {
        super("member not found: " + memberName);
        this.memberName = memberName;
    }

    /** Returns the name that was looked up. */
    public String memberName() {
        return memberName;
    }
}
