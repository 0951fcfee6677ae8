package com.vigil.membership;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Map;

/**
 * Read-only snapshot of a gossip peer.
 * <p>
 * Instances are produced by the {@link MembershipClient} on every query and are never mutated
 * afterwards; a newer gossip view produces new instances.
 *
 * @param name       member name, unique within the cluster and stable across restarts
 * @param address    IP address the member gossips on
 * @param gossipPort gossip port
 * @param tags       tags propagated by gossip (at least {@value #TAG_ROLE})
 * @param status     gossip status at snapshot time
 */
public record ClusterMember(
        String name,
        String address,
        int gossipPort,
        Map<String, String> tags,
        MemberStatus status
) {

    /** Tag that carries the role of the node ({@value #ROLE_MASTER} or {@value #ROLE_NODE}). */
    public static final String TAG_ROLE = "role";

    /** Tag set to {@code "true"} on the node currently holding cluster leadership. */
    public static final String TAG_LEADER = "leader";

    /** Role tag value for control-plane nodes. */
    public static final String ROLE_MASTER = "master";

    /** Role tag value for worker nodes. */
    public static final String ROLE_NODE = "node";

    public ClusterMember {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        tags = tags == null ? Map.of() : Map.copyOf(tags);
        if (status == null) {
            status = MemberStatus.NONE;
        }
    }

    /**
     * Creates an alive member with the given role tag.
     */
    public static ClusterMember alive(String name, String address, int gossipPort, String role) {
        return new ClusterMember(name, address, gossipPort, Map.of(TAG_ROLE, role), MemberStatus.ALIVE);
    }

    /** Returns the value of the {@value #TAG_ROLE} tag, or {@code null} if absent. */
    @JsonIgnore
    public String role() {
        return tags.get(TAG_ROLE);
    }

    /** Returns true if this member carries {@code role=master}. */
    @JsonIgnore
    public boolean isMaster() {
        return ROLE_MASTER.equals(role());
    }

    /** Returns true if this member carries {@code leader=true}. */
    @JsonIgnore
    public boolean isLeader() {
        return "true".equalsIgnoreCase(tags.get(TAG_LEADER));
    }

    /** Returns {@code address:gossipPort}. */
    @JsonIgnore
    public String endpoint() {
        return address + ":" + gossipPort;
    }

    /**
     * Returns a copy of this member with a different gossip status.
     */
    public ClusterMember withStatus(MemberStatus newStatus) {
        return new ClusterMember(name, address, gossipPort, tags, newStatus);
    }

    /**
     * Returns a copy of this member with the given tags.
     */
    public ClusterMember withTags(Map<String, String> newTags) {
        return new ClusterMember(name, address, gossipPort, newTags, status);
    }
}
