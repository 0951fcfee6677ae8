package com.vigil.membership;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Membership view consumed by the status pipeline.
 * <p>
 * Only <em>active</em> members are ever returned. Members that are leaving, have left or have
 * failed are removed before callers see them, so a departed node is never evaluated as a node
 * whose status is missing.
 */
public interface MembershipClient extends AutoCloseable {

    /**
     * Returns the active members. Each call returns a new immutable list.
     *
     * @throws MembershipException if the substrate cannot list members
     */
    List<ClusterMember> members();

    /**
     * Looks up an active member by name.
     *
     * @throws MemberNotFoundException if no active member has this name
     */
    ClusterMember findMember(String name);

    /**
     * Joins the cluster through the given peers. A partial join is not an error.
     *
     * @return number of peers joined
     */
    int join(Collection<String> peers, boolean replay);

    /**
     * Updates the tags of the local member.
     */
    void updateTags(Map<String, String> add, Collection<String> remove);

    /**
     * Returns the network coordinate of the named member, if known.
     */
    Optional<Coordinate> coordinate(String name);

    /**
     * Returns true if {@code localName} is an active member of a cluster with at least one other
     * member. A node that only sees itself has not joined a cluster yet.
     */
    boolean isMember(String localName);

    @Override
    void close();
}
