package com.vigil.membership;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The underlying gossip/membership protocol.
 * <p>
 * The agent never implements gossip itself; it consumes a substrate through this interface.
 * Implementations report every member they know about, including members that are leaving,
 * have left or have failed. Filtering is the job of {@link MembershipClient}.
 */
public interface GossipSubstrate extends AutoCloseable {

    /**
     * Returns every member known to the substrate, regardless of status.
     *
     * @throws MembershipException if the member list cannot be obtained
     */
    List<ClusterMember> members();

    /**
     * Joins the cluster through the given peers.
     *
     * @param peers  peer addresses ({@code host:port}) to contact
     * @param replay whether to replay past user events after joining
     * @return number of peers that were successfully contacted
     * @throws MembershipException if no join could be attempted at all
     */
    int join(Collection<String> peers, boolean replay);

    /**
     * Adds and removes tags on the local member. Changes are propagated by gossip.
     *
     * @param add    tags to set
     * @param remove tag keys to delete
     */
    void updateTags(Map<String, String> add, Collection<String> remove);

    /**
     * Returns the network coordinate of the named member, if the substrate estimates them.
     */
    Optional<Coordinate> coordinate(String node);

    /**
     * Releases the connection to the substrate.
     */
    @Override
    void close();
}
