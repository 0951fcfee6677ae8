package com.vigil.agent.domain;

import com.vigil.membership.ClusterMember;
import com.vigil.status.NodeStatus;

/**
 * Fetches the last collected local status of a peer agent.
 */
public interface PeerStatusClient {

    /**
     * Queries one peer.
     *
     * @param member the peer to query
     * @return the peer's own last collected status
     * @throws PeerStatusException if the peer is unreachable or answers with an error
     */
    NodeStatus localStatus(ClusterMember member);
}
