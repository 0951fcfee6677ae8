package com.vigil.membership.standalone;

import com.vigil.membership.ClusterMember;
import com.vigil.membership.Coordinate;
import com.vigil.membership.GossipSubstrate;
import com.vigil.membership.MemberStatus;
import com.vigil.membership.MembershipException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A substrate for a node that runs alone.
 * <p>
 * The only member is the local node, always alive. Joins contact nobody and tag updates apply
 * to the local member only.
 */
public final class StandaloneGossipSubstrate implements GossipSubstrate {

    private static final Logger log = LoggerFactory.getLogger(StandaloneGossipSubstrate.class);

    private ClusterMember local;
    private boolean closed;

    /**
     * @param name    local node name
     * @param address address announced for the local node
     * @param tags    initial tags of the local node
     */
    public StandaloneGossipSubstrate(String name, String address, Map<String, String> tags) {
        this.local = new ClusterMember(name, address, 0, tags, MemberStatus.ALIVE);
    }

    @Override
    public synchronized List<ClusterMember> members() {
        requireOpen();
        return List.of(local);
    }

    @Override
    public synchronized int join(Collection<String> peers, boolean replay) {
        requireOpen();
        if (!peers.isEmpty()) {
            log.warn("Running standalone, not joining peers {}", peers);
        }
        return 0;
    }

    @Override
    public synchronized void updateTags(Map<String, String> add, Collection<String> remove) {
        requireOpen();
        Map<String, String> tags = new HashMap<>(local.tags());
        tags.putAll(add);
        remove.forEach(tags::remove);
        local = local.withTags(tags);
    }

    @Override
    public Optional<Coordinate> coordinate(String node) {
        return Optional.empty();
    }

    @Override
    public synchronized void close() {
        closed = true;
    }

    private void requireOpen() {
        if (closed) {
            throw new MembershipException("standalone substrate is closed");
        }
    }
}
