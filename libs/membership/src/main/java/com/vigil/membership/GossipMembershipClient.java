package com.vigil.membership;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link MembershipClient} backed by a {@link GossipSubstrate}.
 * <p>
 * The substrate may keep reporting departed members for a while (a member that left is listed
 * until the substrate reaps it). This client hides them: only {@link MemberStatus#ALIVE} members
 * are passed on.
 */
public final class GossipMembershipClient implements MembershipClient {

    private static final Logger log = LoggerFactory.getLogger(GossipMembershipClient.class);

    private final GossipSubstrate substrate;

    /**
     * Creates a client over the given substrate.
     *
     * @param substrate the gossip substrate (must not be null)
     */
    public GossipMembershipClient(GossipSubstrate substrate) {
        if (substrate == null) {
            throw new IllegalArgumentException("substrate must not be null");
        }
        this.substrate = substrate;
    }

    @Override
    public List<ClusterMember> members() {
        List<ClusterMember> all;
        try {
            all = substrate.members();
        } catch (MembershipException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new MembershipException("failed to query gossip members", e);
        }
        if (all == null) {
            throw new MembershipException("gossip substrate returned no member list");
        }
        return all.stream()
                .filter(member -> member.status() == MemberStatus.ALIVE)
                .toList();
    }

    @Override
    public ClusterMember findMember(String name) {
        return members().stream()
                .filter(member -> member.name().equals(name))
                .findFirst()
                .orElseThrow(() -> new MemberNotFoundException(name));
    }

    @Override
    public int join(Collection<String> peers, boolean replay) {
        if (peers == null || peers.isEmpty()) {
            throw new IllegalArgumentException("peers must not be null or empty");
        }
        int joined;
        try {
            joined = substrate.join(List.copyOf(peers), replay);
        } catch (MembershipException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new MembershipException("failed to join peers " + peers, e);
        }
        if (joined < peers.size()) {
            log.warn("Joined {} of {} peers {}", joined, peers.size(), peers);
        } else {
            log.info("Joined {} nodes", joined);
        }
        return joined;
    }

    @Override
    public void updateTags(Map<String, String> add, Collection<String> remove) {
        Map<String, String> toAdd = add == null ? Map.of() : Map.copyOf(add);
        List<String> toRemove = remove == null ? List.of() : List.copyOf(remove);
        try {
            substrate.updateTags(toAdd, toRemove);
        } catch (MembershipException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new MembershipException("failed to update member tags", e);
        }
    }

    @Override
    public Optional<Coordinate> coordinate(String name) {
        return substrate.coordinate(name);
    }

    @Override
    public boolean isMember(String localName) {
        List<ClusterMember> active;
        try {
            active = members();
        } catch (MembershipException e) {
            log.error("Failed to retrieve members", e);
            return false;
        }
        if (active.size() == 1 && active.get(0).name().equals(localName)) {
            return false;
        }
        return active.stream().anyMatch(member -> member.name().equals(localName));
    }

    @Override
    public void close() {
        substrate.close();
    }
}
