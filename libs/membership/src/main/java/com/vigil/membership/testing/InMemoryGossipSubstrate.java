package com.vigil.membership.testing;

import com.vigil.membership.ClusterMember;
import com.vigil.membership.Coordinate;
import com.vigil.membership.GossipSubstrate;
import com.vigil.membership.MemberStatus;
import com.vigil.membership.MembershipException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A controllable gossip substrate for tests.
 * <p>
 * Holds a canned member table that tests mutate directly (add, remove, change status, fail).
 * Placed in {@code src/main/java} for cross-module test use.
 */
public final class InMemoryGossipSubstrate implements GossipSubstrate {

    private final String localName;
    private final Map<String, ClusterMember> members = new LinkedHashMap<>();
    private final Map<String, Coordinate> coordinates = new HashMap<>();
    private final List<String> joinedPeers = new ArrayList<>();
    private final AtomicBoolean failing = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * Creates a substrate whose local member is {@code localName}. The local member is not added
     * automatically.
     */
    public InMemoryGossipSubstrate(String localName) {
        this.localName = localName;
    }

    @Override
    public synchronized List<ClusterMember> members() {
        if (failing.get()) {
            throw new MembershipException("gossip agent unreachable");
        }
        return List.copyOf(members.values());
    }

    @Override
    public synchronized int join(Collection<String> peers, boolean replay) {
        if (failing.get()) {
            throw new MembershipException("gossip agent unreachable");
        }
        int joined = 0;
        for (String peer : peers) {
            boolean known = members.values().stream().anyMatch(m -> m.endpoint().equals(peer));
            if (known) {
                joinedPeers.add(peer);
                joined++;
            }
        }
        return joined;
    }

    @Override
    public synchronized void updateTags(Map<String, String> add, Collection<String> remove) {
        ClusterMember local = members.get(localName);
        if (local == null) {
            throw new MembershipException("local member " + localName + " is not registered");
        }
        Map<String, String> tags = new HashMap<>(local.tags());
        tags.putAll(add);
        remove.forEach(tags::remove);
        members.put(localName, local.withTags(tags));
    }

    @Override
    public synchronized Optional<Coordinate> coordinate(String node) {
        return Optional.ofNullable(coordinates.get(node));
    }

    @Override
    public void close() {
        closed.set(true);
    }

    /** Adds or replaces a member. */
    public synchronized InMemoryGossipSubstrate put(ClusterMember member) {
        members.put(member.name(), member);
        return this;
    }

    /** Removes a member entirely, as if the substrate had reaped it. */
    public synchronized InMemoryGossipSubstrate remove(String name) {
        members.remove(name);
        return this;
    }

    /** Changes the gossip status of an existing member. */
    public synchronized InMemoryGossipSubstrate setStatus(String name, MemberStatus status) {
        ClusterMember member = members.get(name);
        if (member == null) {
            throw new IllegalArgumentException("unknown member " + name);
        }
        members.put(name, member.withStatus(status));
        return this;
    }

    /** Sets the coordinate reported for a member. */
    public synchronized InMemoryGossipSubstrate setCoordinate(String name, Coordinate coordinate) {
        coordinates.put(name, coordinate);
        return this;
    }

    /** Makes every subsequent call fail (or succeed again). */
    public InMemoryGossipSubstrate setFailing(boolean fail) {
        failing.set(fail);
        return this;
    }

    /** Returns the peers accepted by {@link #join}. */
    public synchronized List<String> joinedPeers() {
        return List.copyOf(joinedPeers);
    }

    /** Returns true once {@link #close()} was called. */
    public boolean isClosed() {
        return closed.get();
    }

    /** Returns the name of the local member. */
    public String localName() {
        return localName;
    }
}
