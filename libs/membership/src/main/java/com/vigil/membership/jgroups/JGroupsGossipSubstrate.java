package com.vigil.membership.jgroups;

import com.vigil.membership.ClusterMember;
import com.vigil.membership.Coordinate;
import com.vigil.membership.GossipSubstrate;
import com.vigil.membership.MemberStatus;
import com.vigil.membership.MembershipException;
import org.jgroups.Address;
import org.jgroups.Event;
import org.jgroups.JChannel;
import org.jgroups.Message;
import org.jgroups.ObjectMessage;
import org.jgroups.PhysicalAddress;
import org.jgroups.Receiver;
import org.jgroups.View;
import org.jgroups.protocols.TCPPING;
import org.jgroups.stack.IpAddress;
import org.jgroups.util.NameCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link GossipSubstrate} over a JGroups channel.
 * <p>
 * Members of the current view are reported as {@link MemberStatus#ALIVE}. Members that dropped
 * out of the last view change are reported as {@link MemberStatus#LEFT} until the next view
 * change. Tags are not part of JGroups membership, so every node multicasts its tag map when it
 * changes and whenever the view changes; receivers keep the latest map per sender.
 * <p>
 * Joined peers become initial hosts of the stack's {@link TCPPING}. A node that is still alone
 * reconnects so discovery contacts them right away; a node already in a cluster reaches them
 * through the next merge. A stack without {@code TCPPING} relies on its own discovery.
 * <p>
 * JGroups does not estimate network coordinates; {@link #coordinate(String)} is always empty.
 */
public final class JGroupsGossipSubstrate implements GossipSubstrate, Receiver {

    private static final Logger log = LoggerFactory.getLogger(JGroupsGossipSubstrate.class);

    private final JChannel channel;
    private final String clusterName;
    private final Map<Address, Map<String, String>> tagsByMember = new ConcurrentHashMap<>();
    private final Map<String, String> localTags = new ConcurrentHashMap<>();
    private volatile Map<Address, ClusterMember> departed = Map.of();
    private final Set<InetSocketAddress> knownHosts = new LinkedHashSet<>();
    private volatile View lastView;

    /**
     * Creates a substrate over an unconnected channel. The channel is connected by the first
     * {@link #join} call.
     *
     * @param channel     the JGroups channel (its logical name becomes the member name)
     * @param clusterName JGroups cluster to connect to
     */
    public JGroupsGossipSubstrate(JChannel channel, String clusterName) {
        if (channel == null) {
            throw new IllegalArgumentException("channel must not be null");
        }
        if (clusterName == null || clusterName.isBlank()) {
            throw new IllegalArgumentException("clusterName must not be null or blank");
        }
        this.channel = channel;
        this.clusterName = clusterName;
        channel.setReceiver(this);
    }

    @Override
    public List<ClusterMember> members() {
        View view = channel.getView();
        if (view == null) {
            throw new MembershipException("channel is not connected to cluster " + clusterName);
        }
        List<ClusterMember> result = new ArrayList<>();
        for (Address address : view.getMembers()) {
            result.add(toMember(address, MemberStatus.ALIVE));
        }
        for (Map.Entry<Address, ClusterMember> entry : departed.entrySet()) {
            if (!view.containsMember(entry.getKey())) {
                result.add(entry.getValue());
            }
        }
        return result;
    }

    @Override
    public synchronized int join(Collection<String> peers, boolean replay) {
        List<InetSocketAddress> hosts = new ArrayList<>();
        for (String peer : peers) {
            hosts.add(parsePeer(peer));
        }
        if (!hosts.isEmpty()) {
            addInitialHosts(hosts, peers);
        }
        connect();
        List<InetSocketAddress> endpoints = new ArrayList<>();
        for (Address address : channel.getView().getMembers()) {
            Object physical = channel.down(new Event(Event.GET_PHYSICAL_ADDRESS, address));
            if (physical instanceof IpAddress ip && ip.getIpAddress() != null) {
                endpoints.add(new InetSocketAddress(ip.getIpAddress(), ip.getPort()));
            }
        }
        int joined = 0;
        for (InetSocketAddress host : hosts) {
            if (endpoints.contains(host)) {
                joined++;
            }
        }
        return joined;
    }

    private void addInitialHosts(List<InetSocketAddress> hosts, Collection<String> peers) {
        TCPPING discovery = channel.getProtocolStack().findProtocol(TCPPING.class);
        if (discovery == null) {
            log.warn("Protocol stack has no TCPPING, leaving peers {} to its own discovery", peers);
            return;
        }
        if (!knownHosts.addAll(hosts)) {
            return;
        }
        discovery.initialHosts(List.copyOf(knownHosts));
        log.info("Discovery hosts are now {}", knownHosts);
        View view = channel.getView();
        if (channel.isConnected() && view != null && view.size() == 1) {
            log.info("Alone in cluster {}, reconnecting through peers {}", clusterName, peers);
            channel.disconnect();
            lastView = null;
            departed = Map.of();
            tagsByMember.clear();
        }
    }

    static InetSocketAddress parsePeer(String peer) {
        if (peer == null || peer.isBlank()) {
            throw new IllegalArgumentException("peer must not be blank");
        }
        String host = peer.trim();
        int port = JGroupsStacks.DEFAULT_BIND_PORT;
        int colon = host.lastIndexOf(':');
        if (colon > 0) {
            try {
                port = Integer.parseInt(host.substring(colon + 1));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("invalid peer port in " + peer, e);
            }
            host = host.substring(0, colon);
        }
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("invalid peer port in " + peer);
        }
        return new InetSocketAddress(host, port);
    }

    /**
     * Connects the channel to the cluster if it is not connected yet and announces the local tags.
     * A node without peers to join forms a cluster of its own.
     *
     * @throws MembershipException if the channel cannot connect
     */
    public synchronized void connect() {
        if (!channel.isConnected()) {
            try {
                channel.connect(clusterName);
            } catch (Exception e) {
                throw new MembershipException("failed to connect to cluster " + clusterName, e);
            }
            log.info("Connected to cluster {} as {}", clusterName, channel.getName());
        }
        announceTags();
    }

    @Override
    public void updateTags(Map<String, String> add, Collection<String> remove) {
        localTags.putAll(add);
        remove.forEach(localTags::remove);
        announceTags();
    }

    @Override
    public Optional<Coordinate> coordinate(String node) {
        return Optional.empty();
    }

    @Override
    public void close() {
        channel.close();
    }

    @Override
    public void receive(Message msg) {
        Object payload = msg.getObject();
        if (msg.getSrc() == null || !(payload instanceof Map<?, ?> map)) {
            return;
        }
        Map<String, String> tags = new HashMap<>();
        map.forEach((key, value) -> tags.put(String.valueOf(key), String.valueOf(value)));
        tagsByMember.put(msg.getSrc(), Map.copyOf(tags));
    }

    @Override
    public void viewAccepted(View view) {
        View previous = lastView;
        Map<Address, ClusterMember> left = new LinkedHashMap<>();
        if (previous != null) {
            for (Address address : previous.getMembers()) {
                if (!view.containsMember(address)) {
                    left.put(address, toMember(address, MemberStatus.LEFT));
                    tagsByMember.remove(address);
                }
            }
        }
        departed = Map.copyOf(left);
        lastView = view;
        log.info("Membership view changed: {} ({} left)", view, left.size());
        announceTags();
    }

    private void announceTags() {
        if (!channel.isConnected()) {
            return;
        }
        Address self = channel.getAddress();
        HashMap<String, String> snapshot = new HashMap<>(localTags);
        if (self != null) {
            tagsByMember.put(self, Map.copyOf(snapshot));
        }
        try {
            channel.send(new ObjectMessage(null, snapshot));
        } catch (Exception e) {
            log.warn("Failed to announce tags to cluster {}", clusterName, e);
        }
    }

    private ClusterMember toMember(Address address, MemberStatus status) {
        String name = NameCache.get(address);
        if (name == null) {
            name = address.toString();
        }
        String host = "";
        int port = 0;
        Object physical = channel.down(new Event(Event.GET_PHYSICAL_ADDRESS, address));
        if (physical instanceof IpAddress ip && ip.getIpAddress() != null) {
            host = ip.getIpAddress().getHostAddress();
            port = ip.getPort();
        } else if (physical instanceof PhysicalAddress other) {
            host = other.toString();
        }
        Map<String, String> tags = tagsByMember.getOrDefault(address, Map.of());
        return new ClusterMember(name, host, port, tags, status);
    }
}
