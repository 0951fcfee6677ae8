package com.vigil.membership.jgroups;

import org.jgroups.JChannel;
import org.jgroups.protocols.FD_ALL3;
import org.jgroups.protocols.FRAG2;
import org.jgroups.protocols.MERGE3;
import org.jgroups.protocols.MFC;
import org.jgroups.protocols.TCP;
import org.jgroups.protocols.TCPPING;
import org.jgroups.protocols.UNICAST3;
import org.jgroups.protocols.VERIFY_SUSPECT;
import org.jgroups.protocols.pbcast.GMS;
import org.jgroups.protocols.pbcast.NAKACK2;
import org.jgroups.protocols.pbcast.STABLE;

import java.net.InetAddress;

/**
 * Protocol stacks built in code.
 */
public final class JGroupsStacks {

    /** Default TCP port of the gossip transport. */
    public static final int DEFAULT_BIND_PORT = 7800;

    private JGroupsStacks() {
    }

    /**
     * Creates a channel over TCP whose only discovery is {@link TCPPING}. It finds other members
     * solely through the peers handed to {@link JGroupsGossipSubstrate#join}, so it needs no
     * multicast.
     *
     * @param name        logical name of the channel, the member name
     * @param bindAddress address to bind, or null to let JGroups pick a site-local one
     * @param bindPort    port to bind, or 0 for an ephemeral port
     */
    public static JChannel tcp(String name, InetAddress bindAddress, int bindPort) throws Exception {
        TCP transport = new TCP();
        transport.setBindPort(bindPort);
        if (bindAddress != null) {
            transport.setBindAddress(bindAddress);
        }
        transport.getDiagnosticsHandler().setEnabled(false);
        return new JChannel(
                transport,
                new TCPPING(),
                new MERGE3().setMinInterval(5000).setMaxInterval(15000),
                new FD_ALL3(),
                new VERIFY_SUSPECT(),
                new NAKACK2(),
                new UNICAST3(),
                new STABLE(),
                new GMS().setJoinTimeout(2000),
                new MFC(),
                new FRAG2())
                .name(name);
    }
}
