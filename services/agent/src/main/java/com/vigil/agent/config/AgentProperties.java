package com.vigil.agent.config;

import com.vigil.agent.domain.AgentSettings;
import com.vigil.membership.ClusterMember;
import com.vigil.membership.jgroups.JGroupsStacks;
import com.vigil.observability.TimeoutBudget;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Agent configuration, bound from the {@code vigil.agent.*} prefix:
 *
 * <pre>
 * vigil:
 *   agent:
 *     name: node-1
 *     role: node
 *     peers: [master-1:7800]
 *     agent-port: 7575
 *     status-period: 30s
 *     gossip:
 *       mode: jgroups
 *       cluster-name: vigil
 *       bind-port: 7800
 *     disk:
 *       path: /var/lib
 *       min-free-ratio: 0.1
 * </pre>
 *
 * Reply, local and probe timeouts are derived unless set explicitly, each from the resolved
 * timeout just outside it.
 *
 * @param name          node name, unique in the cluster. Required.
 * @param role          {@code master} or {@code node} (default {@code node})
 * @param peers         gossip endpoints joined at start
 * @param tags          extra tags announced through gossip
 * @param agentPort     port of the status API, announced to peers (default 7575)
 * @param statusPeriod  interval between collection cycles (default 30s)
 * @param replyTimeout  optional override of the peer reply timeout
 * @param localTimeout  optional override of the local collection timeout
 * @param probeTimeout  optional override of the per-checker timeout
 * @param initTimeout   time allowed for membership to become ready (default 30s)
 * @param historySize   number of cluster statuses kept in memory (default 100)
 * @param gossip        gossip substrate settings
 * @param disk          built-in disk space checker settings
 */
@ConfigurationProperties(prefix = "vigil.agent")
@Validated
public record AgentProperties(
        @NotBlank String name,
        String role,
        List<String> peers,
        Map<String, String> tags,
        @Min(1) @Max(65535) int agentPort,
        Duration statusPeriod,
        Duration replyTimeout,
        Duration localTimeout,
        Duration probeTimeout,
        Duration initTimeout,
        @Positive int historySize,
        @Valid Gossip gossip,
        @Valid Disk disk) {

    /** Tag announcing the port of the status API to peers. */
    public static final String TAG_AGENT_PORT = "agent-port";

    public static final int DEFAULT_AGENT_PORT = 7575;

    public AgentProperties {
        if (role == null || role.isBlank()) {
            role = ClusterMember.ROLE_NODE;
        }
        peers = peers == null ? List.of() : List.copyOf(peers);
        tags = tags == null ? Map.of() : Map.copyOf(tags);
        if (agentPort == 0) {
            agentPort = DEFAULT_AGENT_PORT;
        }
        if (statusPeriod == null) {
            statusPeriod = TimeoutBudget.DEFAULT_STATUS_PERIOD;
        }
        if (initTimeout == null) {
            initTimeout = Duration.ofSeconds(30);
        }
        if (historySize == 0) {
            historySize = 100;
        }
        if (gossip == null) {
            gossip = new Gossip(null, null, null, null, 0);
        }
        if (disk == null) {
            disk = new Disk(true, null, 0);
        }
    }

    /**
     * Builds the cascading timeout budget from the status period and the explicit overrides.
     *
     * @throws IllegalArgumentException if the resulting deadlines do not nest
     */
    public TimeoutBudget timeoutBudget() {
        return TimeoutBudget.resolve(statusPeriod, replyTimeout, localTimeout, probeTimeout);
    }

    /** Returns the tags announced through gossip: the extra tags plus role and agent port. */
    public Map<String, String> announcedTags() {
        Map<String, String> announced = new LinkedHashMap<>(tags);
        announced.put(ClusterMember.TAG_ROLE, role);
        announced.put(TAG_AGENT_PORT, Integer.toString(agentPort));
        return announced;
    }

    /** Converts to the settings of the cluster agent. */
    public AgentSettings toSettings() {
        return new AgentSettings(name, announcedTags(), peers, timeoutBudget(), initTimeout, historySize);
    }

    /**
     * Gossip substrate settings.
     * <p>
     * Without a {@code config} file the agent runs a TCP stack that finds other members through
     * the configured peers only.
     *
     * @param mode        {@code jgroups} to join a real cluster, {@code standalone} for a single node
     * @param clusterName JGroups cluster name (default {@code vigil})
     * @param config      optional JGroups protocol stack file replacing the built-in TCP stack
     * @param bindAddress address the TCP stack binds, JGroups picks a site-local one when unset
     * @param bindPort    port the TCP stack binds (default 7800), also the port peers are joined on
     */
    public record Gossip(
            GossipMode mode,
            String clusterName,
            String config,
            String bindAddress,
            @Min(0) @Max(65535) int bindPort) {

        public Gossip {
            if (mode == null) {
                mode = GossipMode.JGROUPS;
            }
            if (clusterName == null || clusterName.isBlank()) {
                clusterName = "vigil";
            }
            if (config != null && config.isBlank()) {
                config = null;
            }
            if (bindAddress != null && bindAddress.isBlank()) {
                bindAddress = null;
            }
            if (bindPort == 0) {
                bindPort = JGroupsStacks.DEFAULT_BIND_PORT;
            }
        }
    }

    /** How cluster membership is obtained. */
    public enum GossipMode {
        JGROUPS,
        STANDALONE
    }

    /**
     * Built-in disk space checker settings.
     *
     * @param enabled      whether the checker is registered (default true)
     * @param path         file system path to watch (default {@code /})
     * @param minFreeRatio minimal usable/total ratio before the probe fails (default 0.1)
     */
    public record Disk(
            Boolean enabled,
            String path,
            @DecimalMin("0.0") @DecimalMax("1.0") double minFreeRatio) {

        public Disk {
            if (enabled == null) {
                enabled = Boolean.TRUE;
            }
            if (path == null || path.isBlank()) {
                path = "/";
            }
            if (minFreeRatio == 0) {
                minFreeRatio = 0.1;
            }
        }
    }
}
