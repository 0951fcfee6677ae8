package com.vigil.agent.domain;

import com.vigil.observability.TimeoutBudget;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Static settings of a {@link ClusterAgent}.
 *
 * @param nodeName    name of the local node, unique in the cluster
 * @param tags        tags the local node announces through gossip
 * @param peers       gossip endpoints ({@code host:port}) to join at start
 * @param budget      cascading collection deadlines
 * @param initTimeout time allowed for the membership client to become ready
 * @param historySize number of past cluster statuses kept in memory
 */
public record AgentSettings(
        String nodeName,
        Map<String, String> tags,
        List<String> peers,
        TimeoutBudget budget,
        Duration initTimeout,
        int historySize) {

    public AgentSettings {
        if (nodeName == null || nodeName.isBlank()) {
            throw new IllegalArgumentException("nodeName must not be null or blank");
        }
        if (budget == null) {
            throw new IllegalArgumentException("budget must not be null");
        }
        if (initTimeout == null || initTimeout.isZero() || initTimeout.isNegative()) {
            throw new IllegalArgumentException("initTimeout must be positive");
        }
        if (historySize <= 0) {
            throw new IllegalArgumentException("historySize must be positive");
        }
        tags = tags == null ? Map.of() : Map.copyOf(tags);
        peers = peers == null ? List.of() : List.copyOf(peers);
    }
}
