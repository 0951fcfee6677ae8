package com.vigil.agent.config;

import com.vigil.agent.domain.AgentSettings;
import com.vigil.agent.domain.ClusterAgent;
import com.vigil.agent.domain.PeerStatusClient;
import com.vigil.agent.infrastructure.checks.DiskSpaceChecker;
import com.vigil.agent.infrastructure.health.ClusterHealthIndicator;
import com.vigil.agent.infrastructure.peer.HttpPeerStatusClient;
import com.vigil.agent.infrastructure.timeline.TimelineEvictor;
import com.vigil.database.TimelineStorageConfig;
import com.vigil.database.TimelineStorageProperties;
import com.vigil.database.TimelineStore;
import com.vigil.eventmodel.Execer;
import com.vigil.eventmodel.Timeline;
import com.vigil.eventmodel.TimelineClock;
import com.vigil.membership.GossipMembershipClient;
import com.vigil.membership.GossipSubstrate;
import com.vigil.membership.MembershipClient;
import com.vigil.membership.jgroups.JGroupsGossipSubstrate;
import com.vigil.membership.jgroups.JGroupsStacks;
import com.vigil.membership.standalone.StandaloneGossipSubstrate;
import com.vigil.observability.AgentMetrics;
import com.vigil.observability.Checker;
import com.vigil.observability.CheckerRegistry;
import com.vigil.observability.CycleTracer;
import com.vigil.observability.NodeStatusCollector;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import org.jgroups.JChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.web.client.RestClient;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Wires the cluster agent from {@link AgentProperties}.
 * <p>
 * Additional {@link Checker} beans declared by the application are registered next to the
 * built-in disk space checker. Timeline events are stored through the {@link Execer} of the
 * timeline storage when it is enabled and discarded otherwise.
 */
@Configuration
@Import(TimelineStorageConfig.class)
public class AgentConfiguration {

    private static final Logger log = LoggerFactory.getLogger(AgentConfiguration.class);

    /** Instrumentation scope name of the agent's spans. */
    public static final String TRACER_NAME = "vigil-agent";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public AgentMetrics agentMetrics(MeterRegistry meterRegistry, AgentProperties properties) {
        return new AgentMetrics(meterRegistry, properties.name());
    }

    @Bean
    public CycleTracer cycleTracer() {
        return new CycleTracer(GlobalOpenTelemetry.getTracer(TRACER_NAME));
    }

    @Bean
    public CheckerRegistry checkerRegistry(AgentProperties properties, ObjectProvider<Checker> checkers) {
        CheckerRegistry registry = new CheckerRegistry();
        AgentProperties.Disk disk = properties.disk();
        if (disk.enabled()) {
            registry.register(new DiskSpaceChecker(Path.of(disk.path()), disk.minFreeRatio()));
        }
        checkers.orderedStream().forEach(registry::register);
        log.info("Registered {} checkers", registry.size());
        return registry;
    }

    @Bean(destroyMethod = "close")
    public NodeStatusCollector nodeStatusCollector(
            CheckerRegistry checkerRegistry, AgentProperties properties, AgentMetrics agentMetrics) {
        return new NodeStatusCollector(checkerRegistry, properties.timeoutBudget().probeTimeout(), agentMetrics);
    }

    @Bean(destroyMethod = "close")
    public MembershipClient membershipClient(AgentProperties properties) throws Exception {
        return new GossipMembershipClient(gossipSubstrate(properties));
    }

    @Bean
    public PeerStatusClient peerStatusClient(RestClient.Builder restClientBuilder, AgentProperties properties) {
        return HttpPeerStatusClient.create(
                restClientBuilder, properties.timeoutBudget().replyTimeout(), properties.agentPort());
    }

    @Bean
    public Timeline timeline() {
        return new Timeline(TimelineClock.system());
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    public ClusterAgent clusterAgent(
            AgentProperties properties,
            MembershipClient membershipClient,
            NodeStatusCollector nodeStatusCollector,
            PeerStatusClient peerStatusClient,
            Timeline timeline,
            ObjectProvider<Execer> execer,
            AgentMetrics agentMetrics,
            CycleTracer cycleTracer,
            Clock clock) {
        AgentSettings settings = properties.toSettings();
        return new ClusterAgent(settings, membershipClient, nodeStatusCollector, peerStatusClient, timeline,
                execer.getIfAvailable(AgentConfiguration::discardingExecer), agentMetrics, cycleTracer, clock);
    }

    @Bean
    public ClusterHealthIndicator clusterHealthIndicator(ClusterAgent clusterAgent) {
        return new ClusterHealthIndicator(clusterAgent);
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    @ConditionalOnProperty(prefix = "vigil.timeline", name = "enabled", havingValue = "true")
    public TimelineEvictor timelineEvictor(
            TimelineStore timelineStore, TimelineStorageProperties timelineProperties, Clock clock) {
        return new TimelineEvictor(timelineStore, timelineProperties.evictionInterval(), clock);
    }

    private static GossipSubstrate gossipSubstrate(AgentProperties properties) throws Exception {
        AgentProperties.Gossip gossip = properties.gossip();
        return switch (gossip.mode()) {
            case JGROUPS -> {
                JChannel channel = gossip.config() != null
                        ? new JChannel(gossip.config()).name(properties.name())
                        : JGroupsStacks.tcp(properties.name(), bindAddress(gossip), gossip.bindPort());
                JGroupsGossipSubstrate substrate = new JGroupsGossipSubstrate(channel, gossip.clusterName());
                substrate.connect();
                yield substrate;
            }
            case STANDALONE -> {
                log.info("Running standalone, no gossip cluster is joined");
                yield new StandaloneGossipSubstrate(properties.name(), "127.0.0.1", properties.announcedTags());
            }
        };
    }

    private static InetAddress bindAddress(AgentProperties.Gossip gossip) throws UnknownHostException {
        return gossip.bindAddress() == null ? null : InetAddress.getByName(gossip.bindAddress());
    }

    private static Execer discardingExecer() {
        log.info("Timeline storage disabled, timeline events are not stored");
        return (timeout, statement, args) -> log.debug("Discarding timeline statement {}", statement);
    }
}
