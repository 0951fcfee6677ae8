package com.vigil.observability;

import com.vigil.status.StatusType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer meters of the status pipeline.
 * <p>
 * Every meter carries a {@value #TAG_NODE} tag with the local node name so that metrics scraped
 * from all agents of a cluster can be told apart.
 */
public final class AgentMetrics {

    /** Tag key for the local node name. */
    public static final String TAG_NODE = "node";

    /** Tag key for a cycle outcome ({@code success} or {@code failure}). */
    public static final String TAG_OUTCOME = "outcome";

    /** Tag key for a probe name. */
    public static final String TAG_PROBE = "probe";

    /** Tag key for a peer name. */
    public static final String TAG_PEER = "peer";

    public static final String CYCLES = "vigil.collection.cycles";
    public static final String CYCLE_DURATION = "vigil.collection.duration";
    public static final String PROBE_FAILURES = "vigil.probe.failures";
    public static final String PEER_FAILURES = "vigil.peer.query.failures";
    public static final String TIMELINE_WRITE_FAILURES = "vigil.timeline.write.failures";
    public static final String CLUSTER_STATUS = "vigil.cluster.status";

    private final MeterRegistry registry;
    private final String nodeName;
    private final Timer cycleDuration;
    private final Counter timelineWriteFailures;
    private final AtomicLong clusterStatus;

    /**
     * Creates the meters in the given registry.
     *
     * @param registry the Micrometer meter registry (e.g., PrometheusMeterRegistry)
     * @param nodeName local node name, included as a tag on every meter
     */
    public AgentMetrics(MeterRegistry registry, String nodeName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (nodeName == null || nodeName.isBlank()) {
            throw new IllegalArgumentException("nodeName must not be null or blank");
        }
        this.registry = registry;
        this.nodeName = nodeName;
        this.cycleDuration = Timer.builder(CYCLE_DURATION)
                .description("Duration of a full status collection cycle")
                .tags(baseTags())
                .register(registry);
        this.timelineWriteFailures = Counter.builder(TIMELINE_WRITE_FAILURES)
                .description("Timeline events that could not be stored")
                .tags(baseTags())
                .register(registry);
        this.clusterStatus = new AtomicLong(statusValue(StatusType.UNKNOWN));
        Gauge.builder(CLUSTER_STATUS, clusterStatus, AtomicLong::doubleValue)
                .description("Cluster status: 0 running, 1 degraded, 2 unknown")
                .tags(baseTags())
                .register(registry);
    }

    /**
     * Creates metrics backed by a private in-memory registry, for callers that do not export
     * metrics.
     */
    public static AgentMetrics inMemory(String nodeName) {
        return new AgentMetrics(new SimpleMeterRegistry(), nodeName);
    }

    /**
     * Records a finished collection cycle.
     *
     * @param duration how long the cycle took
     * @param success  false if the cycle aborted (membership unavailable)
     */
    public void cycleCompleted(Duration duration, boolean success) {
        cycleDuration.record(duration);
        Counter.builder(CYCLES)
                .description("Status collection cycles")
                .tags(baseTags().and(TAG_OUTCOME, success ? "success" : "failure"))
                .register(registry)
                .increment();
    }

    /** Records a failed probe. */
    public void probeFailed(String probe) {
        Counter.builder(PROBE_FAILURES)
                .description("Failed or timed out probes on the local node")
                .tags(baseTags().and(TAG_PROBE, probe))
                .register(registry)
                .increment();
    }

    /** Records a peer whose status could not be obtained. */
    public void peerQueryFailed(String peer) {
        Counter.builder(PEER_FAILURES)
                .description("Remote status queries that failed or timed out")
                .tags(baseTags().and(TAG_PEER, peer))
                .register(registry)
                .increment();
    }

    /** Records a timeline event that could not be stored. */
    public void timelineWriteFailed() {
        timelineWriteFailures.increment();
    }

    /** Publishes the latest cluster status on the gauge. */
    public void clusterStatus(StatusType status) {
        clusterStatus.set(statusValue(status));
    }

    /**
     * Returns the underlying meter registry.
     */
    public MeterRegistry registry() {
        return registry;
    }

    /**
     * Returns the node name used as a default tag.
     */
    public String nodeName() {
        return nodeName;
    }

    private static long statusValue(StatusType status) {
        return switch (status) {
            case RUNNING -> 0;
            case DEGRADED -> 1;
            case UNKNOWN -> 2;
        };
    }

    private Tags baseTags() {
        return Tags.of(TAG_NODE, nodeName);
    }
}
