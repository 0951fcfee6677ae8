package com.vigil.agent.domain;

import com.vigil.eventmodel.Execer;
import com.vigil.eventmodel.Timeline;
import com.vigil.eventmodel.TimelineEvent;
import com.vigil.eventmodel.TimelineStorageException;
import com.vigil.membership.ClusterMember;
import com.vigil.membership.MemberNotFoundException;
import com.vigil.membership.MemberStatus;
import com.vigil.membership.MembershipClient;
import com.vigil.membership.MembershipException;
import com.vigil.observability.AgentMetrics;
import com.vigil.observability.CycleContext;
import com.vigil.observability.CycleContextHolder;
import com.vigil.observability.CycleTracer;
import com.vigil.observability.NodeStatusCollector;
import com.vigil.observability.TimeoutBudget;
import com.vigil.status.ClusterStatusAggregator;
import com.vigil.status.NodeStatus;
import com.vigil.status.StatusType;
import com.vigil.status.SystemStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The agent running on one node: drives periodic status collection and serves the cached result.
 * <p>
 * A collection cycle runs the local checkers and queries every other active member in parallel,
 * waits for the replies up to the reply timeout, aggregates everything into a
 * {@link SystemStatus}, publishes it and records the detected transitions on the timeline. A peer
 * that fails or does not reply in time contributes no status and is reported as missing. Only a
 * membership failure aborts a cycle; the previously published status then stays in place.
 * <p>
 * A cycle ends within its status period. Timeline events get whatever is left of the period; a
 * write still running then finishes in the background, and the next cycle records no events until
 * it has.
 * <p>
 * Cycles never overlap. Readers get the last published status without waiting for a cycle in
 * flight.
 */
public final class ClusterAgent implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ClusterAgent.class);

    /** Interval between two membership readiness checks during start. */
    static final Duration READINESS_POLL = Duration.ofMillis(200);

    private static final NodeStatus NO_REPLY = NodeStatus.empty("no-reply");

    private final AgentSettings settings;
    private final MembershipClient membership;
    private final NodeStatusCollector collector;
    private final PeerStatusClient peers;
    private final Timeline timeline;
    private final Execer execer;
    private final AgentMetrics metrics;
    private final CycleTracer tracer;
    private final Clock clock;
    private final ClusterStatusAggregator aggregator = new ClusterStatusAggregator();

    private final AtomicReference<AgentState> state = new AtomicReference<>(AgentState.INITIALIZING);
    private final AtomicReference<SystemStatus> current = new AtomicReference<>();
    private final Deque<SystemStatus> history = new ArrayDeque<>();
    private final Map<String, Instant> lastSeen = new ConcurrentHashMap<>();
    private final AtomicBoolean started = new AtomicBoolean();
    private final ReentrantLock cycleLock = new ReentrantLock();
    private final ExecutorService peerExecutor;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService timelineWriter;
    private final AtomicReference<Future<?>> pendingWrite = new AtomicReference<>();

    public ClusterAgent(
            AgentSettings settings,
            MembershipClient membership,
            NodeStatusCollector collector,
            PeerStatusClient peers,
            Timeline timeline,
            Execer execer,
            AgentMetrics metrics,
            CycleTracer tracer,
            Clock clock) {
        this.settings = require(settings, "settings");
        this.membership = require(membership, "membership");
        this.collector = require(collector, "collector");
        this.peers = require(peers, "peers");
        this.timeline = require(timeline, "timeline");
        this.execer = require(execer, "execer");
        this.metrics = require(metrics, "metrics");
        this.tracer = require(tracer, "tracer");
        this.clock = require(clock, "clock");
        this.peerExecutor = Executors.newCachedThreadPool(daemonThreads("vigil-peer-"));
        this.scheduler = Executors.newSingleThreadScheduledExecutor(daemonThreads("vigil-agent-loop-"));
        this.timelineWriter = Executors.newSingleThreadExecutor(daemonThreads("vigil-timeline-"));
    }

    /**
     * Waits for the membership client to become ready, announces the local tags, joins the
     * configured peers and schedules the collection loop.
     *
     * @throws AgentInitializationException if membership is not ready within the init timeout
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("agent already started");
        }
        awaitMembership();
        long period = settings.budget().statusPeriod().toMillis();
        scheduler.scheduleAtFixedRate(this::runScheduledCycle, 0, period, TimeUnit.MILLISECONDS);
        log.info("Agent {} started, collecting every {}", settings.nodeName(), settings.budget().statusPeriod());
    }

    /**
     * Runs one full collection cycle and publishes its result.
     *
     * @return the aggregated cluster status
     * @throws MembershipException if the member list cannot be obtained
     * @throws IllegalStateException if the agent is stopped
     */
    public SystemStatus collectOnce() {
        if (state.get() == AgentState.STOPPED) {
            throw new IllegalStateException("agent is stopped");
        }
        cycleLock.lock();
        try {
            CycleContext context = CycleContext.newCycle(settings.nodeName());
            return CycleContextHolder.callWithContext(context,
                    () -> tracer.inSpan("vigil.collection.cycle", () -> runCycle(context)));
        } finally {
            cycleLock.unlock();
        }
    }

    /**
     * Returns the last published cluster status.
     *
     * @throws AgentNotReadyException if no cycle has completed yet
     */
    public SystemStatus currentStatus() {
        SystemStatus status = current.get();
        if (status == null) {
            throw new AgentNotReadyException(
                    "agent " + settings.nodeName() + " has not completed a status collection yet");
        }
        return status;
    }

    /** Returns the last collected status of the local node, as served to peers. */
    public NodeStatus localStatus() {
        return collector.lastLocalStatus(settings.nodeName());
    }

    /** Returns the recently published cluster statuses, oldest first. */
    public List<SystemStatus> statusHistory() {
        synchronized (history) {
            return List.copyOf(history);
        }
    }

    /**
     * Joins the given gossip endpoints.
     *
     * @return the number of peers joined
     */
    public int join(Collection<String> peerEndpoints) {
        return membership.join(peerEndpoints, false);
    }

    /** Returns the active cluster members. */
    public List<ClusterMember> members() {
        return membership.members();
    }

    /**
     * Looks up an active member.
     *
     * @throws MemberNotFoundException if there is no such active member
     */
    public ClusterMember member(String name) {
        return membership.findMember(name);
    }

    /** Returns true if the local node is part of a cluster with at least one other member. */
    public boolean isMember() {
        return membership.isMember(settings.nodeName());
    }

    /**
     * Stores an event reported by a peer and takes the event time as when that peer was last
     * seen. Storing an event that is already stored has no effect.
     *
     * @param name  the reporting member
     * @param event the reported event
     * @throws IllegalArgumentException if the name is blank or the event is invalid
     * @throws TimelineStorageException if the event cannot be stored within the reply timeout
     */
    public void recordEvent(String name, TimelineEvent event) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        timeline.record(event, execer, settings.budget().replyTimeout());
        lastSeen.merge(name, event.timestamp(), (seen, reported) -> reported.isAfter(seen) ? reported : seen);
        log.debug("Recorded {} event reported by {}", event.type().value(), name);
    }

    /** Returns when a status or event was last received from the given member. */
    public Optional<Instant> lastSeen(String name) {
        return Optional.ofNullable(lastSeen.get(name));
    }

    /** Returns the current lifecycle state. */
    public AgentState state() {
        return state.get();
    }

    /** Returns the agent settings. */
    public AgentSettings settings() {
        return settings;
    }

    @Override
    public void close() {
        if (state.getAndSet(AgentState.STOPPED) == AgentState.STOPPED) {
            return;
        }
        scheduler.shutdownNow();
        peerExecutor.shutdownNow();
        timelineWriter.shutdown();
        log.info("Agent {} stopped", settings.nodeName());
    }

    private void awaitMembership() {
        Duration initTimeout = settings.initTimeout();
        long deadline = System.nanoTime() + initTimeout.toNanos();
        RuntimeException lastFailure = null;
        while (true) {
            try {
                membership.updateTags(settings.tags(), List.of());
                if (!settings.peers().isEmpty()) {
                    join(settings.peers());
                }
                membership.findMember(settings.nodeName());
                return;
            } catch (MembershipException | MemberNotFoundException e) {
                lastFailure = e;
                log.debug("Membership not ready yet: {}", e.getMessage());
            }
            if (System.nanoTime() >= deadline) {
                state.set(AgentState.STOPPED);
                throw new AgentInitializationException(
                        "membership not ready within " + initTimeout, lastFailure);
            }
            try {
                Thread.sleep(READINESS_POLL.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                state.set(AgentState.STOPPED);
                throw new AgentInitializationException("interrupted while waiting for membership", e);
            }
        }
    }

    private void runScheduledCycle() {
        try {
            collectOnce();
        } catch (RuntimeException e) {
            log.error("Status collection cycle failed", e);
        }
    }

    private SystemStatus runCycle(CycleContext context) {
        long cycleStart = System.nanoTime();
        state.compareAndSet(AgentState.INITIALIZING, AgentState.COLLECTING);
        state.compareAndSet(AgentState.IDLE, AgentState.COLLECTING);
        try {
            List<ClusterMember> members;
            try {
                members = membership.members();
            } catch (MembershipException e) {
                metrics.cycleCompleted(elapsedSince(cycleStart), false);
                log.error("Cannot list cluster members, keeping the previous status");
                throw e;
            }
            ClusterMember local = localMember(members);
            Map<String, CompletableFuture<NodeStatus>> replies = queryPeers(members, context);
            NodeStatus localStatus = collector.collect(local, settings.budget().localTimeout());
            lastSeen.put(local.name(), clock.instant());
            List<NodeStatus> remoteStatuses = awaitReplies(replies);

            SystemStatus status = aggregator.aggregate(localStatus, remoteStatuses, members, clock.instant());
            publish(status);
            recordTimeline(status, context, cycleStart);
            metrics.cycleCompleted(elapsedSince(cycleStart), true);
            return status;
        } finally {
            state.compareAndSet(AgentState.COLLECTING, AgentState.IDLE);
        }
    }

    private ClusterMember localMember(List<ClusterMember> members) {
        for (ClusterMember member : members) {
            if (member.name().equals(settings.nodeName())) {
                return member;
            }
        }
        log.warn("Local node {} is not an active member", settings.nodeName());
        return new ClusterMember(settings.nodeName(), "", 0, settings.tags(), MemberStatus.NONE);
    }

    private Map<String, CompletableFuture<NodeStatus>> queryPeers(List<ClusterMember> members, CycleContext context) {
        TimeoutBudget budget = settings.budget();
        Map<String, CompletableFuture<NodeStatus>> replies = new LinkedHashMap<>();
        for (ClusterMember member : members) {
            if (member.name().equals(settings.nodeName()) || replies.containsKey(member.name())) {
                continue;
            }
            CompletableFuture<NodeStatus> reply = CompletableFuture
                    .supplyAsync(() -> CycleContextHolder.callWithContext(context, () -> queryPeer(member)),
                            peerExecutor)
                    .completeOnTimeout(NO_REPLY, budget.replyTimeout().toMillis(), TimeUnit.MILLISECONDS);
            replies.put(member.name(), reply);
        }
        return replies;
    }

    private NodeStatus queryPeer(ClusterMember member) {
        try {
            NodeStatus status = peers.localStatus(member);
            if (status == null || !status.name().equals(member.name())) {
                log.warn("Peer {} answered with a status for another node", member.name());
                metrics.peerQueryFailed(member.name());
                return null;
            }
            log.debug("Peer {} reported {}", member.name(), status.statusType());
            return status;
        } catch (RuntimeException e) {
            log.warn("No status from peer {}: {}", member.name(), e.getMessage());
            metrics.peerQueryFailed(member.name());
            return null;
        }
    }

    private List<NodeStatus> awaitReplies(Map<String, CompletableFuture<NodeStatus>> replies) {
        List<NodeStatus> statuses = new ArrayList<>();
        for (Map.Entry<String, CompletableFuture<NodeStatus>> entry : replies.entrySet()) {
            NodeStatus status;
            try {
                status = entry.getValue().join();
            } catch (CompletionException e) {
                log.warn("Query of peer {} failed", entry.getKey(), e.getCause());
                continue;
            }
            if (status == NO_REPLY) {
                log.warn("Peer {} did not reply within {}", entry.getKey(), settings.budget().replyTimeout());
                metrics.peerQueryFailed(entry.getKey());
            } else if (status != null) {
                statuses.add(status);
                lastSeen.put(entry.getKey(), clock.instant());
            }
        }
        return statuses;
    }

    private void publish(SystemStatus status) {
        SystemStatus previous = current.getAndSet(status);
        synchronized (history) {
            history.addLast(status);
            while (history.size() > settings.historySize()) {
                history.removeFirst();
            }
        }
        metrics.clusterStatus(status.statusType());
        StatusType before = previous == null ? null : previous.statusType();
        if (before != status.statusType()) {
            log.info("Cluster status is now {} {}", status.statusType(), status.summary());
        } else {
            log.debug("Cluster status remains {} {}", status.statusType(), status.summary());
        }
    }

    private void recordTimeline(SystemStatus status, CycleContext context, long cycleStart) {
        Duration remaining = settings.budget().statusPeriod().minus(elapsedSince(cycleStart));
        if (remaining.isNegative() || remaining.isZero()) {
            metrics.timelineWriteFailed();
            log.warn("Status period elapsed before timeline events could be stored");
            return;
        }
        Future<?> previous = pendingWrite.get();
        if (previous != null && !previous.isDone()) {
            metrics.timelineWriteFailed();
            log.warn("Previous timeline write still running, not recording events for this cycle");
            return;
        }
        Future<?> write = timelineWriter.submit(() -> CycleContextHolder.runWithContext(context,
                () -> timeline.recordStatus(status, execer, remaining)));
        pendingWrite.set(write);
        try {
            write.get(remaining.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            metrics.timelineWriteFailed();
            log.warn("Timeline events not stored within {}, leaving the write in the background", remaining);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof TimelineStorageException storageFailure) {
                metrics.timelineWriteFailed();
                log.warn("Failed to store timeline events", storageFailure);
            } else if (e.getCause() instanceof RuntimeException failure) {
                throw failure;
            } else {
                throw new IllegalStateException("timeline write failed", e.getCause());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while storing timeline events");
        }
    }

    private static Duration elapsedSince(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static <T> T require(T value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " must not be null");
        }
        return value;
    }
}
