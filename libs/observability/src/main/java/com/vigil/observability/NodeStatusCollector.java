package com.vigil.observability;

import com.vigil.membership.ClusterMember;
import com.vigil.status.NodeStatus;
import com.vigil.status.ProbeResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs the registered checkers of the local node and reduces them to a {@link NodeStatus}.
 * <p>
 * Checkers run concurrently, at most {@link #MAX_CONCURRENT_CHECKERS} at a time. Each checker
 * gets its own deadline, strictly shorter than the deadline of the whole collection. A checker
 * that misses it is recorded as a failed probe with detail {@value ProbeResult#TIMED_OUT} and
 * interrupted; a checker that throws is recorded as a failed probe. Neither affects the other
 * probes, and {@link #collect(ClusterMember, Duration)} always returns by its deadline.
 */
public final class NodeStatusCollector implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(NodeStatusCollector.class);

    /** Maximum number of checkers running at the same time. */
    public static final int MAX_CONCURRENT_CHECKERS = 10;

    private final CheckerRegistry registry;
    private final Duration probeTimeout;
    private final AgentMetrics metrics;
    private final ExecutorService executor;
    private final AtomicReference<NodeStatus> lastLocalStatus = new AtomicReference<>();

    /**
     * Creates a collector.
     *
     * @param registry     checkers to run
     * @param probeTimeout deadline of a single checker
     * @param metrics      meters to record failed probes in
     */
    public NodeStatusCollector(CheckerRegistry registry, Duration probeTimeout, AgentMetrics metrics) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (probeTimeout == null || probeTimeout.isZero() || probeTimeout.isNegative()) {
            throw new IllegalArgumentException("probeTimeout must be positive");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics must not be null");
        }
        this.registry = registry;
        this.probeTimeout = probeTimeout;
        this.metrics = metrics;
        this.executor = Executors.newCachedThreadPool(checkerThreads());
    }

    /**
     * Collects the status of the local node.
     *
     * @param local    membership snapshot of the local node, embedded in the result
     * @param deadline time allowed for the whole collection
     * @return the node status, degraded iff any probe failed or timed out
     */
    public NodeStatus collect(ClusterMember local, Duration deadline) {
        if (local == null) {
            throw new IllegalArgumentException("local must not be null");
        }
        if (deadline == null || deadline.isZero() || deadline.isNegative()) {
            throw new IllegalArgumentException("deadline must be positive");
        }
        String node = local.name();
        Duration checkerDeadline = checkerDeadline(deadline);
        long checkerDeadlineMs = Math.max(1, checkerDeadline.toMillis());
        CycleContext context = CycleContextHolder.get().orElse(null);
        Semaphore slots = new Semaphore(MAX_CONCURRENT_CHECKERS);

        Map<Checker, CompletableFuture<ProbeResult>> results = new LinkedHashMap<>();
        List<Future<?>> tasks = new ArrayList<>();
        for (Checker checker : registry.checkers()) {
            CompletableFuture<ProbeResult> result = new CompletableFuture<>();
            tasks.add(executor.submit(() -> CycleContextHolder.runWithContext(context,
                    () -> result.complete(runChecker(checker, node, checkerDeadline, slots)))));
            result.completeOnTimeout(ProbeResult.timedOut(node, checker.name()),
                    checkerDeadlineMs, TimeUnit.MILLISECONDS);
            results.put(checker, result);
        }

        List<ProbeResult> probes = new ArrayList<>();
        for (Map.Entry<Checker, CompletableFuture<ProbeResult>> entry : results.entrySet()) {
            ProbeResult probe = await(entry.getValue(), deadline, node, entry.getKey().name());
            if (!probe.succeeded()) {
                if (ProbeResult.TIMED_OUT.equals(probe.detail())) {
                    log.warn("Checker {} timed out after {}", probe.probe(), checkerDeadline);
                }
                metrics.probeFailed(probe.probe());
            }
            probes.add(probe);
        }
        tasks.stream().filter(task -> !task.isDone()).forEach(task -> task.cancel(true));

        NodeStatus status = NodeStatus.fromProbes(local, probes);
        lastLocalStatus.set(status);
        log.debug("Collected local status {} with {} probes", status.statusType(), probes.size());
        return status;
    }

    /**
     * Returns the most recently collected local status, or an empty status for {@code node}
     * if nothing was collected yet.
     */
    public NodeStatus lastLocalStatus(String node) {
        NodeStatus status = lastLocalStatus.get();
        return status != null ? status : NodeStatus.empty(node);
    }

    /**
     * Returns the configured per-checker timeout.
     */
    public Duration probeTimeout() {
        return probeTimeout;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    private Duration checkerDeadline(Duration deadline) {
        if (probeTimeout.compareTo(deadline) < 0) {
            return probeTimeout;
        }
        return deadline.multipliedBy(2).dividedBy(3);
    }

    private ProbeResult runChecker(Checker checker, String node, Duration budget, Semaphore slots) {
        try {
            slots.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ProbeResult.timedOut(node, checker.name());
        }
        try {
            log.debug("Running checker {}", checker.name());
            ProbeResult result = checker.run(node, budget);
            if (result == null) {
                return ProbeResult.failed(node, checker.name(), "checker returned no result");
            }
            return new ProbeResult(node, checker.name(), result.succeeded(), result.detail());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ProbeResult.timedOut(node, checker.name());
        } catch (Exception | LinkageError | AssertionError e) {
            log.warn("Checker {} failed", checker.name(), e);
            return ProbeResult.panicked(node, checker.name(), e);
        } finally {
            slots.release();
        }
    }

    private static ProbeResult await(CompletableFuture<ProbeResult> result, Duration deadline,
                                     String node, String checker) {
        try {
            return result.get(deadline.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ProbeResult.timedOut(node, checker);
        } catch (TimeoutException e) {
            return ProbeResult.timedOut(node, checker);
        } catch (ExecutionException e) {
            return ProbeResult.panicked(node, checker, e.getCause());
        }
    }

    private static ThreadFactory checkerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "vigil-checker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
