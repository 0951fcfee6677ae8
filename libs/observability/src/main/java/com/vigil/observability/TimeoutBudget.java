package com.vigil.observability;

import java.time.Duration;

/**
 * Nested deadlines of one collection cycle, outer to inner.
 * <p>
 * Each stage's deadline is strictly shorter than the one of the stage awaiting it, so a slow
 * inner task can never use up the budget of its caller:
 * {@code statusPeriod > replyTimeout > localTimeout > probeTimeout}.
 *
 * @param statusPeriod interval between collection cycles
 * @param replyTimeout time to wait for status replies from remote nodes
 * @param localTimeout time allowed to collect the local node status
 * @param probeTimeout time allowed to a single checker
 */
public record TimeoutBudget(
        Duration statusPeriod,
        Duration replyTimeout,
        Duration localTimeout,
        Duration probeTimeout
) {

    /** Default collection period. */
    public static final Duration DEFAULT_STATUS_PERIOD = Duration.ofSeconds(30);

    public TimeoutBudget {
        requirePositive("statusPeriod", statusPeriod);
        requirePositive("replyTimeout", replyTimeout);
        requirePositive("localTimeout", localTimeout);
        requirePositive("probeTimeout", probeTimeout);
        requireShorter("replyTimeout", replyTimeout, "statusPeriod", statusPeriod);
        requireShorter("localTimeout", localTimeout, "replyTimeout", replyTimeout);
        requireShorter("probeTimeout", probeTimeout, "localTimeout", localTimeout);
    }

    /**
     * Derives the whole budget from the collection period: reply = 2/3 of the period,
     * local = 3/4 of reply, probe = 2/3 of local. A 30s period gives 20s, 15s and 10s.
     *
     * @param statusPeriod the collection period
     * @return the derived budget
     */
    public static TimeoutBudget derive(Duration statusPeriod) {
        return resolve(statusPeriod, null, null, null);
    }

    /**
     * Builds a budget from explicit values where given. A missing stage is derived from the
     * resolved stage just outside it, with the ratios of {@link #derive(Duration)}, so an
     * overridden reply timeout also shrinks the derived local and probe timeouts.
     *
     * @param statusPeriod the collection period
     * @param replyTimeout explicit reply timeout, or null to derive it
     * @param localTimeout explicit local timeout, or null to derive it
     * @param probeTimeout explicit probe timeout, or null to derive it
     * @return the resolved budget
     * @throws IllegalArgumentException if the explicit values do not nest
     */
    public static TimeoutBudget resolve(
            Duration statusPeriod, Duration replyTimeout, Duration localTimeout, Duration probeTimeout) {
        requirePositive("statusPeriod", statusPeriod);
        Duration reply = replyTimeout != null ? replyTimeout : statusPeriod.multipliedBy(2).dividedBy(3);
        Duration local = localTimeout != null ? localTimeout : reply.multipliedBy(3).dividedBy(4);
        Duration probe = probeTimeout != null ? probeTimeout : local.multipliedBy(2).dividedBy(3);
        return new TimeoutBudget(statusPeriod, reply, local, probe);
    }

    /** Returns the default budget derived from {@link #DEFAULT_STATUS_PERIOD}. */
    public static TimeoutBudget defaults() {
        return derive(DEFAULT_STATUS_PERIOD);
    }

    private static void requirePositive(String name, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }

    private static void requireShorter(String inner, Duration innerValue, String outer, Duration outerValue) {
        if (innerValue.compareTo(outerValue) >= 0) {
            throw new IllegalArgumentException(
                    inner + " (" + innerValue + ") must be shorter than " + outer + " (" + outerValue + ")");
        }
    }
}
