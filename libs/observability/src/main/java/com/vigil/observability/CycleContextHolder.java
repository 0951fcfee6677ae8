package com.vigil.observability;

import org.slf4j.MDC;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Thread-local holder for {@link CycleContext} with SLF4J MDC bridge.
 * <p>
 * When a context is set, the MDC keys {@value CycleContext#MDC_CYCLE_ID} and
 * {@value CycleContext#MDC_NODE} are populated; when cleared they are removed. Collection work
 * runs on pool threads, so the context must be handed over explicitly with
 * {@link #callWithContext(CycleContext, Supplier)}.
 */
public final class CycleContextHolder {

    private static final ThreadLocal<CycleContext> CONTEXT = new ThreadLocal<>();

    private CycleContextHolder() {
        // Utility class
    }

    /**
     * Sets the context for the current thread and populates MDC.
     *
     * @param context the context to set (must not be null)
     */
    public static void set(CycleContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        setMdc(CycleContext.MDC_CYCLE_ID, context.cycleId());
        setMdc(CycleContext.MDC_NODE, context.nodeName());
    }

    /**
     * Returns the current thread's context, if set.
     */
    public static Optional<CycleContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /**
     * Clears the context and its MDC keys for the current thread.
     */
    public static void clear() {
        CONTEXT.remove();
        MDC.remove(CycleContext.MDC_CYCLE_ID);
        MDC.remove(CycleContext.MDC_NODE);
    }

    /**
     * Runs {@code work} with the given context installed, then restores the previous context
     * (or clears it if there was none). A null context runs the work unchanged.
     *
     * @param context  the context for the duration of the work (nullable)
     * @param work     the work to execute
     * @param <T>      result type
     * @return the result of the work
     */
    public static <T> T callWithContext(CycleContext context, Supplier<T> work) {
        if (context == null) {
            return work.get();
        }
        CycleContext previous = CONTEXT.get();
        try {
            set(context);
            return work.get();
        } finally {
            if (previous != null) {
                set(previous);
            } else {
                clear();
            }
        }
    }

    /**
     * Void variant of {@link #callWithContext(CycleContext, Supplier)}.
     */
    public static void runWithContext(CycleContext context, Runnable work) {
        callWithContext(context, () -> {
            work.run();
            return null;
        });
    }

    private static void setMdc(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }
}
