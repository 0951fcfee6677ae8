package com.vigil.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Thin wrapper around an OpenTelemetry {@link Tracer} that runs pipeline stages in spans and
 * attaches the current {@link CycleContext} to each of them.
 * <p>
 * The SDK (exporter, sampler) is configured by the hosting application; without one, the global
 * tracer is a no-op.
 */
public final class CycleTracer {

    /** Span attribute carrying the cycle ID. */
    public static final String ATTR_CYCLE_ID = "vigil.cycle.id";

    /** Span attribute carrying the local node name. */
    public static final String ATTR_NODE = "vigil.node";

    private final Tracer tracer;

    /**
     * Creates a tracer wrapper.
     *
     * @param tracer the OpenTelemetry tracer (typically obtained from {@code GlobalOpenTelemetry})
     */
    public CycleTracer(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    /**
     * Runs {@code work} in a new internal span.
     *
     * @param spanName   name for the span
     * @param attributes additional span attributes
     * @param work       the work to execute within the span
     * @param <T>        return type
     * @return the result of the work
     */
    public <T> T inSpan(String spanName, Map<String, String> attributes, Supplier<T> work) {
        var spanBuilder = tracer.spanBuilder(spanName).setSpanKind(SpanKind.INTERNAL);
        attributes.forEach(spanBuilder::setAttribute);
        Span span = spanBuilder.startSpan();

        CycleContextHolder.get().ifPresent(ctx -> {
            span.setAttribute(ATTR_CYCLE_ID, ctx.cycleId());
            if (ctx.nodeName() != null) {
                span.setAttribute(ATTR_NODE, ctx.nodeName());
            }
        });

        try (Scope ignored = span.makeCurrent()) {
            T result = work.get();
            span.setStatus(StatusCode.OK);
            return result;
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Runs {@code work} in a new internal span without extra attributes.
     */
    public <T> T inSpan(String spanName, Supplier<T> work) {
        return inSpan(spanName, Map.of(), work);
    }

    /**
     * Returns the underlying OTel tracer.
     */
    public Tracer tracer() {
        return tracer;
    }
}
