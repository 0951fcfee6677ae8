/**
 * Local status collection and its instrumentation.
 * <p>
 * {@link com.vigil.observability.NodeStatusCollector} runs the checkers held by a
 * {@link com.vigil.observability.CheckerRegistry} under the deadlines of a
 * {@link com.vigil.observability.TimeoutBudget}. Cycle identifiers flow into logs through
 * {@link com.vigil.observability.CycleContextHolder}, into traces through
 * {@link com.vigil.observability.CycleTracer} and into meters through
 * {@link com.vigil.observability.AgentMetrics}.
 */
package com.vigil.observability;
