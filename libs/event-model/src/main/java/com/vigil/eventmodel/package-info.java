/**
 * The cluster event timeline.
 * <p>
 * {@link com.vigil.eventmodel.TimelineEvent} is the closed set of event kinds.
 * {@link com.vigil.eventmodel.StatusDiff} detects them between consecutive cluster statuses and
 * {@link com.vigil.eventmodel.Timeline} stores them through an {@link com.vigil.eventmodel.Execer}
 * using the statements built by {@link com.vigil.eventmodel.EventInserter}.
 */
package com.vigil.eventmodel;
