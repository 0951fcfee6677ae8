package com.vigil.database;

import com.vigil.eventmodel.EventType;

import java.util.Map;
import java.util.Set;

/**
 * Filter over stored timeline events. Every non-null field must match (AND logic).
 *
 * @param type  event kind, or null for any
 * @param node  node name, or null for any
 * @param probe probe name, or null for any
 * @param limit maximum number of events returned, the most recent ones
 */
public record EventQuery(EventType type, String node, String probe, int limit) {

    /** Filter key for the event type. */
    public static final String TYPE = "type";

    /** Filter key for the node name. */
    public static final String NODE = "node";

    /** Filter key for the probe name. */
    public static final String PROBE = "probe";

    /** Default and maximum number of events returned. */
    public static final int MAX_LIMIT = 1000;

    private static final Set<String> KEYS = Set.of(TYPE, NODE, PROBE);

    public EventQuery {
        if (limit <= 0 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
        }
        node = blankToNull(node);
        probe = blankToNull(probe);
    }

    /** A query matching every event. */
    public static EventQuery all() {
        return new EventQuery(null, null, null, MAX_LIMIT);
    }

    /**
     * Builds a query from string filters.
     *
     * @param filters filter values by key ({@value #TYPE}, {@value #NODE}, {@value #PROBE})
     * @throws IllegalArgumentException on an unknown key or an unknown event type
     */
    public static EventQuery fromFilters(Map<String, String> filters) {
        for (String key : filters.keySet()) {
            if (!KEYS.contains(key)) {
                throw new IllegalArgumentException("unknown filter: " + key);
            }
        }
        EventType type = null;
        String typeValue = blankToNull(filters.get(TYPE));
        if (typeValue != null) {
            type = EventType.fromString(typeValue)
                    .orElseThrow(() -> new IllegalArgumentException("unknown event type: " + typeValue));
        }
        return new EventQuery(type, filters.get(NODE), filters.get(PROBE), MAX_LIMIT);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
