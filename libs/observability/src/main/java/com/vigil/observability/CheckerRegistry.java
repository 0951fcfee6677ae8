package com.vigil.observability;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The set of checkers run on the local node.
 * <p>
 * The registry is an explicit object created at agent start and handed to the
 * {@link NodeStatusCollector}; there is no global registration. Checkers are kept in
 * registration order.
 */
public final class CheckerRegistry {

    private final Map<String, Checker> checkers = new LinkedHashMap<>();

    /**
     * Registers a checker under its own name. Replaces any existing checker with the same name.
     *
     * @param checker the checker to register
     * @return this registry
     */
    public synchronized CheckerRegistry register(Checker checker) {
        if (checker == null) {
            throw new IllegalArgumentException("checker must not be null");
        }
        String name = checker.name();
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("checker name must not be null or blank");
        }
        checkers.put(name, checker);
        return this;
    }

    /**
     * Removes a checker by name.
     *
     * @param name checker name to deregister
     * @return true if a checker was removed
     */
    public synchronized boolean deregister(String name) {
        return checkers.remove(name) != null;
    }

    /**
     * Returns a snapshot of the registered checkers in registration order.
     */
    public synchronized List<Checker> checkers() {
        return List.copyOf(checkers.values());
    }

    /**
     * Returns the number of registered checkers.
     */
    public synchronized int size() {
        return checkers.size();
    }
}
