package com.vigil.eventmodel;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates {@link TimelineEvent}s before they are stored.
 * <p>
 * Every event needs a timestamp; node events need a node name; probe events need a node and a
 * probe name; status-carrying events need their status. All errors are reported at once.
 */
public final class EventValidator {

    private EventValidator() {
        // utility class
    }

    /**
     * Validates the fields required by the kind of the event.
     *
     * @param event the event to validate
     * @return a {@link ValidationResult} with any errors found
     */
    public static ValidationResult validate(TimelineEvent event) {
        if (event == null) {
            return ValidationResult.fail(List.of("event must not be null"));
        }
        List<String> errors = new ArrayList<>();
        if (event.timestamp() == null) {
            errors.add("timestamp must not be null");
        }
        event.accept(new FieldCheck(errors));
        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
    }

    private static final class FieldCheck implements TimelineEvent.Visitor<Void> {

        private final List<String> errors;

        FieldCheck(List<String> errors) {
            this.errors = errors;
        }

        @Override
        public Void visitClusterDegraded(TimelineEvent.ClusterDegraded event) {
            if (event.status() == null) {
                errors.add("status must not be null");
            } else if (event.status().isRunning()) {
                errors.add("status must not be RUNNING");
            }
            return null;
        }

        @Override
        public Void visitClusterRecovered(TimelineEvent.ClusterRecovered event) {
            return null;
        }

        @Override
        public Void visitNodeAdded(TimelineEvent.NodeAdded event) {
            requireNode(event.node());
            return null;
        }

        @Override
        public Void visitNodeRemoved(TimelineEvent.NodeRemoved event) {
            requireNode(event.node());
            return null;
        }

        @Override
        public Void visitNodeDegraded(TimelineEvent.NodeDegraded event) {
            requireNode(event.node());
            if (event.status() == null) {
                errors.add("status must not be null");
            }
            return null;
        }

        @Override
        public Void visitNodeRecovered(TimelineEvent.NodeRecovered event) {
            requireNode(event.node());
            return null;
        }

        @Override
        public Void visitProbeFailed(TimelineEvent.ProbeFailed event) {
            requireNode(event.node());
            requireProbe(event.probe());
            return null;
        }

        @Override
        public Void visitProbeSucceeded(TimelineEvent.ProbeSucceeded event) {
            requireNode(event.node());
            requireProbe(event.probe());
            return null;
        }

        @Override
        public Void visitLeaderElected(TimelineEvent.LeaderElected event) {
            requireNode(event.node());
            return null;
        }

        private void requireNode(String node) {
            if (isBlank(node)) {
                errors.add("node must not be null or blank");
            }
        }

        private void requireProbe(String probe) {
            if (isBlank(probe)) {
                errors.add("probe must not be null or blank");
            }
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
