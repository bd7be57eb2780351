package org.pragmatica.structlab.snapshot;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable, ordered frames captured by one logical operation.
 */
public record StepTrace(String operation, List<TraceStep> steps) {
    public StepTrace {
        steps = List.copyOf(steps);
    }

    public int length() {
        return steps.size();
    }

    public TraceStep step(int index) {
        return steps.get(index);
    }

    public TraceStep lastStep() {
        return steps.get(steps.size() - 1);
    }

    /**
     * Accumulates frames, numbering them in insertion order.
     */
    public static Recorder recorder(String operation) {
        return new Recorder(operation);
    }

    public static final class Recorder {
        private final String operation;
        private final List<TraceStep> steps = new ArrayList<>();

        private Recorder(String operation) {
            this.operation = operation;
        }

        public Recorder record(String action, String description, Snapshot snapshot, List<Integer> highlightedIds) {
            return record(action, description, snapshot, highlightedIds, null);
        }

        public Recorder record(String action,
                               String description,
                               Snapshot snapshot,
                               List<Integer> highlightedIds,
                               StepDetail detail) {
            steps.add(new TraceStep(steps.size(), action, description, snapshot, highlightedIds, detail));
            return this;
        }

        /**
         * Append a frame captured elsewhere, renumbering it.
         */
        public Recorder append(TraceStep step) {
            return record(step.action(), step.description(), step.snapshot(), step.highlightedIds(), step.detail());
        }

        public StepTrace build() {
            return new StepTrace(operation, steps);
        }
    }
}
