package org.pragmatica.structlab.dispatch;

import org.pragmatica.structlab.command.Family;
import org.pragmatica.structlab.engine.linear.LinearStructure;
import org.pragmatica.structlab.engine.tree.TreeStructure;
import org.pragmatica.structlab.snapshot.StepTrace;

import java.util.Optional;

/**
 * The two structure slots, one per family. Each holds at most one live structure.
 */
public final class StructureContext {
    public enum SlotState {
        UNINITIALIZED,
        READY,
        BUILDING
    }

    /**
     * Single-owner slot: {@code UNINITIALIZED -> READY | BUILDING -> READY -> UNINITIALIZED}.
     */
    public static final class Slot<S> {
        private final Family family;
        private S structure;
        private BuildProgress build;

        private Slot(Family family) {
            this.family = family;
        }

        public Family family() {
            return family;
        }

        public SlotState state() {
            if (structure == null) {
                return SlotState.UNINITIALIZED;
            }
            return build == null
                   ? SlotState.READY
                   : SlotState.BUILDING;
        }

        public Optional<S> structure() {
            return Optional.ofNullable(structure);
        }

        public Optional<BuildProgress> build() {
            return Optional.ofNullable(build);
        }

        /**
         * Replace the content with a ready structure, cancelling any build.
         *
         * @return the cancelled build, if one was in progress
         */
        Optional<BuildProgress> install(S replacement) {
            var cancelled = build();
            structure = replacement;
            build = null;
            return cancelled;
        }

        Optional<BuildProgress> startBuild(S replacement, StepTrace trace) {
            var cancelled = build();
            structure = replacement;
            build = new BuildProgress(trace);
            return cancelled;
        }

        void finishBuild() {
            build = null;
        }

        Optional<BuildProgress> reset() {
            var cancelled = build();
            structure = null;
            build = null;
            return cancelled;
        }
    }

    private final Slot<LinearStructure> linear = new Slot<>(Family.LINEAR);
    private final Slot<TreeStructure> tree = new Slot<>(Family.TREE);

    public Slot<LinearStructure> linear() {
        return linear;
    }

    public Slot<TreeStructure> tree() {
        return tree;
    }
}
