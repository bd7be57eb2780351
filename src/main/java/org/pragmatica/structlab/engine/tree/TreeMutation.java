package org.pragmatica.structlab.engine.tree;

import org.pragmatica.structlab.snapshot.StepTrace;

import java.util.Optional;

/**
 * Outcome of an ordered insert or delete. A duplicate insert or an absent delete is unchanged;
 * the AVL engine attaches its step trace.
 */
public record TreeMutation(boolean changed, Optional<StepTrace> trace) {
    public static TreeMutation of(boolean changed) {
        return new TreeMutation(changed, Optional.empty());
    }

    public static TreeMutation traced(boolean changed, StepTrace trace) {
        return new TreeMutation(changed, Optional.of(trace));
    }
}
