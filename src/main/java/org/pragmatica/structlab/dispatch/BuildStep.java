package org.pragmatica.structlab.dispatch;

import org.pragmatica.structlab.snapshot.TraceStep;

import java.util.List;
import java.util.Optional;

/**
 * What one pull on a build returns: the frame played, whether the build finished, and the
 * queued commands replayed on completion, each with its own result.
 */
public record BuildStep(Optional<TraceStep> step, boolean finished, List<ScriptReport.Entry> replayed) {
    public BuildStep {
        replayed = List.copyOf(replayed);
    }
}
