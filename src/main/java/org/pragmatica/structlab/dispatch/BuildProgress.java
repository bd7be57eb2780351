package org.pragmatica.structlab.dispatch;

import org.pragmatica.structlab.command.Command;
import org.pragmatica.structlab.snapshot.StepTrace;
import org.pragmatica.structlab.snapshot.TraceStep;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A build being played back: the captured trace, the cursor into it, and the commands that
 * arrived for the family in the meantime.
 */
public final class BuildProgress {
    private final StepTrace trace;
    private final List<Pending> queued = new ArrayList<>();
    private int cursor;

    BuildProgress(StepTrace trace) {
        this.trace = trace;
    }

    public StepTrace trace() {
        return trace;
    }

    /**
     * Next frame, or empty once the trace is exhausted.
     */
    Optional<TraceStep> next() {
        if (isExhausted()) {
            return Optional.empty();
        }
        return Optional.of(trace.step(cursor++));
    }

    public boolean isExhausted() {
        return cursor >= trace.length();
    }

    public int remaining() {
        return trace.length() - cursor;
    }

    void enqueue(String source, Command command) {
        queued.add(new Pending(source, command));
    }

    public List<Command> queued() {
        return queued.stream()
                     .map(Pending::command)
                     .toList();
    }

    List<Pending> pending() {
        return List.copyOf(queued);
    }

    /**
     * A queued command with the text it was read from.
     */
    record Pending(String source, Command command) {}
}
