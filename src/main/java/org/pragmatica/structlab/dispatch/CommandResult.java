package org.pragmatica.structlab.dispatch;

import org.pragmatica.structlab.command.Family;
import org.pragmatica.structlab.error.CommandError;
import org.pragmatica.structlab.snapshot.Snapshot;
import org.pragmatica.structlab.snapshot.StepTrace;

import java.util.Optional;

/**
 * What the dispatcher reports for one command.
 *
 * @param target family whose structure the command addressed; empty for global and unclassified commands
 */
public record CommandResult(
    Outcome outcome,
    String message,
    Optional<Family> target,
    Optional<Snapshot> snapshot,
    Optional<StepTrace> trace,
    Optional<CommandError> cause
) {
    public enum Outcome {
        SUCCESS,
        ERROR
    }

    public static CommandResult success(Family target, String message) {
        return new CommandResult(Outcome.SUCCESS,
                                 message,
                                 Optional.ofNullable(target),
                                 Optional.empty(),
                                 Optional.empty(),
                                 Optional.empty());
    }

    public static CommandResult success(Family target, String message, Snapshot snapshot) {
        return new CommandResult(Outcome.SUCCESS,
                                 message,
                                 Optional.ofNullable(target),
                                 Optional.ofNullable(snapshot),
                                 Optional.empty(),
                                 Optional.empty());
    }

    public static CommandResult success(Family target, String message, Snapshot snapshot, StepTrace trace) {
        return new CommandResult(Outcome.SUCCESS,
                                 message,
                                 Optional.ofNullable(target),
                                 Optional.ofNullable(snapshot),
                                 Optional.ofNullable(trace),
                                 Optional.empty());
    }

    public static CommandResult failure(Family target, CommandError cause) {
        return new CommandResult(Outcome.ERROR,
                                 cause.message(),
                                 Optional.ofNullable(target),
                                 Optional.empty(),
                                 Optional.empty(),
                                 Optional.of(cause));
    }

    public boolean isSuccess() {
        return outcome == Outcome.SUCCESS;
    }
}
