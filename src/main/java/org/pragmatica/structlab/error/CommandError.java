package org.pragmatica.structlab.error;

import org.pragmatica.structlab.lang.Cause;

/**
 * Every way a command can fail, from classification down to engine execution.
 * Each failure is converted to an error outcome at the dispatcher boundary.
 */
public sealed interface CommandError extends Cause
 permits ParseError,
         CommandError.Classification,
         CommandError.Normalization,
         CommandError.NotInitialized,
         CommandError.TypeMismatch,
         CommandError.OutOfRange,
         CommandError.NotFound,
         CommandError.InvalidArgument,
         CommandError.InternalFailure {

    /**
     * Text matches no known command family.
     */
    record Classification(String input) implements CommandError {
        @Override
        public String message() {
            return "Unrecognized command: '" + input + "'";
        }
    }

    /**
     * Parsed command is ambiguous or lacks a required argument.
     */
    record Normalization(String reason) implements CommandError {
        @Override
        public String message() {
            return reason;
        }
    }

    /**
     * Mutation issued before any structure of the family was created.
     */
    record NotInitialized(String family) implements CommandError {
        @Override
        public String message() {
            return "No " + family + " structure has been created";
        }
    }

    /**
     * Operation is not valid for the current structure type.
     */
    record TypeMismatch(String reason) implements CommandError {
        @Override
        public String message() {
            return reason;
        }
    }

    /**
     * Index or path outside of the structure.
     */
    record OutOfRange(String reason) implements CommandError {
        @Override
        public String message() {
            return reason;
        }

        public static OutOfRange index(int index, int bound) {
            return new OutOfRange("Index " + index + " out of range [0, " + bound + ")");
        }
    }

    /**
     * Value or node is absent where absence is reported as failure.
     */
    record NotFound(String reason) implements CommandError {
        @Override
        public String message() {
            return reason;
        }
    }

    /**
     * Argument is syntactically fine but semantically unacceptable.
     */
    record InvalidArgument(String reason) implements CommandError {
        @Override
        public String message() {
            return reason;
        }
    }

    /**
     * Unexpected exception thrown while executing an operation.
     */
    record InternalFailure(String operation, Throwable cause) implements CommandError {
        @Override
        public String message() {
            return "Operation '" + operation + "' failed: " + cause.getMessage();
        }
    }
}
