package org.pragmatica.structlab.lang;

/**
 * Reason of a failed operation. Carried by {@link Result.Failure}.
 */
public interface Cause {
    /**
     * Human-readable description of the failure.
     */
    String message();

    /**
     * Wrap this cause into a failed result of the required type.
     */
    default <T> Result<T> result() {
        return Result.failure(this);
    }
}
