package com.tablecraft.engine;

/**
 * Thrown when a transformation request is malformed: unknown type, missing parameter,
 * a referenced column absent from the data, or an empty {@code group_by}.
 *
 * <p>Always recoverable by fixing the request; never retried.
 */
public class ValidationException extends RuntimeException {
    /**
     * Create a new exception.
     *
     * @param message error message
     */
    public ValidationException(String message) {
        super(message);
    }
}
