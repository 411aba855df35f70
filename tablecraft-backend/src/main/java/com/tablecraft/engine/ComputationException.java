package com.tablecraft.engine;

/**
 * Thrown when a reduction violates an internal invariant, for example a statistic that
 * overflows to a non-finite value.
 */
public class ComputationException extends RuntimeException {
    private final String column;
    private final String operation;

    /**
     * Create a new exception.
     *
     * @param column offending column
     * @param operation statistic or normalization being computed
     * @param message error message
     */
    public ComputationException(String column, String operation, String message) {
        super(message + " (column=" + column + ", operation=" + operation + ")");
        this.column = column;
        this.operation = operation;
    }

    public String getColumn() {
        return column;
    }

    public String getOperation() {
        return operation;
    }
}
