package com.tablecraft.util;

import com.tablecraft.engine.ComputationException;
import com.tablecraft.engine.PipelineStepException;
import com.tablecraft.engine.ValidationException;

/**
 * Maps engine failures to the error codes carried by {@code ErrorResponse} bodies and batch items.
 */
public final class ErrorCodes {

    public static final String VALIDATION_FAILED = "VALIDATION_FAILED";
    public static final String COMPUTATION_ERROR = "COMPUTATION_ERROR";
    public static final String INTERNAL_SERVER_ERROR = "INTERNAL_SERVER_ERROR";
    public static final String MALFORMED_REQUEST = "MALFORMED_REQUEST";
    public static final String NOT_FOUND = "NOT_FOUND";

    private ErrorCodes() {
    }

    /**
     * Error code of a failure; pipeline failures take the code of their cause.
     *
     * @param error failure
     * @return error code
     */
    public static String codeFor(Throwable error) {
        Throwable t = error;
        if (t instanceof PipelineStepException && t.getCause() != null) {
            t = t.getCause();
        }
        if (t instanceof ValidationException) {
            return VALIDATION_FAILED;
        }
        if (t instanceof ComputationException) {
            return COMPUTATION_ERROR;
        }
        return INTERNAL_SERVER_ERROR;
    }

    public static boolean isClientError(Throwable error) {
        return VALIDATION_FAILED.equals(codeFor(error));
    }
}
