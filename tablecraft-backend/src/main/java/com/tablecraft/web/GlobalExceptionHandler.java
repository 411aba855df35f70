package com.tablecraft.web;

import com.tablecraft.api.ErrorResponse;
import com.tablecraft.engine.ComputationException;
import com.tablecraft.engine.PipelineStepException;
import com.tablecraft.engine.ValidationException;
import com.tablecraft.util.ErrorCodes;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.stream.Collectors;

/**
 * Renders engine and request failures as {@link ErrorResponse} bodies.
 *
 * <p>Validation failures map to 400; computation and unexpected failures map to 500.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error(
                ErrorCodes.VALIDATION_FAILED, "Input validation failed", details));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error(
                ErrorCodes.MALFORMED_REQUEST, "Request body is not valid JSON for this endpoint", ex.getMostSpecificCause().getMessage()));
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleTransformValidation(ValidationException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error(
                ErrorCodes.VALIDATION_FAILED, "Transformation failed: " + ex.getMessage(), null));
    }

    @ExceptionHandler(ComputationException.class)
    public ResponseEntity<ErrorResponse> handleComputation(ComputationException ex) {
        log.error("Computation error: column={}, operation={}", ex.getColumn(), ex.getOperation(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error(
                ErrorCodes.COMPUTATION_ERROR, ex.getMessage(), "column=" + ex.getColumn() + ", operation=" + ex.getOperation()));
    }

    @ExceptionHandler(PipelineStepException.class)
    public ResponseEntity<ErrorResponse> handlePipelineStep(PipelineStepException ex) {
        HttpStatus status = ErrorCodes.isClientError(ex) ? HttpStatus.BAD_REQUEST : HttpStatus.INTERNAL_SERVER_ERROR;
        if (status.is5xxServerError()) {
            log.error("Pipeline failed at step {}", ex.getStep(), ex);
        }
        String details = "step=" + ex.getStep() + ", transformation_type=" + ex.getTransformationType();
        return ResponseEntity.status(status).body(error(ErrorCodes.codeFor(ex), ex.getMessage(), details));
    }

    @ExceptionHandler({NoResourceFoundException.class, NoHandlerFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFoundException(Exception ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error(ErrorCodes.NOT_FOUND, "Not found", ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleAllExceptions(Exception ex) {
        log.error("Unhandled exception occurred", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error(
                ErrorCodes.INTERNAL_SERVER_ERROR, "An unexpected error occurred during transformation", ex.getMessage()));
    }

    private static ErrorResponse error(String code, String message, String details) {
        return ErrorResponse.builder()
                .code(code)
                .message(message)
                .details(details)
                .traceId(MDC.get(TraceIdFilter.MDC_TRACE_ID))
                .build();
    }
}
