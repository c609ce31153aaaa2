package com.procurement.api;

import com.procurement.pipeline.PipelineAlreadyRunningException;
import com.procurement.pipeline.PipelineRunException;
import com.procurement.store.StoreUnavailableException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps pipeline, store and request failures to JSON error bodies:
 * {
 *   "error_code": "PIPELINE_RUN_FAILED",
 *   "message": "...",
 *   "timestamp": "2026-..."
 * }
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(PipelineAlreadyRunningException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Map<String, Object> handleAlreadyRunning(PipelineAlreadyRunningException ex) {
        log.warn("Refused while a pipeline run holds the lock: {}", ex.getMessage());
        return errorResponse("PIPELINE_ALREADY_RUNNING", ex.getMessage());
    }

    @ExceptionHandler(PipelineRunException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleRunFailure(PipelineRunException ex) {
        Map<String, Object> body = errorResponse("PIPELINE_RUN_FAILED", ex.getMessage());
        body.put("run_id", ex.getRunId());
        return body;
    }

    @ExceptionHandler(StoreUnavailableException.class)
    @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
    public Map<String, Object> handleStoreUnavailable(StoreUnavailableException ex) {
        log.error("Store unavailable: {}", ex.getMessage());
        return errorResponse("STORE_UNAVAILABLE", ex.getMessage());
    }

    /** Unreadable JSON in a staging load or override body. */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleUnreadableBody(HttpMessageNotReadableException ex,
                                                    HttpServletRequest request) {
        log.warn("Unreadable body on {} {}: {}", request.getMethod(), request.getRequestURI(),
            ex.getMostSpecificCause().getMessage());
        return errorResponse("BAD_REQUEST",
            "body of " + request.getRequestURI() + " is not valid JSON for this endpoint");
    }

    /** Missing override fields, malformed purchase month and similar caller mistakes. */
    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleInvalidArgument(IllegalArgumentException ex) {
        log.debug("Invalid argument: {}", ex.getMessage());
        return errorResponse("INVALID_ARGUMENT", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("Unhandled failure on {} {}", request.getMethod(), request.getRequestURI(), ex);
        Map<String, Object> body = errorResponse("INTERNAL_ERROR",
            "request to " + request.getRequestURI() + " failed unexpectedly");
        body.put("exception", ex.getClass().getSimpleName());
        return body;
    }

    private static Map<String, Object> errorResponse(String errorCode, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error_code", errorCode);
        body.put("message", message);
        body.put("timestamp", Instant.now().toString());
        return body;
    }
}
