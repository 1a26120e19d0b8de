package com.tutorpolicy.api;

import com.tutorpolicy.context.UnknownResetPolicyException;
import com.tutorpolicy.contract.MalformedEventException;
import com.tutorpolicy.strategy.UnknownStrategyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unified error body:
 * {
 *   "error_code": "UNKNOWN_STRATEGY",
 *   "message": "...",
 *   "timestamp": "2026-..."
 * }
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(UnknownStrategyException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleUnknownStrategy(UnknownStrategyException ex) {
        log.warn("Unknown strategy: {}", ex.getStrategyId());
        return errorResponse("UNKNOWN_STRATEGY", ex.getMessage());
    }

    @ExceptionHandler(UnknownResetPolicyException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleUnknownResetPolicy(UnknownResetPolicyException ex) {
        log.warn("Unknown reset policy: {}", ex.getMessage());
        return errorResponse("UNKNOWN_RESET_POLICY", ex.getMessage());
    }

    @ExceptionHandler(MalformedEventException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleMalformedEvent(MalformedEventException ex) {
        log.warn("Malformed event id={}: {}", ex.getEventId(), ex.getMessage());
        return errorResponse("MALFORMED_EVENT", ex.getMessage());
    }

    @ExceptionHandler(DuplicateEventException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Map<String, Object> handleDuplicateEvent(DuplicateEventException ex) {
        log.warn("Duplicate event: {}", ex.getMessage());
        return errorResponse("DUPLICATE_EVENT", ex.getMessage());
    }

    @ExceptionHandler(LearnerNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleLearnerNotFound(LearnerNotFoundException ex) {
        log.warn("Learner lookup failed: {}", ex.getMessage());
        return errorResponse("LEARNER_NOT_FOUND", ex.getMessage());
    }

    @ExceptionHandler({
        MethodArgumentTypeMismatchException.class,
        MissingServletRequestParameterException.class,
        HttpMessageNotReadableException.class
    })
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleUnreadableRequest(Exception ex) {
        log.warn("Unreadable request ({}): {}", ex.getClass().getSimpleName(), ex.getMessage());
        return errorResponse("BAD_REQUEST", "request could not be read: " + ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleInvalidArgument(IllegalArgumentException ex) {
        log.warn("Invalid argument: {}", ex.getMessage());
        return errorResponse("INVALID_ARGUMENT", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleUnexpected(Exception ex) {
        log.error("Policy request failed", ex);
        return errorResponse("INTERNAL_ERROR", "internal error while evaluating the request");
    }

    private static Map<String, Object> errorResponse(String errorCode, String message) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("error_code", errorCode);
        error.put("message", message != null ? message : errorCode);
        error.put("timestamp", Instant.now().toString());
        return error;
    }
}
