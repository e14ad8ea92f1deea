package com.enms.controller;

import com.enms.exception.AnalyticsException;
import com.enms.exception.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.stream.Collectors;

/**
 * Maps failures to a stable error code and HTTP status.
 *
 * Response body: {"code": "...", "message": "..."}
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(AnalyticsException.class)
    public ResponseEntity<ErrorResponse> handleAnalytics(AnalyticsException e) {
        ErrorCode code = e.getCode();
        if (code.getStatus().is5xxServerError()) {
            log.error("Request failed with {}", code, e);
        } else {
            log.warn("Request failed with {}: {}", code, e.getMessage());
        }
        return respond(code, e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .collect(Collectors.joining(", "));
        return respond(ErrorCode.INVALID_REQUEST, message);
    }

    @ExceptionHandler({
        IllegalArgumentException.class,
        HttpMessageNotReadableException.class,
        MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e) {
        log.warn("Invalid request: {}", e.getMessage());
        return respond(ErrorCode.INVALID_REQUEST, e.getMessage());
    }

    @ExceptionHandler({ObjectOptimisticLockingFailureException.class, DataIntegrityViolationException.class})
    public ResponseEntity<ErrorResponse> handleConflict(Exception e) {
        log.warn("Concurrent modification: {}", e.getMessage());
        return respond(ErrorCode.CONFLICT, "Concurrent modification, retry the request");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
        log.error("Error processing request", e);
        return respond(ErrorCode.INTERNAL_ERROR, e.getMessage());
    }

    private ResponseEntity<ErrorResponse> respond(ErrorCode code, String message) {
        return ResponseEntity.status(code.getStatus()).body(new ErrorResponse(code.name(), message));
    }

    record ErrorResponse(String code, String message) {}
}
