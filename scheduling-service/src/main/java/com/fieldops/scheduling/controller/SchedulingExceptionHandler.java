package com.fieldops.scheduling.controller;

import com.fieldops.scheduling.exception.ConstraintValidationException;
import com.fieldops.scheduling.exception.ScheduleBusyException;
import com.fieldops.scheduling.exception.SchedulingException;
import com.fieldops.shared.dto.ApiResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.List;
import java.util.Set;

/**
 * Maps scheduling errors onto the {@link ApiResponse} envelope.
 *
 *   VALIDATION_ERROR, INVALID_REQUEST                  400
 *   RUN_NOT_FOUND, JOB_NOT_FOUND, NO_COMMITTED_SCHEDULE 404
 *   SCHEDULE_BUSY, INVALID_STATE                       409
 *   SERVICE_UNAVAILABLE                                503
 */
@Slf4j
@RestControllerAdvice
public class SchedulingExceptionHandler {

    private static final Set<String> NOT_FOUND = Set.of(
            SchedulingException.RUN_NOT_FOUND,
            SchedulingException.JOB_NOT_FOUND,
            SchedulingException.NO_COMMITTED_SCHEDULE);

    @ExceptionHandler(ConstraintValidationException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidation(ConstraintValidationException ex) {
        log.warn("Validation error: {}", ex.getMessage());
        List<String> details = ex.getViolations().stream().map(Object::toString).toList();
        return ResponseEntity.badRequest()
                .body(ApiResponse.error(ex.getCode(), "Request failed validation", details, false));
    }

    @ExceptionHandler(ScheduleBusyException.class)
    public ResponseEntity<ApiResponse<Void>> handleBusy(ScheduleBusyException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(ApiResponse.error(ex.getCode(), ex.getMessage(), null, true));
    }

    @ExceptionHandler(SchedulingException.class)
    public ResponseEntity<ApiResponse<Void>> handleScheduling(SchedulingException ex) {
        log.warn("Scheduling error [{}]: {}", ex.getCode(), ex.getMessage());
        return ResponseEntity.status(statusOf(ex.getCode()))
                .body(ApiResponse.error(ex.getCode(), ex.getMessage(), null, ex.isRetryable()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleBeanValidation(MethodArgumentNotValidException ex) {
        List<String> details = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + ": " + e.getDefaultMessage())
                .toList();
        return ResponseEntity.badRequest()
                .body(ApiResponse.error(ConstraintValidationException.CODE, "Request failed validation", details, false));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiResponse<Void>> handleMalformed(Exception ex) {
        log.debug("Malformed request: {}", ex.getMessage());
        return ResponseEntity.badRequest()
                .body(ApiResponse.error(SchedulingException.INVALID_REQUEST, "Malformed request: " + ex.getMessage()));
    }

    static HttpStatus statusOf(String code) {
        if (NOT_FOUND.contains(code)) {
            return HttpStatus.NOT_FOUND;
        }
        return switch (code) {
            case SchedulingException.SERVICE_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            case SchedulingException.INVALID_STATE, ScheduleBusyException.CODE -> HttpStatus.CONFLICT;
            default -> HttpStatus.BAD_REQUEST;
        };
    }
}
