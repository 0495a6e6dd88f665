/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.api;

import com.trialgate.application.errors.TrialgateException;
import com.trialgate.application.validation.TrialConflictException;
import com.trialgate.config.SubjectIdentityFilter;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ApiErrorResponse> handleApi(ApiException ex) {
        return respond(ex.getStatus(), ex.getStatus().name(), ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiErrorResponse> handleBadRequest(IllegalArgumentException ex) {
        return respond(HttpStatus.BAD_REQUEST, "BAD_REQUEST", ex.getMessage());
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, ConstraintViolationException.class})
    public ResponseEntity<ApiErrorResponse> handleValidation(Exception ex) {
        return respond(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "Invalid request");
    }

    /**
     * Routing errors that escape to a controller: the experiment or its trials are switched off,
     * the circuit is open or the trial timed out.
     */
    @ExceptionHandler(TrialgateException.class)
    public ResponseEntity<ApiErrorResponse> handleRouting(TrialgateException ex) {
        log.warn("Routing failure requestId={} type={} service={} trial={}",
                currentRequestId(), ex.getType(), ex.getServiceType().getSimpleName(), ex.getTrialKey());
        HttpStatus status = switch (ex.getType()) {
            case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
            case EXPERIMENT_DISABLED, TRIAL_DISABLED, CIRCUIT_OPEN -> HttpStatus.SERVICE_UNAVAILABLE;
        };
        return respond(status, ex.getType().name(), ex.getMessage());
    }

    @ExceptionHandler(TrialConflictException.class)
    public ResponseEntity<ApiErrorResponse> handleConflicts(TrialConflictException ex) {
        return respond(HttpStatus.CONFLICT, "TRIAL_CONFLICT", ex.getMessage());
    }

    @ExceptionHandler(UnsupportedOperationException.class)
    public ResponseEntity<ApiErrorResponse> handleUnsupported(UnsupportedOperationException ex) {
        return respond(HttpStatus.CONFLICT, "UNSUPPORTED_OPERATION", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleAny(Exception ex) {
        String requestId = currentRequestId();
        log.error("Unhandled exception requestId={}", requestId, ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "UNEXPECTED_ERROR", "Unexpected error");
    }

    private ResponseEntity<ApiErrorResponse> respond(HttpStatus status, String code, String message) {
        ApiErrorResponse body = new ApiErrorResponse(
                status.name(),
                code,
                message,
                currentRequestId()
        );
        return ResponseEntity.status(status).body(body);
    }

    private String currentRequestId() {
        String rid = MDC.get(SubjectIdentityFilter.REQUEST_ID_MDC_KEY);
        return (rid == null || rid.isBlank()) ? "" : rid;
    }
}
