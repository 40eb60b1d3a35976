/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/incidencias-service/src/main/java/com/campus360/incidencias/web/ApiExceptionHandler.java
 * Project: Campus360 Incidencias Service
 * Description: Maps service failures to RFC 7807 problem responses.
 * Since: 2026-10-19
 */

package com.campus360.incidencias.web;

import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;

import com.campus360.incidencias.service.error.ErrorKind;
import com.campus360.incidencias.service.error.IncidenciaException;

/**
 * Translates {@link IncidenciaException}, request validation failures and anything
 * unexpected into {@link ProblemDetail} bodies. Every body carries a {@code kind}
 * property with the {@link ErrorKind} name so clients can branch without parsing messages.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(IncidenciaException.class)
    public ResponseEntity<ProblemDetail> handleIncidenciaException(IncidenciaException ex) {
        if (ex.getKind() == ErrorKind.CONFLICT) {
            log.warn("Request rejected: {}", ex.getMessage());
        } else {
            log.debug("Request rejected with {}: {}", ex.getKind(), ex.getMessage());
        }
        return problem(statusOf(ex.getKind()), ex.getKind(), ex.getMessage());
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ProblemDetail> handleBindException(WebExchangeBindException ex) {
        String detail = ex.getFieldErrors().stream()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .collect(Collectors.joining("; "));
        log.debug("Invalid request body: {}", detail);
        return problem(HttpStatus.BAD_REQUEST, ErrorKind.VALIDATION, detail);
    }

    /**
     * Covers {@link org.springframework.web.server.ServerWebInputException} (malformed
     * path variables, query parameters or bodies) along with unknown routes and methods.
     */
    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ProblemDetail> handleResponseStatusException(ResponseStatusException ex) {
        HttpStatusCode status = ex.getStatusCode();
        ErrorKind kind = ProblemDetails.kindOf(status);
        if (kind == ErrorKind.INTERNAL) {
            log.error("Request failed with {}", status, ex);
        } else {
            log.debug("Request rejected by the web layer with {}: {}", status, ex.getReason());
        }
        String detail = ex.getReason() != null ? ex.getReason() : ex.getMessage();
        return problem(status, kind, detail);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleUnexpected(Exception ex) {
        log.error("Unhandled exception while processing request", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, ErrorKind.INTERNAL,
            "An unexpected error occurred, please try again later");
    }

    static HttpStatus statusOf(ErrorKind kind) {
        return switch (kind) {
            case UNAUTHENTICATED -> HttpStatus.UNAUTHORIZED;
            case ACCESS_DENIED -> HttpStatus.FORBIDDEN;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case INVALID_TRANSITION, CONFLICT -> HttpStatus.CONFLICT;
            case INTERNAL -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private static ResponseEntity<ProblemDetail> problem(HttpStatusCode status, ErrorKind kind, String detail) {
        return ResponseEntity.status(status)
            .contentType(MediaType.APPLICATION_PROBLEM_JSON)
            .body(ProblemDetails.of(status, kind, detail));
    }
}
