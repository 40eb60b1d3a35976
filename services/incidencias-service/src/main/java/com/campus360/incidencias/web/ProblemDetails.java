/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/incidencias-service/src/main/java/com/campus360/incidencias/web/ProblemDetails.java
 * Project: Campus360 Incidencias Service
 * Description: Factory for the RFC 7807 bodies returned on every failed request.
 * Since: 2026-10-19
 */

package com.campus360.incidencias.web;

import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;

import com.campus360.incidencias.service.error.ErrorKind;

/**
 * Builds {@link ProblemDetail} bodies carrying the {@code kind} property, shared by
 * the controller advice and the security filter chain.
 */
public final class ProblemDetails {

    public static final String KIND = "kind";

    private ProblemDetails() {
    }

    public static ProblemDetail of(HttpStatusCode status, ErrorKind kind, String detail) {
        ProblemDetail body = ProblemDetail.forStatusAndDetail(status, detail);
        HttpStatus resolved = HttpStatus.resolve(status.value());
        if (resolved != null) {
            body.setTitle(resolved.getReasonPhrase());
        }
        body.setProperty(KIND, kind.name());
        return body;
    }

    /**
     * Kind for failures raised by the web layer itself (bad path variables, unknown
     * routes, unsupported media types) rather than by the service.
     */
    public static ErrorKind kindOf(HttpStatusCode status) {
        return switch (status.value()) {
            case 401 -> ErrorKind.UNAUTHENTICATED;
            case 403 -> ErrorKind.ACCESS_DENIED;
            case 404 -> ErrorKind.NOT_FOUND;
            case 409 -> ErrorKind.CONFLICT;
            default -> status.is4xxClientError() ? ErrorKind.VALIDATION : ErrorKind.INTERNAL;
        };
    }
}
