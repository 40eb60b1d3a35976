/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/incidencias-service/src/main/java/com/campus360/incidencias/service/error/ErrorKind.java
 * Project: Campus360 Incidencias Service
 * Description: Stable error kinds surfaced to callers.
 * Since: 2026-10-19
 */

package com.campus360.incidencias.service.error;

/**
 * Stable, client-visible classification of a failed operation.
 */
public enum ErrorKind {
    UNAUTHENTICATED,
    ACCESS_DENIED,
    NOT_FOUND,
    VALIDATION,
    INVALID_TRANSITION,
    CONFLICT,
    /** Failure not caused by the request; details stay in the server log. */
    INTERNAL
}
