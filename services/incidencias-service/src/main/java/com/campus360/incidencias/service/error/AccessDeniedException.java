/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/incidencias-service/src/main/java/com/campus360/incidencias/service/error/AccessDeniedException.java
 * Project: Campus360 Incidencias Service
 * Description: Raised when an authenticated actor is forbidden by policy.
 * Since: 2026-10-19
 */

package com.campus360.incidencias.service.error;

public class AccessDeniedException extends IncidenciaException {

    public AccessDeniedException(String message) {
        super(ErrorKind.ACCESS_DENIED, message);
    }

    public static AccessDeniedException administratorsOnly(String operation) {
        return new AccessDeniedException("Only administrators may %s".formatted(operation));
    }
}
