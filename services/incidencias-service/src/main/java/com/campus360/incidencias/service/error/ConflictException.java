/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/incidencias-service/src/main/java/com/campus360/incidencias/service/error/ConflictException.java
 * Project: Campus360 Incidencias Service
 * Description: Raised when a concurrent modification invalidated the caller's view.
 * Since: 2026-10-19
 */

package com.campus360.incidencias.service.error;

public class ConflictException extends IncidenciaException {

    public ConflictException(String message, Throwable cause) {
        super(ErrorKind.CONFLICT, message, cause);
    }

    public static ConflictException concurrentUpdate(Long incidenciaId, Throwable cause) {
        return new ConflictException(
            "Incidencia %d was modified concurrently, reload and retry".formatted(incidenciaId), cause);
    }
}
