/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/incidencias-service/src/main/java/com/campus360/incidencias/service/error/NotFoundException.java
 * Project: Campus360 Incidencias Service
 * Description: Raised when a resource is absent or hidden from the actor.
 * Since: 2026-10-19
 */

package com.campus360.incidencias.service.error;

/**
 * Raised both when a resource does not exist and when it exists but the actor may
 * not see it. The message is the same in both cases.
 */
public class NotFoundException extends IncidenciaException {

    public NotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }

    public static NotFoundException incidencia(Long id) {
        return new NotFoundException("Incidencia with id %d not found".formatted(id));
    }
}
