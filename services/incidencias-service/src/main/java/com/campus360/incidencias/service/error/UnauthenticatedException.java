/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/incidencias-service/src/main/java/com/campus360/incidencias/service/error/UnauthenticatedException.java
 * Project: Campus360 Incidencias Service
 * Description: Raised when the caller's token carries no usable identity.
 * Since: 2026-10-19
 */

package com.campus360.incidencias.service.error;

public class UnauthenticatedException extends IncidenciaException {

    public UnauthenticatedException(String message) {
        super(ErrorKind.UNAUTHENTICATED, message);
    }
}
