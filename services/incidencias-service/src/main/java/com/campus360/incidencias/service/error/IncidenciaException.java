/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/incidencias-service/src/main/java/com/campus360/incidencias/service/error/IncidenciaException.java
 * Project: Campus360 Incidencias Service
 * Description: Base type of every failure raised by the incidencias core.
 * Since: 2026-10-19
 */

package com.campus360.incidencias.service.error;

/**
 * Base type of every expected failure of the incidencias core. None of them is
 * retried inside the service; retry policy belongs to the client.
 */
public abstract class IncidenciaException extends RuntimeException {

    private final ErrorKind kind;

    protected IncidenciaException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected IncidenciaException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
