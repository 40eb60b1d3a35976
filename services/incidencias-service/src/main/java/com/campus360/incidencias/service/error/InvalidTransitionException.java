/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/incidencias-service/src/main/java/com/campus360/incidencias/service/error/InvalidTransitionException.java
 * Project: Campus360 Incidencias Service
 * Description: Raised when the state machine rejects a requested edge.
 * Since: 2026-10-19
 */

package com.campus360.incidencias.service.error;

import com.campus360.incidencias.domain.IncidenciaState;

public class InvalidTransitionException extends IncidenciaException {

    public InvalidTransitionException(String message) {
        super(ErrorKind.INVALID_TRANSITION, message);
    }

    public static InvalidTransitionException between(IncidenciaState from, IncidenciaState to) {
        return new InvalidTransitionException(
            "Transition from '%s' to '%s' is not allowed".formatted(from.code(), to.code()));
    }
}
