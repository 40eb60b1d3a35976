/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/incidencias-service/src/main/java/com/campus360/incidencias/service/error/ValidationException.java
 * Project: Campus360 Incidencias Service
 * Description: Raised on malformed input: empty required fields or unknown catalog codes.
 * Since: 2026-10-19
 */

package com.campus360.incidencias.service.error;

public class ValidationException extends IncidenciaException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }

    public static ValidationException unknownCode(String catalog, String code) {
        return new ValidationException("Unknown %s code '%s'".formatted(catalog, code));
    }

    public static ValidationException blank(String field) {
        return new ValidationException("%s must not be empty".formatted(field));
    }
}
