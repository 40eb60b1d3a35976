/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/incidencias-service/src/main/java/com/campus360/incidencias/security/Actor.java
 * Project: Campus360 Incidencias Service
 * Description: Decoded identity of the caller, passed explicitly into every operation.
 * Since: 2026-10-19
 */

package com.campus360.incidencias.security;

import java.util.Objects;

/**
 * Who is performing an operation: the subject id issued by the identity service and
 * the caller's role as stated in the token. Passed explicitly to every lifecycle
 * operation; nothing in the core reads identity from request-scoped state.
 */
public record Actor(String subjectId, String role) {

    public Actor {
        Objects.requireNonNull(subjectId, "subjectId must not be null");
        Objects.requireNonNull(role, "role must not be null");
    }
}
