/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/incidencias-service/src/main/java/com/campus360/incidencias/repository/IncidenciaCriteria.java
 * Project: Campus360 Incidencias Service
 * Description: Final, visibility-constrained read predicate for incidencia listings.
 * Since: 2026-10-19
 */

package com.campus360.incidencias.repository;

/**
 * Resolved listing predicate: catalog codes already translated to ids and the
 * reporter restriction already forced for non-administrators. Null fields do not
 * restrict the result.
 */
public record IncidenciaCriteria(
    String reporterId,
    Long stateId,
    Long priorityId,
    Long categoryId,
    String responsibleId,
    int limit,
    long offset
) {
}
