/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/incidencias-service/src/main/java/com/campus360/incidencias/service/IncidenciaFilter.java
 * Project: Campus360 Incidencias Service
 * Description: Caller-supplied listing filters.
 * Since: 2026-10-19
 */

package com.campus360.incidencias.service;

/**
 * Filters as requested by the caller. They are untrusted: the query builder narrows
 * them to what the actor is allowed to see.
 */
public record IncidenciaFilter(
    String stateCode,
    String priorityCode,
    String categoryCode,
    String reporterId,
    String responsibleId,
    Integer limit,
    Long offset
) {

    public static IncidenciaFilter none() {
        return new IncidenciaFilter(null, null, null, null, null, null, null);
    }
}
