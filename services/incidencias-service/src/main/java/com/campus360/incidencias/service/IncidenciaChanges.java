/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/incidencias-service/src/main/java/com/campus360/incidencias/service/IncidenciaChanges.java
 * Project: Campus360 Incidencias Service
 * Description: Partial update of an incidencia's descriptive fields.
 * Since: 2026-10-19
 */

package com.campus360.incidencias.service;

/**
 * Partial update; null means "leave unchanged", a blank category or location means
 * "clear". State and responsible party are not part of it, they change only through
 * their dedicated operations.
 */
public record IncidenciaChanges(
    String title,
    String description,
    String priorityCode,
    String categoryCode,
    String locationId
) {

    boolean touchesTriageFields() {
        return priorityCode != null || locationId != null;
    }
}
