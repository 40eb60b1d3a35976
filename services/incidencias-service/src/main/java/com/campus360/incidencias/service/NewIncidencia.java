/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/incidencias-service/src/main/java/com/campus360/incidencias/service/NewIncidencia.java
 * Project: Campus360 Incidencias Service
 * Description: Input of the create operation.
 * Since: 2026-10-19
 */

package com.campus360.incidencias.service;

/**
 * Data supplied by the reporter when filing an incidencia. Priority defaults to the
 * configured default when null; category and location are optional.
 */
public record NewIncidencia(
    String title,
    String description,
    String priorityCode,
    String categoryCode,
    String locationId
) {
}
