/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/incidencias-service/src/main/java/com/campus360/incidencias/web/dto/IncidenciaPageResponse.java
 * Project: Campus360 Incidencias Service
 * Description: One page of the incidencia listing.
 * Since: 2026-10-19
 */

package com.campus360.incidencias.web.dto;

import java.util.List;

public record IncidenciaPageResponse(
    List<IncidenciaResponse> items,
    long total,
    int limit,
    long offset,
    boolean hasMore
) {
}
