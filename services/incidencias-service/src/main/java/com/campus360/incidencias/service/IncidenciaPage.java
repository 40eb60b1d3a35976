/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/incidencias-service/src/main/java/com/campus360/incidencias/service/IncidenciaPage.java
 * Project: Campus360 Incidencias Service
 * Description: One page of a listing plus the total match count.
 * Since: 2026-10-19
 */

package com.campus360.incidencias.service;

import java.util.List;

import com.campus360.incidencias.domain.Incidencia;

public record IncidenciaPage(List<Incidencia> items, long total, int limit, long offset) {

    public IncidenciaPage {
        items = List.copyOf(items);
    }

    public boolean hasMore() {
        return offset + items.size() < total;
    }
}
