/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/incidencias-service/src/main/java/com/campus360/incidencias/web/dto/IncidenciaResponse.java
 * Project: Campus360 Incidencias Service
 * Description: API representation of an incidencia.
 * Since: 2026-10-19
 */

package com.campus360.incidencias.web.dto;

import java.time.Instant;

/**
 * API representation of an incidencia. Catalog references are exposed by code, never
 * by internal id.
 */
public class IncidenciaResponse {

    private final Long id;
    private final String title;
    private final String description;
    private final String state;
    private final String priority;
    private final String category;
    private final String reporterId;
    private final String responsibleId;
    private final String locationId;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final Instant resolvedAt;

    public IncidenciaResponse(
        Long id,
        String title,
        String description,
        String state,
        String priority,
        String category,
        String reporterId,
        String responsibleId,
        String locationId,
        Instant createdAt,
        Instant updatedAt,
        Instant resolvedAt
    ) {
        this.id = id;
        this.title = title;
        this.description = description;
        this.state = state;
        this.priority = priority;
        this.category = category;
        this.reporterId = reporterId;
        this.responsibleId = responsibleId;
        this.locationId = locationId;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
        this.resolvedAt = resolvedAt;
    }

    public Long getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public String getState() {
        return state;
    }

    public String getPriority() {
        return priority;
    }

    public String getCategory() {
        return category;
    }

    public String getReporterId() {
        return reporterId;
    }

    public String getResponsibleId() {
        return responsibleId;
    }

    public String getLocationId() {
        return locationId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public Instant getResolvedAt() {
        return resolvedAt;
    }
}
