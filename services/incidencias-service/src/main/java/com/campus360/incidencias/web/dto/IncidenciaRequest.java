/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/incidencias-service/src/main/java/com/campus360/incidencias/web/dto/IncidenciaRequest.java
 * Project: Campus360 Incidencias Service
 * Description: Payload received when a user reports a new incidencia.
 * Since: 2026-10-19
 */

package com.campus360.incidencias.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Payload received when a user reports an incidencia. Catalog entries are referenced
 * by code; omitting {@code priority} falls back to the configured default.
 */
public class IncidenciaRequest {

    @NotBlank
    @Size(max = 200)
    private String title;

    @NotBlank
    private String description;

    @Size(max = 20)
    private String priority;

    @Size(max = 50)
    private String category;

    @Size(max = 50)
    private String locationId;

    public IncidenciaRequest() {
    }

    public IncidenciaRequest(String title, String description, String priority, String category, String locationId) {
        this.title = title;
        this.description = description;
        this.priority = priority;
        this.category = category;
        this.locationId = locationId;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getPriority() {
        return priority;
    }

    public void setPriority(String priority) {
        this.priority = priority;
    }

    public String getCategory() {
        return category;
    }

    public void setCategory(String category) {
        this.category = category;
    }

    public String getLocationId() {
        return locationId;
    }

    public void setLocationId(String locationId) {
        this.locationId = locationId;
    }
}
