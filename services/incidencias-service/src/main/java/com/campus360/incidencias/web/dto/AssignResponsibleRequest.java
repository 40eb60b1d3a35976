/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/incidencias-service/src/main/java/com/campus360/incidencias/web/dto/AssignResponsibleRequest.java
 * Project: Campus360 Incidencias Service
 * Description: Assignment of a responsible party.
 * Since: 2026-10-19
 */

package com.campus360.incidencias.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public class AssignResponsibleRequest {

    @NotBlank
    @Size(max = 50)
    private String responsibleId;

    private String comment;

    public AssignResponsibleRequest() {
    }

    public AssignResponsibleRequest(String responsibleId, String comment) {
        this.responsibleId = responsibleId;
        this.comment = comment;
    }

    public String getResponsibleId() {
        return responsibleId;
    }

    public void setResponsibleId(String responsibleId) {
        this.responsibleId = responsibleId;
    }

    public String getComment() {
        return comment;
    }

    public void setComment(String comment) {
        this.comment = comment;
    }
}
