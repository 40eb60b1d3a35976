/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/incidencias-service/src/main/java/com/campus360/incidencias/web/dto/ChangeStateRequest.java
 * Project: Campus360 Incidencias Service
 * Description: Requested state transition.
 * Since: 2026-10-19
 */

package com.campus360.incidencias.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public class ChangeStateRequest {

    @NotBlank
    @Size(max = 20)
    private String state;

    private String comment;

    public ChangeStateRequest() {
    }

    public ChangeStateRequest(String state, String comment) {
        this.state = state;
        this.comment = comment;
    }

    public String getState() {
        return state;
    }

    public void setState(String state) {
        this.state = state;
    }

    public String getComment() {
        return comment;
    }

    public void setComment(String comment) {
        this.comment = comment;
    }
}
