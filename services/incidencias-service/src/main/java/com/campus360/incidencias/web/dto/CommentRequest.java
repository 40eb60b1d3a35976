/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/incidencias-service/src/main/java/com/campus360/incidencias/web/dto/CommentRequest.java
 * Project: Campus360 Incidencias Service
 * Description: New comment on an incidencia.
 * Since: 2026-10-19
 */

package com.campus360.incidencias.web.dto;

import jakarta.validation.constraints.NotBlank;

public class CommentRequest {

    @NotBlank
    private String content;

    private boolean internal;

    public CommentRequest() {
    }

    public CommentRequest(String content, boolean internal) {
        this.content = content;
        this.internal = internal;
    }

    public String getContent() {
        return content;
    }

    public void setContent(String content) {
        this.content = content;
    }

    public boolean isInternal() {
        return internal;
    }

    public void setInternal(boolean internal) {
        this.internal = internal;
    }
}
