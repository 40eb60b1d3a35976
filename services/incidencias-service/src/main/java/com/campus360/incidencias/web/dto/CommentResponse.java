/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/incidencias-service/src/main/java/com/campus360/incidencias/web/dto/CommentResponse.java
 * Project: Campus360 Incidencias Service
 * Description: API representation of a comment.
 * Since: 2026-10-19
 */

package com.campus360.incidencias.web.dto;

import java.time.Instant;

public record CommentResponse(
    Long id,
    Long incidenciaId,
    String authorId,
    String content,
    boolean internal,
    Instant createdAt,
    Instant updatedAt
) {
}
