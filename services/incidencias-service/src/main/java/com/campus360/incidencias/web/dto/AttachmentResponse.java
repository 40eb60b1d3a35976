/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/incidencias-service/src/main/java/com/campus360/incidencias/web/dto/AttachmentResponse.java
 * Project: Campus360 Incidencias Service
 * Description: API representation of attachment metadata.
 * Since: 2026-10-19
 */

package com.campus360.incidencias.web.dto;

import java.time.Instant;

public record AttachmentResponse(
    Long id,
    Long incidenciaId,
    String filename,
    String mimeType,
    Long sizeBytes,
    String storagePath,
    String uploaderId,
    Instant createdAt
) {
}
