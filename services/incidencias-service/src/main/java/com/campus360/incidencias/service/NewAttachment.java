/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/incidencias-service/src/main/java/com/campus360/incidencias/service/NewAttachment.java
 * Project: Campus360 Incidencias Service
 * Description: Metadata of a file already placed in external storage.
 * Since: 2026-10-19
 */

package com.campus360.incidencias.service;

public record NewAttachment(
    String filename,
    String mimeType,
    Long sizeBytes,
    String storagePath
) {
}
