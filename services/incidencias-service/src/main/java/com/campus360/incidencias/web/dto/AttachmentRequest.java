/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/incidencias-service/src/main/java/com/campus360/incidencias/web/dto/AttachmentRequest.java
 * Project: Campus360 Incidencias Service
 * Description: Metadata of a file already stored elsewhere.
 * Since: 2026-10-19
 */

package com.campus360.incidencias.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

/**
 * Metadata of a file uploaded to external storage. The service never reads the file;
 * {@code storagePath} is kept as an opaque reference.
 */
public class AttachmentRequest {

    @NotBlank
    @Size(max = 255)
    private String filename;

    @Size(max = 100)
    private String mimeType;

    @PositiveOrZero
    private Long sizeBytes;

    @NotBlank
    @Size(max = 500)
    private String storagePath;

    public AttachmentRequest() {
    }

    public AttachmentRequest(String filename, String mimeType, Long sizeBytes, String storagePath) {
        this.filename = filename;
        this.mimeType = mimeType;
        this.sizeBytes = sizeBytes;
        this.storagePath = storagePath;
    }

    public String getFilename() {
        return filename;
    }

    public void setFilename(String filename) {
        this.filename = filename;
    }

    public String getMimeType() {
        return mimeType;
    }

    public void setMimeType(String mimeType) {
        this.mimeType = mimeType;
    }

    public Long getSizeBytes() {
        return sizeBytes;
    }

    public void setSizeBytes(Long sizeBytes) {
        this.sizeBytes = sizeBytes;
    }

    public String getStoragePath() {
        return storagePath;
    }

    public void setStoragePath(String storagePath) {
        this.storagePath = storagePath;
    }
}
