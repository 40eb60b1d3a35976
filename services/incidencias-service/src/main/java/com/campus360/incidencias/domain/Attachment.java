/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/incidencias-service/src/main/java/com/campus360/incidencias/domain/Attachment.java
 * Project: Campus360 Incidencias Service
 * Description: Metadata of a file attached to an incidencia.
 * Since: 2026-10-19
 */

package com.campus360.incidencias.domain;

import java.time.Instant;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

/**
 * Attachment metadata. The file itself lives in external storage; {@code storagePath}
 * is opaque to this service.
 */
@Table("adjuntos")
public class Attachment {

    @Id
    private Long id;

    @Column("incidencia_id")
    private Long incidenciaId;

    @Column("nombre_archivo")
    private String filename;

    @Column("tipo_mime")
    private String mimeType;

    @Column("tamanio_bytes")
    private Long sizeBytes;

    @Column("ruta_almacenamiento")
    private String storagePath;

    @Column("usuario_id")
    private String uploaderId;

    @Column("fecha_creacion")
    private Instant createdAt;

    public Attachment() {
        // default constructor required by Spring Data
    }

    public Attachment(
        Long id,
        Long incidenciaId,
        String filename,
        String mimeType,
        Long sizeBytes,
        String storagePath,
        String uploaderId,
        Instant createdAt
    ) {
        this.id = id;
        this.incidenciaId = incidenciaId;
        this.filename = filename;
        this.mimeType = mimeType;
        this.sizeBytes = sizeBytes;
        this.storagePath = storagePath;
        this.uploaderId = uploaderId;
        this.createdAt = createdAt;
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public Long getIncidenciaId() {
        return incidenciaId;
    }

    public void setIncidenciaId(Long incidenciaId) {
        this.incidenciaId = incidenciaId;
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

    public String getUploaderId() {
        return uploaderId;
    }

    public void setUploaderId(String uploaderId) {
        this.uploaderId = uploaderId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}
