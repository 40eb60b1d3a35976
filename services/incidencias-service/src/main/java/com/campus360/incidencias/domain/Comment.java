/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/incidencias-service/src/main/java/com/campus360/incidencias/domain/Comment.java
 * Project: Campus360 Incidencias Service
 * Description: Comment attached to an incidencia, optionally internal to administrators.
 * Since: 2026-10-19
 */

package com.campus360.incidencias.domain;

import java.time.Instant;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

@Table("comentarios")
public class Comment {

    @Id
    private Long id;

    @Column("incidencia_id")
    private Long incidenciaId;

    @Column("usuario_id")
    private String authorId;

    @Column("contenido")
    private String content;

    @Column("es_interno")
    private boolean internal;

    @Column("fecha_creacion")
    private Instant createdAt;

    @Column("fecha_actualizacion")
    private Instant updatedAt;

    public Comment() {
        // default constructor required by Spring Data
    }

    public Comment(Long id, Long incidenciaId, String authorId, String content, boolean internal, Instant createdAt, Instant updatedAt) {
        this.id = id;
        this.incidenciaId = incidenciaId;
        this.authorId = authorId;
        this.content = content;
        this.internal = internal;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    public static Comment newComment(Long incidenciaId, String authorId, String content, boolean internal, Instant createdAt) {
        return new Comment(null, incidenciaId, authorId, content, internal, createdAt, null);
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

    public String getAuthorId() {
        return authorId;
    }

    public void setAuthorId(String authorId) {
        this.authorId = authorId;
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

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
