/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/incidencias-service/src/main/java/com/campus360/incidencias/domain/Incidencia.java
 * Project: Campus360 Incidencias Service
 * Description: Persistent representation of an incidencia (ticket).
 * Since: 2026-10-19
 */

package com.campus360.incidencias.domain;

import java.time.Instant;
import java.util.Objects;

import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

/**
 * Persistent representation of an incidencia.
 *
 * <p>Reporter, responsible party and location are opaque identifiers owned by the
 * user and room services, so they are stored as plain strings without foreign keys.
 * State, priority and category reference catalog rows by id.</p>
 *
 * <p>The {@code version} column makes every update a conditional single-row write:
 * a concurrent change in between read and write fails instead of being lost.</p>
 */
@Table("incidencias")
public class Incidencia {

    @Id
    private Long id;

    @Column("titulo")
    private String title;

    @Column("descripcion")
    private String description;

    @Column("estado_id")
    private Long stateId;

    @Column("prioridad_id")
    private Long priorityId;

    @Column("categoria_id")
    private Long categoryId;

    @Column("usuario_reportante_id")
    private String reporterId;

    @Column("responsable_id")
    private String responsibleId;

    @Column("salon_id")
    private String locationId;

    @Column("fecha_creacion")
    private Instant createdAt;

    @Column("fecha_actualizacion")
    private Instant updatedAt;

    @Column("fecha_resolucion")
    private Instant resolvedAt;

    @Version
    private Long version;

    public Incidencia() {
        // default constructor required by Spring Data
    }

    public Incidencia(
        Long id,
        String title,
        String description,
        Long stateId,
        Long priorityId,
        Long categoryId,
        String reporterId,
        String responsibleId,
        String locationId,
        Instant createdAt,
        Instant updatedAt,
        Instant resolvedAt,
        Long version
    ) {
        this.id = id;
        this.title = title;
        this.description = description;
        this.stateId = stateId;
        this.priorityId = priorityId;
        this.categoryId = categoryId;
        this.reporterId = reporterId;
        this.responsibleId = responsibleId;
        this.locationId = locationId;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
        this.resolvedAt = resolvedAt;
        this.version = version;
    }

    public static Incidencia report(
        String title,
        String description,
        Long initialStateId,
        Long priorityId,
        Long categoryId,
        String locationId,
        String reporterId,
        Instant createdAt
    ) {
        Objects.requireNonNull(title, "title must not be null");
        Objects.requireNonNull(description, "description must not be null");
        Objects.requireNonNull(initialStateId, "initialStateId must not be null");
        Objects.requireNonNull(priorityId, "priorityId must not be null");
        Objects.requireNonNull(reporterId, "reporterId must not be null");
        return new Incidencia(
            null,
            title,
            description,
            initialStateId,
            priorityId,
            categoryId,
            reporterId,
            null,
            locationId,
            createdAt,
            null,
            null,
            null
        );
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
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

    public Long getStateId() {
        return stateId;
    }

    public void setStateId(Long stateId) {
        this.stateId = stateId;
    }

    public Long getPriorityId() {
        return priorityId;
    }

    public void setPriorityId(Long priorityId) {
        this.priorityId = priorityId;
    }

    public Long getCategoryId() {
        return categoryId;
    }

    public void setCategoryId(Long categoryId) {
        this.categoryId = categoryId;
    }

    // Immutable after creation: no setter.
    public String getReporterId() {
        return reporterId;
    }

    public String getResponsibleId() {
        return responsibleId;
    }

    public void setResponsibleId(String responsibleId) {
        this.responsibleId = responsibleId;
    }

    public String getLocationId() {
        return locationId;
    }

    public void setLocationId(String locationId) {
        this.locationId = locationId;
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

    public Instant getResolvedAt() {
        return resolvedAt;
    }

    public void setResolvedAt(Instant resolvedAt) {
        this.resolvedAt = resolvedAt;
    }

    public Long getVersion() {
        return version;
    }

    public void setVersion(Long version) {
        this.version = version;
    }
}
