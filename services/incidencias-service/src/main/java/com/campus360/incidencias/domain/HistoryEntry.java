/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/incidencias-service/src/main/java/com/campus360/incidencias/domain/HistoryEntry.java
 * Project: Campus360 Incidencias Service
 * Description: Immutable audit record of one accepted mutation of an incidencia.
 * Since: 2026-10-19
 */

package com.campus360.incidencias.domain;

import java.time.Instant;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

/**
 * Audit record written once per accepted mutation and never updated.
 *
 * <p>{@code previousValue} and {@code newValue} hold JSON snapshots of the changed
 * fields. {@code internal} entries document administrator-only activity (internal
 * comments) and are hidden from non-administrators the same way the comments are.</p>
 */
@Table("historial_incidencias")
public record HistoryEntry(
    @Id Long id,
    @Column("incidencia_id") Long incidenciaId,
    @Column("accion") String action,
    @Column("descripcion") String description,
    @Column("usuario_id") String actorId,
    @Column("valor_anterior") String previousValue,
    @Column("valor_nuevo") String newValue,
    @Column("interno") boolean internal,
    @Column("fecha_cambio") Instant changedAt
) {

    public HistoryEntry withId(Long id) {
        return new HistoryEntry(id, incidenciaId, action, description, actorId, previousValue, newValue, internal, changedAt);
    }
}
