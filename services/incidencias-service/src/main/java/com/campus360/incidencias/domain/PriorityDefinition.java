/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/incidencias-service/src/main/java/com/campus360/incidencias/domain/PriorityDefinition.java
 * Project: Campus360 Incidencias Service
 * Description: Catalog row describing one priority level.
 * Since: 2026-10-19
 */

package com.campus360.incidencias.domain;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

/**
 * Priority level. {@code level} is used for sorting only and has no effect on permissions.
 */
@Table("prioridades")
public record PriorityDefinition(
    @Id Long id,
    @Column("codigo") String code,
    @Column("nombre") String name,
    @Column("descripcion") String description,
    @Column("nivel") int level,
    @Column("color") String color,
    @Column("activo") boolean active
) {
}
