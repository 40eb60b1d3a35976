/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/incidencias-service/src/main/java/com/campus360/incidencias/domain/CategoryDefinition.java
 * Project: Campus360 Incidencias Service
 * Description: Catalog row describing one incidencia category.
 * Since: 2026-10-19
 */

package com.campus360.incidencias.domain;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

@Table("categorias")
public record CategoryDefinition(
    @Id Long id,
    @Column("codigo") String code,
    @Column("nombre") String name,
    @Column("descripcion") String description,
    @Column("activo") boolean active
) {
}
