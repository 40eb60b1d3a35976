/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/incidencias-service/src/main/java/com/campus360/incidencias/domain/StateDefinition.java
 * Project: Campus360 Incidencias Service
 * Description: Catalog row describing one lifecycle state.
 * Since: 2026-10-19
 */

package com.campus360.incidencias.domain;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

@Table("estados")
public record StateDefinition(
    @Id Long id,
    @Column("codigo") String code,
    @Column("nombre") String name,
    @Column("descripcion") String description,
    @Column("orden") int rank,
    @Column("activo") boolean active
) {
}
